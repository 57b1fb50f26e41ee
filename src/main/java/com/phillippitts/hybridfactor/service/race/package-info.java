/**
 * Shared state of a single factorization race.
 *
 * <ul>
 *   <li>{@link com.phillippitts.hybridfactor.service.race.StopSignal} - atomic, monotonic
 *       cancellation flag polled by workers</li>
 *   <li>{@link com.phillippitts.hybridfactor.service.race.ResultSlot} - lock-guarded,
 *       first-writer-wins factor pair</li>
 *   <li>{@link com.phillippitts.hybridfactor.service.race.HeartbeatRegistry} - per-worker
 *       progress counters for stall detection</li>
 * </ul>
 *
 * <p>Each primitive protects itself; none is ever locked while another is held.
 *
 * @since 1.0
 */
package com.phillippitts.hybridfactor.service.race;
