/**
 * Factoring workers raced by the coordinator.
 *
 * <p>Architecture:
 * <ul>
 *   <li>{@link com.phillippitts.hybridfactor.service.worker.AbstractFactorWorker} - commit,
 *       heartbeat and fault handling shared by all algorithms</li>
 *   <li>{@link com.phillippitts.hybridfactor.service.worker.PollardPMinusOneWorker} - smooth
 *       p - 1 with an escalating bound</li>
 *   <li>{@link com.phillippitts.hybridfactor.service.worker.PollardRhoWorker} - Floyd cycle
 *       detection, one constant per worker</li>
 *   <li>{@link com.phillippitts.hybridfactor.service.worker.WorkerHandle} - start/join
 *       lifecycle on any {@link java.util.concurrent.Executor}</li>
 * </ul>
 *
 * <p>All workers:
 * <ul>
 *   <li>Share only the {@link com.phillippitts.hybridfactor.service.race.RaceContext}</li>
 *   <li>Beat and poll the stop signal once per batch</li>
 *   <li>Treat a gcd of 1 or N as "no factor this round", never as an error</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.hybridfactor.service.worker;
