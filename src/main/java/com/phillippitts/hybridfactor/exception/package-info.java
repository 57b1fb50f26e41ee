/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.hybridfactor.exception.HybridFactorException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.hybridfactor.exception.InvalidFactorizationRequestException} -
 *       Thrown when N, the trial limit, the worker count or the timeout is out of range</li>
 * </ul>
 *
 * <p>Algorithmic non-events (a gcd of 1 or N) and timeout exhaustion are not exceptions:
 * they end in the probable-prime pair {@code (1, N)}. Faults inside a worker are caught by
 * the worker and surface only as a
 * {@link com.phillippitts.hybridfactor.service.orchestration.event.WorkerFaultEvent}.
 *
 * @see com.phillippitts.hybridfactor.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.hybridfactor.exception;
