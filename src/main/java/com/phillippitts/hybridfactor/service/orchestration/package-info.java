/**
 * Race coordination: pre-filter, worker start-up, arbitration, wind-down and reporting.
 *
 * <p>Entry point is {@link com.phillippitts.hybridfactor.service.orchestration.HybridFactorizer}.
 * Events published by the coordinator live in the {@code event} sub-package.
 *
 * @since 1.0
 */
package com.phillippitts.hybridfactor.service.orchestration;
