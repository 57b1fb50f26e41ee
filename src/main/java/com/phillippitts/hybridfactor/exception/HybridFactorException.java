package com.phillippitts.hybridfactor.exception;

/**
 * Base exception for all hybrid-factorizer application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class HybridFactorException extends RuntimeException {

    public HybridFactorException(String message) {
        super(message);
    }

    public HybridFactorException(String message, Throwable cause) {
        super(message, cause);
    }
}
