package com.phillippitts.hybridfactor.exception;

/**
 * Thrown when a factorization request carries a value outside its valid domain
 * (non-positive N, trial limit, worker count or timeout). Raised before any worker exists.
 */
public class InvalidFactorizationRequestException extends HybridFactorException {

    private final String field;
    private final String reason;

    public InvalidFactorizationRequestException(String field, String reason) {
        super("Invalid factorization request: " + field + " " + reason);
        this.field = field;
        this.reason = reason;
    }

    public InvalidFactorizationRequestException(String field, String reason, Throwable cause) {
        super("Invalid factorization request: " + field + " " + reason, cause);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
