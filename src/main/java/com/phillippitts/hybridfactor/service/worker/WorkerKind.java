package com.phillippitts.hybridfactor.service.worker;

/**
 * Factoring algorithm run by a worker.
 */
public enum WorkerKind {
    P_MINUS_1("p-1"),
    RHO("rho");

    private final String label;

    WorkerKind(String label) {
        this.label = label;
    }

    /** Short name used in worker ids, logs and metric tags. */
    public String label() {
        return label;
    }
}
