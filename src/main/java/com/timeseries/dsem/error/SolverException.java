package com.timeseries.dsem.error;

/**
 * Base class for failures raised while deriving effects from a concrete
 * {@code PathMatrixSet}.
 */
public class SolverException extends IllegalStateException {
    public SolverException(String message) {
        super(message);
    }
}
