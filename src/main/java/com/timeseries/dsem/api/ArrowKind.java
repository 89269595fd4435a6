package com.timeseries.dsem.api;

/** Direction of an arrow in the model text. */
public enum ArrowKind {
    /** {@code from -> to}: a regression coefficient in the equation for {@code to}. */
    PATH("->"),
    /** {@code from <-> to}: a symmetric variance/covariance parameter. */
    COVARIANCE("<->");

    private final String operator;

    ArrowKind(String operator) {
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }
}
