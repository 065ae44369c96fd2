package com.campus.payments.exception;

public class SweepAlreadyRunningException extends ReconciliationException {

    public SweepAlreadyRunningException() {
        super("Pending payment sweep already in progress");
    }
}
