package com.campus.payments.entity;

/**
 * Represents the lifecycle status of a payment transaction.
 */
public enum TransactionStatus {
    /**
     * Charge created at the provider, payer has not completed (or we have not heard yet).
     * The only state a transition can leave.
     */
    PENDING,

    /**
     * Provider confirmed the payment. Terminal.
     */
    SUCCESS,

    /**
     * Provider reported the charge as failed or expired. Terminal.
     */
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
