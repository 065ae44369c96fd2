package com.campus.payments.service;

import com.campus.payments.entity.Transaction;

/**
 * Outcome of {@link TransactionStore#transitionToTerminal}. {@code transitioned} is true for
 * exactly one caller per reference: the one whose write moved the record out of PENDING or
 * inserted it in a terminal state.
 */
public record TransitionResult(Transaction transaction, boolean transitioned) {
}
