package com.campus.payments.service;

import java.util.Locale;

/**
 * Which path asked for a transition. Used for logs and metric tags only; the state machine
 * treats all triggers the same.
 */
public enum ReconciliationTrigger {
    CLIENT,
    WEBHOOK,
    SWEEP;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
