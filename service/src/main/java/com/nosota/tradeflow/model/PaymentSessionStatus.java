package com.nosota.tradeflow.model;

/**
 * State of a hosted payment session. A session settles exactly once.
 */
public enum PaymentSessionStatus {
    OPEN,
    SUCCEEDED,
    FAILED
}
