package com.nosota.tradeflow.api.model;

/**
 * Result reported by the payment gateway integration.
 */
public enum PaymentOutcome {
    SUCCESS,
    FAILURE
}
