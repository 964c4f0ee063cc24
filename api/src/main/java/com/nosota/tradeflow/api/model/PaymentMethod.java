package com.nosota.tradeflow.api.model;

public enum PaymentMethod {
    /** Hosted internet payment gateway; settles through the payment callback. */
    IPG,
    /** Manual bank transfer; the payer uploads a slip and an admin confirms. */
    BANK_TRANSFER
}
