package com.nosota.tradeflow.api.model;

/**
 * Commission ledger entry type.
 */
public enum LedgerEntryType {
    /**
     * PAYOUT: recorded when an order is delivered or a booking completed.
     * sellerPayout = amount x (1 - commissionRate).
     */
    PAYOUT,

    /**
     * REVERSAL: recorded when a refund is processed. All amounts are negative and
     * reference the payout being reversed.
     */
    REVERSAL
}
