package com.nosota.tradeflow.api.model;

public enum SellerResponseStatus {
    PENDING,
    APPROVED,
    REJECTED
}
