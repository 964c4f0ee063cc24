package com.nosota.tradeflow.api.model;

public enum ItemType {
    PRODUCT,
    SERVICE
}
