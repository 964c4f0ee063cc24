package com.nosota.tradeflow.api.model;

public enum ReturnReason {
    DEFECTIVE,
    WRONG_ITEM,
    NOT_AS_DESCRIBED,
    DAMAGED,
    CHANGED_MIND,
    OTHER
}
