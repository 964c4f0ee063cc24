package com.nosota.tradeflow.api.model;

/**
 * Entity types driven by the workflow engine.
 */
public enum EntityType {
    ORDER,
    BOOKING,
    QUOTE,
    DESIGN_APPROVAL,
    RETURN_REQUEST,
    BOOST_PURCHASE,
    CONVERSATION
}
