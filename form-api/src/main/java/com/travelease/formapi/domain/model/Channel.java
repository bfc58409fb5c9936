package com.travelease.formapi.domain.model;

/**
 * Dispatch channels in the order the dispatcher runs them sequentially.
 */
public enum Channel {
    QUEUE("queue"),
    STORE("store"),
    CUSTOMER_EMAIL("customer_email"),
    OWNER_EMAIL("owner_email"),
    BUSINESS_EMAIL("business_email"),
    BROADCAST("broadcast");

    private final String tag;

    Channel(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
