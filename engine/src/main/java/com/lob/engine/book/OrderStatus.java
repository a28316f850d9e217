package com.lob.engine.book;

public enum OrderStatus {
    ACTIVE,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED;
    }
}
