package com.lob.engine.book;

import com.lob.protocol.RejectReason;

/**
 * A command that cannot be applied to the book, for a reason the caller can fix.
 */
public final class OrderBookException extends RuntimeException {

    private final RejectReason reason;
    private final long orderId;

    public OrderBookException(RejectReason reason, long orderId) {
        super(reason + " (order " + orderId + ")");
        this.reason = reason;
        this.orderId = orderId;
    }

    public RejectReason reason() { return reason; }

    public long orderId() { return orderId; }
}
