package com.lob.engine.book;

import com.lob.protocol.Side;

/**
 * Represents a resting limit order (or an in-flight market order while it
 * crosses). Instances are obtained from {@link NodePool}.
 * Fields are read/written directly; no getters/setters on the hot path.
 */
public final class Order {

    public long    orderId;
    public long    ownerId;      // 0 = anonymous
    public Side    side;
    public boolean market;
    public long    price;        // ticks; unused for market orders
    public long    qty;          // remaining quantity
    public long    origQty;
    public long    filledQty;
    public long    priority;     // time priority token, engine-assigned
    public OrderStatus status;

    // Intrusive doubly-linked list within a PriceLevel
    public Order prev;
    public Order next;

    // Back-pointer to the level this order belongs to (for O(1) cancel)
    public PriceLevel level;

    public void reset() {
        orderId = 0;
        ownerId = 0;
        side = null;
        market = false;
        price = 0;
        qty = 0;
        origQty = 0;
        filledQty = 0;
        priority = 0;
        status = null;
        prev = null;
        next = null;
        level = null;
    }

    /** Applies an execution of {@code fillQty} lots to this order's own counters. */
    void fill(long fillQty) {
        qty -= fillQty;
        filledQty += fillQty;
        status = qty == 0 ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
    }

    OrderSnapshot snapshot() {
        return new OrderSnapshot(orderId, ownerId, side, price, origQty, qty, filledQty, priority, status);
    }

    @Override
    public String toString() {
        return "Order{id=" + orderId + ", side=" + side + ", price=" + price
                + ", qty=" + qty + "/" + origQty + ", priority=" + priority + ", status=" + status + '}';
    }
}
