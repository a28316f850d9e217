package com.lob.engine.book;

import com.lob.protocol.RejectReason;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * Order id to locator, for O(1) cancel/modify lookup.
 *
 * The locator is the resting {@link Order} node itself: its side, price and
 * level back-pointer say exactly where it sits. The index never owns the
 * node; the {@link PriceLevel} queue does.
 */
public final class OrderIndex {

    private final Long2ObjectOpenHashMap<Order> orders;

    public OrderIndex(int initialCapacity) {
        this.orders = new Long2ObjectOpenHashMap<>(initialCapacity);
    }

    public void insert(Order order) {
        if (orders.containsKey(order.orderId)) {
            throw new OrderBookException(RejectReason.DUPLICATE_ORDER_ID, order.orderId);
        }
        orders.put(order.orderId, order);
    }

    public Order lookup(long orderId) {
        Order o = orders.get(orderId);
        if (o == null) throw new OrderBookException(RejectReason.UNKNOWN_ORDER_ID, orderId);
        return o;
    }

    public Order remove(long orderId) {
        Order o = orders.remove(orderId);
        if (o == null) throw new OrderBookException(RejectReason.UNKNOWN_ORDER_ID, orderId);
        return o;
    }

    /** Re-points an existing entry after the order moved to another level. */
    public void updateLocator(Order order) {
        if (!orders.containsKey(order.orderId)) {
            throw new OrderBookException(RejectReason.UNKNOWN_ORDER_ID, order.orderId);
        }
        orders.put(order.orderId, order);
    }

    public boolean contains(long orderId) { return orders.containsKey(orderId); }

    public Order find(long orderId) { return orders.get(orderId); }

    public int size() { return orders.size(); }

    /**
     * Cross-checks every entry against the book. Returns null when each
     * indexed order is queued at its claimed level on its claimed side and the
     * index holds exactly as many entries as the book holds orders.
     */
    String audit(BookSide bids, BookSide asks) {
        for (Order o : orders.values()) {
            BookSide side = o.side == bids.side() ? bids : asks;
            PriceLevel level = side.level(o.price);
            if (level == null || o.level != level) {
                return "indexed order " + o.orderId + " is not queued at " + o.side + " " + o.price;
            }
            if (o.status == null || o.status.isTerminal()) {
                return "indexed order " + o.orderId + " has status " + o.status;
            }
        }
        int resting = bids.orderCount() + asks.orderCount();
        if (resting != orders.size()) {
            return "index holds " + orders.size() + " orders, book holds " + resting;
        }
        return null;
    }
}
