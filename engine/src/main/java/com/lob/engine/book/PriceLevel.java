package com.lob.engine.book;

import java.util.NoSuchElementException;

/**
 * Doubly-linked list of orders at a single price.
 * Head = oldest (first to match). Tail = newest.
 * Uses intrusive links on {@link Order} to avoid allocations.
 *
 * {@code totalQty} is maintained incrementally by every mutation and always
 * equals the sum of the member orders' remaining quantities.
 */
public final class PriceLevel {

    public long price;
    public long totalQty;
    public int orderCount;
    public Order head;
    public Order tail;

    public void reset() {
        price = 0;
        totalQty = 0;
        orderCount = 0;
        head = null;
        tail = null;
    }

    /** Appends to the tail, behind every order already queued at this price. */
    public void enqueue(Order o) {
        if (o.price != price) {
            throw new IllegalArgumentException("Order " + o.orderId + " price " + o.price
                    + " does not belong to level " + price);
        }
        o.level = this;
        o.prev = tail;
        o.next = null;
        if (tail != null) tail.next = o;
        tail = o;
        if (head == null) head = o;
        totalQty += o.qty;
        orderCount++;
    }

    public Order peekFront() {
        if (head == null) throw new NoSuchElementException("Price level " + price + " is empty");
        return head;
    }

    public Order popFront() {
        Order o = peekFront();
        remove(o);
        return o;
    }

    /** O(1) removal of an arbitrary member; the rest keep their relative order. */
    public void remove(Order o) {
        if (o.level != this) {
            throw new IllegalArgumentException("Order " + o.orderId + " is not queued at level " + price);
        }
        if (o.prev != null) o.prev.next = o.next;
        else head = o.next;
        if (o.next != null) o.next.prev = o.prev;
        else tail = o.prev;
        totalQty -= o.qty;
        orderCount--;
        o.prev = null;
        o.next = null;
        o.level = null;
    }

    /** Executes {@code fillQty} against a member order. */
    public void fill(Order o, long fillQty) {
        o.fill(fillQty);
        totalQty -= fillQty;
    }

    /** Reduces a member's remaining quantity in place; queue position is kept. */
    public void reduce(Order o, long newQty) {
        if (newQty <= 0 || newQty > o.qty) {
            throw new IllegalArgumentException("Cannot reduce order " + o.orderId + " from " + o.qty + " to " + newQty);
        }
        totalQty -= o.qty - newQty;
        o.qty = newQty;
        o.origQty = o.filledQty + newQty;
    }

    public boolean isEmpty() { return totalQty == 0 && head == null; }

    /**
     * Re-walks the queue and checks it against the incremental bookkeeping.
     * Returns null when consistent, otherwise a description of the first defect.
     */
    String audit() {
        long sum = 0;
        int count = 0;
        long lastPriority = Long.MIN_VALUE;
        Order prev = null;
        for (Order o = head; o != null; o = o.next) {
            if (o.level != this) return "order " + o.orderId + " has wrong level back-pointer";
            if (o.prev != prev) return "broken prev link at order " + o.orderId;
            if (o.price != price) return "order " + o.orderId + " at price " + o.price + " queued in level " + price;
            if (o.qty <= 0) return "order " + o.orderId + " rests with quantity " + o.qty;
            if (o.priority <= lastPriority) return "time priority out of order at order " + o.orderId;
            lastPriority = o.priority;
            sum += o.qty;
            count++;
            prev = o;
        }
        if (prev != tail) return "tail does not match last queued order";
        if (sum != totalQty) return "aggregate quantity " + totalQty + " != sum of orders " + sum;
        if (count != orderCount) return "order count " + orderCount + " != queued orders " + count;
        if (count == 0) return "empty level left in book";
        return null;
    }
}
