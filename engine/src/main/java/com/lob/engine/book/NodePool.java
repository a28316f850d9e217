package com.lob.engine.book;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Fixed-capacity free list of book nodes ({@link Order}s and
 * {@link PriceLevel}s), all allocated up front so matching never allocates.
 *
 * Callers check {@link #available()} before a command starts mutating the
 * book; {@link #borrow()} returning null after that check is a bug.
 */
public final class NodePool<T> {

    private final String name;
    private final Object[] free;
    private final Consumer<T> reset;
    private int top;

    public NodePool(String name, int capacity, Supplier<T> factory, Consumer<T> reset) {
        if (capacity <= 0) throw new IllegalArgumentException(name + " pool capacity must be positive: " + capacity);
        this.name = name;
        this.free = new Object[capacity];
        this.reset = reset;
        for (int i = 0; i < capacity; i++) free[i] = factory.get();
        top = capacity;
    }

    public static NodePool<Order> orders(int capacity) {
        return new NodePool<>("order", capacity, Order::new, Order::reset);
    }

    public static NodePool<PriceLevel> levels(int capacity) {
        return new NodePool<>("price level", capacity, PriceLevel::new, PriceLevel::reset);
    }

    /** A cleared node, or null when every node is in use. */
    @SuppressWarnings("unchecked")
    public T borrow() {
        if (top == 0) return null;
        T node = (T) free[--top];
        free[top] = null;
        reset.accept(node);
        return node;
    }

    public void release(T node) {
        if (top == free.length) throw new IllegalStateException(name + " pool overflow: node released twice?");
        reset.accept(node);
        free[top++] = node;
    }

    public int available() { return top; }

    public int capacity() { return free.length; }
}
