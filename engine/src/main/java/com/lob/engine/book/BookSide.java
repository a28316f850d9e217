package com.lob.engine.book;

import com.lob.protocol.Side;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One side of the book: price levels keyed by price, best price first.
 *
 *   - bids: TreeMap ordered descending (first entry = highest bid)
 *   - asks: TreeMap ordered ascending  (first entry = lowest ask)
 *
 * Levels come from a shared {@link NodePool} and go back to it as soon
 * as they empty, so an empty level is never observable.
 */
public final class BookSide {

    private final Side side;
    private final NodePool<PriceLevel> levelPool;
    private final TreeMap<Long, PriceLevel> levels; // price -> level
    private final Collection<PriceLevel> fromBest;

    public BookSide(Side side, NodePool<PriceLevel> levelPool) {
        this.side = side;
        this.levelPool = levelPool;
        this.levels = new TreeMap<>(side == Side.BUY
                ? Comparator.<Long>reverseOrder()
                : Comparator.<Long>naturalOrder());
        this.fromBest = Collections.unmodifiableCollection(levels.values());
    }

    public Side side() { return side; }

    /** Most aggressive level, or null when the side has no liquidity. */
    public PriceLevel bestLevel() {
        Map.Entry<Long, PriceLevel> e = levels.firstEntry();
        return e == null ? null : e.getValue();
    }

    public PriceLevel level(long price) {
        return levels.get(price);
    }

    public PriceLevel getOrCreateLevel(long price) {
        PriceLevel level = levels.get(price);
        if (level == null) {
            level = levelPool.borrow();
            if (level == null) throw new IllegalStateException("No free price level for " + side + " " + price);
            level.price = price;
            levels.put(price, level);
        }
        return level;
    }

    /** Drops the level at {@code price} if it no longer holds any quantity. */
    public boolean removeLevelIfEmpty(long price) {
        PriceLevel level = levels.get(price);
        if (level == null || !level.isEmpty()) return false;
        levels.remove(price);
        levelPool.release(level);
        return true;
    }

    /**
     * True if an incoming order on the opposite side limited at
     * {@code limitPrice} may trade against {@code level}.
     */
    public boolean crosses(PriceLevel level, long limitPrice) {
        return side == Side.SELL ? level.price <= limitPrice : level.price >= limitPrice;
    }

    /**
     * Live, read-only view of the levels in priority order, backing the depth
     * and total queries. Restartable: iterate again for a fresh pass. Not to
     * be held across fills, which remove levels; matching re-reads
     * {@link #bestLevel()}.
     */
    public Iterable<PriceLevel> iterateFromBest() {
        return fromBest;
    }

    public List<DepthLevel> depth(int maxLevels) {
        if (maxLevels <= 0) return List.of();
        List<DepthLevel> out = new ArrayList<>(Math.min(maxLevels, levels.size()));
        for (PriceLevel level : iterateFromBest()) {
            if (out.size() == maxLevels) break;
            out.add(new DepthLevel(level.price, level.totalQty));
        }
        return out;
    }

    public boolean isEmpty() { return levels.isEmpty(); }

    public int levelCount() { return levels.size(); }

    public long totalQuantity() {
        long sum = 0;
        for (PriceLevel level : iterateFromBest()) sum += level.totalQty;
        return sum;
    }

    public int orderCount() {
        int count = 0;
        for (PriceLevel level : iterateFromBest()) count += level.orderCount;
        return count;
    }

    /** Returns null when every level is consistent, otherwise the first defect found. */
    String audit() {
        for (Map.Entry<Long, PriceLevel> e : levels.entrySet()) {
            PriceLevel level = e.getValue();
            if (level.price != e.getKey()) {
                return side + " level keyed at " + e.getKey() + " carries price " + level.price;
            }
            String defect = level.audit();
            if (defect != null) return side + " level " + level.price + ": " + defect;
            for (Order o = level.head; o != null; o = o.next) {
                if (o.side != side) return "order " + o.orderId + " of side " + o.side + " rests on " + side;
            }
        }
        return null;
    }
}
