package com.lob.engine.book;

import com.lob.common.LobConfig;
import com.lob.protocol.CancelOrder;
import com.lob.protocol.ModifyOrder;
import com.lob.protocol.NewLimitOrder;
import com.lob.protocol.NewMarketOrder;
import com.lob.protocol.OrderCommand;
import com.lob.protocol.RejectReason;
import com.lob.protocol.SelfMatchPolicy;
import com.lob.protocol.Side;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayFIFOQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Price-time priority matching for a single instrument.
 *
 * Owns both {@link BookSide}s, the {@link OrderIndex} and the sequence
 * counters; nothing here is shared with another engine instance.
 *
 * Every command runs in two phases:
 *   1. validate against current state; a failure emits OrderRejected and
 *      returns false with nothing touched
 *   2. apply all mutations in one uninterrupted pass and emit events
 *
 * Not thread-safe. Callers serialize commands (see EngineWorker).
 */
public final class MatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    public static final long NO_SPREAD = -1L;

    private final BookEventListener listener;
    private final SelfMatchPolicy selfMatchPolicy;
    private final boolean verifyInvariants;

    private final NodePool<Order> orderPool;
    private final NodePool<PriceLevel> levelPool;
    private final BookSide bids;
    private final BookSide asks;
    private final OrderIndex index;

    // final status of orders no longer on the book; also guards id reuse.
    // With a limit, the oldest entries are forgotten first.
    private final Long2ObjectOpenHashMap<OrderStatus> retired = new Long2ObjectOpenHashMap<>();
    private final LongArrayFIFOQueue retiredOrder = new LongArrayFIFOQueue();
    private final int retiredStatusLimit;

    private long nextPriority = 1;
    private long nextTradeSequence = 1;

    // top of book as it stood before the current command
    private long bidTopPrice, bidTopQty, askTopPrice, askTopQty;

    private String haltReason;

    public MatchingEngine(LobConfig cfg, BookEventListener listener) {
        this.listener = listener;
        this.selfMatchPolicy = cfg.selfMatchPolicy;
        this.verifyInvariants = cfg.verifyInvariants;
        this.retiredStatusLimit = cfg.retiredStatusLimit;
        this.orderPool = NodePool.orders(cfg.orderPoolSize);
        this.levelPool = NodePool.levels(cfg.levelPoolSize);
        this.bids = new BookSide(Side.BUY, levelPool);
        this.asks = new BookSide(Side.SELL, levelPool);
        this.index = new OrderIndex(cfg.indexInitialCapacity);
    }

    /**
     * Applies one command. Returns true if it was accepted, false if it was
     * rejected (an OrderRejected event has then been emitted).
     *
     * @throws BookInvariantException if the book is found inconsistent, now or earlier
     */
    public boolean process(OrderCommand command) {
        switch (command.type()) {
            case NEW_LIMIT_ORDER -> {
                NewLimitOrder c = (NewLimitOrder) command;
                return newLimitOrder(c.orderId(), c.ownerId(), c.side(), c.price(), c.quantity());
            }
            case NEW_MARKET_ORDER -> {
                NewMarketOrder c = (NewMarketOrder) command;
                return newMarketOrder(c.orderId(), c.ownerId(), c.side(), c.quantity());
            }
            case CANCEL_ORDER -> {
                return cancel(((CancelOrder) command).orderId());
            }
            case MODIFY_ORDER -> {
                ModifyOrder c = (ModifyOrder) command;
                return modify(c.orderId(), c.newPrice(), c.newQuantity());
            }
            default -> throw new IllegalArgumentException("Unsupported command " + command.type());
        }
    }

    // -----------------------------------------------------------------------
    // Commands
    // -----------------------------------------------------------------------

    public boolean newLimitOrder(long orderId, long ownerId, Side side, long price, long quantity) {
        ensureRunning();
        RejectReason reason = validateNewOrder(orderId, side, quantity);
        if (reason == null && price <= 0) reason = RejectReason.INVALID_PRICE;
        if (reason == null && orderPool.available() == 0) reason = RejectReason.SYSTEM_BUSY;
        if (reason == null && sideOf(side).level(price) == null && levelPool.available() == 0) {
            reason = RejectReason.SYSTEM_BUSY;
        }
        if (reason != null) return reject(orderId, reason);

        captureTop();
        Order order = newOrder(orderId, ownerId, side, false, price, quantity);
        listener.onOrderAccepted(orderId);

        boolean mayRest = match(order);
        if (order.qty > 0 && mayRest) {
            rest(order);
            index.insert(order);
        } else {
            if (order.qty > 0) cancelRemainder(order);
            retire(order);
        }
        return complete();
    }

    public boolean newLimitOrder(long orderId, Side side, long price, long quantity) {
        return newLimitOrder(orderId, 0L, side, price, quantity);
    }

    /**
     * Crosses at any price until filled or the opposite side runs dry. An
     * unfilled remainder is cancelled; it never rests.
     */
    public boolean newMarketOrder(long orderId, long ownerId, Side side, long quantity) {
        ensureRunning();
        RejectReason reason = validateNewOrder(orderId, side, quantity);
        if (reason == null && orderPool.available() == 0) reason = RejectReason.SYSTEM_BUSY;
        if (reason != null) return reject(orderId, reason);

        captureTop();
        Order order = newOrder(orderId, ownerId, side, true, 0L, quantity);
        listener.onOrderAccepted(orderId);

        match(order);
        if (order.qty > 0) cancelRemainder(order);
        retire(order);
        return complete();
    }

    public boolean newMarketOrder(long orderId, Side side, long quantity) {
        return newMarketOrder(orderId, 0L, side, quantity);
    }

    public boolean cancel(long orderId) {
        ensureRunning();
        Order order = index.find(orderId);
        if (order == null) return reject(orderId, RejectReason.UNKNOWN_ORDER_ID);
        PriceLevel level = locate(order);

        captureTop();
        level.remove(order);
        sideOf(order.side).removeLevelIfEmpty(order.price);
        index.remove(orderId);
        order.status = OrderStatus.CANCELLED;
        listener.onOrderCancelled(orderId);
        retire(order);
        return complete();
    }

    /**
     * A quantity decrease at the same price keeps time priority and is applied
     * in place. A price change or a quantity increase is a cancel/replace: the
     * order takes a new time priority token and re-enters matching, so it may
     * trade immediately.
     *
     * @param newPrice    {@link ModifyOrder#SAME_PRICE} to keep the current price
     * @param newQuantity the new remaining quantity
     */
    public boolean modify(long orderId, long newPrice, long newQuantity) {
        ensureRunning();
        Order order = index.find(orderId);
        if (order == null) return reject(orderId, RejectReason.UNKNOWN_ORDER_ID);
        if (newQuantity <= 0) return reject(orderId, RejectReason.INVALID_QUANTITY);
        if (newPrice < 0) return reject(orderId, RejectReason.INVALID_PRICE);
        PriceLevel level = locate(order);

        boolean priceChange = ModifyOrder.isPriceChange(newPrice, order.price);
        if (!priceChange && newQuantity <= order.qty) {
            captureTop();
            if (newQuantity < order.qty) level.reduce(order, newQuantity);
            listener.onOrderModified(orderId, order.price, order.qty);
            return complete();
        }

        long targetPrice = priceChange ? newPrice : order.price;
        BookSide own = sideOf(order.side);
        if (own.level(targetPrice) == null && levelPool.available() == 0) {
            return reject(orderId, RejectReason.SYSTEM_BUSY);
        }

        captureTop();
        long oldPrice = order.price;
        level.remove(order);
        own.removeLevelIfEmpty(oldPrice);

        order.price = targetPrice;
        order.qty = newQuantity;
        order.origQty = order.filledQty + newQuantity;
        order.priority = nextPriority++;
        order.status = order.filledQty > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.ACTIVE;
        listener.onOrderModified(orderId, targetPrice, newQuantity);

        boolean mayRest = match(order);
        if (order.qty > 0 && mayRest) {
            rest(order);
            index.updateLocator(order);
        } else {
            index.remove(orderId);
            if (order.qty > 0) cancelRemainder(order);
            retire(order);
        }
        return complete();
    }

    // -----------------------------------------------------------------------
    // Queries (read-only)
    // -----------------------------------------------------------------------

    /** Highest bid, or Long.MIN_VALUE if there are no bids. */
    public long bestBid() {
        PriceLevel best = bids.bestLevel();
        return best == null ? Long.MIN_VALUE : best.price;
    }

    /** Lowest ask, or Long.MAX_VALUE if there are no asks. */
    public long bestAsk() {
        PriceLevel best = asks.bestLevel();
        return best == null ? Long.MAX_VALUE : best.price;
    }

    /** Best ask minus best bid, or {@link #NO_SPREAD} when either side is empty. */
    public long spread() {
        if (bids.isEmpty() || asks.isEmpty()) return NO_SPREAD;
        return bestAsk() - bestBid();
    }

    /** Up to {@code levels} (price, aggregate quantity) pairs, best first. */
    public List<DepthLevel> depth(Side side, int levels) {
        return sideOf(side).depth(levels);
    }

    /**
     * Status of a resting or finished order; null if the id was never accepted,
     * or finished longer ago than the configured retention allows.
     */
    public OrderStatus orderStatus(long orderId) {
        Order o = index.find(orderId);
        return o != null ? o.status : retired.get(orderId);
    }

    /** Snapshot of a resting order, or null if it is not on the book. */
    public OrderSnapshot order(long orderId) {
        Order o = index.find(orderId);
        return o == null ? null : o.snapshot();
    }

    public int restingOrders() { return index.size(); }

    public boolean isHalted() { return haltReason != null; }

    /**
     * Renders a price ladder: asks highest to lowest, the spread, then bids
     * highest to lowest.
     */
    public String formatBook(int levels) {
        StringBuilder sb = new StringBuilder();
        sb.append("------ ASKS ------\n");
        List<DepthLevel> askDepth = asks.depth(levels);
        if (askDepth.isEmpty()) {
            sb.append("No asks\n");
        } else {
            for (int i = askDepth.size() - 1; i >= 0; i--) {
                DepthLevel d = askDepth.get(i);
                sb.append(d.price()).append(" : ").append(d.quantity()).append('\n');
            }
        }
        sb.append("------ SPREAD ------\n");
        long spread = spread();
        sb.append(spread == NO_SPREAD ? "Spread: N/A (one sided)" : "Spread: " + spread).append('\n');
        sb.append("------ BIDS ------\n");
        List<DepthLevel> bidDepth = bids.depth(levels);
        if (bidDepth.isEmpty()) {
            sb.append("No bids\n");
        } else {
            for (DepthLevel d : bidDepth) {
                sb.append(d.price()).append(" : ").append(d.quantity()).append('\n');
            }
        }
        return sb.toString();
    }

    BookSide bids() { return bids; }

    BookSide asks() { return asks; }

    OrderIndex index() { return index; }

    int freeOrders() { return orderPool.available(); }

    // -----------------------------------------------------------------------
    // Matching
    // -----------------------------------------------------------------------

    /**
     * Crosses {@code taker} against the opposite side, best level first and
     * FIFO within a level, each trade at the maker's price.
     *
     * @return false if a self-match stopped the taker (its remainder must not rest)
     */
    private boolean match(Order taker) {
        BookSide opposite = sideOf(taker.side.opposite());
        while (taker.qty > 0) {
            PriceLevel level = opposite.bestLevel();
            if (level == null) break;
            if (!taker.market && !opposite.crosses(level, taker.price)) break;

            Order maker = level.peekFront();
            if (isSelfMatch(taker, maker)) {
                if (selfMatchPolicy == SelfMatchPolicy.CANCEL_INCOMING) return false;
                cancelResting(maker, level, opposite);
                continue;
            }

            long price = level.price;
            long fillQty = Math.min(taker.qty, maker.qty);
            level.fill(maker, fillQty);
            taker.fill(fillQty);
            listener.onTrade(maker.orderId, taker.orderId, taker.side, price, fillQty, nextTradeSequence++);

            if (maker.qty == 0) {
                level.popFront();
                index.remove(maker.orderId);
                retire(maker);
                opposite.removeLevelIfEmpty(price);
            }
        }
        return true;
    }

    private boolean isSelfMatch(Order taker, Order maker) {
        return selfMatchPolicy != SelfMatchPolicy.ALLOW
                && taker.ownerId != 0
                && taker.ownerId == maker.ownerId;
    }

    private void cancelResting(Order maker, PriceLevel level, BookSide side) {
        long price = level.price;
        level.remove(maker);
        index.remove(maker.orderId);
        maker.status = OrderStatus.CANCELLED;
        listener.onOrderCancelled(maker.orderId);
        retire(maker);
        side.removeLevelIfEmpty(price);
    }

    private void rest(Order order) {
        sideOf(order.side).getOrCreateLevel(order.price).enqueue(order);
        listener.onOrderRested(order.orderId, order.price, order.qty);
    }

    private void cancelRemainder(Order order) {
        order.status = OrderStatus.CANCELLED;
        listener.onOrderCancelled(order.orderId);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private RejectReason validateNewOrder(long orderId, Side side, long quantity) {
        if (side == null) return RejectReason.INVALID_SIDE;
        if (quantity <= 0) return RejectReason.INVALID_QUANTITY;
        if (index.contains(orderId) || retired.containsKey(orderId)) return RejectReason.DUPLICATE_ORDER_ID;
        return null;
    }

    private Order newOrder(long orderId, long ownerId, Side side, boolean market, long price, long quantity) {
        Order o = orderPool.borrow();
        o.orderId = orderId;
        o.ownerId = ownerId;
        o.side = side;
        o.market = market;
        o.price = price;
        o.qty = quantity;
        o.origQty = quantity;
        o.priority = nextPriority++;
        o.status = OrderStatus.ACTIVE;
        return o;
    }

    private boolean reject(long orderId, RejectReason reason) {
        log.debug("Rejected order {}: {}", orderId, reason);
        listener.onOrderRejected(orderId, reason);
        return false;
    }

    private void retire(Order order) {
        if (retired.put(order.orderId, order.status) == null && retiredStatusLimit > 0) {
            retiredOrder.enqueue(order.orderId);
            if (retiredOrder.size() > retiredStatusLimit) retired.remove(retiredOrder.dequeueLong());
        }
        orderPool.release(order);
    }

    /** The level an indexed order claims to sit in; halts if the book disagrees. */
    private PriceLevel locate(Order order) {
        PriceLevel level = order.level;
        if (level == null || sideOf(order.side).level(order.price) != level) {
            halt("indexed order " + order.orderId + " is missing from " + order.side + " level " + order.price);
        }
        return level;
    }

    private BookSide sideOf(Side side) {
        return side == Side.BUY ? bids : asks;
    }

    private void captureTop() {
        PriceLevel bid = bids.bestLevel();
        bidTopPrice = bid == null ? 0 : bid.price;
        bidTopQty = bid == null ? 0 : bid.totalQty;
        PriceLevel ask = asks.bestLevel();
        askTopPrice = ask == null ? 0 : ask.price;
        askTopQty = ask == null ? 0 : ask.totalQty;
    }

    /** Publishes top-of-book changes, then checks invariants. */
    private boolean complete() {
        PriceLevel bid = bids.bestLevel();
        long price = bid == null ? 0 : bid.price;
        long qty = bid == null ? 0 : bid.totalQty;
        if (price != bidTopPrice || qty != bidTopQty) listener.onBookTopChanged(Side.BUY, price, qty);

        PriceLevel ask = asks.bestLevel();
        price = ask == null ? 0 : ask.price;
        qty = ask == null ? 0 : ask.totalQty;
        if (price != askTopPrice || qty != askTopQty) listener.onBookTopChanged(Side.SELL, price, qty);

        verify();
        return true;
    }

    private void verify() {
        if (!bids.isEmpty() && !asks.isEmpty() && bestBid() >= bestAsk()) {
            halt("crossed book: best bid " + bestBid() + " >= best ask " + bestAsk());
        }
        if (!verifyInvariants) return;
        String defect = bids.audit();
        if (defect == null) defect = asks.audit();
        if (defect == null) defect = index.audit(bids, asks);
        if (defect != null) halt(defect);
    }

    private void ensureRunning() {
        if (haltReason != null) {
            throw new BookInvariantException("Engine halted: " + haltReason);
        }
    }

    private void halt(String defect) {
        haltReason = defect;
        log.error("Book invariant violated, halting engine: {}", defect);
        throw new BookInvariantException(defect);
    }
}
