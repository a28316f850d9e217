package com.lob.engine.book;

import com.lob.protocol.RejectReason;
import com.lob.protocol.Side;

/**
 * Receives the engine's output, in exactly the order it is generated while a
 * command is processed. Called on the engine thread; implementations must not
 * call back into the engine.
 */
public interface BookEventListener {

    /**
     * @param makerId   resting order
     * @param takerId   incoming order
     * @param takerSide side of the incoming order
     * @param price     maker's resting price
     * @param sequence  engine-wide trade sequence, starting at 1
     */
    void onTrade(long makerId, long takerId, Side takerSide, long price, long qty, long sequence);

    void onOrderAccepted(long orderId);

    void onOrderRejected(long orderId, RejectReason reason);

    void onOrderCancelled(long orderId);

    /** A limit order's residual now rests on the book. */
    void onOrderRested(long orderId, long price, long remainingQty);

    void onOrderModified(long orderId, long price, long remainingQty);

    /** Best price 0 and quantity 0 mean the side is empty. */
    void onBookTopChanged(Side side, long bestPrice, long aggregateQty);
}
