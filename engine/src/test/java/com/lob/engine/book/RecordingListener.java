package com.lob.engine.book;

import com.lob.protocol.RejectReason;
import com.lob.protocol.Side;

import java.util.ArrayList;
import java.util.List;

/** Captures engine output as records, in emission order. */
final class RecordingListener implements BookEventListener {

    record Trade(long makerId, long takerId, Side takerSide, long price, long qty, long sequence) {}
    record Accepted(long orderId) {}
    record Rejected(long orderId, RejectReason reason) {}
    record Cancelled(long orderId) {}
    record Rested(long orderId, long price, long remainingQty) {}
    record Modified(long orderId, long price, long remainingQty) {}
    record TopChanged(Side side, long bestPrice, long aggregateQty) {}

    final List<Object> events = new ArrayList<>();

    @Override
    public void onTrade(long makerId, long takerId, Side takerSide, long price, long qty, long sequence) {
        events.add(new Trade(makerId, takerId, takerSide, price, qty, sequence));
    }

    @Override
    public void onOrderAccepted(long orderId) { events.add(new Accepted(orderId)); }

    @Override
    public void onOrderRejected(long orderId, RejectReason reason) { events.add(new Rejected(orderId, reason)); }

    @Override
    public void onOrderCancelled(long orderId) { events.add(new Cancelled(orderId)); }

    @Override
    public void onOrderRested(long orderId, long price, long remainingQty) {
        events.add(new Rested(orderId, price, remainingQty));
    }

    @Override
    public void onOrderModified(long orderId, long price, long remainingQty) {
        events.add(new Modified(orderId, price, remainingQty));
    }

    @Override
    public void onBookTopChanged(Side side, long bestPrice, long aggregateQty) {
        events.add(new TopChanged(side, bestPrice, aggregateQty));
    }

    List<Trade> trades() {
        List<Trade> out = new ArrayList<>();
        for (Object e : events) {
            if (e instanceof Trade t) out.add(t);
        }
        return out;
    }

    void clear() { events.clear(); }
}
