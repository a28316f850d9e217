package com.lob.engine.book;

import com.lob.protocol.Side;

/**
 * Immutable copy of a resting order's state, for read-only queries.
 */
public record OrderSnapshot(long orderId, long ownerId, Side side, long price,
                            long originalQuantity, long remainingQuantity, long filledQuantity,
                            long priority, OrderStatus status) {
}
