package com.lob.protocol;

/**
 * Limit order. Price is in integer ticks, quantity in lots.
 * {@code ownerId} of 0 means anonymous.
 */
public record NewLimitOrder(long orderId, long ownerId, Side side, long price, long quantity)
        implements OrderCommand {

    public NewLimitOrder(long orderId, Side side, long price, long quantity) {
        this(orderId, 0L, side, price, quantity);
    }

    @Override
    public CommandType type() { return CommandType.NEW_LIMIT_ORDER; }
}
