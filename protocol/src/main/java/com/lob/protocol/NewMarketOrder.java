package com.lob.protocol;

/**
 * Market order: crosses at any price, never rests.
 */
public record NewMarketOrder(long orderId, long ownerId, Side side, long quantity)
        implements OrderCommand {

    public NewMarketOrder(long orderId, Side side, long quantity) {
        this(orderId, 0L, side, quantity);
    }

    @Override
    public CommandType type() { return CommandType.NEW_MARKET_ORDER; }
}
