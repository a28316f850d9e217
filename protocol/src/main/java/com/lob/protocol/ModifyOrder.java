package com.lob.protocol;

/**
 * Modify a resting order. {@code newQuantity} is the new remaining quantity.
 * A {@code newPrice} of {@link #SAME_PRICE} keeps the current price.
 */
public record ModifyOrder(long orderId, long newPrice, long newQuantity) implements OrderCommand {

    public static final long SAME_PRICE = 0L;

    public static ModifyOrder quantity(long orderId, long newQuantity) {
        return new ModifyOrder(orderId, SAME_PRICE, newQuantity);
    }

    public boolean changesPrice(long currentPrice) {
        return isPriceChange(newPrice, currentPrice);
    }

    public static boolean isPriceChange(long newPrice, long currentPrice) {
        return newPrice != SAME_PRICE && newPrice != currentPrice;
    }

    @Override
    public CommandType type() { return CommandType.MODIFY_ORDER; }
}
