package com.lob.protocol;

public record CancelOrder(long orderId) implements OrderCommand {

    @Override
    public CommandType type() { return CommandType.CANCEL_ORDER; }
}
