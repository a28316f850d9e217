package com.lob.protocol;

/**
 * A single command for the matching engine. Commands are plain values: they
 * are validated in full before the engine applies any of them.
 */
public interface OrderCommand {

    CommandType type();

    long orderId();
}
