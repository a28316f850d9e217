package com.lob.engine.book;

/** One row of a depth query: a price and the aggregate resting quantity there. */
public record DepthLevel(long price, long quantity) {
}
