package com.lob.protocol;

public enum Side {
    BUY((byte) 1), SELL((byte) 2);

    public final byte code;
    Side(byte code) { this.code = code; }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    public static Side fromCode(byte code) {
        if (code == 1) return BUY;
        if (code == 2) return SELL;
        throw new IllegalArgumentException("Unknown Side: " + code);
    }
}
