package com.lob.protocol;

/**
 * Reasons a command is refused. A rejected command never changes book state.
 */
public enum RejectReason {
    UNKNOWN             ((byte) 0),
    DUPLICATE_ORDER_ID  ((byte) 1),
    UNKNOWN_ORDER_ID    ((byte) 2),
    INVALID_QUANTITY    ((byte) 3),
    INVALID_PRICE       ((byte) 4),
    SYSTEM_BUSY         ((byte) 5),
    INVALID_SIDE        ((byte) 6);

    public final byte code;
    RejectReason(byte code) { this.code = code; }

    private static final RejectReason[] BY_CODE = new RejectReason[256];
    static {
        for (RejectReason r : values()) BY_CODE[Byte.toUnsignedInt(r.code)] = r;
    }

    public static RejectReason fromCode(byte code) {
        RejectReason r = BY_CODE[Byte.toUnsignedInt(code)];
        return r != null ? r : UNKNOWN;
    }
}
