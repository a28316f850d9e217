package com.lob.protocol;

/**
 * Inbound command type codes (1 byte).
 */
public enum CommandType {
    NEW_LIMIT_ORDER  ((byte) 1),
    NEW_MARKET_ORDER ((byte) 2),
    CANCEL_ORDER     ((byte) 3),
    MODIFY_ORDER     ((byte) 4);

    public final byte code;

    CommandType(byte code) { this.code = code; }

    private static final CommandType[] BY_CODE = new CommandType[256];
    static {
        for (CommandType t : values()) BY_CODE[Byte.toUnsignedInt(t.code)] = t;
    }

    public static CommandType fromCode(byte code) {
        CommandType t = BY_CODE[Byte.toUnsignedInt(code)];
        if (t == null) throw new IllegalArgumentException("Unknown CommandType: " + code);
        return t;
    }
}
