package com.lob.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolTest {

    @Test
    void testSideCodes() {
        assertEquals(Side.BUY,  Side.fromCode(Side.BUY.code));
        assertEquals(Side.SELL, Side.fromCode(Side.SELL.code));
        assertEquals(Side.SELL, Side.BUY.opposite());
        assertEquals(Side.BUY,  Side.SELL.opposite());
        assertThrows(IllegalArgumentException.class, () -> Side.fromCode((byte) 9));
    }

    @Test
    void testCommandTypeCodes() {
        for (CommandType t : CommandType.values()) {
            assertEquals(t, CommandType.fromCode(t.code));
        }
        assertThrows(IllegalArgumentException.class, () -> CommandType.fromCode((byte) 99));
    }

    @Test
    void testUnknownRejectCodeMapsToUnknown() {
        assertEquals(RejectReason.UNKNOWN_ORDER_ID, RejectReason.fromCode(RejectReason.UNKNOWN_ORDER_ID.code));
        assertEquals(RejectReason.UNKNOWN, RejectReason.fromCode((byte) 77));
    }

    @Test
    void testCommandsReportTheirType() {
        assertEquals(CommandType.NEW_LIMIT_ORDER,  new NewLimitOrder(1, Side.BUY, 10, 5).type());
        assertEquals(CommandType.NEW_MARKET_ORDER, new NewMarketOrder(2, Side.SELL, 5).type());
        assertEquals(CommandType.CANCEL_ORDER,     new CancelOrder(3).type());
        assertEquals(CommandType.MODIFY_ORDER,     ModifyOrder.quantity(4, 1).type());
        assertEquals(0L, new NewLimitOrder(1, Side.BUY, 10, 5).ownerId(), "Anonymous by default");
    }

    @Test
    void testModifyPriceChangeDetection() {
        assertFalse(ModifyOrder.quantity(1, 5).changesPrice(10));
        assertFalse(new ModifyOrder(1, 10, 5).changesPrice(10));
        assertTrue(new ModifyOrder(1, 11, 5).changesPrice(10));
    }

    @Test
    void testSelfMatchPolicyParsing() {
        assertEquals(SelfMatchPolicy.CANCEL_INCOMING, SelfMatchPolicy.parse(" cancel_incoming "));
        assertThrows(IllegalArgumentException.class, () -> SelfMatchPolicy.parse("sometimes"));
    }
}
