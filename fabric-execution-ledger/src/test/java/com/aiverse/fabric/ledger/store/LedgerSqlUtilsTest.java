package com.aiverse.fabric.ledger.store;

import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LedgerSqlUtilsTest {

    @Test
    void toUuid_keepsUuidsAndHashesOtherIds() throws Exception {
        UUID id = UUID.randomUUID();
        assertEquals(id, LedgerSqlUtils.toUuid(id.toString()));
        assertEquals(LedgerSqlUtils.toUuid("exec-1"), LedgerSqlUtils.toUuid(" exec-1 "));
        assertNull(LedgerSqlUtils.toUuid(" "));
    }

    @Test
    void toName_truncates() {
        assertEquals("abc", LedgerSqlUtils.toName("abcdef", 3));
        assertNull(LedgerSqlUtils.toName("", 3));
    }

    @Test
    void jsonb_writesSortedJsonAndReadsBack() throws Exception {
        PGobject o = LedgerSqlUtils.toJsonb(Map.of("b", 1, "a", "x"));
        assertEquals("jsonb", o.getType());
        assertEquals("{\"a\":\"x\",\"b\":1}", o.getValue());
        assertEquals("x", LedgerSqlUtils.fromJsonb(o.getValue()).get("a"));
        assertEquals("{}", LedgerSqlUtils.toJsonb(null).getValue());
        assertTrue(LedgerSqlUtils.fromJsonb(null).isEmpty());
    }
}
