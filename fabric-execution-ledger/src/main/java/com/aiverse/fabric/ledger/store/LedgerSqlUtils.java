package com.aiverse.fabric.ledger.store;

import com.aiverse.fabric.contracts.FabricJson;
import org.postgresql.util.PGobject;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * SQL value conversion for ledger columns.
 */
public final class LedgerSqlUtils {

    public static final int NAME_MAX_LEN = 255;

    private LedgerSqlUtils() {}

    /**
     * Converts an id to a UUID. Ids that are not UUIDs map to a deterministic name-based UUID,
     * so the same id always lands on the same row.
     */
    public static UUID toUuid(String s) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim();
        try {
            return UUID.fromString(t);
        } catch (IllegalArgumentException notAUuid) {
            return UUID.nameUUIDFromBytes(t.getBytes(StandardCharsets.UTF_8));
        }
    }

    /** Truncates to max length; null or blank returns null. */
    public static String toName(String s, int maxLen) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim();
        return t.length() > maxLen ? t.substring(0, maxLen) : t;
    }

    public static Timestamp toTimestamp(Instant at) {
        return at != null ? Timestamp.from(at) : null;
    }

    public static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    public static PGobject toJsonb(Map<String, Object> value) throws SQLException {
        PGobject o = new PGobject();
        o.setType("jsonb");
        o.setValue(value != null ? FabricJson.toJson(value) : "{}");
        return o;
    }

    public static Map<String, Object> fromJsonb(String json) {
        if (json == null || json.isBlank()) return Map.of();
        return FabricJson.parseObject(json);
    }
}
