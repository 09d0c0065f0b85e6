package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * An account holding one asset type for one owner.
 *
 * The id is a name-based UUID of (owner, asset), so the same pair always maps to the
 * same fixed-width id. Ids are compared as strings to get the canonical lock order.
 * Balances are derived from the journal, never stored here.
 */
@Value
public class Account {
    String id;
    String userId;
    Kind kind;
    String assetTypeCode;
    long version;
    Instant createdAt;
    Instant updatedAt;

    public enum Kind {
        USER,
        SYSTEM
    }

    public static String idFor(String userId, String assetTypeCode) {
        byte[] name = (userId + '\u0000' + assetTypeCode).getBytes(StandardCharsets.UTF_8);
        return UUID.nameUUIDFromBytes(name).toString();
    }

    static Account open(String userId, String assetTypeCode, Kind kind, Instant now) {
        return new Account(idFor(userId, assetTypeCode), userId, kind, assetTypeCode, 0L, now, now);
    }
}
