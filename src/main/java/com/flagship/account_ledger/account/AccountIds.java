package com.flagship.account_ledger.account;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * Allocates account ids on the command-issuing side.
 *
 * Ids are version 7 UUIDs (RFC 9562): 48 bits of Unix epoch milliseconds followed by
 * random bits, so ids sort in creation order.
 */
public final class AccountIds {

    private static final SecureRandom RANDOM = new SecureRandom();

    private AccountIds() {
        // Utility class
    }

    public static UUID newId() {
        return newId(System.currentTimeMillis());
    }

    /**
     * Id stamped with the given creation time instead of the clock.
     */
    public static UUID newId(long epochMillis) {
        byte[] random = new byte[10];
        RANDOM.nextBytes(random);

        long msb = (epochMillis & 0xFFFF_FFFF_FFFFL) << 16;
        msb |= 0x7000L;                                   // version 7
        msb |= ((random[0] & 0x0FL) << 8) | (random[1] & 0xFFL);

        long lsb = 0x8000_0000_0000_0000L;                // IETF variant
        lsb |= (random[2] & 0x3FL) << 56;
        for (int i = 3; i < 10; i++) {
            lsb |= (random[i] & 0xFFL) << (8 * (9 - i));
        }
        return new UUID(msb, lsb);
    }
}
