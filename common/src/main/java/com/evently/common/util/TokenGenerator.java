package com.evently.common.util;

import java.util.UUID;

public class TokenGenerator {

    /**
     * Generate a waiting room queue token
     */
    public static String generateQueueToken() {
        return "QUEUE_" + UUID.randomUUID().toString().replace("-", "").toUpperCase();
    }

    /**
     * Generate a payment transaction id
     */
    public static String generateTransactionId() {
        return "txn_" + System.currentTimeMillis() + "_"
            + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Generate a scheduler lock owner id, unique per instance
     */
    public static String generateInstanceId() {
        return UUID.randomUUID().toString();
    }
}
