package com.payment.wire.compliance;

/**
 * Redacts card-related fields so they are safe to include in logs.
 * Decoded cards never carry a PAN, but last4 and fingerprint still identify a card and are masked too.
 */
public final class CardDataMasker {

    private static final String MASKED_LAST4 = "****";
    private static final String MASKED_FINGERPRINT = "fp_***";

    private CardDataMasker() {}

    /** Returns a safe-to-log value for last4 (e.g. "4242" -> "****"). */
    public static String maskLast4(String last4) {
        if (last4 == null || last4.isBlank()) return null;
        return MASKED_LAST4;
    }

    /** Returns a safe-to-log value for a card fingerprint. */
    public static String maskFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) return null;
        return MASKED_FINGERPRINT;
    }
}
