package com.evidencetrust.evidence;

/**
 * @param brokenAt 1-based index of the first record that fails verification, or 0 when valid
 */
public record ChainVerification(boolean valid, int recordCount, int brokenAt) {

    public static ChainVerification intact(int recordCount) {
        return new ChainVerification(true, recordCount, 0);
    }

    public static ChainVerification brokenAt(int recordCount, int index) {
        return new ChainVerification(false, recordCount, index);
    }
}
