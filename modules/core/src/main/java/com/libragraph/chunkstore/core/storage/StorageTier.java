package com.libragraph.chunkstore.core.storage;

/**
 * Storage class a chunk currently lives in. Reclamation treats all tiers alike.
 */
public enum StorageTier {
    HOT,
    WARM,
    COLD,
    ARCHIVE;

    /**
     * Maps an S3 storage class name to a tier. Unknown or absent classes are HOT.
     */
    public static StorageTier fromStorageClass(String storageClass) {
        if (storageClass == null) {
            return HOT;
        }
        return switch (storageClass) {
            case "STANDARD_IA", "ONEZONE_IA", "INTELLIGENT_TIERING" -> WARM;
            case "GLACIER", "GLACIER_IR" -> COLD;
            case "DEEP_ARCHIVE" -> ARCHIVE;
            default -> HOT;
        };
    }
}
