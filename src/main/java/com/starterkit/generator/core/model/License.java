package com.starterkit.generator.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * License attached to an order. Issued outside the generator; read-only here.
 *
 * @param licenseKey    key printed in the generated LICENSE document
 * @param downloadToken token used by the delivery layer
 * @param downloadCount downloads consumed so far
 * @param maxDownloads  download allowance
 * @param status        license status
 * @param expiresAt     expiry, or null for a lifetime license
 */
public record License(
        String licenseKey,
        String downloadToken,
        int downloadCount,
        int maxDownloads,
        LicenseStatus status,
        Instant expiresAt
) {
    public License {
        Objects.requireNonNull(licenseKey, "licenseKey is required");
        status = status != null ? status : LicenseStatus.ACTIVE;
    }

    public boolean isExpired(Instant now) {
        return status == LicenseStatus.EXPIRED || (expiresAt != null && !expiresAt.isAfter(now));
    }

    public int remainingDownloads() {
        return Math.max(0, maxDownloads - downloadCount);
    }
}
