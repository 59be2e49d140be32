package com.streamfirst.lazymint.domain;

import java.math.BigInteger;
import java.time.Instant;
import lombok.NonNull;

/**
 * Outcome of a single redemption request. A request starts {@code PENDING} and ends either
 * {@code ISSUED} or {@code REJECTED}; there is no way back.
 */
public record Redemption(
    @NonNull Address requester,
    @NonNull BigInteger assetId,
    @NonNull String metadataRef,
    @NonNull Status status,
    ErrorCode errorCode, // set only when rejected
    @NonNull Instant timestamp
) {

    public enum Status {
        PENDING,
        ISSUED,
        REJECTED
    }

    public static Redemption pending(Address requester, Voucher voucher) {
        return new Redemption(requester, voucher.assetId(), voucher.metadataRef(), Status.PENDING, null, Instant.now());
    }

    /**
     * Moves a pending redemption to its successful end state.
     */
    public Redemption issued() {
        requirePending();
        return new Redemption(requester, assetId, metadataRef, Status.ISSUED, null, Instant.now());
    }

    /**
     * Moves a pending redemption to its failed end state.
     */
    public Redemption rejected(ErrorCode code) {
        requirePending();
        return new Redemption(requester, assetId, metadataRef, Status.REJECTED, code, Instant.now());
    }

    private void requirePending() {
        if (status != Status.PENDING) {
            throw new IllegalStateException("Redemption already settled as " + status);
        }
    }
}
