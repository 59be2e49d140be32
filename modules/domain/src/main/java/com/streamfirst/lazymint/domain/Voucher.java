package com.streamfirst.lazymint.domain;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * A signed, off-line issued authorization to create one specific asset at a minimum price. Exists
 * only for the duration of a redemption request and is never persisted.
 *
 * @param assetId the identifier the asset will be issued under
 * @param minPrice the minimum acceptable payment, in the smallest currency unit
 * @param metadataRef the metadata reference bound to the asset (e.g. {@code ipfs://...})
 * @param signature the issuer's signature over the typed-data digest of the three fields above
 */
public record Voucher(BigInteger assetId, BigInteger minPrice, String metadataRef, byte[] signature) {

  public Voucher {
    Objects.requireNonNull(assetId, "Asset ID cannot be null");
    Objects.requireNonNull(minPrice, "Minimum price cannot be null");
    Objects.requireNonNull(metadataRef, "Metadata reference cannot be null");
    Objects.requireNonNull(signature, "Signature cannot be null");
    if (assetId.signum() < 0 || assetId.bitLength() > 256) {
      throw new IllegalArgumentException("Asset ID must be an unsigned 256-bit integer: " + assetId);
    }
    if (minPrice.signum() < 0 || minPrice.bitLength() > 256) {
      throw new IllegalArgumentException(
          "Minimum price must be an unsigned 256-bit integer: " + minPrice);
    }
    signature = signature.clone();
  }

  /** Returns a copy of this voucher carrying a different signature. */
  public Voucher withSignature(byte[] newSignature) {
    return new Voucher(assetId, minPrice, metadataRef, newSignature);
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Voucher other)) {
      return false;
    }
    return assetId.equals(other.assetId)
        && minPrice.equals(other.minPrice)
        && metadataRef.equals(other.metadataRef)
        && Arrays.equals(signature, other.signature);
  }

  @Override
  public int hashCode() {
    return Objects.hash(assetId, minPrice, metadataRef, Arrays.hashCode(signature));
  }

  @Override
  public String toString() {
    return "Voucher{"
        + "assetId="
        + assetId
        + ", minPrice="
        + minPrice
        + ", metadataRef='"
        + metadataRef
        + '\''
        + ", signatureLength="
        + signature.length
        + '}';
  }
}
