package com.streamfirst.lazymint.ports;

import com.streamfirst.lazymint.domain.Address;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Port for the registry that records issued assets and their owners.
 * Transfer and ownership bookkeeping beyond issuance live behind this port.
 */
public interface AssetRegistryPort {

    /**
     * Issues a new asset to the given owner.
     *
     * @param owner the address that will own the asset
     * @param assetId the identifier of the new asset
     * @throws com.streamfirst.lazymint.domain.OperationRejectedException with
     *     {@code DUPLICATE_ASSET_ID} if the identifier has already been issued
     */
    void issue(Address owner, BigInteger assetId);

    /**
     * Binds a metadata reference to an issued asset.
     *
     * @param assetId the asset identifier
     * @param metadataRef the metadata reference (e.g. an IPFS URI)
     * @throws IllegalArgumentException if the asset has not been issued
     */
    void bindMetadata(BigInteger assetId, String metadataRef);

    /**
     * Removes an asset issued within the current operation. Only used to undo an issuance whose
     * enclosing operation failed before completing.
     *
     * @param assetId the asset identifier
     */
    void revoke(BigInteger assetId);

    /**
     * Gets the owner of an asset.
     *
     * @param assetId the asset identifier
     * @return the owner, or empty if the asset has not been issued
     */
    Optional<Address> ownerOf(BigInteger assetId);

    /**
     * Gets the metadata reference bound to an asset.
     *
     * @param assetId the asset identifier
     * @return the metadata reference, or empty if none is bound
     */
    Optional<String> metadataRef(BigInteger assetId);

    /**
     * Checks whether an asset identifier has been issued.
     */
    default boolean exists(BigInteger assetId) {
        return ownerOf(assetId).isPresent();
    }

    /**
     * Gets the fully resolved metadata URI of an asset (base token URI + metadata reference).
     *
     * @param assetId the asset identifier
     * @return the token URI, or empty if the asset has no metadata bound
     */
    Optional<String> tokenUri(BigInteger assetId);

    /**
     * Gets the collection-level metadata URI.
     */
    String contractUri();
}
