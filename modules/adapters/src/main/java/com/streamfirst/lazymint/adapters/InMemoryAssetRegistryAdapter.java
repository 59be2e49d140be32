package com.streamfirst.lazymint.adapters;

import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.domain.ErrorCode;
import com.streamfirst.lazymint.domain.LedgerEvent;
import com.streamfirst.lazymint.domain.OperationRejectedException;
import com.streamfirst.lazymint.ports.AssetRegistryPort;
import com.streamfirst.lazymint.ports.EventPort;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of AssetRegistryPort for testing and development.
 * Keeps owners and metadata references in maps; token URIs are the base token URI followed by
 * the bound metadata reference.
 */
@Slf4j
@RequiredArgsConstructor
public class InMemoryAssetRegistryAdapter implements AssetRegistryPort {

    @Getter
    @NonNull
    private final String baseTokenUri;
    @NonNull
    private final String contractUri;
    @NonNull
    private final EventPort eventPort;

    private final Map<BigInteger, Address> owners = new ConcurrentHashMap<>();
    private final Map<BigInteger, String> metadataRefs = new ConcurrentHashMap<>();

    @Override
    public void issue(@NonNull Address owner, @NonNull BigInteger assetId) {
        if (owner.isZero()) {
            throw new OperationRejectedException(ErrorCode.ZERO_ADDRESS, "cannot issue to the zero address");
        }
        if (owners.putIfAbsent(assetId, owner) != null) {
            throw new OperationRejectedException(ErrorCode.DUPLICATE_ASSET_ID, "asset " + assetId);
        }
        log.info("Issued asset {} to {}", assetId, owner);
        eventPort.publish(LedgerEvent.TOPIC, new LedgerEvent.AssetIssued(Address.ZERO, owner, assetId));
    }

    @Override
    public void bindMetadata(@NonNull BigInteger assetId, @NonNull String metadataRef) {
        if (!owners.containsKey(assetId)) {
            throw new IllegalArgumentException("Asset not issued: " + assetId);
        }
        metadataRefs.put(assetId, metadataRef);
        log.debug("Bound metadata {} to asset {}", metadataRef, assetId);
    }

    @Override
    public void revoke(@NonNull BigInteger assetId) {
        owners.remove(assetId);
        metadataRefs.remove(assetId);
        log.warn("Revoked asset {}", assetId);
    }

    @Override
    public Optional<Address> ownerOf(BigInteger assetId) {
        return Optional.ofNullable(owners.get(assetId));
    }

    @Override
    public Optional<String> metadataRef(BigInteger assetId) {
        return Optional.ofNullable(metadataRefs.get(assetId));
    }

    @Override
    public Optional<String> tokenUri(BigInteger assetId) {
        return metadataRef(assetId).map(ref -> baseTokenUri + ref);
    }

    @Override
    public String contractUri() {
        return contractUri;
    }

    /** Number of assets issued. */
    public int size() {
        return owners.size();
    }
}
