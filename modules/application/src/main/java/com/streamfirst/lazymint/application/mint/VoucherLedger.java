package com.streamfirst.lazymint.application.mint;

import lombok.extern.slf4j.Slf4j;
import org.web3j.utils.Numeric;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Set of metadata-reference hashes that have already been redeemed. Entries are only ever added.
 * The check and the mark belong to one redemption; {@link MintAuthority} holds its lock across both.
 */
@Slf4j
public class VoucherLedger {

    private final Set<String> usedMetadataHashes = ConcurrentHashMap.newKeySet();

    /**
     * Checks whether a metadata hash has already been redeemed.
     */
    public boolean isUsed(byte[] metadataHash) {
        return usedMetadataHashes.contains(Numeric.toHexString(metadataHash));
    }

    /**
     * Records a metadata hash as redeemed.
     *
     * @throws IllegalStateException if the hash was already recorded
     */
    public void markUsed(byte[] metadataHash) {
        String key = Numeric.toHexString(metadataHash);
        if (!usedMetadataHashes.add(key)) {
            throw new IllegalStateException("Metadata hash already redeemed: " + key);
        }
        log.debug("Marked metadata hash {} as redeemed", key);
    }

    public int size() {
        return usedMetadataHashes.size();
    }
}
