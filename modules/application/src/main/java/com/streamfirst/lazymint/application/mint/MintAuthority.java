package com.streamfirst.lazymint.application.mint;

import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.domain.ErrorCode;
import com.streamfirst.lazymint.domain.LedgerEvent;
import com.streamfirst.lazymint.domain.OperationRejectedException;
import com.streamfirst.lazymint.domain.Redemption;
import com.streamfirst.lazymint.domain.Voucher;
import com.streamfirst.lazymint.ports.AssetRegistryPort;
import com.streamfirst.lazymint.ports.AuthorityPort;
import com.streamfirst.lazymint.ports.EventPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Redeems signed vouchers into issued assets.
 * Each redemption verifies the signer, the payment and the ledger, then issues the asset and marks
 * its metadata as used. Redemptions on one instance are serialized; a rejected redemption leaves
 * no trace besides its audit event.
 */
@Slf4j
@RequiredArgsConstructor
public class MintAuthority {

    private final VoucherSignatureVerifier signatureVerifier;
    private final VoucherLedger voucherLedger;
    private final AssetRegistryPort assetRegistryPort;
    private final AuthorityPort authorityPort;
    private final EventPort eventPort;

    private final ReentrantLock lock = new ReentrantLock();
    private BigInteger collectedProceeds = BigInteger.ZERO;

    /**
     * Redeems a voucher, issuing its asset to the requester.
     *
     * @param requester the address that will own the new asset
     * @param voucher the signed voucher
     * @param attachedPayment the payment sent with the request
     * @return the identifier of the issued asset
     * @throws OperationRejectedException if any check fails; nothing is issued or recorded
     */
    public BigInteger redeem(@NonNull Address requester, @NonNull Voucher voucher, @NonNull BigInteger attachedPayment) {
        if (attachedPayment.signum() < 0) {
            throw new IllegalArgumentException("Attached payment cannot be negative: " + attachedPayment);
        }

        lock.lock();
        try {
            Redemption redemption = Redemption.pending(requester, voucher);
            log.debug("Redeeming {} for {}", voucher, requester);
            try {
                BigInteger assetId = issue(requester, voucher, attachedPayment);
                settle(redemption.issued());
                log.info("Issued asset {} to {} for payment {}", assetId, requester, attachedPayment);
                return assetId;
            } catch (OperationRejectedException e) {
                log.warn("Rejected redemption of asset {} for {}: {}",
                        voucher.assetId(), requester, e.getMessage());
                settle(redemption.rejected(e.getCode()));
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private BigInteger issue(Address requester, Voucher voucher, BigInteger attachedPayment) {
        Address signer = signatureVerifier.recoverSigner(voucher);
        Address authority = authorityPort.designatedAuthority();
        if (!signer.equals(authority)) {
            throw new OperationRejectedException(ErrorCode.UNAUTHORIZED_SIGNER, "signer " + signer);
        }

        if (attachedPayment.compareTo(voucher.minPrice()) < 0) {
            throw new OperationRejectedException(ErrorCode.INSUFFICIENT_PAYMENT,
                "sent " + attachedPayment + ", required " + voucher.minPrice());
        }

        byte[] metadataHash = VoucherSignatureVerifier.metadataHash(voucher.metadataRef());
        if (voucherLedger.isUsed(metadataHash)) {
            throw new OperationRejectedException(ErrorCode.DUPLICATE_METADATA, voucher.metadataRef());
        }

        // DUPLICATE_ASSET_ID propagates unchanged from the registry
        assetRegistryPort.issue(requester, voucher.assetId());
        try {
            assetRegistryPort.bindMetadata(voucher.assetId(), voucher.metadataRef());
        } catch (RuntimeException e) {
            log.error("Failed to bind metadata to asset {}, revoking issuance", voucher.assetId(), e);
            assetRegistryPort.revoke(voucher.assetId());
            throw e;
        }

        voucherLedger.markUsed(metadataHash);
        collectedProceeds = collectedProceeds.add(attachedPayment);
        return voucher.assetId();
    }

    private void settle(Redemption redemption) {
        eventPort.publish(LedgerEvent.TOPIC, new LedgerEvent.RedemptionSettled(redemption));
    }

    /**
     * Checks whether a metadata reference has already been redeemed.
     */
    public boolean isMetadataRedeemed(String metadataRef) {
        return voucherLedger.isUsed(VoucherSignatureVerifier.metadataHash(metadataRef));
    }

    /**
     * Total payments attached to successful redemptions.
     */
    public BigInteger collectedProceeds() {
        lock.lock();
        try {
            return collectedProceeds;
        } finally {
            lock.unlock();
        }
    }
}
