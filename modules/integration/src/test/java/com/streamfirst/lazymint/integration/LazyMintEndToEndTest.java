package com.streamfirst.lazymint.integration;

import com.streamfirst.lazymint.adapters.*;
import com.streamfirst.lazymint.application.equity.*;
import com.streamfirst.lazymint.application.mint.*;
import com.streamfirst.lazymint.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of a lazy-minting deployment.
 * Vouchers are signed off-line with real secp256k1 keys and redeemed through the mint authority;
 * the proceeds are then sent to the distribution instance and split among payees, with address
 * rotation in between. All collaborators are in-memory adapters.
 */
@Slf4j
public class LazyMintEndToEndTest {

    // Well-known development keys
    private static final Credentials AUTHORITY =
        Credentials.create("0x2a871d0798f97d79848a013d4936a73bf4cc922c825d33c1cf7073dff6d409c6");
    private static final Credentials STRANGER =
        Credentials.create("0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80");

    private static final SigningDomain DOMAIN = new SigningDomain(
        "Lazy Minting ERC721", "1", BigInteger.valueOf(1337),
        Address.of("0x5FbDB2315678afecb367f032d93F642f64180aa3"));

    private static final Address REQUESTER = Address.of("0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266");

    private static final List<List<Address>> PAYEE_ADDRESSES = List.of(
        addresses("0x70997970C51812dc3A010C7d01b50e0d17dc79C8", "0x3C44CdDdB6a900fa2b585dd299e03d12FA4293BC",
            "0x90F79bf6EB2c4f870365E785982E1f101E93b906"),
        addresses("0x15d34AAf54267DB7D7c367839AAf71A00a2C6A65", "0x9965507D1a55bcC2695C58ba16FB37d819B0A4dc",
            "0x976EA74026E726554dB657fA54763abd0C3a0aa9"),
        addresses("0x14dC79964da2C08b23698B3D3cc7Ca32193d9955", "0x23618e81E3f5cdF7f54C3d65f7FBc0aBf5B21E8f",
            "0xBcd4042DE499D14e55001CcbB24a551F3b954096"));

    // Adapters
    private InMemoryEventAdapter eventAdapter;
    private InMemoryAssetRegistryAdapter assetRegistryAdapter;
    private InMemoryAuthorityAdapter authorityAdapter;
    private InMemoryValueTransferAdapter valueTransferAdapter;

    // Application services
    private VoucherSignatureVerifier verifier;
    private MintAuthority mintAuthority;
    private ShareRegistry shareRegistry;
    private AddressRotation addressRotation;
    private PaymentDistributor paymentDistributor;

    @BeforeEach
    void setupDeployment() {
        log.info("Setting up lazy-minting deployment for testing");

        eventAdapter = new InMemoryEventAdapter();
        assetRegistryAdapter = new InMemoryAssetRegistryAdapter("ipfs://", "ipfs://contractcid", eventAdapter);
        authorityAdapter = new InMemoryAuthorityAdapter(Address.of(AUTHORITY.getAddress()), eventAdapter);
        valueTransferAdapter = new InMemoryValueTransferAdapter();

        verifier = new VoucherSignatureVerifier(DOMAIN);
        mintAuthority = new MintAuthority(verifier, new VoucherLedger(), assetRegistryAdapter, authorityAdapter,
            eventAdapter);

        shareRegistry = new ShareRegistry(PAYEE_ADDRESSES, List.of(100L, 75L, 100L), eventAdapter);
        addressRotation = new AddressRotation(shareRegistry, eventAdapter);
        paymentDistributor = new PaymentDistributor(shareRegistry, valueTransferAdapter, eventAdapter);

        log.info("Deployment setup complete");
    }

    @Test
    void testProceedsSplitWithRoundingDust() {
        paymentDistributor.receive(REQUESTER, BigInteger.valueOf(1000));

        assertEquals(BigInteger.valueOf(363), paymentDistributor.release(0));
        assertEquals(BigInteger.valueOf(272), paymentDistributor.release(1));
        assertEquals(BigInteger.valueOf(363), paymentDistributor.release(2));

        assertEquals(BigInteger.valueOf(998), shareRegistry.totalReleased());
        assertEquals(BigInteger.valueOf(2), paymentDistributor.heldBalance());
        log.info("Released 998 of 1000, {} left as dust", paymentDistributor.heldBalance());
    }

    @Test
    void testRedeemVoucherAndRejectResubmission() {
        Voucher voucher = sign(voucher(1337, 1, "ipfs://test"), AUTHORITY);

        BigInteger assetId = mintAuthority.redeem(REQUESTER, voucher, BigInteger.ONE);

        assertEquals(BigInteger.valueOf(1337), assetId);
        assertEquals(REQUESTER, assetRegistryAdapter.ownerOf(assetId).orElseThrow());
        assertEquals("ipfs://ipfs://test", assetRegistryAdapter.tokenUri(assetId).orElseThrow());

        OperationRejectedException resubmitted = assertThrows(OperationRejectedException.class,
            () -> mintAuthority.redeem(REQUESTER, voucher, BigInteger.ONE));
        assertEquals(ErrorCode.DUPLICATE_METADATA, resubmitted.getCode());
        assertEquals(ErrorCode.Category.STATE_CONFLICT, resubmitted.getCategory());
        assertEquals(1, assetRegistryAdapter.size());
    }

    @Test
    void testVoucherSignedByNonAuthorityIsRejected() {
        Voucher voucher = sign(voucher(1337, 1, "ipfs://test"), STRANGER);

        OperationRejectedException rejected = assertThrows(OperationRejectedException.class,
            () -> mintAuthority.redeem(REQUESTER, voucher, BigInteger.ONE));

        assertEquals(ErrorCode.UNAUTHORIZED_SIGNER, rejected.getCode());
        assertEquals(ErrorCode.Category.AUTHORIZATION, rejected.getCategory());
        assertFalse(assetRegistryAdapter.exists(BigInteger.valueOf(1337)));
        assertFalse(mintAuthority.isMetadataRedeemed("ipfs://test"));
    }

    @Test
    void testRotationRedirectsFundsUntilAddressesRunOut() {
        Address otherPayee = PAYEE_ADDRESSES.get(1).get(0);

        assertEquals(1, addressRotation.advance(otherPayee, 0));
        paymentDistributor.receive(REQUESTER, BigInteger.valueOf(275));
        paymentDistributor.release(0);
        assertEquals(BigInteger.valueOf(100), valueTransferAdapter.balanceOf(PAYEE_ADDRESSES.get(0).get(1)));
        assertEquals(BigInteger.ZERO, valueTransferAdapter.balanceOf(PAYEE_ADDRESSES.get(0).get(0)));

        assertEquals(2, addressRotation.advance(otherPayee, 0));
        OperationRejectedException exhausted = assertThrows(OperationRejectedException.class,
            () -> addressRotation.advance(otherPayee, 0));
        assertEquals(ErrorCode.ALL_ADDRESSES_USED, exhausted.getCode());
        assertEquals(2, shareRegistry.enabledAddressIndex(0));
    }

    @Test
    void testPayeeCannotRotateItself() {
        OperationRejectedException rejected = assertThrows(OperationRejectedException.class,
            () -> addressRotation.advance(PAYEE_ADDRESSES.get(0).get(0), 0));

        assertEquals(ErrorCode.SELF_ROTATION_FORBIDDEN, rejected.getCode());
        assertEquals(0, shareRegistry.enabledAddressIndex(0));
    }

    @Test
    void testMintProceedsFlowToPayees() {
        for (int i = 0; i < 5; i++) {
            Voucher voucher = sign(voucher(100 + i, 200, "ipfs://item-" + i), AUTHORITY);
            mintAuthority.redeem(REQUESTER, voucher, BigInteger.valueOf(220));
        }
        assertEquals(BigInteger.valueOf(1100), mintAuthority.collectedProceeds());

        paymentDistributor.receive(REQUESTER, mintAuthority.collectedProceeds());
        for (int i = 0; i < shareRegistry.payeeCount(); i++) {
            paymentDistributor.release(i);
        }

        assertEquals(BigInteger.valueOf(400), valueTransferAdapter.balanceOf(PAYEE_ADDRESSES.get(0).get(0)));
        assertEquals(BigInteger.valueOf(300), valueTransferAdapter.balanceOf(PAYEE_ADDRESSES.get(1).get(0)));
        assertEquals(BigInteger.valueOf(400), valueTransferAdapter.balanceOf(PAYEE_ADDRESSES.get(2).get(0)));
        assertEquals(BigInteger.ZERO, paymentDistributor.heldBalance());
        assertEquals(5, eventAdapter.getPublishedEvents(LedgerEvent.AssetIssued.class).size());
    }

    @Test
    void testConcurrentRedemptionsOfTheSameMetadataIssueOnce() throws Exception {
        List<CompletableFuture<Boolean>> attempts = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            Voucher voucher = sign(voucher(500 + i, 1, "ipfs://contested"), AUTHORITY);
            attempts.add(CompletableFuture.supplyAsync(() -> {
                try {
                    mintAuthority.redeem(REQUESTER, voucher, BigInteger.ONE);
                    return true;
                } catch (OperationRejectedException e) {
                    assertEquals(ErrorCode.DUPLICATE_METADATA, e.getCode());
                    return false;
                }
            }));
        }

        long successes = 0;
        for (CompletableFuture<Boolean> attempt : attempts) {
            if (attempt.get(10, TimeUnit.SECONDS)) {
                successes++;
            }
        }
        assertEquals(1, successes);
        assertEquals(1, assetRegistryAdapter.size());
        assertEquals(BigInteger.ONE, mintAuthority.collectedProceeds());
    }

    @Test
    void testConcurrentReleasesNeverOverpay() throws Exception {
        paymentDistributor.receive(REQUESTER, BigInteger.valueOf(27_500));

        List<CompletableFuture<Void>> releases = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            int payee = i % 3;
            releases.add(CompletableFuture.runAsync(() -> {
                try {
                    paymentDistributor.release(payee);
                } catch (OperationRejectedException e) {
                    assertEquals(ErrorCode.NOTHING_DUE, e.getCode());
                }
            }));
        }
        CompletableFuture.allOf(releases.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertEquals(BigInteger.valueOf(10_000), shareRegistry.releasedOf(0));
        assertEquals(BigInteger.valueOf(7_500), shareRegistry.releasedOf(1));
        assertEquals(BigInteger.valueOf(10_000), shareRegistry.releasedOf(2));
        assertEquals(BigInteger.ZERO, paymentDistributor.heldBalance());
    }

    @Test
    void testInvariantsAcrossMixedOperations() {
        BigInteger[] lastReleased = {BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO};
        int[] lastEnabled = {0, 0, 0};

        long[] inflows = {999, 1, 12_345, 274, 3};
        for (int round = 0; round < inflows.length; round++) {
            paymentDistributor.receive(REQUESTER, BigInteger.valueOf(inflows[round]));
            int caller = (round + 1) % 3;
            try {
                addressRotation.advance(shareRegistry.enabledAddress(caller), round % 3);
            } catch (OperationRejectedException e) {
                log.info("Rotation in round {} rejected: {}", round, e.getCode());
            }
            for (int i = 0; i < 3; i++) {
                try {
                    paymentDistributor.release(i);
                } catch (OperationRejectedException e) {
                    assertEquals(ErrorCode.NOTHING_DUE, e.getCode());
                }
            }

            BigInteger sumReleased = BigInteger.ZERO;
            long sumShares = 0;
            for (int i = 0; i < 3; i++) {
                BigInteger released = shareRegistry.releasedOf(i);
                assertTrue(released.compareTo(lastReleased[i]) >= 0, "released must not decrease");
                lastReleased[i] = released;

                int enabled = shareRegistry.enabledAddressIndex(i);
                assertTrue(enabled >= lastEnabled[i] && enabled <= shareRegistry.getGroupSize() - 1);
                lastEnabled[i] = enabled;

                sumReleased = sumReleased.add(released);
                sumShares += shareRegistry.sharesOf(i);
            }
            assertEquals(shareRegistry.totalReleased(), sumReleased);
            assertEquals(shareRegistry.totalShares(), sumShares);

            BigInteger deficit = paymentDistributor.totalReceived().subtract(shareRegistry.totalReleased());
            assertTrue(deficit.signum() >= 0);
            assertTrue(deficit.compareTo(BigInteger.valueOf(shareRegistry.payeeCount())) < 0);
        }
    }

    private static List<Address> addresses(String... values) {
        List<Address> result = new ArrayList<>();
        for (String value : values) {
            result.add(Address.of(value));
        }
        return List.copyOf(result);
    }

    private static Voucher voucher(long assetId, long minPrice, String metadataRef) {
        return new Voucher(BigInteger.valueOf(assetId), BigInteger.valueOf(minPrice), metadataRef, new byte[0]);
    }

    private Voucher sign(Voucher voucher, Credentials signer) {
        Sign.SignatureData signature = Sign.signMessage(verifier.digest(voucher), signer.getEcKeyPair(), false);
        byte[] packed = new byte[65];
        System.arraycopy(signature.getR(), 0, packed, 0, 32);
        System.arraycopy(signature.getS(), 0, packed, 32, 32);
        packed[64] = signature.getV()[0];
        return voucher.withSignature(packed);
    }
}
