package com.streamfirst.lazymint.application.mint;

import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.domain.ErrorCode;
import com.streamfirst.lazymint.domain.OperationRejectedException;
import com.streamfirst.lazymint.domain.SigningDomain;
import com.streamfirst.lazymint.domain.Voucher;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * Builds the typed-data digest of a voucher and recovers the address that signed it.
 * The digest binds the voucher fields to the signing domain, so a signature is only valid for one
 * issuer, version, network and verifying contract. Stateless and safe to share between threads.
 */
@Slf4j
public class VoucherSignatureVerifier {

    static final String DOMAIN_TYPE =
        "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";
    static final String VOUCHER_TYPE =
        "NFTVoucher(uint256 tokenId,uint256 minPriceWei,string metadataURI)";

    static final int SIGNATURE_LENGTH = 65;

    // secp256k1 order / 2; signatures with a larger s are malleable duplicates
    private static final BigInteger HALF_CURVE_ORDER =
        new BigInteger("7FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF5D576E7357A4501DDFE92F46681B20A0", 16);

    private static final byte[] DOMAIN_TYPE_HASH = keccak(DOMAIN_TYPE);
    private static final byte[] VOUCHER_TYPE_HASH = keccak(VOUCHER_TYPE);

    @Getter
    private final SigningDomain domain;
    private final byte[] domainSeparator;

    public VoucherSignatureVerifier(SigningDomain domain) {
        this.domain = domain;
        this.domainSeparator = Hash.sha3(concat(
            DOMAIN_TYPE_HASH,
            keccak(domain.name()),
            keccak(domain.version()),
            word(domain.chainId()),
            word(Numeric.toBigInt(domain.verifyingContract().value()))));
        log.debug("Signing domain {} v{} on chain {} at {}",
                 domain.name(), domain.version(), domain.chainId(), domain.verifyingContract());
    }

    /**
     * Computes the digest a voucher's signature must cover.
     */
    public byte[] digest(Voucher voucher) {
        byte[] structHash = Hash.sha3(concat(
            VOUCHER_TYPE_HASH,
            word(voucher.assetId()),
            word(voucher.minPrice()),
            keccak(voucher.metadataRef())));
        return Hash.sha3(concat(new byte[] {0x19, 0x01}, domainSeparator, structHash));
    }

    /**
     * Recovers the address that produced the voucher's signature.
     *
     * @param voucher the signed voucher
     * @return the signer's address
     * @throws OperationRejectedException with {@code INVALID_SIGNATURE_FORMAT} if the signature is not
     *     a 65-byte {@code r || s || v} value with {@code v} of 27 or 28 and a canonical {@code s}, or no key can be
     *     recovered from it
     */
    public Address recoverSigner(Voucher voucher) {
        byte[] signature = voucher.signature();
        if (signature.length != SIGNATURE_LENGTH) {
            throw new OperationRejectedException(ErrorCode.INVALID_SIGNATURE_FORMAT,
                "invalid signature length " + signature.length);
        }

        byte[] r = Arrays.copyOfRange(signature, 0, 32);
        byte[] s = Arrays.copyOfRange(signature, 32, 64);
        byte v = signature[64];
        if (v != 27 && v != 28) {
            throw new OperationRejectedException(ErrorCode.INVALID_SIGNATURE_FORMAT,
                "invalid signature 'v' value " + v);
        }
        if (Numeric.toBigInt(s).compareTo(HALF_CURVE_ORDER) > 0) {
            throw new OperationRejectedException(ErrorCode.INVALID_SIGNATURE_FORMAT,
                "invalid signature 's' value");
        }

        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(digest(voucher), new Sign.SignatureData(v, r, s));
            return Address.of(Keys.getAddress(publicKey));
        } catch (SignatureException | RuntimeException e) {
            throw new OperationRejectedException(ErrorCode.INVALID_SIGNATURE_FORMAT,
                ErrorCode.INVALID_SIGNATURE_FORMAT.message(), e);
        }
    }

    /**
     * Hash under which a metadata reference is recorded once redeemed.
     */
    public static byte[] metadataHash(String metadataRef) {
        return keccak(metadataRef);
    }

    private static byte[] keccak(String value) {
        return Hash.sha3(value.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] word(BigInteger value) {
        return Numeric.toBytesPadded(value, 32);
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}
