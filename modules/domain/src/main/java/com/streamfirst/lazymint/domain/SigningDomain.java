package com.streamfirst.lazymint.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Binds voucher signatures to one issuer, protocol version, network and contract instance, so a
 * signature produced for one of them can never be replayed against another.
 *
 * @param name the issuer name (the collection name)
 * @param version the signing protocol version, e.g. "1"
 * @param chainId the network identifier
 * @param verifyingContract the address of the instance that verifies the vouchers
 */
public record SigningDomain(String name, String version, BigInteger chainId, Address verifyingContract) {
    public SigningDomain {
        Objects.requireNonNull(name, "Domain name cannot be null");
        Objects.requireNonNull(version, "Domain version cannot be null");
        Objects.requireNonNull(chainId, "Chain ID cannot be null");
        Objects.requireNonNull(verifyingContract, "Verifying contract cannot be null");
        if (chainId.signum() < 0) {
            throw new IllegalArgumentException("Chain ID cannot be negative: " + chainId);
        }
    }
}
