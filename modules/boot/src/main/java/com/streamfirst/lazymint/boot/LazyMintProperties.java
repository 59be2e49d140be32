package com.streamfirst.lazymint.boot;

import com.streamfirst.lazymint.application.equity.ShareRegistry;
import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.domain.SigningDomain;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigInteger;
import java.util.List;

/**
 * Deployment settings bound from the {@code lazymint.*} namespace.
 */
@ConfigurationProperties(prefix = "lazymint")
public record LazyMintProperties(
    SigningDomainSettings signingDomain,
    String authority,
    AssetRegistrySettings assetRegistry,
    EquitySettings equity
) {

    /** Typed-data domain that voucher signatures are bound to. */
    public record SigningDomainSettings(String name, @DefaultValue("1") String version,
                                        BigInteger chainId, String verifyingContract) {
        public SigningDomain toSigningDomain() {
            return new SigningDomain(name, version, chainId, Address.of(verifyingContract));
        }
    }

    public record AssetRegistrySettings(@DefaultValue("ipfs://") String baseTokenUri,
                                        @DefaultValue("") String contractUri) {}

    public record EquitySettings(@DefaultValue("" + ShareRegistry.DEFAULT_GROUP_SIZE) int groupSize,
                                 List<PayeeSettings> payees) {

        public List<List<Address>> addressGroups() {
            return payees.stream()
                .map(payee -> payee.addresses().stream().map(Address::of).toList())
                .toList();
        }

        public List<Long> shares() {
            return payees.stream().map(PayeeSettings::shares).toList();
        }
    }

    /** One payee: its rotation addresses, in order, and its share count. */
    public record PayeeSettings(List<String> addresses, long shares) {}
}
