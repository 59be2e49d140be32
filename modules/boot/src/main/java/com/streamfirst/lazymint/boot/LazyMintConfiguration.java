package com.streamfirst.lazymint.boot;

import com.streamfirst.lazymint.adapters.InMemoryAssetRegistryAdapter;
import com.streamfirst.lazymint.adapters.InMemoryAuthorityAdapter;
import com.streamfirst.lazymint.adapters.InMemoryEventAdapter;
import com.streamfirst.lazymint.adapters.InMemoryValueTransferAdapter;
import com.streamfirst.lazymint.application.equity.AddressRotation;
import com.streamfirst.lazymint.application.equity.PaymentDistributor;
import com.streamfirst.lazymint.application.equity.ShareRegistry;
import com.streamfirst.lazymint.application.mint.MintAuthority;
import com.streamfirst.lazymint.application.mint.VoucherLedger;
import com.streamfirst.lazymint.application.mint.VoucherSignatureVerifier;
import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.domain.LedgerEvent;
import com.streamfirst.lazymint.ports.AssetRegistryPort;
import com.streamfirst.lazymint.ports.AuthorityPort;
import com.streamfirst.lazymint.ports.EventPort;
import com.streamfirst.lazymint.ports.ValueTransferPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires ports, in-memory adapters and the issuance and distribution services.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LazyMintProperties.class)
public class LazyMintConfiguration {

    // --- Adapter Beans ---

    @Bean
    public EventPort eventPort() {
        InMemoryEventAdapter eventAdapter = new InMemoryEventAdapter();
        eventAdapter.subscribe(LedgerEvent.TOPIC, LedgerEvent.class, event -> log.info("Event: {}", event));
        return eventAdapter;
    }

    @Bean
    public AuthorityPort authorityPort(LazyMintProperties properties, EventPort eventPort) {
        return new InMemoryAuthorityAdapter(Address.of(properties.authority()), eventPort);
    }

    @Bean
    public AssetRegistryPort assetRegistryPort(LazyMintProperties properties, EventPort eventPort) {
        LazyMintProperties.AssetRegistrySettings settings = properties.assetRegistry();
        return new InMemoryAssetRegistryAdapter(settings.baseTokenUri(), settings.contractUri(), eventPort);
    }

    @Bean
    public ValueTransferPort valueTransferPort() {
        return new InMemoryValueTransferAdapter();
    }

    // --- Issuance ---

    @Bean
    public VoucherSignatureVerifier voucherSignatureVerifier(LazyMintProperties properties) {
        return new VoucherSignatureVerifier(properties.signingDomain().toSigningDomain());
    }

    @Bean
    public MintAuthority mintAuthority(VoucherSignatureVerifier verifier, AssetRegistryPort assetRegistryPort,
                                       AuthorityPort authorityPort, EventPort eventPort) {
        return new MintAuthority(verifier, new VoucherLedger(), assetRegistryPort, authorityPort, eventPort);
    }

    // --- Distribution ---

    @Bean
    public ShareRegistry shareRegistry(LazyMintProperties properties, EventPort eventPort) {
        LazyMintProperties.EquitySettings equity = properties.equity();
        return new ShareRegistry(equity.addressGroups(), equity.shares(), equity.groupSize(), eventPort);
    }

    @Bean
    public AddressRotation addressRotation(ShareRegistry shareRegistry, EventPort eventPort) {
        return new AddressRotation(shareRegistry, eventPort);
    }

    @Bean
    public PaymentDistributor paymentDistributor(ShareRegistry shareRegistry, ValueTransferPort valueTransferPort,
                                                 EventPort eventPort) {
        return new PaymentDistributor(shareRegistry, valueTransferPort, eventPort);
    }

    @Bean
    public CommandLineRunner startupSummary(VoucherSignatureVerifier verifier, AuthorityPort authorityPort,
                                            ShareRegistry shareRegistry) {
        return args -> {
            log.info("Vouchers for '{}' on chain {} must be signed by {}",
                    verifier.getDomain().name(), verifier.getDomain().chainId(), authorityPort.designatedAuthority());
            log.info("Distributing to {} payees over {} total shares",
                    shareRegistry.payeeCount(), shareRegistry.totalShares());
            for (int i = 0; i < shareRegistry.payeeCount(); i++) {
                log.info("  payee {}: {} shares, receiving at {}",
                        i, shareRegistry.sharesOf(i), shareRegistry.enabledAddress(i));
            }
        };
    }
}
