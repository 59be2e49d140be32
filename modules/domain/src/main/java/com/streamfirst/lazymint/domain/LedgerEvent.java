package com.streamfirst.lazymint.domain;

import java.math.BigInteger;
import java.util.List;

/**
 * Audit events emitted by the issuance and distribution subsystems. Events are for observability
 * only and never drive control flow.
 */
public sealed interface LedgerEvent {

    /** Topic every ledger event is published on. */
    String TOPIC = "lazymint.events";

    /** A payee was registered at construction. */
    record PayeeAdded(int payeeIndex, List<Address> addresses, long shares) implements LedgerEvent {
        public PayeeAdded {
            addresses = List.copyOf(addresses);
        }
    }

    /** A payee's receiving address moved forward. */
    record AddressRotated(int payeeIndex, int enabledIndex, Address enabledAddress) implements LedgerEvent {}

    /** Owed funds were paid out to a payee's enabled address. */
    record PaymentReleased(int payeeIndex, Address to, BigInteger amount) implements LedgerEvent {}

    /** Funds arrived at the distribution instance. */
    record PaymentReceived(Address from, BigInteger amount) implements LedgerEvent {}

    /** An asset was issued by the asset registry. */
    record AssetIssued(Address from, Address to, BigInteger assetId) implements LedgerEvent {}

    /** A redemption request reached its end state. */
    record RedemptionSettled(Redemption redemption) implements LedgerEvent {}

    /** The designated voucher authority changed hands. */
    record AuthorityTransferred(Address previousAuthority, Address newAuthority) implements LedgerEvent {}
}
