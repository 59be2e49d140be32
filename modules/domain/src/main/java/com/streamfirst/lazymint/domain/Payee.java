package com.streamfirst.lazymint.domain;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * A stakeholder entitled to a proportional share of distributed funds. The address list and the
 * share count are fixed at construction; only the released total and the enabled-address cursor
 * move, and both only forward.
 */
@Value
public class Payee {
  /** Zero-based position of this payee in the registry */
  int index;

  /** Candidate receiving addresses, in rotation order */
  @NonNull List<Address> addresses;

  /** Proportional weight of this payee */
  long shares;

  /** Cumulative amount already paid out to this payee */
  @NonNull @With BigInteger released;

  /** Index of the address currently receiving funds; every address before it is disabled */
  @With int enabledIndex;

  public Payee(int index, List<Address> addresses, long shares, BigInteger released, int enabledIndex) {
    this.index = index;
    this.addresses = List.copyOf(addresses);
    this.shares = shares;
    this.released = Objects.requireNonNull(released, "Released amount cannot be null");
    this.enabledIndex = enabledIndex;
  }

  /** Creates a freshly registered payee: nothing released, first address enabled. */
  public static Payee register(int index, List<Address> addresses, long shares) {
    return new Payee(index, addresses, shares, BigInteger.ZERO, 0);
  }

  public Address getEnabledAddress() {
    return addresses.get(enabledIndex);
  }

  /** True while the cursor has at least one more address to move to. */
  public boolean canAdvance() {
    return enabledIndex + 1 < addresses.size();
  }

  /** An address stays enabled while it sits at or after the cursor. */
  public boolean isAddressEnabled(int addressIndex) {
    return addressIndex >= enabledIndex;
  }

  @Override
  public String toString() {
    return "Payee{"
        + "index="
        + index
        + ", shares="
        + shares
        + ", released="
        + released
        + ", enabledAddress="
        + getEnabledAddress()
        + '}';
  }
}
