package com.streamfirst.lazymint.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A 20-byte account identifier, rendered as lowercase {@code 0x}-prefixed hex. Used for voucher
 * signers, asset owners, payee receiving addresses and callers alike.
 *
 * @param value the canonical lowercase hex form, including the {@code 0x} prefix
 */
public record Address(String value) {

  private static final Pattern HEX_ADDRESS = Pattern.compile("0x[0-9a-f]{40}");

  /** The null/empty address. Never a valid payee or authority. */
  public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

  public Address {
    Objects.requireNonNull(value, "Address cannot be null");
    value = value.toLowerCase(Locale.ROOT);
    if (!value.startsWith("0x")) {
      value = "0x" + value;
    }
    if (!HEX_ADDRESS.matcher(value).matches()) {
      throw new IllegalArgumentException("Not a 20-byte hex address: " + value);
    }
  }

  /** Parses an address, accepting mixed case and a missing {@code 0x} prefix. */
  public static Address of(String value) {
    return new Address(value);
  }

  public boolean isZero() {
    return ZERO.equals(this);
  }

  @Override
  public String toString() {
    return value;
  }
}
