package com.streamfirst.lazymint.adapters;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.lazymint.domain.Address;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class InMemoryValueTransferAdapterTest {

  private static final Address RECIPIENT = Address.of("0x70997970C51812dc3A010C7d01b50e0d17dc79C8");

  private final InMemoryValueTransferAdapter transfers = new InMemoryValueTransferAdapter();

  @Test
  void accumulates_balances() {
    assertThat(transfers.transfer(RECIPIENT, BigInteger.valueOf(5))).isTrue();
    assertThat(transfers.transfer(RECIPIENT, BigInteger.valueOf(7))).isTrue();

    assertThat(transfers.balanceOf(RECIPIENT)).isEqualTo(BigInteger.valueOf(12));
  }

  @Test
  void refusing_recipient_gets_nothing_until_it_accepts_again() {
    transfers.setRefusing(RECIPIENT, true);

    assertThat(transfers.transfer(RECIPIENT, BigInteger.TEN)).isFalse();
    assertThat(transfers.balanceOf(RECIPIENT)).isEqualTo(BigInteger.ZERO);

    transfers.setRefusing(RECIPIENT, false);
    assertThat(transfers.transfer(RECIPIENT, BigInteger.TEN)).isTrue();
    assertThat(transfers.balanceOf(RECIPIENT)).isEqualTo(BigInteger.TEN);
  }
}
