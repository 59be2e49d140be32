package com.streamfirst.lazymint.domain;

/**
 * Position of an address inside the payee registry.
 *
 * @param payeeIndex the payee the address belongs to
 * @param addressIndex the position of the address in that payee's rotation list
 */
public record AddressSlot(int payeeIndex, int addressIndex) {}
