package com.streamfirst.lazymint.ports;

import com.streamfirst.lazymint.domain.Address;

import java.math.BigInteger;

/**
 * Port for moving funds out of the system to an external address.
 */
public interface ValueTransferPort {

    /**
     * Sends funds to a destination address.
     *
     * @param destination the receiving address
     * @param amount the amount to send, in the smallest currency unit
     * @return true if the destination accepted the funds, false if it refused them
     */
    boolean transfer(Address destination, BigInteger amount);

    /**
     * Gets the total amount an address has received through this port.
     *
     * @param address the address to look up
     * @return the balance, zero for unknown addresses
     */
    BigInteger balanceOf(Address address);
}
