package com.streamfirst.lazymint.adapters;

import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.ports.ValueTransferPort;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ValueTransferPort. Credits balances per address; addresses can be
 * configured to refuse incoming funds to simulate a reverting recipient.
 */
@Slf4j
public class InMemoryValueTransferAdapter implements ValueTransferPort {

    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();
    private final Set<Address> refusingAddresses = ConcurrentHashMap.newKeySet();

    @Override
    public boolean transfer(Address destination, BigInteger amount) {
        if (refusingAddresses.contains(destination)) {
            log.warn("Destination {} refused {}", destination, amount);
            return false;
        }
        balances.merge(destination, amount, BigInteger::add);
        log.debug("Transferred {} to {}", amount, destination);
        return true;
    }

    @Override
    public BigInteger balanceOf(Address address) {
        return balances.getOrDefault(address, BigInteger.ZERO);
    }

    /**
     * Makes an address refuse (or accept again) incoming funds. Used for testing.
     */
    public void setRefusing(Address address, boolean refusing) {
        if (refusing) {
            refusingAddresses.add(address);
        } else {
            refusingAddresses.remove(address);
        }
    }
}
