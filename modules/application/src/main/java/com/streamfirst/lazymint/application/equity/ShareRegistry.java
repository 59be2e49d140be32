package com.streamfirst.lazymint.application.equity;

import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.domain.AddressSlot;
import com.streamfirst.lazymint.domain.ErrorCode;
import com.streamfirst.lazymint.domain.LedgerEvent;
import com.streamfirst.lazymint.domain.OperationRejectedException;
import com.streamfirst.lazymint.domain.Payee;
import com.streamfirst.lazymint.ports.EventPort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Registry of payees, their receiving addresses and their shares.
 * Addresses and shares are fixed at construction. The registry also owns the funds accounting
 * (held balance and total released) and the single lock of the equity instance: {@link AddressRotation} and {@link PaymentDistributor} mutate payee records only
 * while holding its write lock, and every read takes the read lock.
 */
@Slf4j
public class ShareRegistry {

    public static final int DEFAULT_GROUP_SIZE = 3;

    @Getter
    private final int groupSize;
    private final Payee[] payees;
    private final Map<Address, AddressSlot> slotsByAddress;
    private final long totalShares;
    private BigInteger totalReleased = BigInteger.ZERO;
    private BigInteger heldBalance = BigInteger.ZERO;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public ShareRegistry(List<List<Address>> addressGroups, List<Long> shares, EventPort eventPort) {
        this(addressGroups, shares, DEFAULT_GROUP_SIZE, eventPort);
    }

    /**
     * Registers payees in input order.
     *
     * @param addressGroups one list of rotation addresses per payee
     * @param shares one share count per payee, matching {@code addressGroups} by position
     * @param groupSize the exact number of addresses every payee must have, at least 2
     * @param eventPort receives one payee-added event per payee
     * @throws OperationRejectedException with {@code LENGTH_MISMATCH}, {@code NO_PAYEES},
     *     {@code BAD_ADDRESS_COUNT}, {@code ZERO_ADDRESS} or {@code BAD_SHARES}, checked in that order
     */
    public ShareRegistry(List<List<Address>> addressGroups, List<Long> shares, int groupSize, EventPort eventPort) {
        if (groupSize < 2) {
            throw new IllegalArgumentException("Group size must be at least 2, got " + groupSize);
        }
        if (addressGroups.size() != shares.size()) {
            throw new OperationRejectedException(ErrorCode.LENGTH_MISMATCH,
                addressGroups.size() + " address groups, " + shares.size() + " share counts");
        }
        if (addressGroups.isEmpty()) {
            throw new OperationRejectedException(ErrorCode.NO_PAYEES);
        }
        for (int i = 0; i < addressGroups.size(); i++) {
            if (addressGroups.get(i).size() != groupSize) {
                throw new OperationRejectedException(ErrorCode.BAD_ADDRESS_COUNT,
                    "payee " + i + " has " + addressGroups.get(i).size() + " addresses, expected " + groupSize);
            }
        }
        for (int i = 0; i < addressGroups.size(); i++) {
            for (Address address : addressGroups.get(i)) {
                if (address == null || address.isZero()) {
                    throw new OperationRejectedException(ErrorCode.ZERO_ADDRESS, "payee " + i);
                }
            }
        }
        for (int i = 0; i < shares.size(); i++) {
            if (shares.get(i) == null || shares.get(i) <= 0) {
                throw new OperationRejectedException(ErrorCode.BAD_SHARES, "payee " + i);
            }
        }

        this.groupSize = groupSize;
        this.payees = new Payee[addressGroups.size()];
        Map<Address, AddressSlot> slots = new HashMap<>();
        long total = 0;
        for (int i = 0; i < payees.length; i++) {
            List<Address> addresses = addressGroups.get(i);
            payees[i] = Payee.register(i, addresses, shares.get(i));
            total = Math.addExact(total, shares.get(i));
            for (int a = 0; a < addresses.size(); a++) {
                // first occurrence wins, same as a front-to-back scan
                slots.putIfAbsent(addresses.get(a), new AddressSlot(i, a));
            }
        }
        this.slotsByAddress = Map.copyOf(slots);
        this.totalShares = total;

        for (Payee payee : payees) {
            log.info("Added payee {} with {} shares and addresses {}",
                    payee.getIndex(), payee.getShares(), payee.getAddresses());
            eventPort.publish(LedgerEvent.TOPIC,
                new LedgerEvent.PayeeAdded(payee.getIndex(), payee.getAddresses(), payee.getShares()));
        }
    }

    public int payeeCount() {
        return payees.length;
    }

    public long totalShares() {
        return totalShares;
    }

    public long sharesOf(int payeeIndex) {
        return payee(payeeIndex).getShares();
    }

    public List<Address> payeeAddresses(int payeeIndex) {
        return payee(payeeIndex).getAddresses();
    }

    public int enabledAddressIndex(int payeeIndex) {
        return payee(payeeIndex).getEnabledIndex();
    }

    public Address enabledAddress(int payeeIndex) {
        return payee(payeeIndex).getEnabledAddress();
    }

    public BigInteger releasedOf(int payeeIndex) {
        return payee(payeeIndex).getReleased();
    }

    public BigInteger totalReleased() {
        return read(() -> totalReleased);
    }

    /**
     * Funds currently held, including rounding dust.
     */
    public BigInteger heldBalance() {
        return read(() -> heldBalance);
    }

    /**
     * Gets a snapshot of a payee record.
     *
     * @throws OperationRejectedException with {@code BAD_PAYEE_INDEX} if the index is out of range
     */
    public Payee payee(int payeeIndex) {
        return read(() -> requirePayee(payeeIndex));
    }

    /**
     * Finds which payee, and which of its addresses, an address is.
     *
     * @return the slot, or empty if the address belongs to no payee
     */
    public Optional<AddressSlot> findSlot(Address address) {
        return Optional.ofNullable(slotsByAddress.get(address));
    }

    Payee requirePayee(int payeeIndex) {
        if (payeeIndex < 0 || payeeIndex >= payees.length) {
            throw new OperationRejectedException(ErrorCode.BAD_PAYEE_INDEX, "index " + payeeIndex);
        }
        return payees[payeeIndex];
    }

    // callers hold the write lock
    void replace(Payee payee) {
        payees[payee.getIndex()] = payee;
    }

    // callers hold the read or write lock
    BigInteger getTotalReleased() {
        return totalReleased;
    }

    // callers hold the write lock
    void setTotalReleased(BigInteger totalReleased) {
        this.totalReleased = totalReleased;
    }

    // callers hold the read or write lock
    BigInteger getHeldBalance() {
        return heldBalance;
    }

    // callers hold the write lock
    void setHeldBalance(BigInteger heldBalance) {
        this.heldBalance = heldBalance;
    }

    <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
