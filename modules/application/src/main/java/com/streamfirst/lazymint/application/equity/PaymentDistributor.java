package com.streamfirst.lazymint.application.equity;

import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.domain.ErrorCode;
import com.streamfirst.lazymint.domain.LedgerEvent;
import com.streamfirst.lazymint.domain.OperationRejectedException;
import com.streamfirst.lazymint.domain.Payee;
import com.streamfirst.lazymint.ports.EventPort;
import com.streamfirst.lazymint.ports.ValueTransferPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Holds incoming funds and pays each payee its proportional share on demand.
 *
 * <p>A payee is owed {@code floor(totalReceived * shares / totalShares) - released}, where
 * {@code totalReceived} is everything currently held plus everything ever released. Integer
 * division leaves at most {@code payeeCount - 1} units undistributed per snapshot; that dust stays
 * in the held balance. Funds always go to the payee's currently enabled address. All accounting
 * lives in the {@link ShareRegistry}, so distributors sharing a registry share one balance.
 */
@Slf4j
@RequiredArgsConstructor
public class PaymentDistributor {

    private final ShareRegistry registry;
    private final ValueTransferPort valueTransferPort;
    private final EventPort eventPort;

    /**
     * Accepts incoming funds. Always succeeds.
     *
     * @param from the sender
     * @param amount the amount received
     */
    public void receive(@NonNull Address from, @NonNull BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Received amount cannot be negative: " + amount);
        }
        registry.write(() -> {
            registry.setHeldBalance(registry.getHeldBalance().add(amount));
            return null;
        });
        log.info("Received {} from {}", amount, from);
        eventPort.publish(LedgerEvent.TOPIC, new LedgerEvent.PaymentReceived(from, amount));
    }

    /**
     * Pays a payee everything it is currently owed.
     *
     * @param payeeIndex the payee to pay
     * @return the amount paid
     * @throws OperationRejectedException with {@code BAD_PAYEE_INDEX}, {@code BAD_SHARES},
     *     {@code NOTHING_DUE} or {@code TRANSFER_REJECTED}; in every case no accounting changes
     */
    public BigInteger release(int payeeIndex) {
        try {
            return registry.write(() -> {
                Payee payee = registry.requirePayee(payeeIndex);
                if (payee.getShares() <= 0) {
                    throw new OperationRejectedException(ErrorCode.BAD_SHARES, "payee " + payeeIndex);
                }

                BigInteger owed = owedTo(payee);
                if (owed.signum() <= 0) {
                    throw new OperationRejectedException(ErrorCode.NOTHING_DUE, "payee " + payeeIndex);
                }
                Address destination = payee.getEnabledAddress();

                // accounting moves before the funds so a re-entrant release finds nothing due
                BigInteger previousTotalReleased = registry.getTotalReleased();
                BigInteger previousHeld = registry.getHeldBalance();
                registry.replace(payee.withReleased(payee.getReleased().add(owed)));
                registry.setTotalReleased(previousTotalReleased.add(owed));
                registry.setHeldBalance(previousHeld.subtract(owed));

                boolean accepted;
                try {
                    accepted = valueTransferPort.transfer(destination, owed);
                } catch (RuntimeException e) {
                    rollback(payee, previousTotalReleased, previousHeld);
                    throw new OperationRejectedException(ErrorCode.TRANSFER_REJECTED,
                        ErrorCode.TRANSFER_REJECTED.message() + " (" + destination + ")", e);
                }
                if (!accepted) {
                    rollback(payee, previousTotalReleased, previousHeld);
                    throw new OperationRejectedException(ErrorCode.TRANSFER_REJECTED, destination.value());
                }

                log.info("Released {} to payee {} at {}", owed, payeeIndex, destination);
                eventPort.publish(LedgerEvent.TOPIC, new LedgerEvent.PaymentReleased(payeeIndex, destination, owed));
                return owed;
            });
        } catch (OperationRejectedException e) {
            log.warn("Rejected release for payee {}: {}", payeeIndex, e.getMessage());
            throw e;
        }
    }

    /**
     * Gets the amount a payee would receive if released now.
     */
    public BigInteger releasable(int payeeIndex) {
        return registry.read(() -> owedTo(registry.requirePayee(payeeIndex)));
    }

    /**
     * Funds currently held, including rounding dust.
     */
    public BigInteger heldBalance() {
        return registry.heldBalance();
    }

    /**
     * All-time inflow: funds held plus funds released.
     */
    public BigInteger totalReceived() {
        return registry.read(this::currentTotalReceived);
    }

    private BigInteger owedTo(Payee payee) {
        BigInteger entitled = currentTotalReceived()
            .multiply(BigInteger.valueOf(payee.getShares()))
            .divide(BigInteger.valueOf(registry.totalShares()));
        return entitled.subtract(payee.getReleased());
    }

    private BigInteger currentTotalReceived() {
        return registry.getHeldBalance().add(registry.getTotalReleased());
    }

    private void rollback(Payee before, BigInteger totalReleasedBefore, BigInteger heldBefore) {
        registry.replace(before);
        registry.setTotalReleased(totalReleasedBefore);
        registry.setHeldBalance(heldBefore);
        log.debug("Rolled back release for payee {}", before.getIndex());
    }
}
