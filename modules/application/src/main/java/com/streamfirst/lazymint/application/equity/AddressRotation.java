package com.streamfirst.lazymint.application.equity;

import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.domain.AddressSlot;
import com.streamfirst.lazymint.domain.ErrorCode;
import com.streamfirst.lazymint.domain.LedgerEvent;
import com.streamfirst.lazymint.domain.OperationRejectedException;
import com.streamfirst.lazymint.domain.Payee;
import com.streamfirst.lazymint.ports.EventPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves a payee's receiving address to its next backup.
 * Only another payee, calling from one of its still-enabled addresses, may rotate a payee. The
 * cursor never moves back: addresses before it stop receiving funds for good.
 */
@Slf4j
@RequiredArgsConstructor
public class AddressRotation {

    private final ShareRegistry registry;
    private final EventPort eventPort;

    /**
     * Advances the enabled address of a payee by one.
     *
     * @param caller the address invoking the rotation
     * @param payeeIndex the payee whose address is rotated
     * @return the new enabled address index
     * @throws OperationRejectedException with {@code BAD_PAYEE_INDEX}, {@code ALL_ADDRESSES_USED},
     *     {@code CALLER_NOT_PAYEE}, {@code SELF_ROTATION_FORBIDDEN} or
     *     {@code CALLER_ADDRESS_DISABLED}, checked in that order
     */
    public int advance(@NonNull Address caller, int payeeIndex) {
        try {
            return registry.write(() -> {
                Payee target = registry.requirePayee(payeeIndex);
                if (!target.canAdvance()) {
                    throw new OperationRejectedException(ErrorCode.ALL_ADDRESSES_USED, "payee " + payeeIndex);
                }

                AddressSlot callerSlot = registry.findSlot(caller)
                    .orElseThrow(() -> new OperationRejectedException(ErrorCode.CALLER_NOT_PAYEE, caller.value()));
                if (callerSlot.payeeIndex() == payeeIndex) {
                    throw new OperationRejectedException(ErrorCode.SELF_ROTATION_FORBIDDEN, "payee " + payeeIndex);
                }
                Payee callerPayee = registry.requirePayee(callerSlot.payeeIndex());
                if (!callerPayee.isAddressEnabled(callerSlot.addressIndex())) {
                    throw new OperationRejectedException(ErrorCode.CALLER_ADDRESS_DISABLED, caller.value());
                }

                Payee rotated = target.withEnabledIndex(target.getEnabledIndex() + 1);
                registry.replace(rotated);

                log.info("Payee {} rotated payee {} to address {} ({})",
                        callerSlot.payeeIndex(), payeeIndex, rotated.getEnabledIndex(), rotated.getEnabledAddress());
                eventPort.publish(LedgerEvent.TOPIC, new LedgerEvent.AddressRotated(
                    payeeIndex, rotated.getEnabledIndex(), rotated.getEnabledAddress()));
                return rotated.getEnabledIndex();
            });
        } catch (OperationRejectedException e) {
            log.warn("Rejected rotation of payee {} by {}: {}", payeeIndex, caller, e.getMessage());
            throw e;
        }
    }
}
