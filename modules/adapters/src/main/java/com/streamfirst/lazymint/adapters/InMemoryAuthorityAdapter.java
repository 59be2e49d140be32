package com.streamfirst.lazymint.adapters;

import com.streamfirst.lazymint.domain.Address;
import com.streamfirst.lazymint.domain.ErrorCode;
import com.streamfirst.lazymint.domain.LedgerEvent;
import com.streamfirst.lazymint.domain.OperationRejectedException;
import com.streamfirst.lazymint.ports.AuthorityPort;
import com.streamfirst.lazymint.ports.EventPort;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of AuthorityPort. The authority is set at construction and can only be
 * handed over by the current authority.
 */
@Slf4j
public class InMemoryAuthorityAdapter implements AuthorityPort {

    private final EventPort eventPort;
    private volatile Address authority;

    public InMemoryAuthorityAdapter(@NonNull Address initialAuthority, @NonNull EventPort eventPort) {
        if (initialAuthority.isZero()) {
            throw new IllegalArgumentException("Initial authority cannot be the zero address");
        }
        this.authority = initialAuthority;
        this.eventPort = eventPort;
        log.info("Designated authority is {}", initialAuthority);
    }

    @Override
    public Address designatedAuthority() {
        return authority;
    }

    @Override
    public synchronized void transferAuthority(@NonNull Address caller, @NonNull Address newAuthority) {
        if (!caller.equals(authority)) {
            throw new OperationRejectedException(ErrorCode.UNAUTHORIZED_CALLER, caller.value());
        }
        if (newAuthority.isZero()) {
            throw new OperationRejectedException(ErrorCode.ZERO_ADDRESS, "new authority");
        }
        Address previous = authority;
        authority = newAuthority;
        log.info("Authority transferred from {} to {}", previous, newAuthority);
        eventPort.publish(LedgerEvent.TOPIC, new LedgerEvent.AuthorityTransferred(previous, newAuthority));
    }
}
