package com.streamfirst.lazymint.ports;

import com.streamfirst.lazymint.domain.Address;

/**
 * Port for the ownership collaborator that names who may sign vouchers.
 */
public interface AuthorityPort {

    /**
     * Gets the address whose signatures authorize asset issuance.
     *
     * @return the current designated authority
     */
    Address designatedAuthority();

    /**
     * Hands the authority over to a new address.
     *
     * @param caller the address requesting the transfer; must be the current authority
     * @param newAuthority the address that becomes the designated authority
     * @throws com.streamfirst.lazymint.domain.OperationRejectedException with
     *     {@code UNAUTHORIZED_CALLER} if the caller is not the current authority, or
     *     {@code ZERO_ADDRESS} if the new authority is the zero address
     */
    void transferAuthority(Address caller, Address newAuthority);
}
