package com.streamfirst.lazymint.domain;

/**
 * Every reason an operation can be rejected. Each code belongs to exactly one category; the
 * category tells callers whether to fix the input, the caller identity, or wait for state to
 * change before resubmitting.
 */
public enum ErrorCode {
    INVALID_SIGNATURE_FORMAT(Category.VALIDATION, "ECDSA: invalid signature"),
    UNAUTHORIZED_SIGNER(Category.AUTHORIZATION, "LazyMintingERC721: signer is not allowed"),
    INSUFFICIENT_PAYMENT(Category.VALIDATION, "LazyMintingERC721: insufficient funds to redeem"),
    DUPLICATE_METADATA(Category.STATE_CONFLICT,
        "LazyMintingERC721: token already minted (metadata URI already used)"),
    DUPLICATE_ASSET_ID(Category.STATE_CONFLICT, "ERC721: token already minted"),
    UNAUTHORIZED_CALLER(Category.AUTHORIZATION, "Ownable: caller is not the owner"),

    LENGTH_MISMATCH(Category.VALIDATION, "Equity: payees and shares length mismatch"),
    NO_PAYEES(Category.VALIDATION, "Equity: no payees"),
    BAD_ADDRESS_COUNT(Category.VALIDATION, "Equity: bad payee addresses number"),
    ZERO_ADDRESS(Category.VALIDATION, "Equity: address is the zero address"),
    BAD_SHARES(Category.VALIDATION, "Equity: shares are 0"),
    BAD_PAYEE_INDEX(Category.VALIDATION, "Equity: bad payee index"),
    ALL_ADDRESSES_USED(Category.STATE_CONFLICT, "Equity: all addresses already used"),
    CALLER_NOT_PAYEE(Category.AUTHORIZATION, "Equity: caller is not a payee"),
    SELF_ROTATION_FORBIDDEN(Category.AUTHORIZATION, "Equity: payee cannot change its own address"),
    CALLER_ADDRESS_DISABLED(Category.AUTHORIZATION, "Equity: caller payee address is disabled"),
    NOTHING_DUE(Category.STATE_CONFLICT, "Equity: payee is not due payment"),
    TRANSFER_REJECTED(Category.TRANSFER, "Address: unable to send value, recipient may have reverted");

    /** Error taxonomy shared by both subsystems. */
    public enum Category {
        /** Malformed or out-of-range input */
        VALIDATION,
        /** Caller or signer lacks the right to perform the operation */
        AUTHORIZATION,
        /** Current state forbids the operation */
        STATE_CONFLICT,
        /** Destination refused the funds */
        TRANSFER
    }

    private final Category category;
    private final String message;

    ErrorCode(Category category, String message) {
        this.category = category;
        this.message = message;
    }

    public Category category() {
        return category;
    }

    public String message() {
        return message;
    }
}
