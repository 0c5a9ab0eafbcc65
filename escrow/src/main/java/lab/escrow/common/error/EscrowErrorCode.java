package lab.escrow.common.error;

public enum EscrowErrorCode {
    // validation
    EMPTY_ORDER_ID(ErrorKind.VALIDATION),
    ZERO_ADDRESS(ErrorKind.VALIDATION),
    ZERO_AMOUNT(ErrorKind.VALIDATION),
    INVALID_RELEASE_DELAY(ErrorKind.VALIDATION),
    INVALID_FEE_BIPS(ErrorKind.VALIDATION),
    EMPTY_DISPUTE_REASON(ErrorKind.VALIDATION),
    FIELD_TOO_LONG(ErrorKind.VALIDATION),

    // state
    INVALID_STATUS(ErrorKind.STATE),
    REENTRANT_CALL(ErrorKind.STATE),
    FACTORY_NOT_INITIALIZED(ErrorKind.STATE),
    ALREADY_INITIALIZED(ErrorKind.STATE),

    // authorization
    NOT_PAYER(ErrorKind.AUTHORIZATION),
    NOT_PAYEE(ErrorKind.AUTHORIZATION),
    NOT_PARTY(ErrorKind.AUTHORIZATION),
    NOT_ARBITRATOR(ErrorKind.AUTHORIZATION),
    NOT_OWNER(ErrorKind.AUTHORIZATION),

    // funding
    INSUFFICIENT_ALLOWANCE(ErrorKind.FUNDING),
    INSUFFICIENT_BALANCE(ErrorKind.FUNDING),

    // business
    DUPLICATE_ORDER_ID(ErrorKind.BUSINESS),
    INVALID_WINNER(ErrorKind.BUSINESS),
    RELEASE_TOO_EARLY(ErrorKind.BUSINESS),
    UNKNOWN_ESCROW(ErrorKind.BUSINESS),
    VOLUME_OVERFLOW(ErrorKind.BUSINESS),

    ESCROW_NOT_FOUND(ErrorKind.NOT_FOUND);

    private final ErrorKind kind;

    EscrowErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
