package lab.escrow.common.error;

/**
 * Base type for every domain failure. The code tells callers exactly what went wrong,
 * the kind groups codes into the broad validation/state/authorization/funding/business buckets.
 * Thrown from inside a transaction callback, it rolls the whole unit of work back.
 */
public abstract class EscrowException extends RuntimeException {

    private final EscrowErrorCode code;

    protected EscrowException(EscrowErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EscrowErrorCode getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return code.kind();
    }

    public static EscrowException of(EscrowErrorCode code, String message) {
        return switch (code.kind()) {
            case VALIDATION -> new InvalidRequestException(code, message);
            case STATE -> new InvalidEscrowStateException(code, message);
            case AUTHORIZATION -> new UnauthorizedCallerException(code, message);
            case FUNDING -> new InsufficientFundsException(code, message);
            case BUSINESS -> new EscrowRuleViolationException(code, message);
            case NOT_FOUND -> new EscrowNotFoundException(code, message);
        };
    }
}
