package lab.escrow.common.error;

public class EscrowRuleViolationException extends EscrowException {

    public EscrowRuleViolationException(EscrowErrorCode code, String message) {
        super(code, message);
        if (code.kind() != ErrorKind.BUSINESS) {
            throw new IllegalArgumentException(code + " is not a BUSINESS error");
        }
    }
}
