package lab.escrow.common.error;

public class InsufficientFundsException extends EscrowException {

    public InsufficientFundsException(EscrowErrorCode code, String message) {
        super(code, message);
        if (code.kind() != ErrorKind.FUNDING) {
            throw new IllegalArgumentException(code + " is not a FUNDING error");
        }
    }
}
