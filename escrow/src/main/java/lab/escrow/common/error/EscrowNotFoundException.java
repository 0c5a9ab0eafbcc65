package lab.escrow.common.error;

public class EscrowNotFoundException extends EscrowException {

    public EscrowNotFoundException(EscrowErrorCode code, String message) {
        super(code, message);
        if (code.kind() != ErrorKind.NOT_FOUND) {
            throw new IllegalArgumentException(code + " is not a NOT_FOUND error");
        }
    }
}
