package lab.escrow.common.error;

public class InvalidRequestException extends EscrowException {

    public InvalidRequestException(EscrowErrorCode code, String message) {
        super(code, message);
        if (code.kind() != ErrorKind.VALIDATION) {
            throw new IllegalArgumentException(code + " is not a VALIDATION error");
        }
    }
}
