package lab.escrow.common.error;

public class UnauthorizedCallerException extends EscrowException {

    public UnauthorizedCallerException(EscrowErrorCode code, String message) {
        super(code, message);
        if (code.kind() != ErrorKind.AUTHORIZATION) {
            throw new IllegalArgumentException(code + " is not a AUTHORIZATION error");
        }
    }
}
