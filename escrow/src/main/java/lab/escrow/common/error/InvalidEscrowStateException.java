package lab.escrow.common.error;

public class InvalidEscrowStateException extends EscrowException {

    public InvalidEscrowStateException(EscrowErrorCode code, String message) {
        super(code, message);
        if (code.kind() != ErrorKind.STATE) {
            throw new IllegalArgumentException(code + " is not a STATE error");
        }
    }
}
