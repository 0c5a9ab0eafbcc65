package lab.escrow.common.error;

public enum ErrorKind {
    VALIDATION,
    STATE,
    AUTHORIZATION,
    FUNDING,
    BUSINESS,
    NOT_FOUND
}
