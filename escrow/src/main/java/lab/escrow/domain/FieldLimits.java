package lab.escrow.domain;

import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;

/**
 * Maximum stored lengths. Column definitions use the same constants, so a value that passes
 * {@link #requireMaxLength} always fits its column.
 */
public final class FieldLimits {

    public static final int PRINCIPAL = 64;
    public static final int ORDER_ID = 128;
    public static final int TEXT = 512;

    private FieldLimits() {
    }

    public static String requireMaxLength(String value, int maxLength, String field) {
        if (value != null && value.length() > maxLength) {
            throw EscrowException.of(EscrowErrorCode.FIELD_TOO_LONG,
                    field + " must be at most " + maxLength + " characters, got " + value.length());
        }
        return value;
    }
}
