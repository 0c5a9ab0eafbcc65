package lab.escrow.domain;

import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;

/**
 * Principals (payer, payee, arbitrator, collector, asset ids) are opaque strings.
 * A blank value plays the role of the null identity.
 */
public final class Principals {

    private Principals() {
    }

    public static String require(String principal, String field) {
        if (principal == null || principal.isBlank()) {
            throw EscrowException.of(EscrowErrorCode.ZERO_ADDRESS, field + " must not be empty");
        }
        return FieldLimits.requireMaxLength(principal.trim(), FieldLimits.PRINCIPAL, field);
    }

    // Lookup keys are compared the way they were stored; blank yields null.
    public static String normalize(String principal) {
        if (principal == null || principal.isBlank()) {
            return null;
        }
        return principal.trim();
    }

    public static boolean same(String left, String right) {
        return left != null && right != null && left.trim().equals(right.trim());
    }
}
