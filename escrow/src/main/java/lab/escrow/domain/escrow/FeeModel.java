package lab.escrow.domain.escrow;

import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;

import java.math.BigInteger;

/**
 * Proportional fee in basis points. The fee is truncated and the remainder stays in the net amount,
 * so {@code fee + net == amount} holds for every split.
 */
public final class FeeModel {

    public static final int BIPS_DENOMINATOR = 10_000;

    private static final BigInteger DENOMINATOR = BigInteger.valueOf(BIPS_DENOMINATOR);

    private FeeModel() {
    }

    public static FeeBreakdown split(long amount, int feeBips) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount);
        }
        requireValidBips(feeBips);
        // amount * bips can exceed long range for large amounts
        long fee = BigInteger.valueOf(amount)
                .multiply(BigInteger.valueOf(feeBips))
                .divide(DENOMINATOR)
                .longValueExact();
        return new FeeBreakdown(amount, fee, amount - fee);
    }

    public static int requireValidBips(int feeBips) {
        if (feeBips < 0 || feeBips >= BIPS_DENOMINATOR) {
            throw EscrowException.of(EscrowErrorCode.INVALID_FEE_BIPS,
                    "fee bips must be in [0, " + BIPS_DENOMINATOR + "): " + feeBips);
        }
        return feeBips;
    }

    public record FeeBreakdown(
            long amount,
            long feeAmount,
            long netAmount
    ) {
    }
}
