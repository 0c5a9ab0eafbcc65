package lab.escrow.domain.escrow;

/**
 * Disbursement decided by a terminal transition. {@code feeAmount} goes to the fee collector,
 * {@code netAmount} to the recipient; together they are always the full escrowed amount.
 */
public record Settlement(
        String recipient,
        long netAmount,
        String feeCollector,
        long feeAmount
) {

    public static Settlement withFee(String recipient, FeeModel.FeeBreakdown breakdown, String feeCollector) {
        return new Settlement(recipient, breakdown.netAmount(), feeCollector, breakdown.feeAmount());
    }

    public static Settlement full(String recipient, long amount) {
        return new Settlement(recipient, amount, null, 0L);
    }

    public long total() {
        return netAmount + feeAmount;
    }
}
