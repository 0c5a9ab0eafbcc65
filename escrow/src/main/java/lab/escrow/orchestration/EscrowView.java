package lab.escrow.orchestration;

import lab.escrow.domain.escrow.EscrowInstance;
import lab.escrow.domain.escrow.EscrowStatus;
import lab.escrow.domain.escrow.FeeModel;

import java.time.Instant;
import java.util.UUID;

/**
 * Read model of one escrow as of {@code now}. Built from the entity plus the custody balance
 * reported by the ledger; never mutates anything.
 */
public record EscrowView(
        UUID id,
        String orderId,
        long sequenceNo,
        String template,
        BasicInfo basicInfo,
        String metadata,
        String statusLabel,
        boolean active,
        FeeInfo feeInfo,
        DisputeInfo disputeInfo,
        Timestamps timestamps,
        boolean canAutoRelease,
        String custodyAccount,
        long custodyBalance
) {

    public static EscrowView of(EscrowInstance escrow, Instant now, long custodyBalance) {
        return new EscrowView(
                escrow.getId(),
                escrow.getOrderId(),
                escrow.getSequenceNo(),
                escrow.getTemplate(),
                BasicInfo.of(escrow),
                escrow.getMetadata(),
                escrow.getStatus().label(),
                escrow.isActive(),
                FeeInfo.of(escrow),
                DisputeInfo.of(escrow),
                Timestamps.of(escrow, now),
                escrow.canAutoRelease(now),
                escrow.custodyAccount(),
                custodyBalance
        );
    }

    public record BasicInfo(
            String payer,
            String payee,
            String asset,
            long amount,
            EscrowStatus status
    ) {
        static BasicInfo of(EscrowInstance escrow) {
            return new BasicInfo(escrow.getPayer(), escrow.getPayee(), escrow.getAsset(), escrow.getAmount(), escrow.getStatus());
        }
    }

    public record FeeInfo(
            int feeBips,
            String feeCollector,
            long feeAmount,
            long netAmount
    ) {
        static FeeInfo of(EscrowInstance escrow) {
            FeeModel.FeeBreakdown breakdown = escrow.feeBreakdown();
            return new FeeInfo(escrow.getFeeBips(), escrow.getFeeCollector(), breakdown.feeAmount(), breakdown.netAmount());
        }
    }

    public record DisputeInfo(
            boolean hasDispute,
            String raisedBy,
            String reason
    ) {
        static DisputeInfo of(EscrowInstance escrow) {
            if (!escrow.hasDispute()) {
                return new DisputeInfo(false, "", "");
            }
            return new DisputeInfo(true, escrow.getDisputeRaisedBy(), escrow.getDisputeReason());
        }
    }

    public record Timestamps(
            Instant createdAt,
            Instant releaseAfter,
            long timeLeftSeconds
    ) {
        static Timestamps of(EscrowInstance escrow, Instant now) {
            return new Timestamps(escrow.getCreatedAt(), escrow.getReleaseAfter(), escrow.timeLeft(now).getSeconds());
        }
    }
}
