package lab.escrow.domain.escrow;

import jakarta.persistence.*;
import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;
import lab.escrow.domain.FieldLimits;
import lab.escrow.domain.Principals;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Custody record of one order. Created already FUNDED; every mutation below is a one-way
 * transition guarded by the caller's role and the current status.
 */
@Entity
@Table(name = "escrow_instances",
       indexes = {
           @Index(name = "idx_escrow_order", columnList = "orderId", unique = true),
           @Index(name = "idx_escrow_sequence", columnList = "sequenceNo", unique = true),
           @Index(name = "idx_escrow_payer", columnList = "payer"),
           @Index(name = "idx_escrow_payee", columnList = "payee"),
           @Index(name = "idx_escrow_status", columnList = "status")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class EscrowInstance {

    private static final String CUSTODY_ACCOUNT_PREFIX = "escrow:";

    // keeps createdAt + delay well inside the Instant range
    public static final long MAX_RELEASE_DELAY_SECONDS = Duration.ofDays(36_500).getSeconds();

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private long factoryId;

    @Column(nullable = false, updatable = false, length = FieldLimits.PRINCIPAL)
    private String template;

    // creation order within the factory, 1..N
    @Column(nullable = false, updatable = false)
    private long sequenceNo;

    @Column(nullable = false, updatable = false, length = FieldLimits.ORDER_ID)
    private String orderId;

    @Column(nullable = false, updatable = false, length = FieldLimits.PRINCIPAL)
    private String payer;

    @Column(nullable = false, updatable = false, length = FieldLimits.PRINCIPAL)
    private String payee;

    @Column(nullable = false, updatable = false, length = FieldLimits.PRINCIPAL)
    private String asset;

    @Column(nullable = false, updatable = false)
    private long amount; // smallest unit of the asset

    @Column(nullable = false, updatable = false, length = FieldLimits.TEXT)
    private String metadata;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false, updatable = false)
    private Instant releaseAfter;

    @Column(nullable = false, updatable = false)
    private int feeBips;

    @Column(nullable = false, updatable = false, length = FieldLimits.PRINCIPAL)
    private String feeCollector;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EscrowStatus status;

    @Column(length = FieldLimits.TEXT)
    private String disputeReason;

    @Column(length = FieldLimits.PRINCIPAL)
    private String disputeRaisedBy;

    public static EscrowInstance funded(
            long factoryId,
            String template,
            long sequenceNo,
            String orderId,
            String payer,
            String payee,
            String asset,
            long amount,
            String metadata,
            int feeBips,
            String feeCollector,
            Instant createdAt,
            long releaseDelaySeconds
    ) {
        return EscrowInstance.builder()
                .factoryId(factoryId)
                .template(template)
                .sequenceNo(sequenceNo)
                .orderId(orderId)
                .payer(payer)
                .payee(payee)
                .asset(asset)
                .amount(amount)
                .metadata(metadata == null ? "" : metadata)
                .feeBips(feeBips)
                .feeCollector(feeCollector)
                .createdAt(createdAt)
                .releaseAfter(createdAt.plusSeconds(releaseDelaySeconds))
                .status(EscrowStatus.FUNDED)
                .build();
    }

    public Settlement release(String caller) {
        requireCaller(payer, caller, EscrowErrorCode.NOT_PAYER, "only the payer can release");
        requireStatus(EscrowStatus.FUNDED);
        this.status = EscrowStatus.RELEASED;
        return payeeSettlement();
    }

    public Settlement refund(String caller) {
        requireCaller(payee, caller, EscrowErrorCode.NOT_PAYEE, "only the payee can refund");
        requireStatus(EscrowStatus.FUNDED);
        this.status = EscrowStatus.REFUNDED;
        return Settlement.full(payer, amount);
    }

    public Settlement autoRelease(Instant now) {
        requireStatus(EscrowStatus.FUNDED);
        if (now.isBefore(releaseAfter)) {
            throw EscrowException.of(EscrowErrorCode.RELEASE_TOO_EARLY,
                    "auto release is possible from " + releaseAfter + ", now " + now);
        }
        this.status = EscrowStatus.RELEASED;
        return payeeSettlement();
    }

    public void raiseDispute(String caller, String reason) {
        if (!Principals.same(payer, caller) && !Principals.same(payee, caller)) {
            throw EscrowException.of(EscrowErrorCode.NOT_PARTY, "only the payer or the payee can raise a dispute");
        }
        requireStatus(EscrowStatus.FUNDED);
        if (reason == null || reason.isBlank()) {
            throw EscrowException.of(EscrowErrorCode.EMPTY_DISPUTE_REASON, "dispute reason must not be empty");
        }
        FieldLimits.requireMaxLength(reason, FieldLimits.TEXT, "dispute reason");
        this.status = EscrowStatus.DISPUTED;
        this.disputeReason = reason;
        this.disputeRaisedBy = caller.trim();
    }

    public Settlement resolveDispute(String winner) {
        requireStatus(EscrowStatus.DISPUTED);
        Settlement settlement;
        if (Principals.same(payee, winner)) {
            settlement = payeeSettlement();
        } else if (Principals.same(payer, winner)) {
            settlement = Settlement.full(payer, amount);
        } else {
            throw EscrowException.of(EscrowErrorCode.INVALID_WINNER, "winner must be the payer or the payee: " + winner);
        }
        this.status = EscrowStatus.RESOLVED;
        return settlement;
    }

    public FeeModel.FeeBreakdown feeBreakdown() {
        return FeeModel.split(amount, feeBips);
    }

    public boolean canAutoRelease(Instant now) {
        return status == EscrowStatus.FUNDED && !now.isBefore(releaseAfter);
    }

    public Duration timeLeft(Instant now) {
        if (status != EscrowStatus.FUNDED || !now.isBefore(releaseAfter)) {
            return Duration.ZERO;
        }
        return Duration.between(now, releaseAfter);
    }

    public boolean isActive() {
        return status == EscrowStatus.FUNDED;
    }

    public boolean hasDispute() {
        return disputeRaisedBy != null;
    }

    public String custodyAccount() {
        return custodyAccountOf(id);
    }

    public static String custodyAccountOf(UUID escrowId) {
        return CUSTODY_ACCOUNT_PREFIX + escrowId;
    }

    private Settlement payeeSettlement() {
        return Settlement.withFee(payee, feeBreakdown(), feeCollector);
    }

    private void requireStatus(EscrowStatus expected) {
        if (status != expected) {
            throw EscrowException.of(EscrowErrorCode.INVALID_STATUS,
                    "escrow " + id + " is " + status + ", expected " + expected);
        }
    }

    private static void requireCaller(String expected, String caller, EscrowErrorCode code, String message) {
        if (!Principals.same(expected, caller)) {
            throw EscrowException.of(code, message);
        }
    }
}
