package lab.escrow.orchestration;

import lab.escrow.adapter.AssetLedger;
import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;
import lab.escrow.domain.event.EscrowEvent;
import lab.escrow.domain.escrow.EscrowInstance;
import lab.escrow.domain.escrow.EscrowInstanceRepository;
import lab.escrow.domain.escrow.EscrowStatus;
import lab.escrow.domain.escrow.Settlement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs the per-escrow operations. Each one holds the escrow's settlement guard, then executes
 * in a single transaction: load, transition (status becomes terminal and is flushed),
 * pay out through the ledger, record the event, update the factory tallies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowInstanceService {

    private final EscrowInstanceRepository escrowInstanceRepository;
    private final AssetLedger assetLedger;
    private final FactoryCounters factoryCounters;
    private final EscrowEventRecorder eventRecorder;
    private final SettlementGuard settlementGuard;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public EscrowView release(UUID escrowId, String caller) {
        log.info("event=escrow.release.start escrowId={} caller={}", escrowId, caller);
        EscrowInstance escrow = transition(escrowId, "release", e -> e.release(caller));
        return view(escrow);
    }

    public EscrowView refund(UUID escrowId, String caller) {
        log.info("event=escrow.refund.start escrowId={} caller={}", escrowId, caller);
        EscrowInstance escrow = transition(escrowId, "refund", e -> e.refund(caller));
        return view(escrow);
    }

    // Liveness fallback for an unresponsive payer: anyone may trigger it once the time lock has passed.
    public EscrowView autoRelease(UUID escrowId, String caller) {
        log.info("event=escrow.auto_release.start escrowId={} caller={}", escrowId, caller);
        EscrowInstance escrow = transition(escrowId, "auto_release", e -> e.autoRelease(now()));
        return view(escrow);
    }

    public EscrowView raiseDispute(UUID escrowId, String caller, String reason) {
        log.info("event=escrow.dispute.start escrowId={} caller={}", escrowId, caller);
        EscrowInstance escrow = transition(escrowId, "dispute", e -> {
            e.raiseDispute(caller, reason);
            return null;
        });
        return view(escrow);
    }

    // Called by EscrowFactoryService only, inside its transaction and while it holds the settlement guard.
    Settlement settleDispute(EscrowInstance escrow, String winner) {
        Settlement settlement = escrow.resolveDispute(winner);
        escrowInstanceRepository.saveAndFlush(escrow);
        disburse(escrow, settlement);
        eventRecorder.record(escrow.getId(),
                new EscrowEvent.DisputeResolved(settlement.recipient(), settlement.netAmount(), settlement.feeAmount()));
        return settlement;
    }

    @Transactional(readOnly = true)
    public EscrowView get(UUID escrowId) {
        return view(load(escrowId));
    }

    @Transactional(readOnly = true)
    public EscrowInstance load(UUID escrowId) {
        return escrowInstanceRepository.findById(escrowId)
                .orElseThrow(() -> EscrowException.of(EscrowErrorCode.ESCROW_NOT_FOUND, "escrow not found: " + escrowId));
    }

    public EscrowView view(EscrowInstance escrow) {
        long custodyBalance = assetLedger.balanceOf(escrow.getAsset(), escrow.custodyAccount());
        return EscrowView.of(escrow, now(), custodyBalance);
    }

    // Whole seconds, the granularity releaseAfter is expressed in.
    Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private EscrowInstance transition(UUID escrowId, String operation, Function<EscrowInstance, Settlement> step) {
        try (SettlementGuard.Permit permit = settlementGuard.acquire(escrowId)) {
            EscrowInstance result = transactionTemplate.execute(status -> {
                EscrowInstance escrow = load(escrowId);
                EscrowStatus from = escrow.getStatus();

                Settlement settlement = step.apply(escrow);
                // the new status is written before any funds move
                escrowInstanceRepository.saveAndFlush(escrow);

                if (settlement != null) {
                    disburse(escrow, settlement);
                }
                eventRecorder.record(escrow.getId(), eventFor(escrow, settlement));
                factoryCounters.recordTransition(from, escrow.getStatus());
                return escrow;
            });
            if (result == null) {
                throw new IllegalStateException("failed to " + operation + " escrow " + escrowId);
            }
            log.info(
                    "event=escrow.{}.done escrowId={} orderId={} status={}",
                    operation,
                    escrowId,
                    result.getOrderId(),
                    result.getStatus()
            );
            return result;
        }
    }

    private void disburse(EscrowInstance escrow, Settlement settlement) {
        if (settlement.total() != escrow.getAmount()) {
            throw new IllegalStateException("settlement " + settlement + " does not match escrowed amount " + escrow.getAmount());
        }
        if (settlement.feeAmount() > 0) {
            AssetLedger.TransferResult fee = assetLedger.transfer(
                    escrow.getAsset(), escrow.custodyAccount(), settlement.feeCollector(), settlement.feeAmount());
            log.info("event=escrow.disburse.fee escrowId={} transferId={} collector={} amount={}",
                    escrow.getId(), fee.transferId(), fee.to(), fee.amount());
        }
        if (settlement.netAmount() > 0) {
            AssetLedger.TransferResult net = assetLedger.transfer(
                    escrow.getAsset(), escrow.custodyAccount(), settlement.recipient(), settlement.netAmount());
            log.info("event=escrow.disburse.net escrowId={} transferId={} recipient={} amount={}",
                    escrow.getId(), net.transferId(), net.to(), net.amount());
        }
    }

    private static EscrowEvent eventFor(EscrowInstance escrow, Settlement settlement) {
        return switch (escrow.getStatus()) {
            case RELEASED -> new EscrowEvent.FundsReleased(settlement.recipient(), settlement.netAmount(), settlement.feeAmount());
            case REFUNDED -> new EscrowEvent.FundsRefunded(settlement.recipient(), settlement.netAmount());
            case DISPUTED -> new EscrowEvent.DisputeRaised(escrow.getDisputeRaisedBy(), escrow.getDisputeReason());
            default -> throw new IllegalStateException("no event for transition to " + escrow.getStatus());
        };
    }
}
