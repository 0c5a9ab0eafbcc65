package lab.escrow.orchestration;

import lab.escrow.common.CorrelationIdFilter;
import lab.escrow.domain.event.EscrowEventLog;
import lab.escrow.domain.escrow.EscrowInstance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/escrows")
@Slf4j
public class EscrowController {

    private final EscrowFactoryService factoryService;
    private final EscrowInstanceService escrowInstanceService;
    private final EscrowEventRecorder eventRecorder;

    // The caller becomes the payer; it must have approved the factory address for the amount beforehand.
    @PostMapping
    public ResponseEntity<EscrowView> create(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody CreateEscrowRequest req
    ) {
        log.info(
                "event=escrow.create.request orderId={} payee={} asset={} amount={}",
                req.orderId(),
                req.payee(),
                req.asset(),
                req.amount()
        );
        EscrowInstance created = factoryService.createEscrow(caller, req);
        EscrowView view = escrowInstanceService.get(created.getId());
        log.info("event=escrow.create.response escrowId={} status={}", view.id(), view.basicInfo().status());
        return ResponseEntity.ok(view);
    }

    @GetMapping("/{id}")
    public ResponseEntity<EscrowView> get(@PathVariable UUID id) {
        log.info("event=escrow.get.request escrowId={}", id);
        return ResponseEntity.ok(escrowInstanceService.get(id));
    }

    @GetMapping("/{id}/fee-info")
    public ResponseEntity<EscrowView.FeeInfo> feeInfo(@PathVariable UUID id) {
        return ResponseEntity.ok(escrowInstanceService.get(id).feeInfo());
    }

    @GetMapping("/{id}/dispute-info")
    public ResponseEntity<EscrowView.DisputeInfo> disputeInfo(@PathVariable UUID id) {
        return ResponseEntity.ok(escrowInstanceService.get(id).disputeInfo());
    }

    @GetMapping("/{id}/timestamps")
    public ResponseEntity<EscrowView.Timestamps> timestamps(@PathVariable UUID id) {
        return ResponseEntity.ok(escrowInstanceService.get(id).timestamps());
    }

    @GetMapping("/{id}/events")
    public ResponseEntity<List<EscrowEventLog>> events(@PathVariable UUID id) {
        escrowInstanceService.load(id);
        List<EscrowEventLog> events = eventRecorder.eventsOf(id);
        log.info("event=escrow.events.response escrowId={} count={}", id, events.size());
        return ResponseEntity.ok(events);
    }

    @PostMapping("/{id}/release")
    public ResponseEntity<EscrowView> release(
            @PathVariable UUID id,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller
    ) {
        EscrowView view = escrowInstanceService.release(id, caller);
        log.info("event=escrow.release.response escrowId={} status={}", id, view.basicInfo().status());
        return ResponseEntity.ok(view);
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<EscrowView> refund(
            @PathVariable UUID id,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller
    ) {
        EscrowView view = escrowInstanceService.refund(id, caller);
        log.info("event=escrow.refund.response escrowId={} status={}", id, view.basicInfo().status());
        return ResponseEntity.ok(view);
    }

    // No role check: any keeper may trigger it after releaseAfter.
    @PostMapping("/{id}/auto-release")
    public ResponseEntity<EscrowView> autoRelease(
            @PathVariable UUID id,
            @RequestHeader(value = CorrelationIdFilter.CALLER_HEADER, required = false) String caller
    ) {
        EscrowView view = escrowInstanceService.autoRelease(id, caller);
        log.info("event=escrow.auto_release.response escrowId={} status={}", id, view.basicInfo().status());
        return ResponseEntity.ok(view);
    }

    @PostMapping("/{id}/dispute")
    public ResponseEntity<EscrowView> raiseDispute(
            @PathVariable UUID id,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody RaiseDisputeRequest req
    ) {
        EscrowView view = escrowInstanceService.raiseDispute(id, caller, req.reason());
        log.info("event=escrow.dispute.response escrowId={} status={}", id, view.basicInfo().status());
        return ResponseEntity.ok(view);
    }
}
