package lab.escrow.orchestration;

import lab.escrow.common.CorrelationIdFilter;
import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;
import lab.escrow.domain.event.EscrowEventLog;
import lab.escrow.domain.escrow.EscrowInstance;
import lab.escrow.domain.escrow.EscrowStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/factory")
@Slf4j
public class FactoryController {

    private final EscrowFactoryService factoryService;
    private final EscrowInstanceService escrowInstanceService;
    private final EscrowEventRecorder eventRecorder;

    @PostMapping("/disputes/{id}/resolve")
    public ResponseEntity<EscrowView> resolveDispute(
            @PathVariable UUID id,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody ResolveDisputeRequest req
    ) {
        EscrowInstance resolved = factoryService.resolveDispute(caller, id, req.winner());
        EscrowView view = escrowInstanceService.view(resolved);
        log.info("event=factory.resolve_dispute.response escrowId={} status={}", id, view.basicInfo().status());
        return ResponseEntity.ok(view);
    }

    @GetMapping("/stats")
    public ResponseEntity<FactoryStats> stats() {
        return ResponseEntity.ok(factoryService.stats());
    }

    @GetMapping("/status-counts")
    public ResponseEntity<Map<EscrowStatus, Long>> statusCounts() {
        return ResponseEntity.ok(factoryService.statusCounts());
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<Map<String, Object>> byOrderId(@PathVariable String orderId) {
        UUID escrowId = factoryService.findEscrowByOrderId(orderId)
                .orElseThrow(() -> EscrowException.of(EscrowErrorCode.ESCROW_NOT_FOUND, "no escrow for order: " + orderId));
        return ResponseEntity.ok(Map.of("orderId", orderId, "escrowId", escrowId));
    }

    @GetMapping("/escrows")
    public ResponseEntity<List<UUID>> escrows(@RequestParam(required = false) EscrowStatus status) {
        List<UUID> escrows = status == null ? factoryService.allEscrows() : factoryService.escrowsByStatus(status);
        log.info("event=factory.escrows.response status={} count={}", status, escrows.size());
        return ResponseEntity.ok(escrows);
    }

    @GetMapping("/escrows/{id}/known")
    public ResponseEntity<Map<String, Object>> isKnown(@PathVariable UUID id) {
        return ResponseEntity.ok(Map.of("escrowId", id, "known", factoryService.isKnownEscrow(id)));
    }

    @GetMapping("/participants/{participant}/escrows")
    public ResponseEntity<List<UUID>> participantEscrows(@PathVariable String participant) {
        return ResponseEntity.ok(factoryService.escrowsOf(participant));
    }

    @GetMapping("/participants/{participant}/count")
    public ResponseEntity<Map<String, Object>> participantCount(@PathVariable String participant) {
        return ResponseEntity.ok(Map.of(
                "participant", participant,
                "escrowCount", factoryService.participantEscrowCount(participant)
        ));
    }

    @GetMapping("/events")
    public ResponseEntity<List<EscrowEventLog>> events() {
        return ResponseEntity.ok(eventRecorder.factoryEvents());
    }

    @PutMapping("/fee-collector")
    public ResponseEntity<FactoryStats> setFeeCollector(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody FactorySettingsRequest req
    ) {
        return ResponseEntity.ok(factoryService.setFeeCollector(caller, req.feeCollector()));
    }

    @PutMapping("/arbitrator")
    public ResponseEntity<FactoryStats> setArbitrator(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody FactorySettingsRequest req
    ) {
        return ResponseEntity.ok(factoryService.setArbitrator(caller, req.arbitrator()));
    }

    @PutMapping("/fee-bips")
    public ResponseEntity<FactoryStats> setDefaultFeeBips(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody FactorySettingsRequest req
    ) {
        return ResponseEntity.ok(factoryService.setDefaultFeeBips(caller, req.feeBips()));
    }
}
