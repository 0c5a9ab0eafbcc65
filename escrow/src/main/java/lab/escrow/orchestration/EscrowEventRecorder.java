package lab.escrow.orchestration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lab.escrow.domain.event.EscrowEvent;
import lab.escrow.domain.event.EscrowEventLog;
import lab.escrow.domain.event.EscrowEventLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowEventRecorder {

    private final EscrowEventLogRepository eventLogRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // Persist first so the log and the listeners see the same events; both roll back with the caller.
    @Transactional
    public EscrowEventLog record(UUID escrowId, EscrowEvent event) {
        EscrowEventLog saved = eventLogRepository.save(EscrowEventLog.of(escrowId, event, toJson(event), clock.instant()));
        eventPublisher.publishEvent(event);
        log.info("event=escrow_event.recorded escrowId={} type={} payload={}", escrowId, event.type(), saved.getPayload());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<EscrowEventLog> eventsOf(UUID escrowId) {
        return eventLogRepository.findByEscrowIdOrderByIdAsc(escrowId);
    }

    @Transactional(readOnly = true)
    public List<EscrowEventLog> factoryEvents() {
        return eventLogRepository.findByEscrowIdIsNullOrderByIdAsc();
    }

    private String toJson(EscrowEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize " + event.type(), e);
        }
    }
}
