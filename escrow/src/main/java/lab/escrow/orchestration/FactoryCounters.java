package lab.escrow.orchestration;

import lab.escrow.domain.Principals;
import lab.escrow.domain.escrow.EscrowInstance;
import lab.escrow.domain.escrow.EscrowStatus;
import lab.escrow.domain.factory.EscrowStatusCount;
import lab.escrow.domain.factory.EscrowStatusCountRepository;
import lab.escrow.domain.factory.FactoryStateRepository;
import lab.escrow.domain.factory.ParticipantStat;
import lab.escrow.domain.factory.ParticipantStatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;

/**
 * The only writer of the factory aggregates. Every update is a single atomic statement,
 * so concurrent settlements of different escrows cannot lose increments.
 * Invariant: the status buckets always add up to the number of escrows created.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FactoryCounters {

    private final FactoryStateRepository factoryStateRepository;
    private final EscrowStatusCountRepository statusCountRepository;
    private final ParticipantStatRepository participantStatRepository;

    @Transactional
    public void seed() {
        for (EscrowStatus status : EscrowStatus.values()) {
            if (!statusCountRepository.existsById(status)) {
                statusCountRepository.save(EscrowStatusCount.empty(status));
            }
        }
    }

    @Transactional
    public void recordCreated(EscrowInstance escrow) {
        factoryStateRepository.recordCreation(escrow.getFactoryId(), escrow.getAmount());
        incrementParticipant(escrow.getPayer());
        if (!Principals.same(escrow.getPayer(), escrow.getPayee())) {
            incrementParticipant(escrow.getPayee());
        }
        statusCountRepository.increment(EscrowStatus.FUNDED);
    }

    @Transactional
    public void recordTransition(EscrowStatus from, EscrowStatus to) {
        if (from == to) {
            return;
        }
        if (statusCountRepository.decrementIfPositive(from) == 0) {
            log.warn("event=factory_counters.underflow status={} next={}", from, to);
        }
        statusCountRepository.increment(to);
    }

    @Transactional(readOnly = true)
    public Map<EscrowStatus, Long> statusCounts() {
        Map<EscrowStatus, Long> counts = new EnumMap<>(EscrowStatus.class);
        for (EscrowStatus status : EscrowStatus.values()) {
            counts.put(status, 0L);
        }
        statusCountRepository.findAll().forEach(c -> counts.put(c.getStatus(), c.getEscrowCount()));
        return counts;
    }

    @Transactional(readOnly = true)
    public long participantCount(String participant) {
        String key = Principals.normalize(participant);
        if (key == null) {
            return 0L;
        }
        return participantStatRepository.findById(key)
                .map(ParticipantStat::getEscrowCount)
                .orElse(0L);
    }

    private void incrementParticipant(String participant) {
        if (participantStatRepository.increment(participant) == 0) {
            participantStatRepository.save(ParticipantStat.first(participant));
        }
    }
}
