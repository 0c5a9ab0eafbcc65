package lab.escrow.domain.event;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface EscrowEventLogRepository extends JpaRepository<EscrowEventLog, Long> {

    List<EscrowEventLog> findByEscrowIdOrderByIdAsc(UUID escrowId);

    List<EscrowEventLog> findByEscrowIdIsNullOrderByIdAsc();
}
