package lab.escrow.domain.escrow;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EscrowInstanceRepository extends JpaRepository<EscrowInstance, UUID> {

    Optional<EscrowInstance> findByOrderId(String orderId);

    boolean existsByOrderId(String orderId);

    Optional<EscrowInstance> findByIdAndFactoryId(UUID id, long factoryId);

    boolean existsByIdAndFactoryId(UUID id, long factoryId);

    List<EscrowInstance> findByPayerOrPayeeOrderBySequenceNoAsc(String payer, String payee);

    List<EscrowInstance> findByStatusOrderBySequenceNoAsc(EscrowStatus status);

    List<EscrowInstance> findAllByOrderBySequenceNoAsc();
}
