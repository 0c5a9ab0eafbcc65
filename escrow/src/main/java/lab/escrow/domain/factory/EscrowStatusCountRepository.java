package lab.escrow.domain.factory;

import lab.escrow.domain.escrow.EscrowStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EscrowStatusCountRepository extends JpaRepository<EscrowStatusCount, EscrowStatus> {

    @Modifying(flushAutomatically = true)
    @Query("update EscrowStatusCount c set c.escrowCount = c.escrowCount + 1 where c.status = :status")
    int increment(@Param("status") EscrowStatus status);

    // returns 0 instead of going negative
    @Modifying(flushAutomatically = true)
    @Query("update EscrowStatusCount c set c.escrowCount = c.escrowCount - 1 "
            + "where c.status = :status and c.escrowCount > 0")
    int decrementIfPositive(@Param("status") EscrowStatus status);
}
