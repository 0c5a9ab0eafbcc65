package lab.escrow.domain.factory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ParticipantStatRepository extends JpaRepository<ParticipantStat, String> {

    @Modifying(flushAutomatically = true)
    @Query("update ParticipantStat p set p.escrowCount = p.escrowCount + 1 where p.participant = :participant")
    int increment(@Param("participant") String participant);
}
