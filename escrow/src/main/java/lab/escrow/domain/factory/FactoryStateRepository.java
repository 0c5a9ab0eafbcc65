package lab.escrow.domain.factory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FactoryStateRepository extends JpaRepository<FactoryState, Long> {

    @Modifying(flushAutomatically = true)
    @Query("update FactoryState f set f.totalEscrowsCreated = f.totalEscrowsCreated + 1, "
            + "f.totalVolume = f.totalVolume + :amount where f.id = :id")
    int recordCreation(@Param("id") long id, @Param("amount") long amount);
}
