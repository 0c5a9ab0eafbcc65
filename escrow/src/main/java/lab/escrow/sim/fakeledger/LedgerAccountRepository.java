package lab.escrow.sim.fakeledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, UUID> {

    Optional<LedgerAccount> findByAssetAndHolder(String asset, String holder);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from LedgerAccount a where a.asset = :asset and a.holder = :holder")
    Optional<LedgerAccount> lockByAssetAndHolder(@Param("asset") String asset, @Param("holder") String holder);
}
