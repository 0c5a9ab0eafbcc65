package lab.escrow.sim.fakeledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface LedgerAllowanceRepository extends JpaRepository<LedgerAllowance, UUID> {

    Optional<LedgerAllowance> findByAssetAndOwnerAndSpender(String asset, String owner, String spender);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from LedgerAllowance a where a.asset = :asset and a.owner = :owner and a.spender = :spender")
    Optional<LedgerAllowance> lockByAssetAndOwnerAndSpender(
            @Param("asset") String asset,
            @Param("owner") String owner,
            @Param("spender") String spender
    );
}
