package lab.escrow.sim.fakeledger;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "sim_ledger_allowances",
       uniqueConstraints = @UniqueConstraint(name = "uk_ledger_allowance", columnNames = {"asset", "owner", "spender"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerAllowance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 64)
    private String asset;

    @Column(nullable = false, updatable = false, length = 128)
    private String owner;

    @Column(nullable = false, updatable = false, length = 128)
    private String spender;

    @Column(nullable = false)
    private long amount;

    public static LedgerAllowance of(String asset, String owner, String spender, long amount) {
        return new LedgerAllowance(null, asset, owner, spender, amount);
    }

    void approve(long amount) {
        this.amount = amount;
    }

    void spend(long spent) {
        this.amount -= spent;
    }
}
