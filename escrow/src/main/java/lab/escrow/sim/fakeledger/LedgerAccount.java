package lab.escrow.sim.fakeledger;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "sim_ledger_accounts",
       uniqueConstraints = @UniqueConstraint(name = "uk_ledger_account", columnNames = {"asset", "holder"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 64)
    private String asset;

    @Column(nullable = false, updatable = false, length = 128)
    private String holder;

    @Column(nullable = false)
    private long balance;

    public static LedgerAccount open(String asset, String holder) {
        return new LedgerAccount(null, asset, holder, 0L);
    }

    void credit(long amount) {
        this.balance = Math.addExact(balance, amount);
    }

    void debit(long amount) {
        if (amount > balance) {
            throw new IllegalStateException("debit exceeds balance of " + holder);
        }
        this.balance -= amount;
    }
}
