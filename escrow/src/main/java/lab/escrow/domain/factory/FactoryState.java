package lab.escrow.domain.factory;

import jakarta.persistence.*;
import lab.escrow.domain.FieldLimits;
import lombok.*;

import java.time.Instant;

/**
 * The single factory record. Settings change through the owner-gated setters,
 * the totals only through {@link FactoryStateRepository#recordCreation}.
 */
@Entity
@Table(name = "escrow_factory")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class FactoryState {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    // ledger identity payers approve as spender
    @Column(nullable = false, updatable = false, length = FieldLimits.PRINCIPAL)
    private String address;

    @Column(nullable = false, updatable = false, length = FieldLimits.PRINCIPAL)
    private String template;

    @Column(nullable = false, updatable = false, length = FieldLimits.PRINCIPAL)
    private String owner;

    @Column(nullable = false, length = FieldLimits.PRINCIPAL)
    private String feeCollector;

    @Column(nullable = false, length = FieldLimits.PRINCIPAL)
    private String arbitrator;

    @Column(nullable = false)
    private int defaultFeeBips;

    @Column(nullable = false)
    private long totalEscrowsCreated;

    @Column(nullable = false)
    private long totalVolume;

    @Column(nullable = false, updatable = false)
    private Instant initializedAt;

    public static FactoryState initialized(
            String address,
            String template,
            String owner,
            String feeCollector,
            String arbitrator,
            int defaultFeeBips,
            Instant now
    ) {
        return FactoryState.builder()
                .id(SINGLETON_ID)
                .address(address)
                .template(template)
                .owner(owner)
                .feeCollector(feeCollector)
                .arbitrator(arbitrator)
                .defaultFeeBips(defaultFeeBips)
                .totalEscrowsCreated(0L)
                .totalVolume(0L)
                .initializedAt(now)
                .build();
    }

    public void changeFeeCollector(String feeCollector) {
        this.feeCollector = feeCollector;
    }

    public void changeArbitrator(String arbitrator) {
        this.arbitrator = arbitrator;
    }

    public void changeDefaultFeeBips(int defaultFeeBips) {
        this.defaultFeeBips = defaultFeeBips;
    }
}
