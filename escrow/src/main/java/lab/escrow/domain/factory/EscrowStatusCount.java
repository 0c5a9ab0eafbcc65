package lab.escrow.domain.factory;

import jakarta.persistence.*;
import lab.escrow.domain.escrow.EscrowStatus;
import lombok.*;

@Entity
@Table(name = "escrow_status_counts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowStatusCount {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private EscrowStatus status;

    @Column(nullable = false)
    private long escrowCount;

    public static EscrowStatusCount empty(EscrowStatus status) {
        return new EscrowStatusCount(status, 0L);
    }
}
