package lab.escrow.domain.factory;

import jakarta.persistence.*;
import lab.escrow.domain.FieldLimits;
import lombok.*;

@Entity
@Table(name = "escrow_participants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ParticipantStat {

    @Id
    @Column(length = FieldLimits.PRINCIPAL)
    private String participant;

    @Column(nullable = false)
    private long escrowCount;

    public static ParticipantStat first(String participant) {
        return new ParticipantStat(participant, 1L);
    }
}
