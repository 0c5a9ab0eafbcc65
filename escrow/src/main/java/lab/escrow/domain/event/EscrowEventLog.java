package lab.escrow.domain.event;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "escrow_event_logs", indexes = {
        @Index(name = "idx_event_escrow", columnList = "escrowId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class EscrowEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // null for factory-wide events such as fee changes
    @Column(updatable = false)
    private UUID escrowId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private EventSource source;

    @Column(nullable = false, updatable = false, length = 64)
    private String eventType;

    // holds caller-supplied metadata and reasons, JSON-escaped
    @Lob
    @Column(nullable = false, updatable = false)
    private String payload;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static EscrowEventLog of(UUID escrowId, EscrowEvent event, String payload, Instant createdAt) {
        return EscrowEventLog.builder()
                .escrowId(escrowId)
                .source(event.source())
                .eventType(event.type())
                .payload(payload)
                .createdAt(createdAt)
                .build();
    }
}
