package lab.escrow.domain.event;

import java.util.UUID;

/**
 * Domain events observed by indexers. Each record is persisted as JSON in the event log
 * and published to in-process listeners.
 */
public interface EscrowEvent {

    EventSource source();

    default String type() {
        return getClass().getSimpleName();
    }

    record EscrowInitialized(
            String payer,
            String payee,
            String asset,
            long amount,
            String metadata
    ) implements EscrowEvent {
        @Override
        public EventSource source() {
            return EventSource.INSTANCE;
        }
    }

    record EscrowCreated(
            UUID instance,
            String orderId,
            String payer,
            String payee,
            String asset,
            long amount
    ) implements EscrowEvent {
        @Override
        public EventSource source() {
            return EventSource.FACTORY;
        }
    }

    record FundsReleased(
            String recipient,
            long netAmount,
            long feeAmount
    ) implements EscrowEvent {
        @Override
        public EventSource source() {
            return EventSource.INSTANCE;
        }
    }

    record FundsRefunded(
            String recipient,
            long amount
    ) implements EscrowEvent {
        @Override
        public EventSource source() {
            return EventSource.INSTANCE;
        }
    }

    record DisputeRaised(
            String raiser,
            String reason
    ) implements EscrowEvent {
        @Override
        public EventSource source() {
            return EventSource.INSTANCE;
        }
    }

    record DisputeResolved(
            String winner,
            long netAmount,
            long feeAmount
    ) implements EscrowEvent {
        @Override
        public EventSource source() {
            return EventSource.INSTANCE;
        }
    }

    record FeeCollectorUpdated(String newCollector) implements EscrowEvent {
        @Override
        public EventSource source() {
            return EventSource.FACTORY;
        }
    }

    record ArbitratorUpdated(String newArbitrator) implements EscrowEvent {
        @Override
        public EventSource source() {
            return EventSource.FACTORY;
        }
    }

    record PlatformFeeUpdated(int newFeeBips) implements EscrowEvent {
        @Override
        public EventSource source() {
            return EventSource.FACTORY;
        }
    }
}
