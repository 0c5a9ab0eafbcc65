package lab.escrow.domain.event;

public enum EventSource {
    FACTORY,
    INSTANCE
}
