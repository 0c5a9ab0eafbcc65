package lab.escrow.domain.escrow;

public enum EscrowStatus {
    FUNDED,
    RELEASED,
    REFUNDED,
    DISPUTED,
    RESOLVED;

    public boolean isTerminal() {
        return this == RELEASED || this == REFUNDED || this == RESOLVED;
    }

    public String label() {
        return this == FUNDED ? "ACTIVE" : name();
    }
}
