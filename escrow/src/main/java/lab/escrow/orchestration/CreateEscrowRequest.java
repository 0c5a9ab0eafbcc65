package lab.escrow.orchestration;

public record CreateEscrowRequest(
        String orderId,
        String payee,
        String asset,
        Long amount,
        String metadata,
        Long releaseDelaySeconds
) {}
