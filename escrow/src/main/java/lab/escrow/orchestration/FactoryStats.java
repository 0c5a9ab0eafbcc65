package lab.escrow.orchestration;

import lab.escrow.domain.factory.FactoryState;

public record FactoryStats(
        String address,
        String template,
        String owner,
        long totalEscrows,
        long totalVolume,
        int defaultFeeBips,
        String feeCollector,
        String arbitrator
) {

    static FactoryStats of(FactoryState factory) {
        return new FactoryStats(
                factory.getAddress(),
                factory.getTemplate(),
                factory.getOwner(),
                factory.getTotalEscrowsCreated(),
                factory.getTotalVolume(),
                factory.getDefaultFeeBips(),
                factory.getFeeCollector(),
                factory.getArbitrator()
        );
    }
}
