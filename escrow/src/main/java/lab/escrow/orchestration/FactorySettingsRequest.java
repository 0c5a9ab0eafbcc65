package lab.escrow.orchestration;

/**
 * Body of the owner-gated setters; each endpoint reads the one field it changes.
 */
public record FactorySettingsRequest(
        String feeCollector,
        String arbitrator,
        Integer feeBips
) {}
