package lab.escrow.orchestration;

public record RaiseDisputeRequest(String reason) {}
