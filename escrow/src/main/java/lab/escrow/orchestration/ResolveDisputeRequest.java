package lab.escrow.orchestration;

public record ResolveDisputeRequest(String winner) {}
