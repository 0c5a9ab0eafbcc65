package lab.escrow.adapter;

/**
 * Capability contract of the fungible-asset ledger escrow funds move against.
 * Implementations only move balances that are already held or already approved; they never mint.
 */
public interface AssetLedger {

    long allowance(String asset, String owner, String spender);

    long balanceOf(String asset, String account);

    // Spends the allowance {@code owner} granted to {@code spender}.
    TransferResult transferFrom(String asset, String spender, String owner, String recipient, long amount);

    TransferResult transfer(String asset, String from, String recipient, long amount);

    record TransferResult(
            String transferId,
            String asset,
            String from,
            String to,
            long amount
    ) {}
}
