package lab.escrow.sim.fakeledger;

import lab.escrow.adapter.AssetLedger;
import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;
import lab.escrow.domain.Principals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Database-backed stand-in for a stable-coin ledger. Joins the caller's transaction,
 * so a failed escrow operation also rolls back the balance movements it made.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FakeAssetLedger implements AssetLedger {

    private final LedgerAccountRepository accountRepository;
    private final LedgerAllowanceRepository allowanceRepository;

    @Override
    @Transactional(readOnly = true)
    public long allowance(String asset, String owner, String spender) {
        return allowanceRepository.findByAssetAndOwnerAndSpender(asset, owner, spender)
                .map(LedgerAllowance::getAmount)
                .orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public long balanceOf(String asset, String account) {
        return accountRepository.findByAssetAndHolder(asset, account)
                .map(LedgerAccount::getBalance)
                .orElse(0L);
    }

    @Override
    @Transactional
    public TransferResult transferFrom(String asset, String spender, String owner, String recipient, long amount) {
        requirePositive(amount);
        LedgerAllowance allowance = allowanceRepository.lockByAssetAndOwnerAndSpender(asset, owner, spender)
                .filter(a -> a.getAmount() >= amount)
                .orElseThrow(() -> EscrowException.of(EscrowErrorCode.INSUFFICIENT_ALLOWANCE,
                        "allowance of " + spender + " over " + owner + " is below " + amount + " " + asset));
        TransferResult result = move(asset, owner, recipient, amount);
        allowance.spend(amount);
        return result;
    }

    @Override
    @Transactional
    public TransferResult transfer(String asset, String from, String recipient, long amount) {
        requirePositive(amount);
        return move(asset, from, recipient, amount);
    }

    @Transactional
    public long mint(String asset, String holder, long amount) {
        String assetId = Principals.require(asset, "asset");
        String account = Principals.require(holder, "holder");
        requirePositive(amount);
        LedgerAccount ledgerAccount = lockOrOpen(assetId, account);
        if (ledgerAccount.getBalance() > Long.MAX_VALUE - amount) {
            throw new IllegalArgumentException("minting " + amount + " would overflow the balance of " + account);
        }
        ledgerAccount.credit(amount);
        log.info("event=fake_ledger.mint asset={} holder={} amount={} balance={}",
                assetId, account, amount, ledgerAccount.getBalance());
        return ledgerAccount.getBalance();
    }

    @Transactional
    public void approve(String asset, String owner, String spender, long amount) {
        String assetId = Principals.require(asset, "asset");
        String ownerId = Principals.require(owner, "owner");
        String spenderId = Principals.require(spender, "spender");
        if (amount < 0) {
            throw new IllegalArgumentException("allowance must not be negative: " + amount);
        }
        allowanceRepository.lockByAssetAndOwnerAndSpender(assetId, ownerId, spenderId)
                .ifPresentOrElse(
                        existing -> existing.approve(amount),
                        () -> allowanceRepository.save(LedgerAllowance.of(assetId, ownerId, spenderId, amount))
                );
        log.info("event=fake_ledger.approve asset={} owner={} spender={} amount={}", assetId, ownerId, spenderId, amount);
    }

    private TransferResult move(String asset, String from, String to, long amount) {
        LedgerAccount source = accountRepository.lockByAssetAndHolder(asset, from)
                .filter(a -> a.getBalance() >= amount)
                .orElseThrow(() -> EscrowException.of(EscrowErrorCode.INSUFFICIENT_BALANCE,
                        "balance of " + from + " is below " + amount + " " + asset));
        LedgerAccount target = lockOrOpen(asset, to);
        source.debit(amount);
        target.credit(amount);

        TransferResult result = new TransferResult(newTransferId(), asset, from, to, amount);
        log.info(
                "event=fake_ledger.transfer transferId={} asset={} from={} to={} amount={}",
                result.transferId(),
                asset,
                from,
                to,
                amount
        );
        return result;
    }

    private LedgerAccount lockOrOpen(String asset, String holder) {
        return accountRepository.lockByAssetAndHolder(asset, holder)
                .orElseGet(() -> accountRepository.save(LedgerAccount.open(asset, holder)));
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("transfer amount must be positive: " + amount);
        }
    }

    private static String newTransferId() {
        return "0xLEDGER_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
