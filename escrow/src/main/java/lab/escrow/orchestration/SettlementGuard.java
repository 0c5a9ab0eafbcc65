package lab.escrow.orchestration;

import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-escrow mutual exclusion held for the whole of a settlement, ledger calls included.
 * Other threads queue up behind the holder; the holding thread itself may not enter again,
 * which is what stops a ledger callback from settling the same escrow twice.
 * An entry lives only while some thread holds or waits for it.
 */
@Component
public class SettlementGuard {

    private final ConcurrentHashMap<UUID, Entry> locks = new ConcurrentHashMap<>();

    public Permit acquire(UUID escrowId) {
        Entry entry = locks.compute(escrowId, (id, existing) -> {
            if (existing != null && existing.lock.isHeldByCurrentThread()) {
                throw EscrowException.of(EscrowErrorCode.REENTRANT_CALL, "re-entrant call on escrow " + escrowId);
            }
            Entry current = existing == null ? new Entry() : existing;
            current.users++;
            return current;
        });
        entry.lock.lock();
        return new Permit(escrowId, entry);
    }

    int trackedEscrows() {
        return locks.size();
    }

    private void release(UUID escrowId, Entry entry) {
        entry.lock.unlock();
        locks.compute(escrowId, (id, existing) -> --existing.users == 0 ? null : existing);
    }

    // users is only touched inside compute, which runs under the map's bin lock
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    public final class Permit implements AutoCloseable {

        private final UUID escrowId;
        private final Entry entry;

        private Permit(UUID escrowId, Entry entry) {
            this.escrowId = escrowId;
            this.entry = entry;
        }

        @Override
        public void close() {
            release(escrowId, entry);
        }
    }
}
