package lab.escrow.orchestration;

import lab.escrow.adapter.AssetLedger;
import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;
import lab.escrow.domain.FieldLimits;
import lab.escrow.domain.Principals;
import lab.escrow.domain.event.EscrowEvent;
import lab.escrow.domain.escrow.EscrowInstance;
import lab.escrow.domain.escrow.EscrowInstanceRepository;
import lab.escrow.domain.escrow.EscrowStatus;
import lab.escrow.domain.escrow.FeeModel;
import lab.escrow.domain.escrow.Settlement;
import lab.escrow.domain.factory.FactoryState;
import lab.escrow.domain.factory.FactoryStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowFactoryService {

    private final FactoryStateRepository factoryStateRepository;
    private final EscrowInstanceRepository escrowInstanceRepository;
    private final EscrowInstanceService escrowInstanceService;
    private final FactoryCounters factoryCounters;
    private final EscrowEventRecorder eventRecorder;
    private final SettlementGuard settlementGuard;
    private final AssetLedger assetLedger;
    private final TransactionTemplate transactionTemplate;
    // serializes creation and settings changes; sequence numbers are read under it
    private final ReentrantLock factoryLock = new ReentrantLock();

    public FactoryState initialize(
            String address,
            String template,
            String owner,
            String feeCollector,
            String arbitrator,
            int defaultFeeBips
    ) {
        factoryLock.lock();
        try {
            FactoryState state = transactionTemplate.execute(status -> {
                if (factoryStateRepository.existsById(FactoryState.SINGLETON_ID)) {
                    throw EscrowException.of(EscrowErrorCode.ALREADY_INITIALIZED, "escrow factory is already initialized");
                }
                FactoryState created = factoryStateRepository.save(FactoryState.initialized(
                        Principals.require(address, "factory address"),
                        Principals.require(template, "template"),
                        Principals.require(owner, "owner"),
                        Principals.require(feeCollector, "feeCollector"),
                        Principals.require(arbitrator, "arbitrator"),
                        FeeModel.requireValidBips(defaultFeeBips),
                        escrowInstanceService.now()
                ));
                factoryCounters.seed();
                return created;
            });
            log.info(
                    "event=factory.initialized address={} template={} owner={} feeCollector={} arbitrator={} defaultFeeBips={}",
                    address,
                    template,
                    owner,
                    feeCollector,
                    arbitrator,
                    defaultFeeBips
            );
            return state;
        } finally {
            factoryLock.unlock();
        }
    }

    @Transactional(readOnly = true)
    public boolean isInitialized() {
        return factoryStateRepository.existsById(FactoryState.SINGLETON_ID);
    }

    // Instantiate, fund and register a new escrow as one unit: any failure leaves no trace.
    public EscrowInstance createEscrow(String caller, CreateEscrowRequest req) {
        log.info(
                "event=factory.create_escrow.start caller={} orderId={} payee={} asset={} amount={} releaseDelaySeconds={}",
                caller,
                req.orderId(),
                req.payee(),
                req.asset(),
                req.amount(),
                req.releaseDelaySeconds()
        );
        factoryLock.lock();
        try {
            EscrowInstance created = transactionTemplate.execute(status -> createAndFund(caller, req));
            if (created == null) {
                throw new IllegalStateException("failed to create escrow for order " + req.orderId());
            }
            log.info(
                    "event=factory.create_escrow.done escrowId={} orderId={} sequenceNo={} status={}",
                    created.getId(),
                    created.getOrderId(),
                    created.getSequenceNo(),
                    created.getStatus()
            );
            return created;
        } finally {
            factoryLock.unlock();
        }
    }

    private EscrowInstance createAndFund(String caller, CreateEscrowRequest req) {
        FactoryState factory = loadFactory();

        if (req.orderId() == null || req.orderId().isBlank()) {
            throw EscrowException.of(EscrowErrorCode.EMPTY_ORDER_ID, "orderId must not be empty");
        }
        String payer = Principals.require(caller, "payer");
        String payee = Principals.require(req.payee(), "payee");
        String asset = Principals.require(req.asset(), "asset");
        if (req.amount() == null || req.amount() <= 0) {
            throw EscrowException.of(EscrowErrorCode.ZERO_AMOUNT, "amount must be positive");
        }
        if (req.releaseDelaySeconds() == null
                || req.releaseDelaySeconds() < 0
                || req.releaseDelaySeconds() > EscrowInstance.MAX_RELEASE_DELAY_SECONDS) {
            throw EscrowException.of(EscrowErrorCode.INVALID_RELEASE_DELAY,
                    "releaseDelaySeconds must be in [0, " + EscrowInstance.MAX_RELEASE_DELAY_SECONDS + "]");
        }
        String orderId = FieldLimits.requireMaxLength(req.orderId().trim(), FieldLimits.ORDER_ID, "orderId");
        FieldLimits.requireMaxLength(req.metadata(), FieldLimits.TEXT, "metadata");
        long amount = req.amount();
        requireVolumeHeadroom(factory, amount);
        if (escrowInstanceRepository.existsByOrderId(orderId)) {
            log.warn("event=factory.create_escrow.duplicate_order orderId={} caller={}", orderId, payer);
            throw EscrowException.of(EscrowErrorCode.DUPLICATE_ORDER_ID, "order already has an escrow: " + orderId);
        }
        requireFunding(factory, payer, asset, amount);

        EscrowInstance escrow = escrowInstanceRepository.saveAndFlush(EscrowInstance.funded(
                factory.getId(),
                factory.getTemplate(),
                factory.getTotalEscrowsCreated() + 1,
                orderId,
                payer,
                payee,
                asset,
                amount,
                req.metadata(),
                factory.getDefaultFeeBips(),
                factory.getFeeCollector(),
                escrowInstanceService.now(),
                req.releaseDelaySeconds()
        ));

        // funds go straight from the payer to the escrow's own account, never through the factory
        AssetLedger.TransferResult funding = assetLedger.transferFrom(
                asset, factory.getAddress(), payer, escrow.custodyAccount(), amount);
        log.info(
                "event=factory.create_escrow.funded escrowId={} transferId={} custodyAccount={} amount={}",
                escrow.getId(),
                funding.transferId(),
                escrow.custodyAccount(),
                amount
        );

        eventRecorder.record(escrow.getId(),
                new EscrowEvent.EscrowInitialized(payer, payee, asset, amount, escrow.getMetadata()));
        factoryCounters.recordCreated(escrow);
        eventRecorder.record(escrow.getId(),
                new EscrowEvent.EscrowCreated(escrow.getId(), orderId, payer, payee, asset, amount));
        return escrow;
    }

    private static void requireVolumeHeadroom(FactoryState factory, long amount) {
        try {
            Math.addExact(factory.getTotalVolume(), amount);
        } catch (ArithmeticException e) {
            throw EscrowException.of(EscrowErrorCode.VOLUME_OVERFLOW,
                    "total volume " + factory.getTotalVolume() + " cannot absorb " + amount);
        }
    }

    private void requireFunding(FactoryState factory, String payer, String asset, long amount) {
        long allowance = assetLedger.allowance(asset, payer, factory.getAddress());
        if (allowance < amount) {
            throw EscrowException.of(EscrowErrorCode.INSUFFICIENT_ALLOWANCE,
                    "allowance " + allowance + " to " + factory.getAddress() + " is below " + amount);
        }
        long balance = assetLedger.balanceOf(asset, payer);
        if (balance < amount) {
            throw EscrowException.of(EscrowErrorCode.INSUFFICIENT_BALANCE,
                    "balance " + balance + " of " + payer + " is below " + amount);
        }
    }

    // Arbitrator-only. The prior status is captured before the escrow changes so the right bucket is decremented.
    public EscrowInstance resolveDispute(String caller, UUID escrowId, String winner) {
        log.info("event=factory.resolve_dispute.start escrowId={} caller={} winner={}", escrowId, caller, winner);
        try (SettlementGuard.Permit permit = settlementGuard.acquire(escrowId)) {
            EscrowInstance resolved = transactionTemplate.execute(status -> {
                FactoryState factory = loadFactory();
                if (!Principals.same(factory.getArbitrator(), caller)) {
                    throw EscrowException.of(EscrowErrorCode.NOT_ARBITRATOR, "only the arbitrator can resolve disputes");
                }
                EscrowInstance escrow = escrowInstanceRepository.findByIdAndFactoryId(escrowId, factory.getId())
                        .orElseThrow(() -> EscrowException.of(EscrowErrorCode.UNKNOWN_ESCROW,
                                "escrow was not created by this factory: " + escrowId));

                EscrowStatus prior = escrow.getStatus();
                Settlement settlement = escrowInstanceService.settleDispute(escrow, winner);
                factoryCounters.recordTransition(prior, EscrowStatus.RESOLVED);
                log.info(
                        "event=factory.resolve_dispute.settled escrowId={} prior={} recipient={} net={} fee={}",
                        escrowId,
                        prior,
                        settlement.recipient(),
                        settlement.netAmount(),
                        settlement.feeAmount()
                );
                return escrow;
            });
            if (resolved == null) {
                throw new IllegalStateException("failed to resolve dispute on escrow " + escrowId);
            }
            log.info("event=factory.resolve_dispute.done escrowId={} status={}", escrowId, resolved.getStatus());
            return resolved;
        }
    }

    public FactoryStats setFeeCollector(String caller, String newCollector) {
        return updateSettings(caller, "fee_collector", factory -> {
            String collector = Principals.require(newCollector, "feeCollector");
            factory.changeFeeCollector(collector);
            return new EscrowEvent.FeeCollectorUpdated(collector);
        });
    }

    public FactoryStats setArbitrator(String caller, String newArbitrator) {
        return updateSettings(caller, "arbitrator", factory -> {
            String arbitrator = Principals.require(newArbitrator, "arbitrator");
            factory.changeArbitrator(arbitrator);
            return new EscrowEvent.ArbitratorUpdated(arbitrator);
        });
    }

    // Only escrows created afterwards use the new rate; existing ones keep their snapshot.
    public FactoryStats setDefaultFeeBips(String caller, Integer newFeeBips) {
        return updateSettings(caller, "fee_bips", factory -> {
            if (newFeeBips == null) {
                throw EscrowException.of(EscrowErrorCode.INVALID_FEE_BIPS, "feeBips is required");
            }
            factory.changeDefaultFeeBips(FeeModel.requireValidBips(newFeeBips));
            return new EscrowEvent.PlatformFeeUpdated(newFeeBips);
        });
    }

    private FactoryStats updateSettings(String caller, String setting, Function<FactoryState, EscrowEvent> change) {
        log.info("event=factory.settings.start setting={} caller={}", setting, caller);
        factoryLock.lock();
        try {
            FactoryStats stats = transactionTemplate.execute(status -> {
                FactoryState factory = loadFactory();
                if (!Principals.same(factory.getOwner(), caller)) {
                    throw EscrowException.of(EscrowErrorCode.NOT_OWNER, "only the factory owner can change " + setting);
                }
                EscrowEvent event = change.apply(factory);
                factoryStateRepository.save(factory);
                eventRecorder.record(null, event);
                return FactoryStats.of(factory);
            });
            log.info("event=factory.settings.done setting={} stats={}", setting, stats);
            return stats;
        } finally {
            factoryLock.unlock();
        }
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findEscrowByOrderId(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            return Optional.empty();
        }
        return escrowInstanceRepository.findByOrderId(orderId.trim()).map(EscrowInstance::getId);
    }

    @Transactional(readOnly = true)
    public boolean isKnownEscrow(UUID escrowId) {
        return escrowInstanceRepository.existsByIdAndFactoryId(escrowId, FactoryState.SINGLETON_ID);
    }

    @Transactional(readOnly = true)
    public FactoryStats stats() {
        return FactoryStats.of(loadFactory());
    }

    @Transactional(readOnly = true)
    public long totalEscrows() {
        return loadFactory().getTotalEscrowsCreated();
    }

    public Map<EscrowStatus, Long> statusCounts() {
        return factoryCounters.statusCounts();
    }

    public long participantEscrowCount(String participant) {
        return factoryCounters.participantCount(participant);
    }

    @Transactional(readOnly = true)
    public List<UUID> escrowsOf(String participant) {
        String key = Principals.normalize(participant);
        if (key == null) {
            return List.of();
        }
        return escrowInstanceRepository.findByPayerOrPayeeOrderBySequenceNoAsc(key, key).stream()
                .map(EscrowInstance::getId)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> escrowsByStatus(EscrowStatus status) {
        return escrowInstanceRepository.findByStatusOrderBySequenceNoAsc(status).stream()
                .map(EscrowInstance::getId)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> allEscrows() {
        return escrowInstanceRepository.findAllByOrderBySequenceNoAsc().stream()
                .map(EscrowInstance::getId)
                .toList();
    }

    private FactoryState loadFactory() {
        return factoryStateRepository.findById(FactoryState.SINGLETON_ID)
                .orElseThrow(() -> EscrowException.of(EscrowErrorCode.FACTORY_NOT_INITIALIZED,
                        "escrow factory has not been initialized"));
    }
}
