package lab.escrow.orchestration;

import lab.escrow.common.error.EscrowErrorCode;
import lab.escrow.common.error.EscrowException;
import lab.escrow.domain.event.EscrowEventLog;
import lab.escrow.domain.escrow.EscrowInstance;
import lab.escrow.domain.escrow.EscrowStatus;
import lab.escrow.sim.fakeledger.FakeAssetLedger;
import lab.escrow.support.MutableClock;
import lab.escrow.support.TestClockConfig;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
class EscrowFactoryServiceIntegrationTest {

    private static final String ASSET = "USDC";
    private static final String FACTORY_ADDRESS = "escrow-factory";
    private static final String OWNER = "platform-owner";
    private static final String ARBITRATOR = "platform-arbitrator";
    private static final String FEE_COLLECTOR = "platform-fees";
    private static final long AMOUNT = 100_000_000L;
    private static final long SEVEN_DAYS = Duration.ofDays(7).getSeconds();

    @Autowired
    private EscrowFactoryService factoryService;

    @Autowired
    private EscrowInstanceService escrowInstanceService;

    @Autowired
    private EscrowEventRecorder eventRecorder;

    @Autowired
    private FakeAssetLedger ledger;

    @Autowired
    private MutableClock clock;

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void fund(String payer, long amount) {
        ledger.mint(ASSET, payer, amount);
        ledger.approve(ASSET, payer, FACTORY_ADDRESS, amount);
    }

    private EscrowInstance create(String payer, String payee, long amount) {
        fund(payer, amount);
        return factoryService.createEscrow(payer, new CreateEscrowRequest(
                unique("order"), payee, ASSET, amount, "{\"sku\":\"A-1\"}", SEVEN_DAYS));
    }

    private static void assertCode(ThrowableAssert.ThrowingCallable call, EscrowErrorCode code) {
        assertThatThrownBy(call)
                .isInstanceOf(EscrowException.class)
                .satisfies(e -> assertThat(((EscrowException) e).getCode()).isEqualTo(code));
    }

    private static long sum(Map<EscrowStatus, Long> counts) {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    @Test
    void createEscrow_movesFundsIntoCustodyAndRegistersTheEscrow() {
        String payer = unique("buyer");
        String payee = unique("seller");
        FactoryStats before = factoryService.stats();
        long fundedBefore = factoryService.statusCounts().get(EscrowStatus.FUNDED);

        EscrowInstance escrow = create(payer, payee, AMOUNT);

        assertThat(escrow.getStatus()).isEqualTo(EscrowStatus.FUNDED);
        assertThat(escrow.getFeeBips()).isEqualTo(250);
        assertThat(escrow.getFeeCollector()).isEqualTo(FEE_COLLECTOR);
        assertThat(escrow.getReleaseAfter()).isEqualTo(escrow.getCreatedAt().plusSeconds(SEVEN_DAYS));
        assertThat(ledger.balanceOf(ASSET, payer)).isZero();
        assertThat(ledger.allowance(ASSET, payer, FACTORY_ADDRESS)).isZero();
        assertThat(ledger.balanceOf(ASSET, escrow.custodyAccount())).isEqualTo(AMOUNT);

        FactoryStats after = factoryService.stats();
        assertThat(after.totalEscrows()).isEqualTo(before.totalEscrows() + 1);
        assertThat(after.totalVolume()).isEqualTo(before.totalVolume() + AMOUNT);
        assertThat(escrow.getSequenceNo()).isEqualTo(after.totalEscrows());
        assertThat(factoryService.statusCounts().get(EscrowStatus.FUNDED)).isEqualTo(fundedBefore + 1);

        assertThat(factoryService.findEscrowByOrderId(escrow.getOrderId())).contains(escrow.getId());
        assertThat(factoryService.isKnownEscrow(escrow.getId())).isTrue();
        assertThat(factoryService.isKnownEscrow(UUID.randomUUID())).isFalse();
        assertThat(factoryService.escrowsOf(payer)).containsExactly(escrow.getId());
        assertThat(factoryService.escrowsOf(payee)).containsExactly(escrow.getId());
        assertThat(factoryService.participantEscrowCount(payer)).isEqualTo(1);
        assertThat(factoryService.participantEscrowCount(payee)).isEqualTo(1);
        assertThat(factoryService.escrowsByStatus(EscrowStatus.FUNDED)).contains(escrow.getId());

        assertThat(eventRecorder.eventsOf(escrow.getId()))
                .extracting(EscrowEventLog::getEventType)
                .containsExactly("EscrowInitialized", "EscrowCreated");
    }

    @Test
    void duplicateOrderId_isRejectedWithoutSideEffects() {
        String payer = unique("buyer");
        String orderId = unique("order");
        fund(payer, 2 * AMOUNT);
        factoryService.createEscrow(payer, new CreateEscrowRequest(orderId, unique("seller"), ASSET, AMOUNT, null, SEVEN_DAYS));
        long total = factoryService.totalEscrows();

        assertCode(() -> factoryService.createEscrow(payer,
                new CreateEscrowRequest(orderId, unique("seller"), ASSET, AMOUNT, null, SEVEN_DAYS)),
                EscrowErrorCode.DUPLICATE_ORDER_ID);

        assertThat(factoryService.totalEscrows()).isEqualTo(total);
        assertThat(ledger.balanceOf(ASSET, payer)).isEqualTo(AMOUNT);
        assertThat(factoryService.participantEscrowCount(payer)).isEqualTo(1);
    }

    @Test
    void missingAllowanceOrBalance_failsAndLeavesNoTrace() {
        String payer = unique("buyer");
        ledger.mint(ASSET, payer, AMOUNT);
        long total = factoryService.totalEscrows();
        String orderId = unique("order");

        assertCode(() -> factoryService.createEscrow(payer,
                new CreateEscrowRequest(orderId, unique("seller"), ASSET, AMOUNT, null, SEVEN_DAYS)),
                EscrowErrorCode.INSUFFICIENT_ALLOWANCE);

        String poorPayer = unique("buyer");
        ledger.mint(ASSET, poorPayer, AMOUNT - 1);
        ledger.approve(ASSET, poorPayer, FACTORY_ADDRESS, AMOUNT);
        assertCode(() -> factoryService.createEscrow(poorPayer,
                new CreateEscrowRequest(orderId, unique("seller"), ASSET, AMOUNT, null, SEVEN_DAYS)),
                EscrowErrorCode.INSUFFICIENT_BALANCE);

        assertThat(factoryService.totalEscrows()).isEqualTo(total);
        assertThat(factoryService.findEscrowByOrderId(orderId)).isEmpty();
        assertThat(ledger.balanceOf(ASSET, payer)).isEqualTo(AMOUNT);
        assertThat(ledger.allowance(ASSET, poorPayer, FACTORY_ADDRESS)).isEqualTo(AMOUNT);
        assertThat(factoryService.participantEscrowCount(poorPayer)).isZero();
    }

    @Test
    void invalidCreateRequests_areRejectedInValidationOrder() {
        String payer = unique("buyer");
        fund(payer, AMOUNT);

        assertCode(() -> factoryService.createEscrow(payer,
                new CreateEscrowRequest(" ", "seller", ASSET, AMOUNT, null, SEVEN_DAYS)), EscrowErrorCode.EMPTY_ORDER_ID);
        assertCode(() -> factoryService.createEscrow(payer,
                new CreateEscrowRequest(unique("order"), "", ASSET, AMOUNT, null, SEVEN_DAYS)), EscrowErrorCode.ZERO_ADDRESS);
        assertCode(() -> factoryService.createEscrow(payer,
                new CreateEscrowRequest(unique("order"), "seller", null, AMOUNT, null, SEVEN_DAYS)), EscrowErrorCode.ZERO_ADDRESS);
        assertCode(() -> factoryService.createEscrow(payer,
                new CreateEscrowRequest(unique("order"), "seller", ASSET, 0L, null, SEVEN_DAYS)), EscrowErrorCode.ZERO_AMOUNT);
        assertCode(() -> factoryService.createEscrow(payer,
                new CreateEscrowRequest(unique("order"), "seller", ASSET, AMOUNT, null, -1L)), EscrowErrorCode.INVALID_RELEASE_DELAY);
        assertCode(() -> factoryService.createEscrow(null,
                new CreateEscrowRequest(unique("order"), "seller", ASSET, AMOUNT, null, SEVEN_DAYS)), EscrowErrorCode.ZERO_ADDRESS);

        assertThat(ledger.balanceOf(ASSET, payer)).isEqualTo(AMOUNT);
    }

    @Test
    void samePayerAndPayee_countsTheParticipantOnce() {
        String self = unique("self");

        EscrowInstance escrow = create(self, self, AMOUNT);

        assertThat(factoryService.participantEscrowCount(self)).isEqualTo(1);
        assertThat(factoryService.escrowsOf(self)).containsExactly(escrow.getId());
    }

    @Test
    void release_paysPayeeAndCollector_andMovesTheStatusBucket() {
        String payer = unique("buyer");
        String payee = unique("seller");
        EscrowInstance escrow = create(payer, payee, AMOUNT);
        long collectorBefore = ledger.balanceOf(ASSET, FEE_COLLECTOR);
        Map<EscrowStatus, Long> countsBefore = factoryService.statusCounts();

        EscrowView view = escrowInstanceService.release(escrow.getId(), payer);

        assertThat(view.basicInfo().status()).isEqualTo(EscrowStatus.RELEASED);
        assertThat(view.statusLabel()).isEqualTo("RELEASED");
        assertThat(view.custodyBalance()).isZero();
        assertThat(ledger.balanceOf(ASSET, payee)).isEqualTo(97_500_000L);
        assertThat(ledger.balanceOf(ASSET, FEE_COLLECTOR)).isEqualTo(collectorBefore + 2_500_000L);

        Map<EscrowStatus, Long> countsAfter = factoryService.statusCounts();
        assertThat(countsAfter.get(EscrowStatus.FUNDED)).isEqualTo(countsBefore.get(EscrowStatus.FUNDED) - 1);
        assertThat(countsAfter.get(EscrowStatus.RELEASED)).isEqualTo(countsBefore.get(EscrowStatus.RELEASED) + 1);
        assertThat(sum(countsAfter)).isEqualTo(factoryService.totalEscrows());
        assertThat(factoryService.escrowsByStatus(EscrowStatus.RELEASED)).contains(escrow.getId());
        assertThat(factoryService.escrowsByStatus(EscrowStatus.FUNDED)).doesNotContain(escrow.getId());
    }

    @Test
    void refund_returnsEverythingToPayer() {
        String payer = unique("buyer");
        String payee = unique("seller");
        EscrowInstance escrow = create(payer, payee, AMOUNT);
        long collectorBefore = ledger.balanceOf(ASSET, FEE_COLLECTOR);

        assertCode(() -> escrowInstanceService.refund(escrow.getId(), payer), EscrowErrorCode.NOT_PAYEE);
        escrowInstanceService.refund(escrow.getId(), payee);

        assertThat(ledger.balanceOf(ASSET, payer)).isEqualTo(AMOUNT);
        assertThat(ledger.balanceOf(ASSET, FEE_COLLECTOR)).isEqualTo(collectorBefore);
        assertCode(() -> escrowInstanceService.release(escrow.getId(), payer), EscrowErrorCode.INVALID_STATUS);
    }

    @Test
    void autoRelease_opensExactlyAtReleaseAfter() {
        String payer = unique("buyer");
        String payee = unique("seller");
        EscrowInstance escrow = create(payer, payee, AMOUNT);

        clock.advance(Duration.ofSeconds(SEVEN_DAYS - 1));
        EscrowView early = escrowInstanceService.get(escrow.getId());
        assertThat(early.canAutoRelease()).isFalse();
        assertThat(early.timestamps().timeLeftSeconds()).isEqualTo(1);
        assertCode(() -> escrowInstanceService.autoRelease(escrow.getId(), "keeper"), EscrowErrorCode.RELEASE_TOO_EARLY);

        clock.advance(Duration.ofSeconds(1));
        EscrowView released = escrowInstanceService.autoRelease(escrow.getId(), "keeper");

        assertThat(released.basicInfo().status()).isEqualTo(EscrowStatus.RELEASED);
        assertThat(released.timestamps().timeLeftSeconds()).isZero();
        assertThat(ledger.balanceOf(ASSET, payee)).isEqualTo(97_500_000L);
    }

    @Test
    void dispute_payerWins_getsFullRefund() {
        String payer = unique("buyer");
        String payee = unique("seller");
        EscrowInstance escrow = create(payer, payee, AMOUNT);
        long collectorBefore = ledger.balanceOf(ASSET, FEE_COLLECTOR);

        EscrowView disputed = escrowInstanceService.raiseDispute(escrow.getId(), payee, "buyer stopped responding");
        assertThat(disputed.disputeInfo().hasDispute()).isTrue();
        assertThat(disputed.disputeInfo().raisedBy()).isEqualTo(payee);
        assertThat(disputed.canAutoRelease()).isFalse();

        EscrowInstance resolved = factoryService.resolveDispute(ARBITRATOR, escrow.getId(), payer);

        assertThat(resolved.getStatus()).isEqualTo(EscrowStatus.RESOLVED);
        assertThat(ledger.balanceOf(ASSET, payer)).isEqualTo(AMOUNT);
        assertThat(ledger.balanceOf(ASSET, payee)).isZero();
        assertThat(ledger.balanceOf(ASSET, FEE_COLLECTOR)).isEqualTo(collectorBefore);
        assertThat(sum(factoryService.statusCounts())).isEqualTo(factoryService.totalEscrows());
        assertThat(eventRecorder.eventsOf(escrow.getId()))
                .extracting(EscrowEventLog::getEventType)
                .containsExactly("EscrowInitialized", "EscrowCreated", "DisputeRaised", "DisputeResolved");
    }

    @Test
    void dispute_payeeWins_feeIsCharged() {
        String payer = unique("buyer");
        String payee = unique("seller");
        EscrowInstance escrow = create(payer, payee, AMOUNT);
        long collectorBefore = ledger.balanceOf(ASSET, FEE_COLLECTOR);
        escrowInstanceService.raiseDispute(escrow.getId(), payer, "item damaged");
        long resolvedBefore = factoryService.statusCounts().get(EscrowStatus.RESOLVED);

        factoryService.resolveDispute(ARBITRATOR, escrow.getId(), payee);

        assertThat(ledger.balanceOf(ASSET, payee)).isEqualTo(97_500_000L);
        assertThat(ledger.balanceOf(ASSET, FEE_COLLECTOR)).isEqualTo(collectorBefore + 2_500_000L);
        assertThat(factoryService.statusCounts().get(EscrowStatus.RESOLVED)).isEqualTo(resolvedBefore + 1);
    }

    @Test
    void resolveDispute_guardsCallerEscrowStatusAndWinner() {
        String payer = unique("buyer");
        String payee = unique("seller");
        EscrowInstance escrow = create(payer, payee, AMOUNT);

        assertCode(() -> factoryService.resolveDispute(ARBITRATOR, escrow.getId(), payee), EscrowErrorCode.INVALID_STATUS);
        escrowInstanceService.raiseDispute(escrow.getId(), payer, "wrong size");

        assertCode(() -> factoryService.resolveDispute(payer, escrow.getId(), payer), EscrowErrorCode.NOT_ARBITRATOR);
        assertCode(() -> factoryService.resolveDispute(ARBITRATOR, UUID.randomUUID(), payer), EscrowErrorCode.UNKNOWN_ESCROW);
        assertCode(() -> factoryService.resolveDispute(ARBITRATOR, escrow.getId(), ARBITRATOR), EscrowErrorCode.INVALID_WINNER);

        // nothing moved by the failed attempts
        assertThat(escrowInstanceService.get(escrow.getId()).basicInfo().status()).isEqualTo(EscrowStatus.DISPUTED);
        assertThat(ledger.balanceOf(ASSET, escrow.custodyAccount())).isEqualTo(AMOUNT);
    }

    @Test
    void resolveDispute_afterRelease_isRejected() {
        String payer = unique("buyer");
        String payee = unique("seller");
        EscrowInstance escrow = create(payer, payee, AMOUNT);
        escrowInstanceService.release(escrow.getId(), payer);

        assertCode(() -> factoryService.resolveDispute(ARBITRATOR, escrow.getId(), payer), EscrowErrorCode.INVALID_STATUS);
        assertThat(ledger.balanceOf(ASSET, payer)).isZero();
    }

    @Test
    void feeChange_appliesOnlyToEscrowsCreatedAfterwards() {
        EscrowInstance before = create(unique("buyer"), unique("seller"), AMOUNT);
        try {
            assertCode(() -> factoryService.setDefaultFeeBips("not-the-owner", 100), EscrowErrorCode.NOT_OWNER);
            assertCode(() -> factoryService.setDefaultFeeBips(OWNER, 10_000), EscrowErrorCode.INVALID_FEE_BIPS);

            FactoryStats stats = factoryService.setDefaultFeeBips(OWNER, 100);
            assertThat(stats.defaultFeeBips()).isEqualTo(100);

            String payer = unique("buyer");
            String payee = unique("seller");
            EscrowInstance after = create(payer, payee, AMOUNT);
            assertThat(after.getFeeBips()).isEqualTo(100);

            escrowInstanceService.release(after.getId(), payer);
            assertThat(ledger.balanceOf(ASSET, payee)).isEqualTo(99_000_000L);
            assertThat(escrowInstanceService.get(before.getId()).feeInfo().feeBips()).isEqualTo(250);
        } finally {
            factoryService.setDefaultFeeBips(OWNER, 250);
        }
    }

    @Test
    void collectorAndArbitratorChanges_areOwnerOnly_andLogged() {
        String newCollector = unique("treasury");
        String newArbitrator = unique("arbitrator");
        try {
            assertCode(() -> factoryService.setFeeCollector(ARBITRATOR, newCollector), EscrowErrorCode.NOT_OWNER);
            assertCode(() -> factoryService.setFeeCollector(OWNER, " "), EscrowErrorCode.ZERO_ADDRESS);

            assertThat(factoryService.setFeeCollector(OWNER, newCollector).feeCollector()).isEqualTo(newCollector);
            assertThat(factoryService.setArbitrator(OWNER, newArbitrator).arbitrator()).isEqualTo(newArbitrator);

            EscrowInstance escrow = create(unique("buyer"), unique("seller"), AMOUNT);
            assertThat(escrow.getFeeCollector()).isEqualTo(newCollector);
            assertThat(eventRecorder.factoryEvents())
                    .extracting(EscrowEventLog::getEventType)
                    .contains("FeeCollectorUpdated", "ArbitratorUpdated");
        } finally {
            factoryService.setFeeCollector(OWNER, FEE_COLLECTOR);
            factoryService.setArbitrator(OWNER, ARBITRATOR);
        }
    }

    @Test
    void valuesLongerThanTheirColumns_areRejectedAsValidationErrors() {
        String payer = unique("buyer");
        fund(payer, AMOUNT);
        long total = factoryService.totalEscrows();

        assertCode(() -> factoryService.createEscrow(payer, new CreateEscrowRequest(
                unique("order"), "seller", ASSET, AMOUNT, "x".repeat(600), SEVEN_DAYS)), EscrowErrorCode.FIELD_TOO_LONG);
        assertCode(() -> factoryService.createEscrow(payer, new CreateEscrowRequest(
                unique("order"), "p".repeat(80), ASSET, AMOUNT, null, SEVEN_DAYS)), EscrowErrorCode.FIELD_TOO_LONG);
        assertCode(() -> factoryService.createEscrow(payer, new CreateEscrowRequest(
                unique("order"), "seller", "a".repeat(65), AMOUNT, null, SEVEN_DAYS)), EscrowErrorCode.FIELD_TOO_LONG);
        assertCode(() -> factoryService.createEscrow(payer, new CreateEscrowRequest(
                "o".repeat(129), "seller", ASSET, AMOUNT, null, SEVEN_DAYS)), EscrowErrorCode.FIELD_TOO_LONG);
        assertCode(() -> factoryService.createEscrow("b".repeat(65), new CreateEscrowRequest(
                unique("order"), "seller", ASSET, AMOUNT, null, SEVEN_DAYS)), EscrowErrorCode.FIELD_TOO_LONG);
        assertCode(() -> factoryService.setFeeCollector(OWNER, "c".repeat(65)), EscrowErrorCode.FIELD_TOO_LONG);
        assertCode(() -> factoryService.setArbitrator(OWNER, "a".repeat(65)), EscrowErrorCode.FIELD_TOO_LONG);

        assertThat(factoryService.totalEscrows()).isEqualTo(total);
        assertThat(ledger.balanceOf(ASSET, payer)).isEqualTo(AMOUNT);
        assertThat(factoryService.stats().feeCollector()).isEqualTo(FEE_COLLECTOR);

        // exactly at the limits is accepted and stored
        EscrowInstance escrow = factoryService.createEscrow(payer, new CreateEscrowRequest(
                unique("order"), "s".repeat(64), ASSET, AMOUNT, "m".repeat(512), SEVEN_DAYS));
        assertThat(escrow.getMetadata()).hasSize(512);
        assertThat(escrowInstanceService.get(escrow.getId()).basicInfo().payee()).hasSize(64);
    }

    @Test
    void longDisputeReason_isRejected_andEscrowStaysFunded() {
        String payer = unique("buyer");
        EscrowInstance escrow = create(payer, unique("seller"), AMOUNT);

        assertCode(() -> escrowInstanceService.raiseDispute(escrow.getId(), payer, "r".repeat(600)),
                EscrowErrorCode.FIELD_TOO_LONG);

        assertThat(escrowInstanceService.get(escrow.getId()).basicInfo().status()).isEqualTo(EscrowStatus.FUNDED);

        // a reason at the limit, quotes included, still fits the event log
        String reason = "\"".repeat(512);
        escrowInstanceService.raiseDispute(escrow.getId(), payer, reason);
        assertThat(escrowInstanceService.get(escrow.getId()).disputeInfo().reason()).isEqualTo(reason);
    }

    @Test
    void createEscrow_thatWouldOverflowTotalVolume_isRejected() {
        create(unique("buyer"), unique("seller"), AMOUNT);
        FactoryStats before = factoryService.stats();
        String payer = unique("whale");
        fund(payer, Long.MAX_VALUE);

        assertCode(() -> factoryService.createEscrow(payer, new CreateEscrowRequest(
                unique("order"), unique("seller"), ASSET, Long.MAX_VALUE, null, SEVEN_DAYS)), EscrowErrorCode.VOLUME_OVERFLOW);

        FactoryStats after = factoryService.stats();
        assertThat(after.totalVolume()).isEqualTo(before.totalVolume());
        assertThat(after.totalEscrows()).isEqualTo(before.totalEscrows());
        assertThat(ledger.balanceOf(ASSET, payer)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void releaseDelayBeyondTheSupportedRange_isRejected() {
        String payer = unique("buyer");
        fund(payer, AMOUNT);

        assertCode(() -> factoryService.createEscrow(payer, new CreateEscrowRequest(
                unique("order"), "seller", ASSET, AMOUNT, null, Long.MAX_VALUE)), EscrowErrorCode.INVALID_RELEASE_DELAY);
        assertCode(() -> factoryService.createEscrow(payer, new CreateEscrowRequest(
                unique("order"), "seller", ASSET, AMOUNT, null, EscrowInstance.MAX_RELEASE_DELAY_SECONDS + 1)),
                EscrowErrorCode.INVALID_RELEASE_DELAY);

        EscrowInstance escrow = factoryService.createEscrow(payer, new CreateEscrowRequest(
                unique("order"), "seller", ASSET, AMOUNT, null, EscrowInstance.MAX_RELEASE_DELAY_SECONDS));
        assertThat(escrow.getReleaseAfter())
                .isEqualTo(escrow.getCreatedAt().plusSeconds(EscrowInstance.MAX_RELEASE_DELAY_SECONDS));
    }

    @Test
    void lookups_trimKeysTheWayCreationStoresThem() {
        String payer = unique("buyer");
        String payee = unique("seller");
        String orderId = unique("order");
        fund(payer, AMOUNT);
        EscrowInstance escrow = factoryService.createEscrow(" " + payer + " ", new CreateEscrowRequest(
                "  " + orderId + " ", " " + payee, ASSET, AMOUNT, null, SEVEN_DAYS));

        assertThat(escrow.getOrderId()).isEqualTo(orderId);
        assertThat(factoryService.findEscrowByOrderId(" " + orderId)).contains(escrow.getId());
        assertThat(factoryService.findEscrowByOrderId(orderId + "  ")).contains(escrow.getId());
        assertThat(factoryService.escrowsOf(" " + payee + " ")).containsExactly(escrow.getId());
        assertThat(factoryService.participantEscrowCount(payer + " ")).isEqualTo(1);
        assertThat(factoryService.findEscrowByOrderId(" ")).isEmpty();
        assertThat(factoryService.escrowsOf(null)).isEmpty();
        assertThat(factoryService.participantEscrowCount("")).isZero();
        assertCode(() -> factoryService.createEscrow(payer, new CreateEscrowRequest(
                " " + orderId, payee, ASSET, AMOUNT, null, SEVEN_DAYS)), EscrowErrorCode.DUPLICATE_ORDER_ID);
    }

    @Test
    void initialize_onlyOnce() {
        assertThat(factoryService.isInitialized()).isTrue();
        assertCode(() -> factoryService.initialize(FACTORY_ADDRESS, "escrow-instance-v1", "someone", "x", "y", 250),
                EscrowErrorCode.ALREADY_INITIALIZED);
        assertThat(factoryService.stats().owner()).isEqualTo(OWNER);
    }

    @Test
    void concurrentCreations_getDistinctSequenceNumbers_andKeepTotalsConsistent() throws Exception {
        int threads = 8;
        long totalBefore = factoryService.totalEscrows();
        List<String> payers = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String payer = unique("buyer");
            fund(payer, AMOUNT);
            payers.add(payer);
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<EscrowInstance>> tasks = new ArrayList<>();
            for (String payer : payers) {
                tasks.add(() -> factoryService.createEscrow(payer,
                        new CreateEscrowRequest(unique("order"), unique("seller"), ASSET, AMOUNT, null, SEVEN_DAYS)));
            }
            List<Long> sequenceNumbers = new ArrayList<>();
            for (Future<EscrowInstance> f : executor.invokeAll(tasks)) {
                sequenceNumbers.add(f.get().getSequenceNo());
            }

            assertThat(sequenceNumbers).doesNotHaveDuplicates();
            assertThat(factoryService.totalEscrows()).isEqualTo(totalBefore + threads);
            assertThat(sum(factoryService.statusCounts())).isEqualTo(factoryService.totalEscrows());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentReleases_settleExactlyOnce() throws Exception {
        String payer = unique("buyer");
        String payee = unique("seller");
        EscrowInstance escrow = create(payer, payee, AMOUNT);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                tasks.add(() -> {
                    try {
                        escrowInstanceService.release(escrow.getId(), payer);
                        return true;
                    } catch (EscrowException e) {
                        return false;
                    }
                });
            }
            int successes = 0;
            for (Future<Boolean> f : executor.invokeAll(tasks)) {
                if (f.get()) {
                    successes++;
                }
            }

            assertThat(successes).isEqualTo(1);
            assertThat(ledger.balanceOf(ASSET, payee)).isEqualTo(97_500_000L);
            assertThat(ledger.balanceOf(ASSET, escrow.custodyAccount())).isZero();
        } finally {
            executor.shutdownNow();
        }
    }
}
