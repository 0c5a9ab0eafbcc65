package lab.escrow.orchestration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "escrow.factory", name = "auto-initialize", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FactoryBootstrap implements ApplicationRunner {

    private final EscrowFactoryService factoryService;

    @Value("${escrow.factory.address:escrow-factory}")
    private String address;

    @Value("${escrow.factory.template:escrow-instance-v1}")
    private String template;

    @Value("${escrow.factory.owner}")
    private String owner;

    @Value("${escrow.factory.fee-collector}")
    private String feeCollector;

    @Value("${escrow.factory.arbitrator}")
    private String arbitrator;

    @Value("${escrow.factory.default-fee-bips:250}")
    private int defaultFeeBips;

    // Initialize exactly once; a restart against an existing database keeps the stored settings.
    @Override
    public void run(ApplicationArguments args) {
        if (factoryService.isInitialized()) {
            log.info("event=factory.bootstrap.skip reason=already_initialized");
            return;
        }
        factoryService.initialize(address, template, owner, feeCollector, arbitrator, defaultFeeBips);
    }
}
