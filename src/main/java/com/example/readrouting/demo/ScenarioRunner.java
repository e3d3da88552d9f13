package com.example.readrouting.demo;

import com.example.readrouting.config.RoutingProperties;
import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.model.ReadQuery;
import com.example.readrouting.model.ReadResult;
import com.example.readrouting.position.LogPosition;
import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.service.ReadRoutingService;
import com.example.readrouting.util.ReplayPositionAwaiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Command-line walkthrough of the active strategy, enabled with {@code routing.demo.scenario}.
 */
@Component
public class ScenarioRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ScenarioRunner.class);

    private final RoutingProperties properties;
    private final ReadRoutingService routingService;
    private final ReplicaRegistry registry;
    private final LagGenerator lagGenerator;

    public ScenarioRunner(RoutingProperties properties, ReadRoutingService routingService,
                          ReplicaRegistry registry, LagGenerator lagGenerator) {
        this.properties = properties;
        this.routingService = routingService;
        this.registry = registry;
        this.lagGenerator = lagGenerator;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        RoutingProperties.Demo demo = properties.getDemo();
        switch (demo.getScenario()) {
            case CREATE_LAG:
                lagGenerator.createLag(demo.getLagRows(), demo.getLagPadding());
                break;
            case PATTERN:
                runPattern();
                break;
            case NONE:
            default:
                break;
        }
    }

    private void runPattern() throws InterruptedException {
        log.info("=== Strategy {} ===", routingService.activeStrategy());
        switch (routingService.activeStrategy()) {
            case TIME_BASED:
                timeBasedScenario();
                break;
            case LOG_POSITION:
                logPositionScenario();
                break;
            case STICKY_HASH:
                stickyScenario();
                break;
            default:
                throw new IllegalStateException("No scenario for " + routingService.activeStrategy());
        }
    }

    private void timeBasedScenario() throws InterruptedException {
        String session = "time-based-demo";
        long id = routingService.write(session, "Pattern1-Critical-Data");
        log.info("Wrote record {} to primary", id);
        report(session, "Immediate read");

        Duration wait = properties.getTimeThreshold().plusSeconds(1);
        log.info("Waiting {} for the threshold to pass", wait);
        Thread.sleep(wait.toMillis());
        report(session, "Read after threshold");
    }

    private void logPositionScenario() {
        String session = "log-position-demo";
        long id = routingService.write(session, "Pattern2-LSN-Test");
        log.info("Wrote record {} at {}", id,
                routingService.session(session).flatMap(s -> s.getLastWritePosition()).orElse(null));
        report(session, "Immediate read");

        NodeEndpoint replica = registry.preferredReplica(properties.getPreferredReplica());
        routingService.session(session).flatMap(s -> s.getLastWritePosition()).ifPresent((LogPosition target) -> {
            boolean replayed = ReplayPositionAwaiter.awaitReplay(replica, target, Duration.ofSeconds(30),
                    ReplayPositionAwaiter.DEFAULT_POLL_INTERVAL);
            log.info("{} replayed {}: {}", replica.node().getId(), target, replayed);
        });
        report(session, "Read after replay");
    }

    private void stickyScenario() {
        List<String> users = List.of("alice", "bob", "charlie");
        for (String user : users) {
            routingService.write(user, "Hello World");
            ReplayPositionAwaiter.awaitAllReplicas(registry, Duration.ofSeconds(30));
            ReadResult result = routingService.read(user, ReadQuery.latestOwnedBy(user, ReadQuery.DEFAULT_LIMIT));
            log.info("{} read from {}: {} rows", user, result.getSource(), result.getRows().size());
        }
        for (String user : users) {
            for (int i = 1; i <= 5; i++) {
                ReadResult result = routingService.read(user, ReadQuery.latestOwnedBy(user, ReadQuery.DEFAULT_LIMIT));
                log.info("{} read #{} from {}: {} rows", user, i, result.getSource(), result.getRows().size());
            }
        }
    }

    private void report(String session, String step) {
        ReadResult result = routingService.read(session, ReadQuery.latest(3));
        log.info("{}: {} -> {} rows", step, result.getSource(), result.getRows().size());
    }
}
