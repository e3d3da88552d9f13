package com.example.readrouting.demo;

import com.example.readrouting.TestNodes;
import com.example.readrouting.config.RoutingProperties;
import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.model.ReadQuery;
import com.example.readrouting.model.ReadResult;
import com.example.readrouting.model.ReplicaNode;
import com.example.readrouting.model.RoutingDecision;
import com.example.readrouting.position.LogPosition;
import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.routing.StrategyType;
import com.example.readrouting.service.ReadRoutingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ScenarioRunnerTest {

    private RoutingProperties properties;
    private ReadRoutingService routingService;
    private LagGenerator lagGenerator;
    private ScenarioRunner runner;

    @BeforeEach
    void setUp() {
        NodeEndpoint primary = TestNodes.primary("primary");
        NodeEndpoint replica1 = TestNodes.replica("replica1", 5433);
        NodeEndpoint replica2 = TestNodes.replica("replica2", 5434);
        LogPosition position = LogPosition.parse("0/3000060");
        when(primary.currentWritePosition()).thenReturn(position);
        when(replica1.lastReplayPosition()).thenReturn(position);
        when(replica2.lastReplayPosition()).thenReturn(position);
        ReplicaRegistry registry = new ReplicaRegistry(primary, List.of(replica1, replica2));

        properties = new RoutingProperties();
        routingService = mock(ReadRoutingService.class);
        lagGenerator = mock(LagGenerator.class);
        runner = new ScenarioRunner(properties, routingService, registry, lagGenerator);
    }

    @Test
    void stickyPatternRepeatsReadsForEveryUser() throws Exception {
        properties.getDemo().setScenario(RoutingProperties.Demo.Scenario.PATTERN);
        when(routingService.activeStrategy()).thenReturn(StrategyType.STICKY_HASH);
        RoutingDecision decision = new RoutingDecision(
                ReplicaNode.replica("replica1", "localhost:5433/testdb"),
                "REPLICA (replica1, sticky)");
        for (String user : List.of("alice", "bob", "charlie")) {
            when(routingService.read(user, ReadQuery.latestOwnedBy(user, ReadQuery.DEFAULT_LIMIT)))
                    .thenReturn(new ReadResult(List.of(), decision));
        }

        runner.run(null);

        for (String user : List.of("alice", "bob", "charlie")) {
            verify(routingService).write(user, "Hello World");
            verify(routingService, times(6)).read(user, ReadQuery.latestOwnedBy(user, ReadQuery.DEFAULT_LIMIT));
        }
        verifyNoInteractions(lagGenerator);
    }

    @Test
    void createLagRunsLagGeneratorOnly() throws Exception {
        properties.getDemo().setScenario(RoutingProperties.Demo.Scenario.CREATE_LAG);

        runner.run(null);

        verify(lagGenerator).createLag(500_000, 500);
        verify(routingService, never()).write(anyString(), anyString());
    }

    @Test
    void noScenarioDoesNothing() throws Exception {
        runner.run(null);

        verifyNoInteractions(routingService, lagGenerator);
    }
}
