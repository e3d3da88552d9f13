package com.example.readrouting.config;

import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.routing.LogPositionRouter;
import com.example.readrouting.routing.ReadRoutingStrategy;
import com.example.readrouting.routing.StickyHashRouter;
import com.example.readrouting.routing.TimeBasedRouter;
import com.example.readrouting.routing.hash.ConsistentHashReplicaSelector;
import com.example.readrouting.routing.hash.ModuloReplicaSelector;
import com.example.readrouting.routing.hash.ReplicaSelector;
import com.example.readrouting.service.ReadRoutingService;
import com.example.readrouting.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the single active read-routing strategy selected by {@code routing.strategy}.
 */
@Configuration
public class ReadRoutingConfig {

    private static final Logger log = LoggerFactory.getLogger(ReadRoutingConfig.class);

    @Bean
    public Clock routingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReplicaSelector replicaSelector(RoutingProperties properties) {
        RoutingProperties.Sticky sticky = properties.getSticky();
        if (sticky.getSelector() == RoutingProperties.Sticky.SelectorType.CONSISTENT_HASH) {
            return new ConsistentHashReplicaSelector(sticky.getVirtualNodes());
        }
        return new ModuloReplicaSelector();
    }

    @Bean
    public ReadRoutingStrategy readRoutingStrategy(RoutingProperties properties, SessionStore sessionStore,
                                                   ReplicaRegistry registry, Clock routingClock,
                                                   ReplicaSelector replicaSelector) {
        ReadRoutingStrategy strategy;
        switch (properties.getStrategy()) {
            case LOG_POSITION:
                strategy = new LogPositionRouter(sessionStore, registry, properties.getPreferredReplica());
                break;
            case STICKY_HASH:
                strategy = new StickyHashRouter(registry, replicaSelector);
                break;
            case TIME_BASED:
            default:
                strategy = new TimeBasedRouter(sessionStore, registry, routingClock,
                        properties.getTimeThreshold(), properties.getPreferredReplica());
                break;
        }
        log.info("Read routing strategy: {}", strategy.type());
        return strategy;
    }

    @Bean
    public ReadRoutingService readRoutingService(ReplicaRegistry registry, SessionStore sessionStore,
                                                 ReadRoutingStrategy readRoutingStrategy) {
        return new ReadRoutingService(registry, sessionStore, readRoutingStrategy);
    }
}
