package com.example.readrouting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Node pools are built per endpoint by {@link com.example.readrouting.config.ReplicaRegistryConfig},
 * so the single auto-configured DataSource is switched off.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class ReadRoutingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReadRoutingApplication.class, args);
    }
}
