package com.example.readrouting.config;

import com.example.readrouting.exception.RoutingConfigurationException;
import com.example.readrouting.model.EndpointDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Turns configured endpoint properties into connection descriptors.
 *
 * Endpoints with a {@code secret-name} take host, port, database and credentials from the JSON
 * secret in AWS Secrets Manager; static properties fill whatever the secret leaves out.
 */
@Component
public class EndpointCredentialsResolver {

    private static final Logger log = LoggerFactory.getLogger(EndpointCredentialsResolver.class);

    private final Supplier<SecretsManagerClient> clientFactory;
    private final ObjectMapper mapper;

    @Autowired
    public EndpointCredentialsResolver(RoutingProperties properties) {
        this(() -> SecretsManagerClient.builder().region(Region.of(properties.getAws().getRegion())).build(),
                new ObjectMapper());
    }

    EndpointCredentialsResolver(Supplier<SecretsManagerClient> clientFactory, ObjectMapper mapper) {
        this.clientFactory = clientFactory;
        this.mapper = mapper;
    }

    public EndpointDescriptor resolve(RoutingProperties.EndpointProperties endpoint) {
        String secretName = endpoint.getSecretName();
        if (secretName == null || secretName.isBlank()) {
            return new EndpointDescriptor(endpoint.getHost(), endpoint.getPort(), endpoint.getDatabase(),
                    endpoint.getUsername(), endpoint.getPassword());
        }
        return fromSecret(endpoint, secretName);
    }

    private EndpointDescriptor fromSecret(RoutingProperties.EndpointProperties endpoint, String secretName) {
        log.info("Fetching credentials for endpoint {} from secret {}", endpoint.getId(), secretName);
        Map<String, Object> secret = readSecret(secretName);

        String username = firstNonNull(secret, "username", "user", endpoint.getUsername());
        String password = firstNonNull(secret, "password", null, endpoint.getPassword());
        String host = firstNonNull(secret, "host", null, endpoint.getHost());
        String port = firstNonNull(secret, "port", null, String.valueOf(endpoint.getPort()));
        String database = firstNonNull(secret, "dbname", "database", endpoint.getDatabase());

        if (host == null || database == null) {
            throw new RoutingConfigurationException("Secret " + secretName
                    + " does not contain required fields 'host' and 'dbname' (or 'database'). Keys: " + secret.keySet());
        }
        if (username == null || password == null) {
            throw new RoutingConfigurationException("Secret " + secretName
                    + " does not contain 'username' and 'password'. Keys: " + secret.keySet());
        }
        try {
            return new EndpointDescriptor(host, Integer.parseInt(port), database, username, password);
        } catch (IllegalArgumentException e) {
            throw new RoutingConfigurationException("Secret " + secretName + " has an invalid endpoint: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> readSecret(String secretName) {
        String secretString;
        try (SecretsManagerClient client = clientFactory.get()) {
            GetSecretValueResponse response = client.getSecretValue(GetSecretValueRequest.builder()
                    .secretId(secretName)
                    .build());
            secretString = response.secretString();
        } catch (SdkException e) {
            throw new RoutingConfigurationException("Failed to fetch secret " + secretName + ": " + e.getMessage(), e);
        }
        if (secretString == null) {
            throw new RoutingConfigurationException("Secret " + secretName + " has no string value");
        }
        try {
            return mapper.readValue(secretString, new TypeReference<Map<String, Object>>() { });
        } catch (JsonProcessingException e) {
            throw new RoutingConfigurationException("Secret " + secretName + " is not a JSON object", e);
        }
    }

    private static String firstNonNull(Map<String, Object> secret, String key, String alternateKey, String fallback) {
        Object value = secret.get(key);
        if (value == null && alternateKey != null) {
            value = secret.get(alternateKey);
        }
        return value != null ? value.toString() : fallback;
    }
}
