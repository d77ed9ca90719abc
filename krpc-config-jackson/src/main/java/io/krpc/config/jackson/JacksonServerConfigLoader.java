package io.krpc.config.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.krpc.server.core.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Reads {@link ServerConfig} settings from JSON.
 *
 * <pre>{@code
 * {
 *   "address": "0.0.0.0",
 *   "rpcPort": 50000,
 *   "streamPort": 50001,
 *   "maxTimePerTickMs": 5,
 *   "adaptiveRateControl": true
 * }
 * }</pre>
 *
 * <p>Unknown keys are ignored and absent keys keep their defaults. The loader never writes
 * configuration back.
 */
public final class JacksonServerConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(JacksonServerConfigLoader.class);

    private final ObjectMapper mapper;

    public JacksonServerConfigLoader() {
        this(new ObjectMapper(new JsonFactory()));
    }

    public JacksonServerConfigLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    public ServerConfig load(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return load(input);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration from " + path, e);
        }
    }

    /**
     * Loads {@code path}, or returns the defaults when it does not exist.
     */
    public ServerConfig loadOrDefaults(Path path) {
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, using defaults", path);
            return ServerConfig.defaults();
        }
        return load(path);
    }

    public ServerConfig load(InputStream input) {
        ServerConfigDocument document;
        try {
            document = mapper.readValue(input, ServerConfigDocument.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration", e);
        }
        return toConfig(document);
    }

    public ServerConfig load(String json) {
        ServerConfigDocument document;
        try {
            document = mapper.readValue(json, ServerConfigDocument.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration", e);
        }
        return toConfig(document);
    }

    private ServerConfig toConfig(ServerConfigDocument document) {
        ServerConfig.Builder builder = ServerConfig.builder();
        if (document == null) {
            return builder.build();
        }
        if (document.address != null) builder.address(document.address);
        if (document.rpcPort != null) builder.rpcPort(document.rpcPort);
        if (document.streamPort != null) builder.streamPort(document.streamPort);
        if (document.maxCallsPerTick != null) builder.maxCallsPerTick(document.maxCallsPerTick);
        if (document.maxTimePerTickMs != null) builder.maxTimePerTick(Duration.ofMillis(document.maxTimePerTickMs));
        if (document.adaptiveRateControl != null) builder.adaptiveRateControl(document.adaptiveRateControl);
        if (document.targetTickPeriodMs != null) builder.targetTickPeriod(Duration.ofMillis(document.targetTickPeriodMs));
        if (document.minTimePerTickMs != null) builder.minTimePerTick(Duration.ofMillis(document.minTimePerTickMs));
        if (document.blockingReceive != null) builder.blockingReceive(document.blockingReceive);
        if (document.receiveTimeoutMs != null) builder.receiveTimeout(Duration.ofMillis(document.receiveTimeoutMs));
        if (document.receiveBufferCapacity != null) builder.receiveBufferCapacity(document.receiveBufferCapacity);
        if (document.maxFrameLength != null) builder.maxFrameLength(document.maxFrameLength);
        if (document.sendQueueCapacity != null) builder.sendQueueCapacity(document.sendQueueCapacity);
        if (document.maxQueuedRequests != null) builder.maxQueuedRequests(document.maxQueuedRequests);
        if (document.maxPendingConnections != null) builder.maxPendingConnections(document.maxPendingConnections);
        if (document.handshakeTimeoutMs != null) builder.handshakeTimeout(Duration.ofMillis(document.handshakeTimeoutMs));
        if (document.approvalTimeoutMs != null) builder.approvalTimeout(Duration.ofMillis(document.approvalTimeoutMs));
        try {
            ServerConfig config = builder.build();
            LOG.debug("Loaded {}", config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }
}
