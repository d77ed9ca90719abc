package io.krpc.server.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable server settings.
 *
 * <p>Use {@link #builder()} to override the defaults:
 * <pre>{@code
 * ServerConfig config = ServerConfig.builder()
 *     .rpcPort(50000)
 *     .streamPort(50001)
 *     .maxTimePerTick(Duration.ofMillis(5))
 *     .build();
 * }</pre>
 */
public final class ServerConfig {

    /** Unlimited calls per tick. */
    public static final int UNLIMITED_CALLS = 0;

    public static final String DEFAULT_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_RPC_PORT = 50000;
    public static final int DEFAULT_STREAM_PORT = 50001;

    private final String address;
    private final int rpcPort;
    private final int streamPort;
    private final int maxCallsPerTick;
    private final Duration maxTimePerTick;
    private final boolean adaptiveRateControl;
    private final Duration targetTickPeriod;
    private final Duration minTimePerTick;
    private final boolean blockingReceive;
    private final Duration receiveTimeout;
    private final int receiveBufferCapacity;
    private final int maxFrameLength;
    private final int sendQueueCapacity;
    private final int maxQueuedRequests;
    private final int maxPendingConnections;
    private final Duration handshakeTimeout;
    private final Duration approvalTimeout;

    public static Builder builder() {
        return new Builder();
    }

    public static ServerConfig defaults() {
        return builder().build();
    }

    private ServerConfig(Builder builder) {
        this.address = builder.address != null ? builder.address : DEFAULT_ADDRESS;
        this.rpcPort = builder.rpcPort != null ? builder.rpcPort : DEFAULT_RPC_PORT;
        this.streamPort = builder.streamPort != null ? builder.streamPort : DEFAULT_STREAM_PORT;
        this.maxCallsPerTick = builder.maxCallsPerTick;
        this.maxTimePerTick = builder.maxTimePerTick != null ? builder.maxTimePerTick : Duration.ofMillis(10);
        this.adaptiveRateControl = builder.adaptiveRateControl;
        this.targetTickPeriod = builder.targetTickPeriod != null ? builder.targetTickPeriod : Duration.ofMillis(20);
        this.minTimePerTick = builder.minTimePerTick != null ? builder.minTimePerTick : Duration.ofMillis(1);
        this.blockingReceive = builder.blockingReceive;
        this.receiveTimeout = builder.receiveTimeout != null ? builder.receiveTimeout : Duration.ofMillis(1);
        this.receiveBufferCapacity = builder.receiveBufferCapacity > 0 ? builder.receiveBufferCapacity : 1024 * 1024;
        this.maxFrameLength = builder.maxFrameLength > 0 ? builder.maxFrameLength : receiveBufferCapacity;
        this.sendQueueCapacity = builder.sendQueueCapacity > 0 ? builder.sendQueueCapacity : 8 * 1024 * 1024;
        this.maxQueuedRequests = builder.maxQueuedRequests > 0 ? builder.maxQueuedRequests : 64;
        this.maxPendingConnections = builder.maxPendingConnections > 0 ? builder.maxPendingConnections : 16;
        this.handshakeTimeout = builder.handshakeTimeout != null ? builder.handshakeTimeout : Duration.ofSeconds(10);
        this.approvalTimeout = builder.approvalTimeout != null ? builder.approvalTimeout : Duration.ofSeconds(30);

        checkPort("rpcPort", rpcPort);
        checkPort("streamPort", streamPort);
        if (maxCallsPerTick < 0) {
            throw new IllegalArgumentException("maxCallsPerTick must be >= 0");
        }
        checkPositive("maxTimePerTick", maxTimePerTick);
        checkPositive("targetTickPeriod", targetTickPeriod);
        checkPositive("minTimePerTick", minTimePerTick);
        checkPositive("handshakeTimeout", handshakeTimeout);
        checkPositive("approvalTimeout", approvalTimeout);
        if (receiveTimeout.isNegative()) {
            throw new IllegalArgumentException("receiveTimeout must not be negative");
        }
        if (maxFrameLength > receiveBufferCapacity) {
            throw new IllegalArgumentException("maxFrameLength must not exceed receiveBufferCapacity");
        }
        if (minTimePerTick.compareTo(maxTimePerTick) > 0) {
            throw new IllegalArgumentException("minTimePerTick must not exceed maxTimePerTick");
        }
    }

    private static void checkPort(String name, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
    }

    private static void checkPositive(String name, Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /** Listen address for both ports. */
    public String address() {
        return address;
    }

    /** RPC listen port; 0 picks an ephemeral port. */
    public int rpcPort() {
        return rpcPort;
    }

    /** Stream listen port; 0 picks an ephemeral port. */
    public int streamPort() {
        return streamPort;
    }

    /** Request messages started per tick, or {@link #UNLIMITED_CALLS}. */
    public int maxCallsPerTick() {
        return maxCallsPerTick;
    }

    public Duration maxTimePerTick() {
        return maxTimePerTick;
    }

    public boolean adaptiveRateControl() {
        return adaptiveRateControl;
    }

    /** Host tick period adaptive rate control tries to protect. */
    public Duration targetTickPeriod() {
        return targetTickPeriod;
    }

    /** Floor for the adaptive time budget. */
    public Duration minTimePerTick() {
        return minTimePerTick;
    }

    public boolean blockingReceive() {
        return blockingReceive;
    }

    public Duration receiveTimeout() {
        return receiveTimeout;
    }

    /** Bytes a connection may buffer while waiting for a complete message. */
    public int receiveBufferCapacity() {
        return receiveBufferCapacity;
    }

    /** Largest frame payload accepted; longer frames are a decode error. */
    public int maxFrameLength() {
        return maxFrameLength;
    }

    /** Unsent bytes a connection may hold; a client that falls further behind is disconnected. */
    public int sendQueueCapacity() {
        return sendQueueCapacity;
    }

    /** Received requests a connection may queue before the server stops reading from it. */
    public int maxQueuedRequests() {
        return maxQueuedRequests;
    }

    /** Sessions that may await approval at once; further handshakes are rejected. */
    public int maxPendingConnections() {
        return maxPendingConnections;
    }

    /** Time a new connection has to send its connection request. */
    public Duration handshakeTimeout() {
        return handshakeTimeout;
    }

    /** Time the approver has to decide on a session. */
    public Duration approvalTimeout() {
        return approvalTimeout;
    }

    public Builder toBuilder() {
        return new Builder()
                .address(address)
                .rpcPort(rpcPort)
                .streamPort(streamPort)
                .maxCallsPerTick(maxCallsPerTick)
                .maxTimePerTick(maxTimePerTick)
                .adaptiveRateControl(adaptiveRateControl)
                .targetTickPeriod(targetTickPeriod)
                .minTimePerTick(minTimePerTick)
                .blockingReceive(blockingReceive)
                .receiveTimeout(receiveTimeout)
                .receiveBufferCapacity(receiveBufferCapacity)
                .maxFrameLength(maxFrameLength)
                .sendQueueCapacity(sendQueueCapacity)
                .maxQueuedRequests(maxQueuedRequests)
                .maxPendingConnections(maxPendingConnections)
                .handshakeTimeout(handshakeTimeout)
                .approvalTimeout(approvalTimeout);
    }

    @Override
    public String toString() {
        return "ServerConfig{address=" + address + ", rpcPort=" + rpcPort + ", streamPort=" + streamPort
                + ", maxCallsPerTick=" + maxCallsPerTick + ", maxTimePerTick=" + maxTimePerTick
                + ", adaptiveRateControl=" + adaptiveRateControl + ", blockingReceive=" + blockingReceive + "}";
    }

    /**
     * Builder for {@link ServerConfig}.
     */
    public static final class Builder {
        private String address;
        private Integer rpcPort;
        private Integer streamPort;
        private int maxCallsPerTick = UNLIMITED_CALLS;
        private Duration maxTimePerTick;
        private boolean adaptiveRateControl = true;
        private Duration targetTickPeriod;
        private Duration minTimePerTick;
        private boolean blockingReceive;
        private Duration receiveTimeout;
        private int receiveBufferCapacity;
        private int maxFrameLength;
        private int sendQueueCapacity;
        private int maxQueuedRequests;
        private int maxPendingConnections;
        private Duration handshakeTimeout;
        private Duration approvalTimeout;

        private Builder() {}

        /** Sets the listen address. Default: 127.0.0.1. */
        public Builder address(String address) {
            this.address = Objects.requireNonNull(address, "address");
            return this;
        }

        /** Sets the RPC port. Default: 50000. */
        public Builder rpcPort(int rpcPort) {
            this.rpcPort = rpcPort;
            return this;
        }

        /** Sets the stream port. Default: 50001. */
        public Builder streamPort(int streamPort) {
            this.streamPort = streamPort;
            return this;
        }

        /** Sets the request limit per tick. Default: unlimited. */
        public Builder maxCallsPerTick(int maxCallsPerTick) {
            this.maxCallsPerTick = maxCallsPerTick;
            return this;
        }

        /** Sets the RPC time budget per tick. Default: 10 ms. */
        public Builder maxTimePerTick(Duration maxTimePerTick) {
            this.maxTimePerTick = maxTimePerTick;
            return this;
        }

        /** Enables budget adjustment from the observed host tick period. Default: on. */
        public Builder adaptiveRateControl(boolean adaptiveRateControl) {
            this.adaptiveRateControl = adaptiveRateControl;
            return this;
        }

        /** Sets the host tick period to protect. Default: 20 ms. */
        public Builder targetTickPeriod(Duration targetTickPeriod) {
            this.targetTickPeriod = targetTickPeriod;
            return this;
        }

        /** Sets the adaptive budget floor. Default: 1 ms. */
        public Builder minTimePerTick(Duration minTimePerTick) {
            this.minTimePerTick = minTimePerTick;
            return this;
        }

        /** Waits for a request when none is pending at the start of a tick. Default: off. */
        public Builder blockingReceive(boolean blockingReceive) {
            this.blockingReceive = blockingReceive;
            return this;
        }

        /** Sets the blocking receive wait. Default: 1 ms. */
        public Builder receiveTimeout(Duration receiveTimeout) {
            this.receiveTimeout = receiveTimeout;
            return this;
        }

        /** Sets the per-connection receive buffer capacity. Default: 1 MiB. */
        public Builder receiveBufferCapacity(int receiveBufferCapacity) {
            this.receiveBufferCapacity = receiveBufferCapacity;
            return this;
        }

        /** Sets the largest accepted frame payload. Default: the receive buffer capacity. */
        public Builder maxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        /** Sets the per-connection limit on unsent bytes. Default: 8 MiB. */
        public Builder sendQueueCapacity(int sendQueueCapacity) {
            this.sendQueueCapacity = sendQueueCapacity;
            return this;
        }

        /** Sets the per-connection limit on queued requests. Default: 64. */
        public Builder maxQueuedRequests(int maxQueuedRequests) {
            this.maxQueuedRequests = maxQueuedRequests;
            return this;
        }

        /** Sets the approval queue bound. Default: 16. */
        public Builder maxPendingConnections(int maxPendingConnections) {
            this.maxPendingConnections = maxPendingConnections;
            return this;
        }

        /** Sets the handshake timeout. Default: 10 seconds. */
        public Builder handshakeTimeout(Duration handshakeTimeout) {
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        /** Sets the approval timeout. Default: 30 seconds. */
        public Builder approvalTimeout(Duration approvalTimeout) {
            this.approvalTimeout = approvalTimeout;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
