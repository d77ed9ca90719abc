package io.krpc.config.jackson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON shape of the server settings. Absent keys stay null and keep the defaults; durations are
 * whole milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class ServerConfigDocument {

    public String address;
    public Integer rpcPort;
    public Integer streamPort;
    public Integer maxCallsPerTick;
    public Long maxTimePerTickMs;
    public Boolean adaptiveRateControl;
    public Long targetTickPeriodMs;
    public Long minTimePerTickMs;
    public Boolean blockingReceive;
    public Long receiveTimeoutMs;
    public Integer receiveBufferCapacity;
    public Integer maxFrameLength;
    public Integer sendQueueCapacity;
    public Integer maxQueuedRequests;
    public Integer maxPendingConnections;
    public Long handshakeTimeoutMs;
    public Long approvalTimeoutMs;
}
