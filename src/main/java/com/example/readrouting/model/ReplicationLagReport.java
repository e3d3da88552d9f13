package com.example.readrouting.model;

/**
 * One standby as seen from the primary's {@code pg_stat_replication}.
 * Lag values are null when the standby has not reported yet.
 */
public final class ReplicationLagReport {

    private final String applicationName;
    private final String state;
    private final Long replayLagBytes;
    private final Double replayLagSeconds;

    public ReplicationLagReport(String applicationName, String state, Long replayLagBytes, Double replayLagSeconds) {
        this.applicationName = applicationName;
        this.state = state;
        this.replayLagBytes = replayLagBytes;
        this.replayLagSeconds = replayLagSeconds;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public String getState() {
        return state;
    }

    public Long getReplayLagBytes() {
        return replayLagBytes;
    }

    public Double getReplayLagSeconds() {
        return replayLagSeconds;
    }

    @Override
    public String toString() {
        return applicationName + ": " + replayLagBytes + " bytes (" + replayLagSeconds + "s)";
    }
}
