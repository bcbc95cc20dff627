package com.healer.remediator.escalation;

/**
 * Outcome of one channel delivery.
 */
public record ChannelResult(String channel, Status status, String error) {

    public enum Status { SENT, FAILED, SKIPPED }

    public static ChannelResult sent(String channel)                 { return new ChannelResult(channel, Status.SENT, null); }
    public static ChannelResult skipped(String channel, String why)  { return new ChannelResult(channel, Status.SKIPPED, why); }
    public static ChannelResult failed(String channel, String error) { return new ChannelResult(channel, Status.FAILED, error); }

    public boolean isSent() {
        return status == Status.SENT;
    }
}
