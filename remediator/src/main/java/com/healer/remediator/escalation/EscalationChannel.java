package com.healer.remediator.escalation;

/**
 * A destination for escalations: chat webhook, ticketing API, PR comment.
 *
 * send() may throw; the dispatcher isolates channels from each other.
 */
public interface EscalationChannel {

    String name();

    boolean enabled();

    ChannelResult send(EscalationNotification notification);
}
