package com.healer.remediator.escalation;

import com.healer.remediator.client.PullRequestClient;
import com.healer.remediator.config.HealerProperties;
import org.springframework.stereotype.Component;

/**
 * Comments the report inline on the pull request the failure belongs to.
 * Skips when there is no PR.
 */
@Component
public class PullRequestCommentChannel implements EscalationChannel {

    private final PullRequestClient        github;
    private final HealerProperties.Channel config;

    public PullRequestCommentChannel(PullRequestClient github, HealerProperties props) {
        this.github = github;
        this.config = props.getEscalation().getPrComment();
    }

    @Override
    public String name() {
        return "pr-comment";
    }

    @Override
    public boolean enabled() {
        return config.isEnabled();
    }

    @Override
    public ChannelResult send(EscalationNotification n) {
        String repo = n.detail(EscalationNotification.REPOSITORY);
        String pr   = n.detail(EscalationNotification.PR_NUMBER);
        if (repo == null || repo.isBlank() || pr == null) {
            return ChannelResult.skipped(name(), "no pull request");
        }
        github.comment(repo, Integer.parseInt(pr), n.message());
        return ChannelResult.sent(name());
    }
}
