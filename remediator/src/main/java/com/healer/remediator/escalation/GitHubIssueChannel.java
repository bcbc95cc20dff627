package com.healer.remediator.escalation;

import com.healer.remediator.client.PullRequestClient;
import com.healer.remediator.config.HealerProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens a tracking issue. Uses the repository from the notification, or
 * the configured fallback repository.
 */
@Component
public class GitHubIssueChannel implements EscalationChannel {

    static final List<String> LABELS = List.of("healer", "escalation", "needs-attention");

    private final PullRequestClient        github;
    private final HealerProperties.Channel config;
    private final String                   fallbackRepository;

    public GitHubIssueChannel(PullRequestClient github, HealerProperties props) {
        this.github             = github;
        this.config             = props.getEscalation().getGithubIssue();
        this.fallbackRepository = props.getEscalation().getRepository();
    }

    @Override
    public String name() {
        return "github-issue";
    }

    @Override
    public boolean enabled() {
        return config.isEnabled();
    }

    @Override
    public ChannelResult send(EscalationNotification n) {
        String repo = n.detail(EscalationNotification.REPOSITORY);
        if (repo == null || repo.isBlank()) {
            repo = fallbackRepository;
        }
        if (repo == null || repo.isBlank()) {
            return ChannelResult.skipped(name(), "no repository to file the issue in");
        }
        List<String> labels = new ArrayList<>(LABELS);
        String type = n.detail(EscalationNotification.TYPE);
        if (type != null) {
            labels.add(type);
        }
        github.createIssue(repo, n.title(), n.message(), labels);
        return ChannelResult.sent(name());
    }
}
