package com.healer.remediator.client;

import java.util.List;

/**
 * Review / merge / check status and write access for pull requests and issues.
 */
public interface PullRequestClient {

    PullRequestState getPullRequest(String repository, int number);

    List<FeedbackItem> listFeedback(String repository, int number);

    /** True when someone with write access left an explicit success marker on the PR. */
    boolean hasManualSuccessSignal(String repository, int number);

    void comment(String repository, int number, String body);

    /** Open an issue and return its number. */
    int createIssue(String repository, String title, String body, List<String> labels);
}
