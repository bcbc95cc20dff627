package com.healer.remediator.client;

import com.healer.remediator.model.Severity;

/**
 * One piece of reviewer feedback on a pull request.
 */
public record FeedbackItem(
        String   id,
        String   author,
        Severity severity,
        boolean  resolved,
        String   description
) {}
