package com.healer.remediator.tracker;

import java.time.Instant;

/** Corrective job currently working on a failed task. */
public record ActiveRemediation(String jobRef, String diagnosis, Instant startedAt) {}
