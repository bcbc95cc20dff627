package com.healer.remediator.client;

import java.util.Map;

/**
 * Resource lifecycle API for corrective jobs.
 */
public interface JobClient {

    /** Create the job; returns its reference (the job name). */
    String submit(JobSpec spec);

    JobPhase getStatus(String jobRef);

    void delete(String jobRef);

    /** Delete every job whose labels match all given pairs; returns the count deleted. */
    int deleteMatching(Map<String, String> labelSelector);
}
