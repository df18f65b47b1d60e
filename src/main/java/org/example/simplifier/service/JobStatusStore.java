package org.example.simplifier.service;

import org.example.simplifier.model.RewriteJobStatus;

import java.util.Optional;

/**
 * Holds the latest status snapshot of every job. {@link #set} always replaces the whole record;
 * the last writer wins.
 */
public interface JobStatusStore {

    Optional<RewriteJobStatus> get(String jobId);

    void set(RewriteJobStatus status);
}
