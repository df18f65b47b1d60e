package org.example.simplifier.service;

import org.example.simplifier.model.RewriteJobStatus;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryJobStatusStore implements JobStatusStore {

    private final ConcurrentHashMap<String, RewriteJobStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public Optional<RewriteJobStatus> get(String jobId) {
        return Optional.ofNullable(statuses.get(jobId));
    }

    @Override
    public void set(RewriteJobStatus status) {
        statuses.put(status.jobId(), status);
    }
}
