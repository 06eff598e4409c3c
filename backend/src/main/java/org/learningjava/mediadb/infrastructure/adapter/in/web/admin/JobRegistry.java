package org.learningjava.mediadb.infrastructure.adapter.in.web.admin;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory status of background import jobs. Lost on restart.
 * Finished jobs are forgotten once the retention window has passed; running jobs are kept.
 */
@Component
public class JobRegistry {

    public enum JobState { RUNNING, DONE, FAILED }

    public record JobStatus(
            String id,
            String type,
            JobState state,
            String message,
            int processed,
            int total
    ) {}

    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();
    private final Map<String, Instant> finishedAt = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    public JobRegistry() {
        this(Clock.systemUTC(), Duration.ofHours(1));
    }

    @Autowired
    public JobRegistry(@Value("${mediadb.jobs.retention-minutes:60}") long retentionMinutes) {
        this(Clock.systemUTC(), Duration.ofMinutes(retentionMinutes));
    }

    JobRegistry(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    public String start(String type) {
        evictExpired();
        String id = UUID.randomUUID().toString();
        jobs.put(id, new JobStatus(id, type, JobState.RUNNING, "Started", 0, 0));
        return id;
    }

    public void progress(String id, int processed, int total) {
        jobs.computeIfPresent(id, (k, cur) -> new JobStatus(id, cur.type(), JobState.RUNNING,
                "Processed " + processed + " of " + total, processed, total));
    }

    public void done(String id, String message) {
        JobStatus s = jobs.computeIfPresent(id, (k, cur) -> new JobStatus(id, cur.type(), JobState.DONE,
                message != null ? message : "Done", cur.total(), cur.total()));
        if (s != null) finishedAt.put(id, clock.instant());
    }

    public void fail(String id, String message) {
        JobStatus s = jobs.computeIfPresent(id, (k, cur) -> new JobStatus(id, cur.type(), JobState.FAILED,
                message != null ? message : "Failed", cur.processed(), cur.total()));
        if (s != null) finishedAt.put(id, clock.instant());
    }

    public JobStatus get(String id) {
        evictExpired();
        return jobs.get(id);
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        finishedAt.entrySet().removeIf(e -> {
            if (e.getValue().isBefore(cutoff)) {
                jobs.remove(e.getKey());
                return true;
            }
            return false;
        });
    }
}
