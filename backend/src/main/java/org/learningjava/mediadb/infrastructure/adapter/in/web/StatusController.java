package org.learningjava.mediadb.infrastructure.adapter.in.web;

import org.learningjava.mediadb.application.usecase.BackupUseCase;
import org.learningjava.mediadb.application.usecase.CollectionStatsUseCase;
import org.learningjava.mediadb.domain.model.BackupReport;
import org.learningjava.mediadb.infrastructure.adapter.in.web.dto.StatsView;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StatusController {

    static final String SERVICE = "mediadb";
    static final String VERSION = "0.1.0";

    private final CollectionStatsUseCase stats;
    private final BackupUseCase backup;
    private final Clock clock;

    public StatusController(CollectionStatsUseCase stats, BackupUseCase backup, Clock clock) {
        this.stats = stats;
        this.backup = backup;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "healthy");
        out.put("service", SERVICE);
        out.put("version", VERSION);
        out.put("timestamp", clock.instant().toString());
        return out;
    }

    @GetMapping("/stats")
    public StatsView stats() {
        return StatsView.from(stats.stats());
    }

    @PostMapping("/backup")
    public Map<String, Object> backup(@RequestBody(required = false) BackupRequest req) {
        Path dest = req != null && req.destination() != null && !req.destination().isBlank()
                ? Path.of(req.destination())
                : null;
        BackupReport r = backup.backupTo(dest);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "ok");
        out.put("destination", r.destination().toString());
        out.put("files", r.files());
        out.put("bytes", r.bytes());
        return out;
    }

    public record BackupRequest(String destination) {
    }
}
