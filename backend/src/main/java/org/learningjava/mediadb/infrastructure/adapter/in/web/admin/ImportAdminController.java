package org.learningjava.mediadb.infrastructure.adapter.in.web.admin;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.mediadb.application.usecase.IngestMediaUseCase;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.model.DirectoryImportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

@RestController
@RequestMapping("/admin")
public class ImportAdminController {

    private static final Logger log = LoggerFactory.getLogger(ImportAdminController.class);

    private final IngestMediaUseCase ingest;
    private final JobRegistry jobs;
    private final Executor executor;

    public ImportAdminController(IngestMediaUseCase ingest,
                                 JobRegistry jobs,
                                 @Qualifier("applicationTaskExecutor") Executor executor) {
        this.ingest = ingest;
        this.jobs = jobs;
        this.executor = executor;
    }

    // --- Import a server-side directory in the background
    @PostMapping("/import")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> importDirectory(@Valid @RequestBody ImportRequest req) {
        Path dir = Path.of(req.rootDir());
        if (!Files.isDirectory(dir)) throw MediaNotFoundException.file(dir);

        DirectoryImportRequest request = new DirectoryImportRequest(
                dir,
                req.source(),
                !Boolean.FALSE.equals(req.recursive()),
                req.contentType(),
                req.subjects() != null ? Set.copyOf(req.subjects()) : Set.of(),
                req.styleTags() != null ? Set.copyOf(req.styleTags()) : Set.of(),
                Boolean.TRUE.equals(req.skipExisting()),
                Boolean.TRUE.equals(req.inferFromFilenames()));

        String jobId = jobs.start("IMPORT");
        executor.execute(() -> {
            try {
                log.info("[{}] Import start: {}", jobId, dir);
                int count = ingest.importDirectory(request, (processed, total) -> jobs.progress(jobId, processed, total));
                jobs.done(jobId, "Imported " + count + " files");
                log.info("[{}] Import done: {} files", jobId, count);
            } catch (Exception e) {
                jobs.fail(jobId, e.getMessage());
                log.error("[{}] Import failed: {}", jobId, e.toString(), e);
            }
        });
        return Map.of("job_id", jobId);
    }

    @GetMapping("/jobs/{id}")
    public JobRegistry.JobStatus status(@PathVariable("id") String id) {
        JobRegistry.JobStatus s = jobs.get(id);
        if (s == null) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job: " + id);
        return s;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ImportRequest(
            @NotBlank String rootDir,
            String source,
            Boolean recursive,
            String contentType,
            List<String> subjects,
            List<String> styleTags,
            Boolean skipExisting,
            Boolean inferFromFilenames
    ) {
    }
}
