package org.learningjava.mediadb.application.usecase;

import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.application.port.ProjectStorePort;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class ProjectCatalogUseCase {

    private static final Logger log = LoggerFactory.getLogger(ProjectCatalogUseCase.class);

    private final ProjectStorePort projects;
    private final AssetStorePort assets;
    private final Clock clock;

    public ProjectCatalogUseCase(ProjectStorePort projects, AssetStorePort assets, Clock clock) {
        this.projects = projects;
        this.assets = assets;
        this.clock = clock;
    }

    public UUID createProject(String name, String theme, List<UUID> assetIds) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("project name is required");
        List<UUID> ids = assetIds == null ? List.of() : List.copyOf(assetIds);
        for (UUID id : ids) {
            if (assets.findById(id).isEmpty()) throw MediaNotFoundException.asset(id);
        }
        Project p = new Project(UUID.randomUUID(), name.trim(), theme, ids,
                clock.instant().truncatedTo(ChronoUnit.MICROS), null, 0, 0, 0);
        projects.save(p);
        log.info("Created project '{}' with {} assets as {}", p.projectName(), ids.size(), p.id());
        return p.id();
    }

    public Optional<Project> getProject(UUID id) {
        return projects.findById(id);
    }

    public List<Project> listProjects() {
        return projects.list();
    }
}
