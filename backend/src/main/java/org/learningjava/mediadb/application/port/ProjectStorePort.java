package org.learningjava.mediadb.application.port;

import org.learningjava.mediadb.domain.model.Project;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProjectStorePort {
    void ensureSchema();

    void save(Project project);

    Optional<Project> findById(UUID id);

    List<Project> list();
}
