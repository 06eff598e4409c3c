package org.learningjava.mediadb.infrastructure.adapter.in.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.mediadb.application.usecase.ProjectCatalogUseCase;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.model.Project;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/projects")
public class ProjectController {

    private final ProjectCatalogUseCase projects;

    public ProjectController(ProjectCatalogUseCase projects) {
        this.projects = projects;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectDTO create(@Valid @RequestBody CreateProjectRequest req) {
        UUID id = projects.createProject(req.projectName(), req.theme(), req.assetIds());
        return projects.getProject(id).map(ProjectDTO::from).orElseThrow(() -> MediaNotFoundException.project(id));
    }

    @GetMapping
    public List<ProjectDTO> list() {
        return projects.listProjects().stream().map(ProjectDTO::from).toList();
    }

    @GetMapping("/{id}")
    public ProjectDTO get(@PathVariable("id") UUID id) {
        return projects.getProject(id).map(ProjectDTO::from).orElseThrow(() -> MediaNotFoundException.project(id));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CreateProjectRequest(@NotBlank String projectName, String theme, List<UUID> assetIds) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ProjectDTO(
            UUID id,
            String projectName,
            String theme,
            List<UUID> assetIds,
            Instant createdAt,
            Instant publishedAt,
            int engagementLikes,
            int engagementComments,
            int engagementShares
    ) {
        static ProjectDTO from(Project p) {
            return new ProjectDTO(p.id(), p.projectName(), p.theme(), p.assetIds(), p.createdAt(),
                    p.publishedAt(), p.engagementLikes(), p.engagementComments(), p.engagementShares());
        }
    }
}
