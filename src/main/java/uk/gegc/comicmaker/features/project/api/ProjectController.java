package uk.gegc.comicmaker.features.project.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.comicmaker.features.project.api.dto.CreateProjectRequest;
import uk.gegc.comicmaker.features.project.api.dto.ProjectDto;
import uk.gegc.comicmaker.features.project.api.dto.UpdateProjectRequest;
import uk.gegc.comicmaker.features.project.application.ProjectService;
import uk.gegc.comicmaker.features.user.application.CurrentUserResolver;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/projects")
@RequiredArgsConstructor
@Tag(name = "Projects", description = "Comic project management")
@SecurityRequirement(name = "bearerAuth")
public class ProjectController {

    private final ProjectService projectService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Create a project", description = "Captures the caller's current plan as the project's plan snapshot.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Project created"),
            @ApiResponse(responseCode = "400", description = "Validation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<ProjectDto> createProject(@Valid @RequestBody CreateProjectRequest request,
                                                    Authentication authentication) {
        ProjectDto created = projectService.createProject(currentUserResolver.resolve(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "List my projects")
    @GetMapping
    public Page<ProjectDto> listProjects(
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable,
            Authentication authentication) {
        return projectService.listProjects(currentUserResolver.resolve(authentication), pageable);
    }

    @Operation(summary = "Get a project")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project found"),
            @ApiResponse(responseCode = "403", description = "Project belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Project not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{projectId}")
    public ProjectDto getProject(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                 Authentication authentication) {
        return projectService.getProject(currentUserResolver.resolve(authentication), projectId);
    }

    @Operation(summary = "Update a DRAFT project")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project updated"),
            @ApiResponse(responseCode = "400", description = "Project is not DRAFT or validation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/{projectId}")
    public ProjectDto updateProject(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                    @Valid @RequestBody UpdateProjectRequest request,
                                    Authentication authentication) {
        return projectService.updateProject(currentUserResolver.resolve(authentication), projectId, request);
    }

    @Operation(summary = "Delete a project", description = "Soft delete; the project disappears from every read path.")
    @DeleteMapping("/{projectId}")
    public ResponseEntity<Void> deleteProject(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                              Authentication authentication) {
        projectService.deleteProject(currentUserResolver.resolve(authentication), projectId);
        return ResponseEntity.noContent().build();
    }
}
