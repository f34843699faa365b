package uk.gegc.comicmaker.features.generation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.comicmaker.features.generation.api.dto.GenerationStartResponse;
import uk.gegc.comicmaker.features.generation.api.dto.TaskStatusResponse;
import uk.gegc.comicmaker.features.generation.application.GenerationService;
import uk.gegc.comicmaker.features.user.application.CurrentUserResolver;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/projects/{projectId}/generate")
@RequiredArgsConstructor
@Tag(name = "Generation", description = "Asynchronous comic page generation")
@SecurityRequirement(name = "bearerAuth")
public class GenerationController {

    private final GenerationService generationService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Start image generation", description = "Queues a job that renders every page of the project")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job queued"),
            @ApiResponse(responseCode = "400", description = "Project not DRAFT or has no scenes",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Not the owner, or free story already used",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "A job is already running for this project",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Monthly quota exhausted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public GenerationStartResponse startGeneration(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                                   Authentication authentication) {
        return generationService.startGeneration(currentUserResolver.resolve(authentication), projectId);
    }

    @Operation(summary = "Poll a generation job")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status returned, {\"status\":\"not_found\"} for unknown ids")
    })
    @GetMapping("/status/{taskId}")
    public TaskStatusResponse getStatus(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                        @Parameter(description = "Job id returned when the job was queued") @PathVariable String taskId,
                                        Authentication authentication) {
        return generationService.getGenerationStatus(currentUserResolver.resolve(authentication), projectId, taskId);
    }
}
