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
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.comicmaker.features.project.api.dto.SceneBatchResponse;
import uk.gegc.comicmaker.features.project.api.dto.SceneDto;
import uk.gegc.comicmaker.features.project.api.dto.UpsertScenesRequest;
import uk.gegc.comicmaker.features.project.application.SceneService;
import uk.gegc.comicmaker.features.user.application.CurrentUserResolver;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/projects/{projectId}/scenes")
@RequiredArgsConstructor
@Tag(name = "Scenes", description = "Panels of a comic project")
@SecurityRequirement(name = "bearerAuth")
public class SceneController {

    private final SceneService sceneService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Create or replace panels")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scenes saved"),
            @ApiResponse(responseCode = "400", description = "Project not DRAFT or panel outside 1..4",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Page count exceeds the plan snapshot limit",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public SceneBatchResponse upsertScenes(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                           @Valid @RequestBody UpsertScenesRequest request,
                                           Authentication authentication) {
        return sceneService.upsertScenes(currentUserResolver.resolve(authentication), projectId, request.scenes());
    }

    @Operation(summary = "List panels ordered by page then panel")
    @GetMapping
    public List<SceneDto> listScenes(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                     Authentication authentication) {
        return sceneService.listScenes(currentUserResolver.resolve(authentication), projectId);
    }
}
