package uk.gegc.comicmaker.features.story.api;

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
import uk.gegc.comicmaker.features.story.api.dto.StoryParseRequest;
import uk.gegc.comicmaker.features.story.api.dto.StoryParseResponse;
import uk.gegc.comicmaker.features.story.application.StoryService;
import uk.gegc.comicmaker.features.user.application.CurrentUserResolver;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/projects/{projectId}/story")
@RequiredArgsConstructor
@Tag(name = "Story Engine", description = "LLM story scripting")
@SecurityRequirement(name = "bearerAuth")
public class StoryController {

    private final StoryService storyService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Generate panels from a story description")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scenes generated and saved"),
            @ApiResponse(responseCode = "400", description = "Project not DRAFT or content blocked",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "LLM output never matched the script schema",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "LLM provider error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/parse")
    public StoryParseResponse parseStory(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                         @Valid @RequestBody StoryParseRequest request,
                                         Authentication authentication) {
        return storyService.parseStory(currentUserResolver.resolve(authentication), projectId, request.inputText());
    }
}
