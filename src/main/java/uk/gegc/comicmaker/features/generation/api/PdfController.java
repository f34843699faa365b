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
import uk.gegc.comicmaker.features.generation.api.dto.PdfRequest;
import uk.gegc.comicmaker.features.generation.api.dto.PdfStatusResponse;
import uk.gegc.comicmaker.features.generation.application.GenerationService;
import uk.gegc.comicmaker.features.user.application.CurrentUserResolver;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/projects/{projectId}/pdf")
@RequiredArgsConstructor
@Tag(name = "PDF", description = "PDF compilation of completed comics")
@SecurityRequirement(name = "bearerAuth")
public class PdfController {

    private final GenerationService generationService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Compile the comic into a PDF")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Compilation queued"),
            @ApiResponse(responseCode = "400", description = "Project is not COMPLETED",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Plan does not allow PDF export or page limit exceeded",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "PDF already exists or a job is running",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Some pages have not been rendered",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public GenerationStartResponse requestPdf(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                              @RequestBody(required = false) PdfRequest request,
                                              Authentication authentication) {
        boolean force = request != null && request.force();
        return generationService.requestPdf(currentUserResolver.resolve(authentication), projectId, force);
    }

    @Operation(summary = "Status of the latest PDF job")
    @GetMapping("/status")
    public PdfStatusResponse getStatus(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                       Authentication authentication) {
        return generationService.getPdfStatus(currentUserResolver.resolve(authentication), projectId);
    }
}
