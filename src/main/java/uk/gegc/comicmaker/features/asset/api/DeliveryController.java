package uk.gegc.comicmaker.features.asset.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.comicmaker.features.asset.api.dto.PageAssetDto;
import uk.gegc.comicmaker.features.asset.api.dto.PdfAssetDto;
import uk.gegc.comicmaker.features.asset.application.DeliveryService;
import uk.gegc.comicmaker.features.user.application.CurrentUserResolver;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/projects/{projectId}")
@RequiredArgsConstructor
@Tag(name = "Delivery", description = "Signed download links for compiled comics")
@SecurityRequirement(name = "bearerAuth")
public class DeliveryController {

    private final DeliveryService deliveryService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Get the PDF download link", description = "Re-signs the link when it has expired")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Download link returned"),
            @ApiResponse(responseCode = "403", description = "Not the project owner",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Project not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "No PDF compiled yet",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/download")
    public PdfAssetDto download(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                Authentication authentication) {
        return deliveryService.getDownloadUrl(currentUserResolver.resolve(authentication), projectId);
    }

    @Operation(summary = "List rendered pages with signed links")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pages returned"),
            @ApiResponse(responseCode = "403", description = "Not the project owner",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "No pages generated yet",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/pages")
    public List<PageAssetDto> listPages(@Parameter(description = "Project ID") @PathVariable UUID projectId,
                                        Authentication authentication) {
        return deliveryService.listPages(currentUserResolver.resolve(authentication), projectId);
    }
}
