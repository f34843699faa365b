package uk.gegc.comicmaker.features.generation.application;

import uk.gegc.comicmaker.features.generation.api.dto.GenerationStartResponse;
import uk.gegc.comicmaker.features.generation.api.dto.PdfStatusResponse;
import uk.gegc.comicmaker.features.generation.api.dto.TaskStatusResponse;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.util.UUID;

public interface GenerationService {

    /**
     * Queues image generation for a DRAFT project and moves it to GENERATING.
     */
    GenerationStartResponse startGeneration(User user, UUID projectId);

    TaskStatusResponse getGenerationStatus(User user, UUID projectId, String taskId);

    GenerationStartResponse requestPdf(User user, UUID projectId, boolean forceRegenerate);

    PdfStatusResponse getPdfStatus(User user, UUID projectId);
}
