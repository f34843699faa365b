package uk.gegc.comicmaker.features.generation.application.worker;

import uk.gegc.comicmaker.features.generation.domain.model.TaskType;

import java.util.UUID;

/**
 * Handler for one job kind. Terminal failures are recorded on the Generation and swallowed;
 * anything thrown out of {@link #execute(UUID)} is retried by the job runner.
 */
public interface GenerationWorker {

    TaskType taskType();

    void execute(UUID generationId);
}
