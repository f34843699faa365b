package uk.gegc.comicmaker.features.generation.application;

import uk.gegc.comicmaker.features.generation.domain.model.Generation;
import uk.gegc.comicmaker.features.generation.domain.model.TaskStatusView;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.user.domain.model.User;

public interface GenerationDispatcher {

    /**
     * Creates a QUEUED Generation for the project and hands it to the job queue.
     *
     * @throws uk.gegc.comicmaker.features.generation.domain.exception.TaskAlreadyRunningException if
     *         the project already has a QUEUED or PROCESSING job, including one inserted concurrently
     */
    Generation enqueue(Project project, User user, TaskType taskType);

    /**
     * Side-effect free. Unknown ids yield {@link TaskStatusView#notFound()}.
     */
    TaskStatusView getStatus(String jobId);
}
