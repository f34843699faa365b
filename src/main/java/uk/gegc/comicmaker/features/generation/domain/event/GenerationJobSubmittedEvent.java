package uk.gegc.comicmaker.features.generation.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.comicmaker.features.generation.domain.model.GenerationJob;

/**
 * Published when a job has been queued. Handled after the surrounding transaction commits so the
 * worker always sees the Generation row.
 */
public class GenerationJobSubmittedEvent extends ApplicationEvent {

    private final GenerationJob job;

    public GenerationJobSubmittedEvent(Object source, GenerationJob job) {
        super(source);
        this.job = job;
    }

    public GenerationJob getJob() {
        return job;
    }
}
