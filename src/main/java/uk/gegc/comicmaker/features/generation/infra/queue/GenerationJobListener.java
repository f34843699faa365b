package uk.gegc.comicmaker.features.generation.infra.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.comicmaker.features.generation.application.GenerationJobRunner;
import uk.gegc.comicmaker.features.generation.domain.event.GenerationJobSubmittedEvent;

@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationJobListener {

    private final GenerationJobRunner jobRunner;

    @Async("generationTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onJobSubmitted(GenerationJobSubmittedEvent event) {
        log.debug("Received job {} ({})", event.getJob().jobId(), event.getJob().taskType());
        jobRunner.run(event.getJob());
    }
}
