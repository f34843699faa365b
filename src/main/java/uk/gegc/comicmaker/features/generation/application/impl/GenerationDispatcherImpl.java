package uk.gegc.comicmaker.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.generation.application.GenerationDispatcher;
import uk.gegc.comicmaker.features.generation.application.GenerationMetrics;
import uk.gegc.comicmaker.features.generation.application.JobQueue;
import uk.gegc.comicmaker.features.generation.domain.exception.TaskAlreadyRunningException;
import uk.gegc.comicmaker.features.generation.domain.model.Generation;
import uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus;
import uk.gegc.comicmaker.features.generation.domain.model.TaskStatusView;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.generation.domain.repository.GenerationRepository;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationDispatcherImpl implements GenerationDispatcher {

    private final GenerationRepository generationRepository;
    private final JobQueue jobQueue;
    private final GenerationMetrics generationMetrics;
    private final Clock clock;

    @Override
    @Transactional
    public Generation enqueue(Project project, User user, TaskType taskType) {
        if (generationRepository.existsByActiveProjectId(project.getId())) {
            generationMetrics.incrementRejected(taskType);
            throw new TaskAlreadyRunningException(project.getId());
        }

        Generation generation = new Generation();
        generation.setProjectId(project.getId());
        generation.setUserId(user.getId());
        generation.setTaskType(taskType);
        generation.setStatus(GenerationStatus.QUEUED);
        generation.setProgress(0);
        generation.setActiveProjectId(project.getId());
        generation.setCreatedAt(LocalDateTime.now(clock));

        try {
            // The unique index on active_project_id rejects a concurrent second insert
            generation = generationRepository.saveAndFlush(generation);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent {} enqueue rejected for project {}", taskType, project.getId());
            generationMetrics.incrementRejected(taskType);
            throw new TaskAlreadyRunningException(project.getId());
        }

        String jobId = jobQueue.submit(generation.getId(), project.getId(), taskType);
        generation.setJobId(jobId);
        generation = generationRepository.save(generation);

        generationMetrics.incrementQueued(taskType);
        log.info("Enqueued {} job {} (generation {}) for project {}", taskType, jobId, generation.getId(), project.getId());
        return generation;
    }

    @Override
    @Transactional(readOnly = true)
    public TaskStatusView getStatus(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return TaskStatusView.notFound();
        }
        return generationRepository.findByJobId(jobId)
                .map(TaskStatusView::of)
                .orElseGet(TaskStatusView::notFound);
    }
}
