package uk.gegc.comicmaker.features.generation.application.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.comicmaker.features.generation.application.GenerationDispatcher;
import uk.gegc.comicmaker.features.generation.application.JobQueue;
import uk.gegc.comicmaker.features.generation.domain.exception.TaskAlreadyRunningException;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.generation.domain.repository.GenerationRepository;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;
import uk.gegc.comicmaker.features.project.domain.repository.ProjectRepository;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.features.user.domain.repository.UserRepository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Runs without a surrounding test transaction so every thread commits on its own.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@DisplayName("Generation concurrency Integration Tests")
class GenerationDispatcherConcurrencyTest {

    private static final int THREADS = 8;

    @Autowired
    private GenerationDispatcher dispatcher;
    @Autowired
    private GenerationRepository generationRepository;
    @Autowired
    private ProjectRepository projectRepository;
    @Autowired
    private UserRepository userRepository;
    @Autowired
    private TransactionTemplate transactionTemplate;

    @MockitoBean
    private JobQueue jobQueue;

    private User user;
    private Project project;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        when(jobQueue.submit(any(), any(), any())).thenAnswer(inv -> UUID.randomUUID().toString());

        user = new User();
        user.setUsername("racer_" + UUID.randomUUID().toString().substring(0, 8));
        user.setEmail(user.getUsername() + "@example.com");
        user.setHashedPassword("{noop}password");
        user.setPlan(PlanTier.FREE);
        user = userRepository.saveAndFlush(user);

        project = new Project();
        project.setUserId(user.getId());
        project.setTitle("Race");
        project.setPlanSnapshot(PlanTier.FREE);
        project.setStatus(ProjectStatus.GENERATING);
        project.setTotalPages(1);
        project = projectRepository.saveAndFlush(project);

        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        generationRepository.deleteAll();
        projectRepository.deleteAll();
        userRepository.deleteAll();
    }

    @Test
    @DisplayName("concurrent enqueues for one project: exactly one job is accepted")
    void enqueue_concurrent_onlyOneAccepted() throws Exception {
        List<Throwable> failures = runConcurrently(() -> {
            dispatcher.enqueue(project, user, TaskType.IMAGE_GENERATION);
            return true;
        });

        assertThat(failures).hasSize(THREADS - 1);
        assertThat(failures).allMatch(TaskAlreadyRunningException.class::isInstance);
        assertThat(generationRepository.existsByActiveProjectId(project.getId())).isTrue();
        assertThat(generationRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("concurrent free story consumption: exactly one caller flips the flag")
    void markFreeStoryUsed_concurrent_onlyOneWins() throws Exception {
        List<Integer> results = new ArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return transactionTemplate.execute(
                        status -> userRepository.markFreeStoryUsed(user.getId(), LocalDateTime.now()));
            }));
        }
        start.countDown();
        for (Future<Integer> future : futures) {
            results.add(future.get(10, TimeUnit.SECONDS));
        }

        assertThat(results.stream().mapToInt(Integer::intValue).sum()).isEqualTo(1);
        User reloaded = userRepository.findById(user.getId()).orElseThrow();
        assertThat(reloaded.isFreeStoryUsed()).isTrue();
        assertThat(reloaded.isFreeStoryAvailable()).isFalse();
    }

    private List<Throwable> runConcurrently(Callable<Boolean> task) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();

        List<Throwable> failures = new ArrayList<>();
        for (Future<Boolean> future : futures) {
            try {
                future.get(10, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            } catch (TimeoutException e) {
                failures.add(e);
            }
        }
        return failures;
    }
}
