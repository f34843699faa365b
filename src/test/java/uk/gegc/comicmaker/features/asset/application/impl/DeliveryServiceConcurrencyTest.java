package uk.gegc.comicmaker.features.asset.application.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.comicmaker.features.asset.api.dto.PdfAssetDto;
import uk.gegc.comicmaker.features.asset.application.DeliveryService;
import uk.gegc.comicmaker.features.asset.domain.model.PdfAsset;
import uk.gegc.comicmaker.features.asset.domain.repository.PdfAssetRepository;
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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs without a surrounding test transaction so every download commits on its own.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@DisplayName("Download counter concurrency Integration Tests")
class DeliveryServiceConcurrencyTest {

    private static final int THREADS = 8;

    @Autowired
    private DeliveryService deliveryService;
    @Autowired
    private PdfAssetRepository pdfAssetRepository;
    @Autowired
    private ProjectRepository projectRepository;
    @Autowired
    private UserRepository userRepository;

    private User owner;
    private Project project;
    private PdfAsset pdf;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        owner = new User();
        owner.setUsername("reader_" + UUID.randomUUID().toString().substring(0, 8));
        owner.setEmail(owner.getUsername() + "@example.com");
        owner.setHashedPassword("{noop}password");
        owner.setPlan(PlanTier.PRO);
        owner = userRepository.saveAndFlush(owner);

        project = new Project();
        project.setUserId(owner.getId());
        project.setTitle("Downloads");
        project.setPlanSnapshot(PlanTier.PRO);
        project.setStatus(ProjectStatus.COMPLETED);
        project.setTotalPages(1);
        project = projectRepository.saveAndFlush(project);

        pdf = new PdfAsset();
        pdf.setProjectId(project.getId());
        pdf.setBlobPath("pdfs/" + project.getId() + "/comic.pdf");
        pdf.setBlobUrl("https://blobs.example.com/comic.pdf");
        pdf.setUrlExpiresAt(LocalDateTime.now().plusDays(1));
        pdf.setDpi(150);
        pdf.setFileSizeBytes(1024);
        pdf.setPageCount(1);
        pdf = pdfAssetRepository.saveAndFlush(pdf);

        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        pdfAssetRepository.deleteAll();
        projectRepository.deleteAll();
        userRepository.deleteAll();
    }

    @Test
    @DisplayName("concurrent downloads: every download is counted")
    void getDownloadUrl_concurrent_noLostIncrements() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PdfAssetDto>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return deliveryService.getDownloadUrl(owner, project.getId());
            }));
        }
        start.countDown();

        List<Long> reported = new ArrayList<>();
        for (Future<PdfAssetDto> future : futures) {
            reported.add(future.get(10, TimeUnit.SECONDS).downloadCount());
        }

        assertThat(pdfAssetRepository.findById(pdf.getId()).orElseThrow().getDownloadCount()).isEqualTo(THREADS);
        assertThat(reported).allMatch(count -> count >= 1 && count <= THREADS);
    }

    @Test
    @DisplayName("sequential downloads: each response reports the stored count")
    void getDownloadUrl_sequential_reportsStoredCount() {
        PdfAssetDto first = deliveryService.getDownloadUrl(owner, project.getId());
        PdfAssetDto second = deliveryService.getDownloadUrl(owner, project.getId());

        assertThat(first.downloadCount()).isEqualTo(1);
        assertThat(second.downloadCount()).isEqualTo(2);
        assertThat(pdfAssetRepository.findById(pdf.getId()).orElseThrow().getDownloadCount()).isEqualTo(2);
    }
}
