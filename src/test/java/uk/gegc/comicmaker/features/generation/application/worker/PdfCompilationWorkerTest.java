package uk.gegc.comicmaker.features.generation.application.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import uk.gegc.comicmaker.BaseUnitTest;
import uk.gegc.comicmaker.features.asset.application.BlobPaths;
import uk.gegc.comicmaker.features.asset.application.BlobStorage;
import uk.gegc.comicmaker.features.asset.application.PdfCompiler;
import uk.gegc.comicmaker.features.asset.config.PdfProperties;
import uk.gegc.comicmaker.features.asset.domain.exception.PdfCompilationException;
import uk.gegc.comicmaker.features.asset.domain.model.ComicAsset;
import uk.gegc.comicmaker.features.asset.domain.model.PdfAsset;
import uk.gegc.comicmaker.features.asset.domain.model.SignedUrl;
import uk.gegc.comicmaker.features.asset.domain.repository.ComicAssetRepository;
import uk.gegc.comicmaker.features.asset.domain.repository.PdfAssetRepository;
import uk.gegc.comicmaker.features.generation.application.GenerationMetrics;
import uk.gegc.comicmaker.features.generation.application.GenerationStateService;
import uk.gegc.comicmaker.features.generation.domain.model.Generation;
import uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.generation.domain.repository.GenerationRepository;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;
import uk.gegc.comicmaker.features.project.domain.repository.ProjectRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("PdfCompilationWorker Unit Tests")
class PdfCompilationWorkerTest extends BaseUnitTest {

    private static final byte[] PDF_BYTES = "%PDF-1.7 test".getBytes();
    private static final LocalDateTime EXPIRES = LocalDateTime.of(2026, 2, 2, 8, 0);

    @Mock
    private GenerationRepository generationRepository;
    @Mock
    private ProjectRepository projectRepository;
    @Mock
    private ComicAssetRepository comicAssetRepository;
    @Mock
    private PdfAssetRepository pdfAssetRepository;
    @Mock
    private BlobStorage blobStorage;
    @Mock
    private BlobPaths blobPaths;
    @Mock
    private PdfCompiler pdfCompiler;
    @Mock
    private GenerationStateService stateService;
    @Mock
    private GenerationMetrics metrics;

    private PdfCompilationWorker worker;
    private Generation generation;
    private Project project;

    @BeforeEach
    void setUp() {
        worker = new PdfCompilationWorker(generationRepository, projectRepository, comicAssetRepository,
                pdfAssetRepository, blobStorage, blobPaths, pdfCompiler, new PdfProperties(), stateService, metrics);

        project = new Project();
        project.setId(UUID.randomUUID());
        project.setPlanSnapshot(PlanTier.PRO);
        project.setStatus(ProjectStatus.COMPLETED);
        project.setTotalPages(2);

        generation = new Generation();
        generation.setId(UUID.randomUUID());
        generation.setProjectId(project.getId());
        generation.setTaskType(TaskType.PDF_COMPILATION);
        generation.setStatus(GenerationStatus.QUEUED);

        when(generationRepository.findById(generation.getId())).thenReturn(Optional.of(generation));
        when(projectRepository.findByIdAndDeletedAtIsNull(project.getId())).thenReturn(Optional.of(project));
        when(comicAssetRepository.findByProjectIdOrderByPageNoAsc(project.getId())).thenReturn(List.of(page(1), page(2)));
        when(blobStorage.download(anyString())).thenAnswer(inv -> ((String) inv.getArgument(0)).getBytes());
        when(pdfCompiler.compile(anyList(), anyInt())).thenReturn(PDF_BYTES);
        when(blobPaths.pdfPath(project.getId())).thenReturn("pdfs/" + project.getId() + "/comic.pdf");
        when(blobStorage.sign(anyString())).thenReturn(new SignedUrl("https://blobs.example.com/comic.pdf", EXPIRES));
        when(pdfAssetRepository.findByProjectId(project.getId())).thenReturn(Optional.empty());
    }

    @Nested
    @DisplayName("success")
    class Success {

        @Test
        @DisplayName("pages compiled at the plan dpi; progress 10, 30, 70 then completed")
        void execute_valid_completes() {
            worker.execute(generation.getId());

            InOrder order = inOrder(stateService, pdfCompiler, blobStorage, pdfAssetRepository);
            order.verify(stateService).markProcessing(generation.getId());
            order.verify(stateService).updateProgress(generation.getId(), 10);
            order.verify(stateService).updateProgress(generation.getId(), 30);
            order.verify(pdfCompiler).compile(anyList(), eq(150));
            order.verify(stateService).updateProgress(generation.getId(), 70);
            order.verify(blobStorage).upload("pdfs/" + project.getId() + "/comic.pdf", PDF_BYTES, "application/pdf");
            order.verify(pdfAssetRepository).save(any(PdfAsset.class));
            order.verify(stateService).complete(generation.getId());
            verify(metrics).incrementCompleted(TaskType.PDF_COMPILATION);
            verify(stateService, never()).fail(any(), any());
        }

        @Test
        @DisplayName("PDF asset recorded with size, dpi, page count and signed URL")
        void execute_valid_recordsAsset() {
            worker.execute(generation.getId());

            ArgumentCaptor<PdfAsset> captor = ArgumentCaptor.forClass(PdfAsset.class);
            verify(pdfAssetRepository).save(captor.capture());
            PdfAsset asset = captor.getValue();
            assertThat(asset.getProjectId()).isEqualTo(project.getId());
            assertThat(asset.getGenerationId()).isEqualTo(generation.getId());
            assertThat(asset.getDpi()).isEqualTo(150);
            assertThat(asset.getPageCount()).isEqualTo(2);
            assertThat(asset.getFileSizeBytes()).isEqualTo(PDF_BYTES.length);
            assertThat(asset.getBlobUrl()).isEqualTo("https://blobs.example.com/comic.pdf");
            assertThat(asset.getUrlExpiresAt()).isEqualTo(EXPIRES);
        }

        @Test
        @DisplayName("recompile: existing PDF row replaced, download count kept")
        void execute_existingPdf_updated() {
            PdfAsset existing = new PdfAsset();
            existing.setId(UUID.randomUUID());
            existing.setProjectId(project.getId());
            existing.setDownloadCount(5);
            when(pdfAssetRepository.findByProjectId(project.getId())).thenReturn(Optional.of(existing));

            worker.execute(generation.getId());

            verify(pdfAssetRepository).save(existing);
            assertThat(existing.getDownloadCount()).isEqualTo(5);
            assertThat(existing.getGenerationId()).isEqualTo(generation.getId());
        }
    }

    @Nested
    @DisplayName("failure")
    class Failure {

        @Test
        @DisplayName("project not COMPLETED: job failed without touching storage")
        void execute_projectNotCompleted_fails() {
            project.setStatus(ProjectStatus.GENERATING);

            worker.execute(generation.getId());

            verify(stateService).fail(eq(generation), contains("COMPLETED"));
            verify(metrics).incrementFailed(TaskType.PDF_COMPILATION, "GenerationTerminalException");
            verifyNoInteractions(pdfCompiler);
            verify(blobStorage, never()).download(anyString());
            verify(stateService, never()).complete(any());
        }

        @Test
        @DisplayName("rendered page count differs from total pages: job failed")
        void execute_pageCountMismatch_fails() {
            project.setTotalPages(3);

            worker.execute(generation.getId());

            verify(stateService).fail(eq(generation), contains("Expected 3 rendered pages but found 2"));
            verifyNoInteractions(pdfCompiler);
            verify(pdfAssetRepository, never()).save(any());
        }

        @Test
        @DisplayName("unreadable page image: job failed with the compiler error")
        void execute_compilerFails_fails() {
            when(pdfCompiler.compile(anyList(), anyInt()))
                    .thenThrow(new PdfCompilationException("Page 2 is not a readable image", null));

            worker.execute(generation.getId());

            verify(stateService).fail(generation, "Page 2 is not a readable image");
            verify(metrics).incrementFailed(TaskType.PDF_COMPILATION, "PdfCompilationException");
            verify(blobStorage, never()).upload(anyString(), any(), anyString());
        }

        @Test
        @DisplayName("job already terminal: nothing runs")
        void execute_terminal_skips() {
            generation.setStatus(GenerationStatus.COMPLETED);

            worker.execute(generation.getId());

            verify(stateService, never()).markProcessing(any());
            verifyNoInteractions(pdfCompiler, blobStorage);
        }
    }

    private ComicAsset page(int pageNo) {
        ComicAsset asset = new ComicAsset();
        asset.setId(UUID.randomUUID());
        asset.setProjectId(project.getId());
        asset.setPageNo(pageNo);
        asset.setBlobPath("pages/" + project.getId() + "/pages/" + pageNo + ".png");
        return asset;
    }
}
