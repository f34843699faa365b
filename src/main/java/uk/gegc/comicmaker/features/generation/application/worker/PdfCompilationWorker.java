package uk.gegc.comicmaker.features.generation.application.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
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
import uk.gegc.comicmaker.features.generation.domain.exception.GenerationTerminalException;
import uk.gegc.comicmaker.features.generation.domain.model.Generation;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.generation.domain.repository.GenerationRepository;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;
import uk.gegc.comicmaker.features.project.domain.repository.ProjectRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Compiles the rendered pages of a completed project into one PDF. Progress: 10 project loaded,
 * 30 pages fetched, 70 PDF built, 100 uploaded and recorded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfCompilationWorker implements GenerationWorker {

    private static final String PDF = "application/pdf";

    private final GenerationRepository generationRepository;
    private final ProjectRepository projectRepository;
    private final ComicAssetRepository comicAssetRepository;
    private final PdfAssetRepository pdfAssetRepository;
    private final BlobStorage blobStorage;
    private final BlobPaths blobPaths;
    private final PdfCompiler pdfCompiler;
    private final PdfProperties pdfProperties;
    private final GenerationStateService stateService;
    private final GenerationMetrics metrics;

    @Override
    public TaskType taskType() {
        return TaskType.PDF_COMPILATION;
    }

    @Override
    public void execute(UUID generationId) {
        Optional<Generation> loaded = generationRepository.findById(generationId);
        if (loaded.isEmpty()) {
            log.error("Generation {} not found; dropping job", generationId);
            return;
        }
        Generation generation = loaded.get();
        if (generation.getStatus().isTerminal()) {
            log.info("Generation {} already {}; nothing to do", generationId, generation.getStatus());
            return;
        }
        stateService.markProcessing(generationId);

        try {
            Project project = projectRepository.findByIdAndDeletedAtIsNull(generation.getProjectId())
                    .orElseThrow(() -> new GenerationTerminalException("Project " + generation.getProjectId() + " not found"));
            if (project.getStatus() != ProjectStatus.COMPLETED) {
                throw new GenerationTerminalException("Project must be COMPLETED to compile a PDF; it is " + project.getStatus());
            }
            List<ComicAsset> pages = comicAssetRepository.findByProjectIdOrderByPageNoAsc(project.getId());
            if (pages.size() != project.getTotalPages()) {
                throw new GenerationTerminalException("Expected " + project.getTotalPages()
                        + " rendered pages but found " + pages.size());
            }
            stateService.updateProgress(generationId, 10);

            List<byte[]> images = new ArrayList<>(pages.size());
            for (ComicAsset page : pages) {
                images.add(blobStorage.download(page.getBlobPath()));
            }
            stateService.updateProgress(generationId, 30);

            int dpi = pdfProperties.dpiFor(project.getPlanSnapshot());
            byte[] pdf = pdfCompiler.compile(images, dpi);
            stateService.updateProgress(generationId, 70);

            String path = blobPaths.pdfPath(project.getId());
            blobStorage.upload(path, pdf, PDF);
            SignedUrl signed = blobStorage.sign(path);
            upsertPdfAsset(project.getId(), generationId, path, signed, dpi, pdf.length, pages.size());

            stateService.complete(generationId);
            metrics.incrementCompleted(taskType());
            log.info("Compiled PDF for project {}: {} pages at {} dpi ({} bytes)", project.getId(), pages.size(), dpi, pdf.length);
        } catch (GenerationTerminalException | PdfCompilationException e) {
            log.error("PDF compilation {} failed permanently: {}", generationId, e.getMessage());
            stateService.fail(generation, e.getMessage());
            metrics.incrementFailed(taskType(), e.getClass().getSimpleName());
        }
    }

    private void upsertPdfAsset(UUID projectId, UUID generationId, String path, SignedUrl signed,
                                int dpi, long size, int pageCount) {
        PdfAsset asset = pdfAssetRepository.findByProjectId(projectId).orElseGet(() -> {
            PdfAsset created = new PdfAsset();
            created.setProjectId(projectId);
            return created;
        });
        asset.setBlobPath(path);
        asset.setBlobUrl(signed.url());
        asset.setUrlExpiresAt(signed.expiresAt());
        asset.setDpi(dpi);
        asset.setFileSizeBytes(size);
        asset.setPageCount(pageCount);
        asset.setGenerationId(generationId);
        pdfAssetRepository.save(asset);
    }
}
