package uk.gegc.comicmaker.features.comic.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.comicmaker.BaseUnitTest;
import uk.gegc.comicmaker.features.asset.application.BlobPaths;
import uk.gegc.comicmaker.features.asset.application.BlobStorage;
import uk.gegc.comicmaker.features.asset.domain.model.ComicAsset;
import uk.gegc.comicmaker.features.asset.domain.model.SignedUrl;
import uk.gegc.comicmaker.features.asset.domain.repository.ComicAssetRepository;
import uk.gegc.comicmaker.features.comic.domain.exception.SceneStructureException;
import uk.gegc.comicmaker.features.comic.domain.model.ImageResolution;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.project.domain.model.NarrativeText;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.Scene;
import uk.gegc.comicmaker.features.project.domain.repository.SceneRepository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ComicPageRenderer Unit Tests")
class ComicPageRendererTest extends BaseUnitTest {

    private static final byte[] PANEL = {1, 2, 3};
    private static final byte[] PAGE = {4, 5, 6, 7};
    private static final byte[] WATERMARKED = {8, 9};
    private static final LocalDateTime EXPIRES = LocalDateTime.of(2026, 1, 16, 10, 0);

    @Mock
    private SceneRepository sceneRepository;
    @Mock
    private ComicAssetRepository comicAssetRepository;
    @Mock
    private PanelPromptBuilder promptBuilder;
    @Mock
    private ImageGenerationClient imageGenerationClient;
    @Mock
    private PageComposer pageComposer;
    @Mock
    private WatermarkService watermarkService;
    @Mock
    private BlobStorage blobStorage;
    @Mock
    private BlobPaths blobPaths;
    @Mock
    private PlatformTransactionManager transactionManager;

    private ComicPageRenderer renderer;
    private Project project;
    private UUID generationId;

    @BeforeEach
    void setUp() {
        renderer = new ComicPageRenderer(sceneRepository, comicAssetRepository, promptBuilder, imageGenerationClient,
                pageComposer, watermarkService, blobStorage, blobPaths, new TransactionTemplate(transactionManager));

        project = new Project();
        project.setId(UUID.randomUUID());
        project.setPlanSnapshot(PlanTier.PRO);
        generationId = UUID.randomUUID();

        when(promptBuilder.build(any(), any())).thenAnswer(inv -> "prompt: " + ((NarrativeText) inv.getArgument(0)).description());
        when(imageGenerationClient.generate(anyString(), any(), anyLong())).thenReturn(PANEL);
        when(pageComposer.compose(anyList())).thenReturn(PAGE);
        when(watermarkService.shouldWatermark(any())).thenReturn(false);
        when(watermarkService.apply(any(), any())).thenReturn(WATERMARKED);
        when(blobPaths.pagePath(any(), anyInt())).thenAnswer(inv -> "pages/" + inv.getArgument(1) + ".png");
        when(blobStorage.sign(anyString())).thenAnswer(inv -> new SignedUrl("https://blobs.example.com/" + inv.getArgument(0), EXPIRES));
        when(comicAssetRepository.findByProjectIdAndPageNo(any(), anyInt())).thenReturn(Optional.empty());
        when(comicAssetRepository.save(any(ComicAsset.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("panel layout")
    class Layout {

        @Test
        @DisplayName("three panels on the page: SceneStructureException before any provider call")
        void renderPage_threePanels_throws() {
            stubScenes(1, 1, 2, 3);

            assertThatThrownBy(() -> renderer.renderPage(project, 1, 42L, generationId))
                    .isInstanceOf(SceneStructureException.class)
                    .hasMessageContaining("exactly 4 panels, found 3");
            verifyNoInteractions(imageGenerationClient, blobStorage, transactionManager);
        }

        @Test
        @DisplayName("panels not numbered 1..4: SceneStructureException naming the expected panel")
        void renderPage_wrongNumbering_throws() {
            stubScenes(2, 1, 2, 4, 5);

            assertThatThrownBy(() -> renderer.renderPage(project, 2, 42L, generationId))
                    .isInstanceOf(SceneStructureException.class)
                    .hasMessageContaining("expected panel 3, found 4");
            verifyNoInteractions(imageGenerationClient);
        }
    }

    @Nested
    @DisplayName("rendering")
    class Rendering {

        @Test
        @DisplayName("four panels: generated with the plan resolution and one seed, asset tied to the generation")
        void renderPage_valid_upsertsAsset() {
            List<Scene> scenes = stubScenes(1, 1, 2, 3, 4);

            ComicAsset asset = renderer.renderPage(project, 1, 42L, generationId);

            verify(imageGenerationClient, times(4)).generate(anyString(), eq(ImageResolution.STANDARD), eq(42L));
            verify(blobStorage).upload("pages/1.png", PAGE, "image/png");
            assertThat(asset.getProjectId()).isEqualTo(project.getId());
            assertThat(asset.getPageNo()).isEqualTo(1);
            assertThat(asset.getGenerationId()).isEqualTo(generationId);
            assertThat(asset.getSeed()).isEqualTo(42L);
            assertThat(asset.getBlobUrl()).isEqualTo("https://blobs.example.com/pages/1.png");
            assertThat(asset.getUrlExpiresAt()).isEqualTo(EXPIRES);
            assertThat(asset.getResolution()).isEqualTo(ImageResolution.STANDARD);
            assertThat(asset.isWatermarked()).isFalse();
            assertThat(scenes).extracting(Scene::getPromptUsed)
                    .containsExactly("prompt: panel 1", "prompt: panel 2", "prompt: panel 3", "prompt: panel 4");
            verify(sceneRepository).saveAll(scenes);
        }

        @Test
        @DisplayName("plan requires a watermark: the watermarked page is uploaded")
        void renderPage_watermarkedPlan_uploadsWatermarked() {
            project.setPlanSnapshot(PlanTier.FREE);
            when(watermarkService.shouldWatermark(PlanTier.FREE)).thenReturn(true);
            stubScenes(1, 1, 2, 3, 4);

            ComicAsset asset = renderer.renderPage(project, 1, 7L, generationId);

            verify(watermarkService).apply(PAGE, PlanTier.FREE);
            verify(blobStorage).upload("pages/1.png", WATERMARKED, "image/png");
            verify(imageGenerationClient, times(4)).generate(anyString(), eq(ImageResolution.LOW), eq(7L));
            assertThat(asset.isWatermarked()).isTrue();
            assertThat(asset.getPlanSnapshot()).isEqualTo(PlanTier.FREE);
        }

        @Test
        @DisplayName("re-render: existing asset row for the page is updated in place")
        void renderPage_existingAsset_updated() {
            ComicAsset existing = new ComicAsset();
            existing.setId(UUID.randomUUID());
            existing.setProjectId(project.getId());
            existing.setPageNo(1);
            existing.setGenerationId(UUID.randomUUID());
            when(comicAssetRepository.findByProjectIdAndPageNo(project.getId(), 1)).thenReturn(Optional.of(existing));
            stubScenes(1, 1, 2, 3, 4);

            ComicAsset asset = renderer.renderPage(project, 1, 42L, generationId);

            assertThat(asset).isSameAs(existing);
            assertThat(asset.getGenerationId()).isEqualTo(generationId);
            ArgumentCaptor<ComicAsset> saved = ArgumentCaptor.forClass(ComicAsset.class);
            verify(comicAssetRepository).save(saved.capture());
            assertThat(saved.getValue().getId()).isEqualTo(existing.getId());
        }
    }

    @Nested
    @DisplayName("transaction boundary")
    class TransactionBoundary {

        @Test
        @DisplayName("provider calls and upload finish before the transaction opens")
        void renderPage_providerAndUploadOutsideTransaction() {
            stubScenes(1, 1, 2, 3, 4);

            renderer.renderPage(project, 1, 42L, generationId);

            InOrder order = inOrder(imageGenerationClient, blobStorage, transactionManager, comicAssetRepository);
            order.verify(imageGenerationClient, times(4)).generate(anyString(), any(), anyLong());
            order.verify(blobStorage).upload(anyString(), any(), anyString());
            order.verify(transactionManager).getTransaction(any());
            order.verify(comicAssetRepository).save(any(ComicAsset.class));
            order.verify(transactionManager).commit(any());
        }

        @Test
        @DisplayName("provider failure: no transaction is opened and nothing is written")
        void renderPage_providerFails_noTransaction() {
            stubScenes(1, 1, 2, 3, 4);
            when(imageGenerationClient.generate(anyString(), any(), anyLong()))
                    .thenThrow(new IllegalStateException("provider down"));

            assertThatThrownBy(() -> renderer.renderPage(project, 1, 42L, generationId))
                    .isInstanceOf(IllegalStateException.class);
            verifyNoInteractions(transactionManager, blobStorage);
            verify(comicAssetRepository, never()).save(any());
            verify(sceneRepository, never()).saveAll(any());
        }
    }

    private List<Scene> stubScenes(int pageNo, int... panelNumbers) {
        List<Scene> scenes = new ArrayList<>();
        for (int panelNo : panelNumbers) {
            Scene scene = new Scene();
            scene.setId(UUID.randomUUID());
            scene.setProjectId(project.getId());
            scene.setPageNo(pageNo);
            scene.setPanelNo(panelNo);
            scene.setNarrativeText(new NarrativeText("panel " + panelNo, null, null, null, null));
            scenes.add(scene);
        }
        when(sceneRepository.findByProjectIdAndPageNoAndDeletedAtIsNullOrderByPanelNoAsc(project.getId(), pageNo))
                .thenReturn(scenes);
        return scenes;
    }
}
