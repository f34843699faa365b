package uk.gegc.comicmaker.features.story.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.comicmaker.BaseUnitTest;
import uk.gegc.comicmaker.features.plan.application.PlanGuard;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.project.api.dto.SceneBatchResponse;
import uk.gegc.comicmaker.features.project.api.dto.SceneDto;
import uk.gegc.comicmaker.features.project.api.dto.SceneInput;
import uk.gegc.comicmaker.features.project.application.ProjectService;
import uk.gegc.comicmaker.features.project.application.SceneService;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectInvalidStatusException;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.ProjectConfig;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;
import uk.gegc.comicmaker.features.story.api.dto.StoryParseResponse;
import uk.gegc.comicmaker.features.story.application.StoryLlmClient;
import uk.gegc.comicmaker.features.story.application.StoryPromptBuilder;
import uk.gegc.comicmaker.features.story.application.StoryScriptParser;
import uk.gegc.comicmaker.features.story.config.StoryProperties;
import uk.gegc.comicmaker.features.story.domain.exception.ContentBlockedException;
import uk.gegc.comicmaker.features.story.domain.exception.StoryParseFailedException;
import uk.gegc.comicmaker.features.story.domain.model.LlmCompletion;
import uk.gegc.comicmaker.features.story.domain.model.LlmUsage;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("StoryServiceImpl Unit Tests")
class StoryServiceImplTest extends BaseUnitTest {

    private static final String VALID_SCRIPT = """
            {"pages":[{"page_no":1,"panels":[
              {"panel_no":1,"description":"Hero wakes up","dialogue":"Morning!","caption":"Dawn"},
              {"panel_no":2,"description":"Hero eats"},
              {"panel_no":3,"description":"Hero leaves"},
              {"panel_no":4,"description":"Hero flies"}
            ]}]}
            """;
    private static final LlmUsage USAGE = new LlmUsage("openai", "gpt-4o-mini", 120, 340);

    @Mock
    private ProjectService projectService;
    @Mock
    private SceneService sceneService;
    @Mock
    private PlanGuard planGuard;
    @Mock
    private StoryLlmClient llmClient;

    private StoryServiceImpl service;
    private User user;
    private Project project;

    @BeforeEach
    void setUp() {
        service = new StoryServiceImpl(projectService, sceneService, planGuard, llmClient,
                new StoryPromptBuilder(), new StoryScriptParser(new ObjectMapper()), new StoryProperties());

        user = new User();
        user.setId(UUID.randomUUID());
        user.setPlan(PlanTier.PRO);

        project = new Project();
        project.setId(UUID.randomUUID());
        project.setUserId(user.getId());
        project.setPlanSnapshot(PlanTier.PRO);
        project.setStatus(ProjectStatus.DRAFT);
        project.setConfig(new ProjectConfig("noir", "english"));

        when(projectService.loadOwnedProject(user, project.getId())).thenReturn(project);
        when(sceneService.saveScenes(eq(project), anyList())).thenAnswer(inv -> {
            List<SceneInput> inputs = inv.getArgument(1);
            List<SceneDto> dtos = inputs.stream()
                    .map(i -> new SceneDto(UUID.randomUUID(), i.pageNo(), i.panelNo(), i.narrativeText(), i.language(), null))
                    .toList();
            return new SceneBatchResponse(1, dtos);
        });
    }

    @Nested
    @DisplayName("parseStory")
    class ParseStory {

        @Test
        @DisplayName("when LLM returns a valid script then saves four scenes with implied setting")
        @SuppressWarnings("unchecked")
        void validScript_SavesScenes() {
            when(llmClient.complete(anyString(), anyString())).thenReturn(new LlmCompletion(VALID_SCRIPT, USAGE));

            StoryParseResponse response = service.parseStory(user, project.getId(), "A hero's ordinary morning");

            assertThat(response.status()).isEqualTo("success");
            assertThat(response.pages()).isEqualTo(1);
            assertThat(response.firstPageScenes()).isEqualTo(4);
            assertThat(response.usage()).isEqualTo(USAGE);

            ArgumentCaptor<List<SceneInput>> captor = ArgumentCaptor.forClass(List.class);
            verify(sceneService).saveScenes(eq(project), captor.capture());
            SceneInput first = captor.getValue().get(0);
            assertThat(first.narrativeText().setting()).isEqualTo("implied");
            assertThat(first.narrativeText().action()).isEqualTo("Hero wakes up");
            assertThat(first.narrativeText().dialogue()).containsExactly("Morning!");
            assertThat(captor.getValue().get(1).narrativeText().dialogue()).isEmpty();
        }

        @Test
        @DisplayName("when first output is invalid then retries and succeeds")
        void invalidThenValid_Retries() {
            when(llmClient.complete(anyString(), anyString()))
                    .thenReturn(new LlmCompletion("not json", USAGE))
                    .thenReturn(new LlmCompletion(VALID_SCRIPT, USAGE));

            StoryParseResponse response = service.parseStory(user, project.getId(), "A hero's ordinary morning");

            assertThat(response.pages()).isEqualTo(1);
            verify(llmClient, times(2)).complete(anyString(), anyString());
        }

        @Test
        @DisplayName("when every attempt is invalid then throws StoryParseFailedException after 3 calls")
        void alwaysInvalid_Fails() {
            when(llmClient.complete(anyString(), anyString())).thenReturn(new LlmCompletion("{\"pages\":[]}", USAGE));

            assertThatThrownBy(() -> service.parseStory(user, project.getId(), "A hero's ordinary morning"))
                    .isInstanceOf(StoryParseFailedException.class);
            verify(llmClient, times(3)).complete(anyString(), anyString());
            verifyNoInteractions(sceneService);
        }

        @Test
        @DisplayName("when input contains a blocked term then throws ContentBlockedException before calling the LLM")
        void blockedTerm_Rejected() {
            assertThatThrownBy(() -> service.parseStory(user, project.getId(), "Some FORBIDDEN_CONTENT here"))
                    .isInstanceOf(ContentBlockedException.class);
            verifyNoInteractions(llmClient);
        }

        @Test
        @DisplayName("when project is not DRAFT then throws ProjectInvalidStatusException")
        void notDraft_Rejected() {
            project.setStatus(ProjectStatus.COMPLETED);

            assertThatThrownBy(() -> service.parseStory(user, project.getId(), "A hero's ordinary morning"))
                    .isInstanceOf(ProjectInvalidStatusException.class);
            verifyNoInteractions(llmClient);
        }

        @Test
        @DisplayName("multi-page script produces four scenes per page")
        @SuppressWarnings("unchecked")
        void multiPage_AllScenesSaved() {
            String pages = String.join(",", IntStream.rangeClosed(1, 2)
                    .mapToObj(p -> "{\"page_no\":" + p + ",\"panels\":["
                            + "{\"panel_no\":1,\"description\":\"a\"},{\"panel_no\":2,\"description\":\"b\"},"
                            + "{\"panel_no\":3,\"description\":\"c\"},{\"panel_no\":4,\"description\":\"d\"}]}")
                    .toList());
            when(llmClient.complete(anyString(), anyString()))
                    .thenReturn(new LlmCompletion("{\"pages\":[" + pages + "]}", USAGE));

            service.parseStory(user, project.getId(), "A two page adventure");

            ArgumentCaptor<List<SceneInput>> captor = ArgumentCaptor.forClass(List.class);
            verify(sceneService).saveScenes(eq(project), captor.capture());
            assertThat(captor.getValue()).hasSize(8);
        }
    }
}
