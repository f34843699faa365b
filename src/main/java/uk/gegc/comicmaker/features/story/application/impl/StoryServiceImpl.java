package uk.gegc.comicmaker.features.story.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.comicmaker.features.plan.application.PlanGuard;
import uk.gegc.comicmaker.features.project.api.dto.SceneBatchResponse;
import uk.gegc.comicmaker.features.project.api.dto.SceneInput;
import uk.gegc.comicmaker.features.project.application.ProjectService;
import uk.gegc.comicmaker.features.project.application.SceneService;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectInvalidStatusException;
import uk.gegc.comicmaker.features.project.domain.model.NarrativeText;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.ProjectConfig;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;
import uk.gegc.comicmaker.features.story.api.dto.StoryParseResponse;
import uk.gegc.comicmaker.features.story.application.StoryLlmClient;
import uk.gegc.comicmaker.features.story.application.StoryPromptBuilder;
import uk.gegc.comicmaker.features.story.application.StoryScriptParser;
import uk.gegc.comicmaker.features.story.application.StoryService;
import uk.gegc.comicmaker.features.story.config.StoryProperties;
import uk.gegc.comicmaker.features.story.domain.exception.ContentBlockedException;
import uk.gegc.comicmaker.features.story.domain.exception.StoryParseFailedException;
import uk.gegc.comicmaker.features.story.domain.exception.StoryScriptInvalidException;
import uk.gegc.comicmaker.features.story.domain.model.LlmCompletion;
import uk.gegc.comicmaker.features.story.domain.model.StoryScript;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class StoryServiceImpl implements StoryService {

    private static final String IMPLIED_SETTING = "implied";

    private final ProjectService projectService;
    private final SceneService sceneService;
    private final PlanGuard planGuard;
    private final StoryLlmClient llmClient;
    private final StoryPromptBuilder promptBuilder;
    private final StoryScriptParser scriptParser;
    private final StoryProperties storyProperties;

    @Override
    public StoryParseResponse parseStory(User user, UUID projectId, String inputText) {
        Project project = projectService.loadOwnedProject(user, projectId);
        planGuard.checkPlanAccess(user, storyProperties.getMinimumPlan());
        if (project.getStatus() != ProjectStatus.DRAFT) {
            throw new ProjectInvalidStatusException(project.getStatus(),
                    "Story generation only allowed in DRAFT status");
        }
        moderate(inputText);

        ProjectConfig config = project.getConfig() != null ? project.getConfig() : ProjectConfig.defaults();
        String language = config.languageOrDefault();
        String systemPrompt = promptBuilder.systemPrompt(language);
        String userPrompt = promptBuilder.userPrompt(inputText, config.styleOrDefault(), storyProperties.getDefaultTheme());

        int maxAttempts = storyProperties.getMaxSchemaRetries() + 1;
        StoryScript script = null;
        LlmCompletion completion = null;
        StoryScriptInvalidException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts && script == null; attempt++) {
            completion = llmClient.complete(systemPrompt, userPrompt);
            try {
                script = scriptParser.parse(completion.content());
            } catch (StoryScriptInvalidException e) {
                lastError = e;
                log.warn("Story script for project {} failed validation (attempt {}/{}): {}",
                        projectId, attempt, maxAttempts, e.getMessage());
            }
        }
        if (script == null) {
            log.error("No valid story script for project {} after {} attempts", projectId, maxAttempts);
            throw new StoryParseFailedException("Output didn't match schema: "
                    + (lastError != null ? lastError.getMessage() : "unknown"), lastError);
        }

        List<SceneInput> scenes = toScenes(script, language);
        SceneBatchResponse saved = sceneService.saveScenes(project, scenes);
        int firstPageNo = script.pages().get(0).pageNo();
        int firstPageScenes = (int) saved.scenes().stream().filter(s -> s.pageNo() == firstPageNo).count();

        log.info("Parsed story into {} page(s) for project {}", script.pages().size(), projectId);
        return new StoryParseResponse("success", script.pages().size(), saved.totalPages(), firstPageScenes,
                completion.usage());
    }

    private void moderate(String inputText) {
        String normalized = inputText == null ? "" : inputText.toLowerCase(Locale.ROOT);
        for (String term : storyProperties.getBlockedTerms()) {
            if (term != null && !term.isBlank() && normalized.contains(term.toLowerCase(Locale.ROOT))) {
                log.warn("Story input rejected by moderation");
                throw new ContentBlockedException();
            }
        }
    }

    private static List<SceneInput> toScenes(StoryScript script, String language) {
        List<SceneInput> scenes = new ArrayList<>();
        for (StoryScript.Page page : script.pages()) {
            for (StoryScript.Panel panel : page.panels()) {
                List<String> dialogue = panel.dialogue() == null || panel.dialogue().isBlank()
                        ? List.of()
                        : List.of(panel.dialogue());
                NarrativeText narrative = new NarrativeText(
                        panel.description(), dialogue, panel.description(), IMPLIED_SETTING, panel.caption());
                scenes.add(new SceneInput(page.pageNo(), panel.panelNo(), narrative, language));
            }
        }
        return scenes;
    }
}
