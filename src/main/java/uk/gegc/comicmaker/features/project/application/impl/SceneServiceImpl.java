package uk.gegc.comicmaker.features.project.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.plan.application.PlanPolicy;
import uk.gegc.comicmaker.features.plan.domain.exception.PlanLimitExceededException;
import uk.gegc.comicmaker.features.project.api.dto.SceneBatchResponse;
import uk.gegc.comicmaker.features.project.api.dto.SceneDto;
import uk.gegc.comicmaker.features.project.api.dto.SceneInput;
import uk.gegc.comicmaker.features.project.application.ProjectService;
import uk.gegc.comicmaker.features.project.application.SceneService;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectInvalidStatusException;
import uk.gegc.comicmaker.features.project.domain.exception.ScenePanelRuleViolationException;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;
import uk.gegc.comicmaker.features.project.domain.model.Scene;
import uk.gegc.comicmaker.features.project.domain.repository.ProjectRepository;
import uk.gegc.comicmaker.features.project.domain.repository.SceneRepository;
import uk.gegc.comicmaker.features.project.infra.mapping.ProjectMapper;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class SceneServiceImpl implements SceneService {

    private final ProjectService projectService;
    private final ProjectRepository projectRepository;
    private final SceneRepository sceneRepository;
    private final PlanPolicy planPolicy;
    private final ProjectMapper projectMapper;

    @Override
    @Transactional
    public SceneBatchResponse upsertScenes(User user, UUID projectId, List<SceneInput> scenes) {
        Project project = projectService.loadOwnedProject(user, projectId);
        return saveScenes(project, scenes);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SceneDto> listScenes(User user, UUID projectId) {
        projectService.loadOwnedProject(user, projectId);
        return sceneRepository.findByProjectIdAndDeletedAtIsNullOrderByPageNoAscPanelNoAsc(projectId).stream()
                .map(projectMapper::toDto)
                .toList();
    }

    @Override
    @Transactional
    public SceneBatchResponse saveScenes(Project project, List<SceneInput> scenes) {
        if (project.getStatus() != ProjectStatus.DRAFT) {
            throw new ProjectInvalidStatusException(project.getStatus(),
                    "Scenes can only be changed while the project is DRAFT; project is " + project.getStatus());
        }
        if (scenes == null || scenes.isEmpty()) {
            throw new ScenePanelRuleViolationException("At least one scene is required");
        }

        Set<String> seenKeys = new HashSet<>();
        for (SceneInput input : scenes) {
            if (input.panelNo() < 1 || input.panelNo() > Scene.PANELS_PER_PAGE) {
                throw new ScenePanelRuleViolationException(
                        "panel_no must be between 1 and " + Scene.PANELS_PER_PAGE + "; got " + input.panelNo());
            }
            if (input.pageNo() < 1) {
                throw new ScenePanelRuleViolationException("page_no must be at least 1; got " + input.pageNo());
            }
            if (input.narrativeText() == null) {
                throw new ScenePanelRuleViolationException(
                        "Narrative text missing for page " + input.pageNo() + " panel " + input.panelNo());
            }
            if (!seenKeys.add(input.pageNo() + ":" + input.panelNo())) {
                throw new ScenePanelRuleViolationException(
                        "Duplicate scene for page " + input.pageNo() + " panel " + input.panelNo());
            }
        }

        Set<Integer> pages = new TreeSet<>(sceneRepository.findDistinctPageNumbers(project.getId()));
        scenes.forEach(input -> pages.add(input.pageNo()));
        int maxPages = planPolicy.limitsFor(project.getPlanSnapshot()).maxPages();
        if (pages.size() > maxPages) {
            throw new PlanLimitExceededException("Plan " + project.getPlanSnapshot() + " allows at most "
                    + maxPages + " page(s); this change would give the project " + pages.size());
        }
        int expected = 1;
        for (int pageNo : pages) {
            if (pageNo != expected) {
                throw new ScenePanelRuleViolationException(
                        "Pages must be numbered consecutively from 1; missing page " + expected);
            }
            expected++;
        }

        String defaultLanguage = project.getConfig() != null ? project.getConfig().languageOrDefault() : null;
        List<Scene> saved = new ArrayList<>(scenes.size());
        for (SceneInput input : scenes) {
            Scene scene = sceneRepository.findByProjectIdAndPageNoAndPanelNo(project.getId(), input.pageNo(), input.panelNo())
                    .orElseGet(() -> {
                        Scene created = new Scene();
                        created.setProjectId(project.getId());
                        created.setPageNo(input.pageNo());
                        created.setPanelNo(input.panelNo());
                        return created;
                    });
            scene.setNarrativeText(input.narrativeText());
            scene.setLanguage(input.language() != null ? input.language() : defaultLanguage);
            scene.setDeletedAt(null);
            saved.add(sceneRepository.save(scene));
        }

        project.setTotalPages(pages.size());
        projectRepository.save(project);
        log.info("Upserted {} scene(s) on project {}; total pages {}", saved.size(), project.getId(), pages.size());

        saved.sort(Comparator.comparingInt(Scene::getPageNo).thenComparingInt(Scene::getPanelNo));
        return new SceneBatchResponse(pages.size(), saved.stream().map(projectMapper::toDto).toList());
    }
}
