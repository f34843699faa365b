package uk.gegc.comicmaker.features.project.domain.exception;

public class ScenePanelRuleViolationException extends RuntimeException {

    public ScenePanelRuleViolationException(String message) {
        super(message);
    }
}
