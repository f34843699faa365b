package uk.gegc.comicmaker.features.story.application;

import uk.gegc.comicmaker.features.story.api.dto.StoryParseResponse;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.util.UUID;

public interface StoryService {

    /**
     * Turns free text into scenes on a DRAFT project through the LLM, then saves them under the
     * same rules as manual scene edits.
     */
    StoryParseResponse parseStory(User user, UUID projectId, String inputText);
}
