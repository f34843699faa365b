package uk.gegc.comicmaker.features.story.application;

import uk.gegc.comicmaker.features.story.domain.model.LlmCompletion;

public interface StoryLlmClient {

    /**
     * One chat completion. Timeout and connection failures are retried with bounded backoff
     * inside the call; anything else surfaces at once.
     *
     * @throws uk.gegc.comicmaker.features.story.domain.exception.LlmProviderException
     */
    LlmCompletion complete(String systemPrompt, String userPrompt);
}
