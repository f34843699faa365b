package uk.gegc.comicmaker.features.story.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.story.application.StoryLlmClient;
import uk.gegc.comicmaker.features.story.domain.exception.LlmProviderException;
import uk.gegc.comicmaker.features.story.domain.model.LlmCompletion;
import uk.gegc.comicmaker.features.story.domain.model.LlmUsage;
import uk.gegc.comicmaker.shared.config.RetryProperties;
import uk.gegc.comicmaker.shared.util.Backoff;
import uk.gegc.comicmaker.shared.util.TransientFailures;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiStoryLlmClient implements StoryLlmClient {

    private static final String PROVIDER = "openai";

    private final ChatClient chatClient;
    private final RetryProperties retryProperties;

    @Override
    public LlmCompletion complete(String systemPrompt, String userPrompt) {
        RetryProperties.Policy policy = retryProperties.getProvider();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call(systemPrompt, userPrompt);
            } catch (LlmProviderException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!TransientFailures.isTransient(e)) {
                    log.error("LLM provider rejected request: {}", e.getMessage());
                    throw new LlmProviderException("LLM provider error: " + e.getMessage(), false, e);
                }
                if (attempt >= policy.getMaxAttempts()) {
                    log.error("LLM provider unreachable after {} attempts", attempt);
                    throw new LlmProviderException("LLM provider unavailable after " + attempt + " attempts", true, e);
                }
                long delay = Backoff.delayMs(policy, attempt - 1);
                log.warn("LLM call attempt {} failed ({}); retrying in {} ms", attempt, e.getMessage(), delay);
                sleepFor(delay);
            }
        }
    }

    private LlmCompletion call(String systemPrompt, String userPrompt) {
        Prompt prompt = new Prompt(List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)));
        ChatResponse response = chatClient.prompt(prompt)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null) {
            throw new LlmProviderException("No response received from LLM provider");
        }
        String content = response.getResult().getOutput().getText();
        if (content == null || content.isBlank()) {
            throw new LlmProviderException("Empty response received from LLM provider");
        }

        String model = response.getMetadata() != null ? response.getMetadata().getModel() : null;
        LlmUsage usage = LlmUsage.empty(PROVIDER, model);
        if (response.getMetadata() != null && response.getMetadata().getUsage() != null) {
            Usage raw = response.getMetadata().getUsage();
            usage = new LlmUsage(PROVIDER, model, toLong(raw.getPromptTokens()), toLong(raw.getCompletionTokens()));
        }
        return new LlmCompletion(content, usage);
    }

    protected void sleepFor(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmProviderException("Interrupted while waiting to retry LLM call", false, e);
        }
    }

    private static long toLong(Integer value) {
        return value == null ? 0 : value;
    }
}
