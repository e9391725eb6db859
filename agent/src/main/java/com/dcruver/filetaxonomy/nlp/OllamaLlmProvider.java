package com.dcruver.filetaxonomy.nlp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * LLM provider backed by Ollama via Spring AI.
 */
@Service
@Slf4j
public class OllamaLlmProvider implements LlmProvider {

    private static final String JSON_SYSTEM_MESSAGE =
        "You organize files into categories. Respond with a single JSON object and nothing else.";

    private final ChatModel chatModel;

    public OllamaLlmProvider(ChatModel chatModel) {
        this.chatModel = chatModel;
        log.info("OllamaLlmProvider initialized with ChatModel: {}", chatModel.getClass().getSimpleName());
    }

    @Override
    public String identifier() {
        return "ollama";
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public String complete(String prompt, LlmOptions options) throws LlmException {
        return call(null, prompt, toOllamaOptions(options, false));
    }

    @Override
    public String completeJson(String prompt, LlmOptions options) throws LlmException {
        return call(JSON_SYSTEM_MESSAGE, prompt, toOllamaOptions(options, true));
    }

    private String call(String systemMessage, String userMessage, OllamaOptions options) throws LlmException {
        List<Message> messages = new ArrayList<>();
        if (systemMessage != null && !systemMessage.isBlank()) {
            messages.add(new SystemMessage(systemMessage));
        }
        messages.add(new UserMessage(userMessage));

        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(messages, options));
        } catch (RuntimeException e) {
            throw new LlmException("Ollama call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResults().isEmpty()) {
            throw new LlmException("No response generated");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new LlmException("Empty response from model");
        }
        return LlmJson.requireWellFormed(text);
    }

    private OllamaOptions toOllamaOptions(LlmOptions options, boolean json) {
        OllamaOptions.Builder builder = OllamaOptions.builder()
            .temperature(options.getTemperature())
            .topP(options.getTopP())
            .numPredict(options.getMaxTokens());
        if (options.getModel() != null) {
            builder.model(options.getModel());
        }
        if (options.getStop() != null && !options.getStop().isEmpty()) {
            builder.stop(options.getStop());
        }
        if (json) {
            builder.format("json");
        }
        return builder.build();
    }
}
