package com.adlanda.contextassembler.service.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link GenerativeModelClient} backed by Spring AI's {@link ChatModel}.
 */
@Component
public class SpringAiGenerativeModelClient implements GenerativeModelClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiGenerativeModelClient.class);

    private final ChatModel chatModel;

    @Autowired
    public SpringAiGenerativeModelClient(ObjectProvider<ChatModel> chatModel) {
        this(chatModel.getIfAvailable());
    }

    SpringAiGenerativeModelClient(ChatModel chatModel) {
        this.chatModel = chatModel;
        if (chatModel == null) {
            log.warn("No chat model configured; AI-assisted selection disabled");
        }
    }

    @Override
    public ModelReply generate(String prompt) {
        if (chatModel == null) {
            throw new IllegalStateException("No chat model configured");
        }
        ChatResponse response = chatModel.call(new Prompt(prompt));
        Generation result = response == null ? null : response.getResult();
        if (result == null || result.getOutput() == null || result.getOutput().getText() == null) {
            throw new IllegalStateException("Chat model returned no content");
        }
        String text = result.getOutput().getText();

        Usage usage = response.getMetadata() == null ? null : response.getMetadata().getUsage();
        if (usage == null || usage.getPromptTokens() == null || usage.getCompletionTokens() == null
                || usage.getPromptTokens() + usage.getCompletionTokens() == 0) {
            return ModelReply.of(text);
        }
        return new ModelReply(text, usage.getPromptTokens(), usage.getCompletionTokens());
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }
}
