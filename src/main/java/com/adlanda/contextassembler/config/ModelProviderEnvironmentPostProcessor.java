package com.adlanda.contextassembler.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Switches the OpenAI chat and embedding providers off when no API key is configured.
 *
 * Without a key the OpenAI auto-configuration refuses to start, so the context would fail before
 * the rule-based selection fallback could run. A provider is only switched off while it is still
 * set to {@code openai} and neither the shared nor its own {@code api-key} property has a value.
 * Key values are never logged.
 */
public class ModelProviderEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    private static final Logger log = LoggerFactory.getLogger(ModelProviderEnvironmentPostProcessor.class);

    static final String SOURCE_NAME = "assemblerModelProviders";
    static final String OPENAI = "openai";
    static final String NONE = "none";

    static final String CHAT_PROVIDER = "spring.ai.model.chat";
    static final String EMBEDDING_PROVIDER = "spring.ai.model.embedding";

    private static final String SHARED_KEY = "spring.ai.openai.api-key";
    private static final String CHAT_KEY = "spring.ai.openai.chat.api-key";
    private static final String EMBEDDING_KEY = "spring.ai.openai.embedding.api-key";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment env, SpringApplication application) {
        boolean sharedKey = hasText(env.getProperty(SHARED_KEY));
        Map<String, Object> overrides = new LinkedHashMap<>();
        disableIfKeyless(env, CHAT_PROVIDER, sharedKey || hasText(env.getProperty(CHAT_KEY)), overrides);
        disableIfKeyless(env, EMBEDDING_PROVIDER, sharedKey || hasText(env.getProperty(EMBEDDING_KEY)), overrides);
        if (overrides.isEmpty()) {
            return;
        }
        env.getPropertySources().remove(SOURCE_NAME);
        env.getPropertySources().addFirst(new MapPropertySource(SOURCE_NAME, overrides));
        log.warn("No OpenAI API key configured; disabled {}. File selection will use the rule-based strategy",
                overrides.keySet());
    }

    private static void disableIfKeyless(ConfigurableEnvironment env, String providerProperty, boolean hasKey,
                                         Map<String, Object> overrides) {
        String provider = env.getProperty(providerProperty, OPENAI);
        if (!hasKey && OPENAI.equalsIgnoreCase(provider.strip())) {
            overrides.put(providerProperty, NONE);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public int getOrder() {
        // after config data has been loaded
        return Ordered.LOWEST_PRECEDENCE;
    }
}
