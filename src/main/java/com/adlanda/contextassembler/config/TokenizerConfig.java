package com.adlanda.contextassembler.config;

import com.adlanda.contextassembler.service.token.EstimatingTokenCounter;
import com.adlanda.contextassembler.service.token.JtokkitTokenCounter;
import com.adlanda.contextassembler.service.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the token counter for the whole run.
 */
@Configuration
public class TokenizerConfig {

    private static final Logger log = LoggerFactory.getLogger(TokenizerConfig.class);

    @Bean
    public TokenCounter tokenCounter(AssemblyProperties properties) {
        if (properties.getTokenizer() == AssemblyProperties.TokenizerMode.ESTIMATE) {
            log.info("Using estimated token counting (configured)");
            return new EstimatingTokenCounter();
        }
        try {
            TokenCounter counter = new JtokkitTokenCounter();
            log.info("Tokenizer available: using cl100k_base for token counting");
            return counter;
        } catch (RuntimeException | LinkageError e) {
            log.warn("Tokenizer not available, token counts will be estimated: {}", e.getMessage());
            return new EstimatingTokenCounter();
        }
    }
}
