package com.adlanda.contextassembler.config;

import com.adlanda.contextassembler.model.TokenSource;
import com.adlanda.contextassembler.service.token.EstimatingTokenCounter;
import com.adlanda.contextassembler.service.token.JtokkitTokenCounter;
import com.adlanda.contextassembler.service.token.TokenCounter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerConfigTest {

    private final TokenizerConfig config = new TokenizerConfig();

    @Test
    void tokenCounter_exactMode_usesTokenizer() {
        TokenCounter counter = config.tokenCounter(new AssemblyProperties());

        assertThat(counter).isInstanceOf(JtokkitTokenCounter.class);
        assertThat(counter.source()).isEqualTo(TokenSource.EXACT);
    }

    @Test
    void tokenCounter_estimateMode_usesEstimator() {
        AssemblyProperties properties = new AssemblyProperties();
        properties.setTokenizer(AssemblyProperties.TokenizerMode.ESTIMATE);

        TokenCounter counter = config.tokenCounter(properties);

        assertThat(counter).isInstanceOf(EstimatingTokenCounter.class);
    }
}
