package com.adlanda.contextassembler.service.token;

import com.adlanda.contextassembler.model.TokenEstimate;
import com.adlanda.contextassembler.model.TokenSource;

/**
 * Deterministic fallback: roughly four characters per token, rounded up.
 */
public class EstimatingTokenCounter implements TokenCounter {

    static final int CHARS_PER_TOKEN = 4;

    @Override
    public TokenEstimate count(String text) {
        if (text == null || text.isEmpty()) {
            return new TokenEstimate(0, TokenSource.ESTIMATED);
        }
        long tokens = (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
        return new TokenEstimate(tokens, TokenSource.ESTIMATED);
    }

    @Override
    public TokenSource source() {
        return TokenSource.ESTIMATED;
    }
}
