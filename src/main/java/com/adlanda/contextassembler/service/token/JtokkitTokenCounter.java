package com.adlanda.contextassembler.service.token;

import com.adlanda.contextassembler.model.TokenEstimate;
import com.adlanda.contextassembler.model.TokenSource;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Exact token counts using the cl100k_base vocabulary.
 *
 * Special-token markers such as {@code <|endoftext|>} are counted as ordinary text.
 */
public class JtokkitTokenCounter implements TokenCounter {

    private final Encoding encoding;

    public JtokkitTokenCounter() {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
    }

    @Override
    public TokenEstimate count(String text) {
        if (text == null || text.isEmpty()) {
            return new TokenEstimate(0, TokenSource.EXACT);
        }
        return new TokenEstimate(encoding.countTokensOrdinary(text), TokenSource.EXACT);
    }

    @Override
    public TokenSource source() {
        return TokenSource.EXACT;
    }
}
