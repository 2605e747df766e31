package com.adlanda.contextassembler.model;

/**
 * Token count for a piece of text together with how it was obtained.
 */
public record TokenEstimate(long tokens, TokenSource source) {

    public TokenEstimate {
        if (tokens < 0) {
            throw new IllegalArgumentException("Token count cannot be negative: " + tokens);
        }
    }
}
