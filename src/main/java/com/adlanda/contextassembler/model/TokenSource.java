package com.adlanda.contextassembler.model;

/**
 * Where a token count came from.
 */
public enum TokenSource {
    /** Counted by a real tokenizer or reported by the remote service. */
    EXACT,
    /** Approximated from the character count. */
    ESTIMATED
}
