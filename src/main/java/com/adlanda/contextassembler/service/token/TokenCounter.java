package com.adlanda.contextassembler.service.token;

import com.adlanda.contextassembler.model.TokenEstimate;
import com.adlanda.contextassembler.model.TokenSource;

/**
 * Counts tokens for budgeting and usage accounting.
 *
 * One counter is used for a whole run so exact and estimated counts never mix silently.
 */
public interface TokenCounter {

    TokenEstimate count(String text);

    TokenSource source();
}
