package com.adlanda.contextassembler.service.remote;

/**
 * A single, non-retrying call to a generative model.
 *
 * Implementations throw whatever their transport throws; the caller classifies it.
 */
public interface GenerativeModelClient {

    ModelReply generate(String prompt);

    boolean isAvailable();
}
