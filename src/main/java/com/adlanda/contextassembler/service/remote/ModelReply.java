package com.adlanda.contextassembler.service.remote;

/**
 * Text returned by the generative model, with usage counts when the service reports them.
 *
 * @param text             Generated text
 * @param promptTokens     Input tokens reported by the service, or null
 * @param completionTokens Output tokens reported by the service, or null
 */
public record ModelReply(String text, Integer promptTokens, Integer completionTokens) {

    public static ModelReply of(String text) {
        return new ModelReply(text, null, null);
    }

    public boolean hasUsage() {
        return promptTokens != null && completionTokens != null;
    }
}
