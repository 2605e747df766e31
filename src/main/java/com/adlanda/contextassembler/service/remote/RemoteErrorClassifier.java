package com.adlanda.contextassembler.service.remote;

import com.adlanda.contextassembler.exception.RemoteCallException;
import com.adlanda.contextassembler.exception.RemoteFatalException;
import com.adlanda.contextassembler.exception.RemoteTransientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps whatever a model client threw onto the retry taxonomy.
 *
 * Only rate limiting is transient. Auth, request-structure and every other failure is fatal.
 */
public final class RemoteErrorClassifier {

    /** Spring AI formats HTTP failures as "429 - {body}". */
    private static final Pattern STATUS_PREFIX = Pattern.compile("^\\s*(?:HTTP\\s+)?(\\d{3})\\s*-");

    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "rate limit", "rate_limit", "ratelimit", "too many requests", "quota exceeded",
            "resource_exhausted", "resource exhausted", "insufficient_quota");

    private static final int MAX_MESSAGE = 300;

    private RemoteErrorClassifier() {
    }

    public static RemoteCallException classify(Throwable error) {
        if (error instanceof RemoteCallException already) {
            return already;
        }
        List<Throwable> chain = causeChain(error);

        Integer status = statusCode(chain);
        String message = shortMessage(error);

        if (status != null && status == 429) {
            return new RemoteTransientException("Rate limited (HTTP 429): " + message, status, error);
        }
        if (status == null && mentionsRateLimit(chain)) {
            return new RemoteTransientException("Rate limited: " + message, null, error);
        }
        if (status != null && (status == 401 || status == 403)) {
            return new RemoteFatalException("Authentication failed (HTTP " + status + "): " + message, status, error);
        }
        if (status != null) {
            return new RemoteFatalException("Remote call failed (HTTP " + status + "): " + message, status, error);
        }
        return new RemoteFatalException("Remote call failed: " + message, null, error);
    }

    private static Integer statusCode(List<Throwable> chain) {
        for (Throwable t : chain) {
            if (t instanceof RestClientResponseException http) {
                return http.getStatusCode().value();
            }
        }
        for (Throwable t : chain) {
            String m = t.getMessage();
            if (m != null) {
                Matcher matcher = STATUS_PREFIX.matcher(m);
                if (matcher.find()) {
                    return Integer.parseInt(matcher.group(1));
                }
            }
        }
        return null;
    }

    private static boolean mentionsRateLimit(List<Throwable> chain) {
        for (Throwable t : chain) {
            String m = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            for (String marker : RATE_LIMIT_MARKERS) {
                if (m.contains(marker)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && chain.size() < 20 && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    private static String shortMessage(Throwable error) {
        String m = error == null || error.getMessage() == null
                ? String.valueOf(error)
                : error.getMessage();
        m = m.replaceAll("\\s+", " ").trim();
        return m.length() <= MAX_MESSAGE ? m : m.substring(0, MAX_MESSAGE) + "...";
    }
}
