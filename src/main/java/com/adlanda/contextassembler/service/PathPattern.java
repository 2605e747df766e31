package com.adlanda.contextassembler.service;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single compiled ignore-style pattern.
 *
 * Patterns follow .gitignore line syntax without negation: a trailing '/' restricts the pattern to
 * directories, a leading or inner '/' anchors it to the project root, and '*', '?' and '**' are
 * globs. Matching works on whole path segments, never on raw substrings.
 *
 * @param source        The line the pattern was parsed from
 * @param regex         Compiled glob body
 * @param anchored      Whether the pattern must match from the first segment
 * @param directoryOnly Whether only directory segments (never the file name) can match
 */
public record PathPattern(String source, Pattern regex, boolean anchored, boolean directoryOnly) {

    /**
     * Parses one pattern line.
     *
     * @return empty for blank lines, comments and negations
     * @throws IllegalArgumentException if the glob does not compile, e.g. a reversed range like {@code [z-a]}
     */
    public static Optional<PathPattern> parse(String line, boolean caseInsensitive) {
        if (line == null) {
            return Optional.empty();
        }
        String pattern = line.strip();
        if (pattern.isEmpty() || pattern.startsWith("#") || pattern.startsWith("!")) {
            return Optional.empty();
        }
        pattern = pattern.replace('\\', '/');

        boolean directoryOnly = pattern.endsWith("/");
        while (pattern.endsWith("/")) {
            pattern = pattern.substring(0, pattern.length() - 1);
        }

        boolean anchored = pattern.startsWith("/") || pattern.indexOf('/') > 0;
        while (pattern.startsWith("/")) {
            pattern = pattern.substring(1);
        }
        while (pattern.startsWith("**/")) {
            pattern = pattern.substring(3);
            anchored = false;
        }
        if (pattern.isEmpty() || pattern.equals("**")) {
            return Optional.empty();
        }

        int flags = caseInsensitive ? Pattern.CASE_INSENSITIVE : 0;
        Pattern regex;
        try {
            regex = Pattern.compile(globToRegex(pattern), flags);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern '" + line.strip() + "': " + e.getDescription(), e);
        }
        return Optional.of(new PathPattern(line.strip(), regex, anchored, directoryOnly));
    }

    /**
     * Whether this pattern selects the file path or one of its parent directories.
     *
     * @param segments The path split on '/'
     */
    public boolean matches(String[] segments) {
        return matches(segments, true);
    }

    /**
     * Whether this pattern selects the directory or one of its parents.
     */
    public boolean matchesDirectory(String[] segments) {
        return matches(segments, false);
    }

    private boolean matches(String[] segments, boolean lastIsFile) {
        int n = segments.length;
        int lastStart = anchored ? 0 : n - 1;
        for (int start = 0; start <= lastStart; start++) {
            StringBuilder candidate = new StringBuilder();
            for (int end = start; end < n; end++) {
                if (end > start) {
                    candidate.append('/');
                }
                candidate.append(segments[end]);
                boolean isFileName = lastIsFile && end == n - 1;
                if (directoryOnly && isFileName) {
                    break;
                }
                if (regex.matcher(candidate).matches()) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean matches(String path) {
        return matches(path.split("/"));
    }

    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
                if (doubleStar) {
                    boolean followedBySlash = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
                    if (followedBySlash) {
                        regex.append("(?:.*/)?");
                        i += 3;
                    } else {
                        regex.append(".*");
                        i += 2;
                    }
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else if (c == '[') {
                int close = glob.indexOf(']', i + 1);
                if (close > i + 1) {
                    String body = glob.substring(i + 1, close).replace("\\", "\\\\");
                    if (body.startsWith("!")) {
                        body = "^" + body.substring(1);
                    }
                    regex.append('[').append(body).append(']');
                    i = close + 1;
                    continue;
                }
                regex.append(Pattern.quote("["));
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return regex.toString();
    }
}
