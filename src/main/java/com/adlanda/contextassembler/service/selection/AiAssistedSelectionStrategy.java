package com.adlanda.contextassembler.service.selection;

import com.adlanda.contextassembler.exception.RemoteCallException;
import com.adlanda.contextassembler.exception.SelectionFailureException;
import com.adlanda.contextassembler.model.CandidateRanking;
import com.adlanda.contextassembler.model.FileTree;
import com.adlanda.contextassembler.model.RankedFile;
import com.adlanda.contextassembler.service.FileTreeRenderer;
import com.adlanda.contextassembler.service.remote.ResilientRemoteCaller;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Asks the generative model which files matter, given only the file tree and README.
 *
 * The reply must be a JSON array of paths (or an object with a "files" array). Paths that are not
 * in the tree are dropped; a reply that leaves no valid path is a failure.
 */
@Component
public class AiAssistedSelectionStrategy implements SelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(AiAssistedSelectionStrategy.class);

    public static final String NAME = "ai";

    static final String OPERATION = "select-files";

    private static final String PROMPT_TEMPLATE = """
            You are an expert developer analyzing a project. Identify the files that are most important
            to examine in order to understand this project's structure, purpose and core business logic.

            Prioritize:
            1. Files containing core business logic and domain rules
            2. Files that define key workflows and processes
            3. Main entry points that show how the application logic flows
            4. Files that define data models and their relationships
            5. Build manifests and configuration that shape the application

            Avoid style sheets, static assets, lock files and generated code. Include test files only
            when they clearly demonstrate business logic.

            README:
            %s

            %s
            Respond with ONLY a JSON array of file paths exactly as they appear in the structure above,
            most important first, with no explanation. Example:
            ["src/main.py", "lib/core.py", "models/user.py"]
            """;

    private final ResilientRemoteCaller remoteCaller;
    private final FileTreeRenderer treeRenderer;
    private final ObjectMapper objectMapper;

    public AiAssistedSelectionStrategy(ResilientRemoteCaller remoteCaller, FileTreeRenderer treeRenderer) {
        this.remoteCaller = remoteCaller;
        this.treeRenderer = treeRenderer;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return remoteCaller.isAvailable();
    }

    @Override
    public CandidateRanking rank(FileTree fileTree, SelectionContext context) {
        if (fileTree.isEmpty()) {
            throw new SelectionFailureException(NAME, "no files to choose from");
        }
        String prompt = buildPrompt(fileTree, context);

        String reply;
        try {
            reply = remoteCaller.call(OPERATION, prompt, context.ledger());
        } catch (RemoteCallException e) {
            throw new SelectionFailureException(NAME, "model call failed: " + e.getMessage(), e);
        }

        List<String> suggested = parsePaths(reply);
        Set<String> valid = new LinkedHashSet<>();
        for (String path : suggested) {
            String normalized = FileTree.normalize(path);
            if (fileTree.contains(normalized)) {
                valid.add(normalized);
            } else {
                log.debug("Model suggested a file that is not in the project: {}", path);
            }
        }
        if (valid.isEmpty()) {
            throw new SelectionFailureException(NAME, "model listed " + suggested.size()
                    + " paths but none exist in the project");
        }

        List<RankedFile> ranked = new ArrayList<>(valid.size());
        int n = valid.size();
        int position = 0;
        for (String path : valid) {
            ranked.add(new RankedFile(path, n - position++));
        }
        log.info("AI selected {} valid files ({} suggested)", ranked.size(), suggested.size());
        return new CandidateRanking(NAME, ranked);
    }

    String buildPrompt(FileTree fileTree, SelectionContext context) {
        String readme = context.readmeContent().orElse("No README.md found.");
        return PROMPT_TEMPLATE.formatted(readme, treeRenderer.render(fileTree));
    }

    /**
     * Extracts the list of paths from the model's reply.
     *
     * @throws SelectionFailureException if the reply is not the expected JSON
     */
    List<String> parsePaths(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new SelectionFailureException(NAME, "empty response");
        }
        String cleaned = stripCodeFence(reply.trim());

        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.debug("Raw model reply: {}", reply);
            throw new SelectionFailureException(NAME, "response is not JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode array = root != null && root.isObject() ? root.get("files") : root;
        if (array == null || !array.isArray()) {
            throw new SelectionFailureException(NAME, "response is not a JSON array of paths");
        }
        List<String> paths = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            if (item.isTextual() && !item.asText().isBlank()) {
                paths.add(item.asText().trim());
            } else if (item.isObject() && item.hasNonNull("path")) {
                paths.add(item.get("path").asText().trim());
            }
        }
        return paths;
    }

    private static String stripCodeFence(String text) {
        String cleaned = text;
        if (cleaned.startsWith("```")) {
            int newline = cleaned.indexOf('\n');
            cleaned = newline < 0 ? cleaned.substring(3) : cleaned.substring(newline + 1);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
