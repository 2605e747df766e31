package com.adlanda.contextassembler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service responsible for reading the project from the filesystem.
 *
 * Walks the root directory, pruning ignored directories while walking, locates the README
 * and provides a reader for file contents.
 */
@Service
public class ProjectScanner {

    private static final Logger log = LoggerFactory.getLogger(ProjectScanner.class);

    public static final String README = "README.md";

    /**
     * Lists every non-ignored regular file under the root, as relative paths in walk order.
     */
    public List<String> scan(Path root, IgnoreRuleEngine ignoreRules) {
        if (!Files.isDirectory(root)) {
            log.warn("Project root does not exist or is not a directory: {}", root);
            return List.of();
        }

        List<String> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    return ignoreRules.shouldIgnoreDirectory(relative(root, dir))
                            ? FileVisitResult.SKIP_SUBTREE
                            : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        String rel = relative(root, file);
                        if (!ignoreRules.shouldIgnore(rel)) {
                            files.add(rel);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Cannot access {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.error("Failed to walk project directory: {}", root, e);
        }

        files.sort(null);
        log.info("Found {} files under {}", files.size(), root);
        return files;
    }

    /**
     * Reads the root README.md if the project has one.
     */
    public Optional<String> readReadme(Path root) {
        Path readme = root.resolve(README);
        if (!Files.isRegularFile(readme)) {
            log.warn("{} not found in {}", README, root);
            return Optional.empty();
        }
        try {
            String content = readText(readme);
            log.info("{} contains {} characters", README, content.length());
            return Optional.of(content);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", readme, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reader resolving relative paths against the root.
     */
    public FileContentReader contentReader(Path root) {
        return path -> readText(root.resolve(path));
    }

    /**
     * Reads a file as UTF-8, replacing malformed input instead of failing.
     */
    static String readText(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }

    private static String relative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
