package com.adlanda.contextassembler.service.remote;

import com.adlanda.contextassembler.config.AssemblyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dumps prompts, replies and errors of remote calls to files when debugging is enabled.
 */
@Component
public class RemoteCallDebugWriter {

    private static final Logger log = LoggerFactory.getLogger(RemoteCallDebugWriter.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final boolean enabled;
    private final Path directory;
    private final AtomicInteger sequence = new AtomicInteger();

    @Autowired
    public RemoteCallDebugWriter(AssemblyProperties properties) {
        this(properties.isDebugRemoteCalls(), Path.of(properties.getDebugDir()));
    }

    public RemoteCallDebugWriter(boolean enabled, Path directory) {
        this.enabled = enabled;
        this.directory = directory;
        if (enabled) {
            log.info("Remote call debugging enabled, writing to {}", directory.toAbsolutePath());
        }
    }

    public void prompt(String operation, String prompt) {
        write("prompt", operation, prompt);
    }

    public void reply(String operation, String reply) {
        write("response", operation, reply);
    }

    public void error(String operation, int attempt, Throwable error) {
        write("error", operation, "Attempt " + attempt + "\n\n" + error);
    }

    public boolean isEnabled() {
        return enabled;
    }

    private void write(String kind, String operation, String body) {
        if (!enabled) {
            return;
        }
        String name = String.format("%s_%s_%s_%03d.txt", kind, sanitize(operation),
                LocalDateTime.now().format(STAMP), sequence.incrementAndGet());
        Path file = directory.resolve(name);
        try {
            Files.createDirectories(directory);
            Files.writeString(file, body == null ? "" : body, StandardCharsets.UTF_8);
            log.info("DEBUG: {} for {} saved to {}", kind, operation, file);
        } catch (IOException e) {
            log.warn("Could not write debug file {}: {}", file, e.getMessage());
        }
    }

    private static String sanitize(String operation) {
        return operation.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
