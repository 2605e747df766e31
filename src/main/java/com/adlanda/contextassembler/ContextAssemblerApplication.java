package com.adlanda.contextassembler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Context Assembler - Main Application
 *
 * Selects the files of a codebase that matter most, ranks them, and loads as many as fit a
 * token budget into a context bundle for AI assistants.
 *
 * This application uses:
 * - Spring Boot 3 with an ApplicationRunner that assembles once at startup
 * - Spring AI for embeddings and chat via OpenAI
 * - resilience4j for retrying rate-limited model calls
 * - JTokkit for token counting
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class ContextAssemblerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextAssemblerApplication.class, args);
    }
}
