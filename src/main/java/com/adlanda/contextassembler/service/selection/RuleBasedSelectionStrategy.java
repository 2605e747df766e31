package com.adlanda.contextassembler.service.selection;

import com.adlanda.contextassembler.model.CandidateRanking;
import com.adlanda.contextassembler.model.FileTree;
import com.adlanda.contextassembler.model.RankedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic ranking from file names and directory positions.
 *
 * Needs no network or model, never throws, and is the last link of every fallback chain.
 */
@Component
public class RuleBasedSelectionStrategy implements SelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedSelectionStrategy.class);

    public static final String NAME = "rules";

    /**
     * Weight categories, checked in declaration order; the first match wins.
     */
    enum Category {
        EXCLUDED(0),
        TEST(10),
        ENTRY_POINT(100),
        BUILD_CONFIG(90),
        DOCUMENTATION(70),
        SOURCE_DIRECTORY(50),
        SOURCE_CODE(30),
        OTHER(5);

        final int weight;

        Category(int weight) {
            this.weight = weight;
        }
    }

    private static final Pattern STYLESHEET = Pattern.compile(".*\\.(css|scss|sass|less|styl)$");
    private static final Pattern GENERATED = Pattern.compile(".*(\\.min\\.(js|css)|\\.map|\\.generated\\.[a-z]+|\\.pb\\.go|_pb2\\.py)$");
    private static final Set<String> LOCK_FILES = Set.of(
            "package-lock.json", "yarn.lock", "pnpm-lock.yaml", "poetry.lock", "pipfile.lock",
            "cargo.lock", "composer.lock", "gemfile.lock", "go.sum", "gradle.lockfile");

    private static final Pattern TEST_NAME = Pattern.compile(
            "^(test_.*|.*_test\\.[a-z]+|.*\\.(test|spec)\\.[a-z]+|conftest\\.py)$");
    // JVM/.NET test classes, matched against the original case: OrderServiceTest.java, not Contest.java
    private static final Pattern TEST_CLASS_NAME = Pattern.compile(
            "^(?:[A-Za-z0-9_]*[a-z0-9_])?(Test|Tests|IT)\\.(java|kt|scala|cs)$");
    private static final Set<String> TEST_DIRECTORIES = Set.of("test", "tests", "__tests__", "spec", "specs");

    private static final Pattern ENTRY_POINT = Pattern.compile(
            "^(main|index|app|server|cli|__main__|manage|program|application)\\.[a-z]+$"
                    + "|^.*application\\.(java|kt)$");

    private static final Set<String> BUILD_CONFIG = Set.of(
            "package.json", "setup.py", "setup.cfg", "pyproject.toml", "requirements.txt", "pipfile",
            "pom.xml", "build.gradle", "build.gradle.kts", "settings.gradle", "settings.gradle.kts",
            "cargo.toml", "go.mod", "gemfile", "composer.json", "makefile", "cmakelists.txt",
            "dockerfile", "docker-compose.yml", "docker-compose.yaml", "tsconfig.json",
            "webpack.config.js", "vite.config.js", "vite.config.ts", ".env.example",
            "application.properties", "application.yml", "application.yaml", ".gitignore");

    private static final Pattern DOCUMENTATION = Pattern.compile("^(readme|contributing|architecture|changelog)(\\.[a-z]+)?$");

    private static final Set<String> SOURCE_DIRECTORIES = Set.of(
            "src", "app", "lib", "core", "pkg", "internal", "cmd", "controllers", "models",
            "services", "domain", "api", "handlers", "routes");

    private static final Set<String> SOURCE_EXTENSIONS = Set.of(
            "java", "kt", "scala", "groovy", "py", "js", "jsx", "ts", "tsx", "go", "rs", "rb", "php",
            "c", "h", "cpp", "hpp", "cc", "cs", "swift", "m", "sql", "sh", "vue", "svelte", "ex", "exs",
            "clj", "dart", "lua", "r", "pl");

    private static final Comparator<RankedFile> BY_WEIGHT = Comparator
            .comparingDouble(RankedFile::score).reversed()
            .thenComparingInt(f -> FileTree.depth(f.path()))
            .thenComparing(RankedFile::path);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CandidateRanking rank(FileTree fileTree, SelectionContext context) {
        List<RankedFile> ranked = new ArrayList<>();
        List<RankedFile> excluded = new ArrayList<>();
        for (String path : fileTree.paths()) {
            Category category = categorize(path);
            if (category == Category.EXCLUDED) {
                excluded.add(new RankedFile(path, 0));
            } else {
                ranked.add(new RankedFile(path, category.weight));
            }
        }
        ranked.sort(BY_WEIGHT);

        if (ranked.isEmpty() && !excluded.isEmpty()) {
            log.warn("Every file is in an excluded category; keeping all {} of them", excluded.size());
            return new CandidateRanking(NAME, excluded);
        }
        log.info("Rule-based selection ranked {} files ({} excluded)", ranked.size(), excluded.size());
        return new CandidateRanking(NAME, ranked);
    }

    static Category categorize(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        String[] segments = lower.split("/");
        String fileName = segments[segments.length - 1];
        String extension = extension(fileName);

        if (STYLESHEET.matcher(fileName).matches() || GENERATED.matcher(fileName).matches()
                || LOCK_FILES.contains(fileName) || fileName.endsWith(".lock")) {
            return Category.EXCLUDED;
        }
        String originalFileName = path.substring(path.lastIndexOf('/') + 1);
        if (TEST_NAME.matcher(fileName).matches() || TEST_CLASS_NAME.matcher(originalFileName).matches()
                || inDirectory(segments, TEST_DIRECTORIES)) {
            return Category.TEST;
        }
        if (ENTRY_POINT.matcher(fileName).matches()) {
            return Category.ENTRY_POINT;
        }
        if (BUILD_CONFIG.contains(fileName)) {
            return Category.BUILD_CONFIG;
        }
        if (DOCUMENTATION.matcher(fileName).matches()) {
            return Category.DOCUMENTATION;
        }
        if (segments.length > 1 && SOURCE_DIRECTORIES.contains(segments[0])) {
            return Category.SOURCE_DIRECTORY;
        }
        if (SOURCE_EXTENSIONS.contains(extension)) {
            return Category.SOURCE_CODE;
        }
        return Category.OTHER;
    }

    private static boolean inDirectory(String[] segments, Set<String> directories) {
        for (int i = 0; i < segments.length - 1; i++) {
            if (directories.contains(segments[i])) {
                return true;
            }
        }
        return false;
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1);
    }
}
