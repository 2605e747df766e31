package com.adlanda.contextassembler.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathPatternTest {

    @Test
    void parse_blankCommentAndNegation_areSkipped() {
        assertThat(PathPattern.parse("", false)).isEmpty();
        assertThat(PathPattern.parse("   ", false)).isEmpty();
        assertThat(PathPattern.parse("# comment", false)).isEmpty();
        assertThat(PathPattern.parse("!keep.txt", false)).isEmpty();
    }

    @Test
    void parse_trailingSlash_isDirectoryOnly() {
        PathPattern pattern = PathPattern.parse("logs/", false).orElseThrow();

        assertThat(pattern.directoryOnly()).isTrue();
        assertThat(pattern.anchored()).isFalse();
    }

    @Test
    void parse_innerSlash_isAnchored() {
        assertThat(PathPattern.parse("docs/*.md", false).orElseThrow().anchored()).isTrue();
        assertThat(PathPattern.parse("/docs", false).orElseThrow().anchored()).isTrue();
        assertThat(PathPattern.parse("**/docs", false).orElseThrow().anchored()).isFalse();
    }

    @Test
    void matches_singleStarStaysWithinSegment() {
        PathPattern pattern = PathPattern.parse("src/*.py", false).orElseThrow();

        assertThat(pattern.matches("src/app.py")).isTrue();
        assertThat(pattern.matches("src/pkg/app.py")).isFalse();
    }

    @Test
    void matches_questionMarkAndCharacterClass() {
        PathPattern pattern = PathPattern.parse("file?.[ch]", false).orElseThrow();

        assertThat(pattern.matches("lib/file1.c")).isTrue();
        assertThat(pattern.matches("file2.h")).isTrue();
        assertThat(pattern.matches("file10.c")).isFalse();
        assertThat(pattern.matches("file1.o")).isFalse();
    }

    @Test
    void matches_caseInsensitiveOnlyWhenRequested() {
        assertThat(PathPattern.parse("*.png", true).orElseThrow().matches("LOGO.PNG")).isTrue();
        assertThat(PathPattern.parse("*.png", false).orElseThrow().matches("LOGO.PNG")).isFalse();
    }

    @Test
    void matches_regexMetacharactersAreLiteral() {
        PathPattern pattern = PathPattern.parse("a+b(1).txt", false).orElseThrow();

        assertThat(pattern.matches("a+b(1).txt")).isTrue();
        assertThat(pattern.matches("aab1.txt")).isFalse();
    }

    @Test
    void parse_reversedBracketRange_throwsIllegalArgument() {
        assertThatThrownBy(() -> PathPattern.parse("[z-a].txt", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[z-a].txt");
    }
}
