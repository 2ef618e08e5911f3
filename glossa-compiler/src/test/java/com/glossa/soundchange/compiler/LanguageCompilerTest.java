package com.glossa.soundchange.compiler;

import com.glossa.soundchange.api.exceptions.CompilationException;
import com.glossa.soundchange.api.exceptions.DuplicateBundleException;
import com.glossa.soundchange.api.exceptions.MalformedRuleException;
import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundChangeRule;
import com.glossa.soundchange.runtime.model.LanguageModel;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageCompilerTest {

    private static final String LETTERS = """
                "consonants": [
                    {"symbol": "t", "features": ["voiceless", "dental", "plosive"]},
                    {"symbol": "d", "features": ["voiced", "dental", "plosive"]},
                    {"symbol": "h", "features": ["voiceless", "glottal", "fricative"]}
                ],
                "vowels": [
                    {"symbol": "a", "features": ["unrounded", "open", "central"]}
                ]
            """;

    @TempDir
    Path tempDir;

    private LanguageCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new LanguageCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    private Path writeLanguage(String body) throws IOException {
        Path file = tempDir.resolve("language.json");
        Files.writeString(file, "{ \"name\": \"Tada\",\n" + LETTERS + body + "}");
        return file;
    }

    @Test
    @DisplayName("Should compile letters, rules, syllables and affixes")
    void shouldCompileFullLanguage() throws IOException {
        Path file = writeLanguage("""
                ,
                "syllables": [["C", "V"], ["C", "V", "C"]],
                "affixes": {"plural": ["-", "a", "t"], "agent": ["h", "a", "-"]},
                "rules": [
                    {"id": "initial-voicing", "source": ["t"], "target": ["d"], "environment": "#_V"},
                    {"source": ["h"], "target": [""]}
                ]
                """);

        LanguageModel model = compiler.compile(file);

        assertThat(model.name()).isEqualTo("Tada");
        assertThat(model.inventory().size()).isEqualTo(4);
        assertThat(model.syllableStructures()).hasSize(2);
        assertThat(model.affixes()).containsKeys("plural", "agent");
        assertThat(model.ruleSet().rules()).extracting(SoundChangeRule::id)
                .containsExactly("initial-voicing", "rule-1");

        SoundChangeRule voicing = model.ruleSet().get("initial-voicing").orElseThrow();
        assertThat(voicing.environment())
                .containsExactly(MatchSpec.boundary(), MatchSpec.focus(), MatchSpec.vowel());
        assertThat(model.ruleSet().get("rule-1").orElseThrow().target())
                .containsExactly(MatchSpec.deletion());
    }

    @Test
    @DisplayName("Should report the index of a malformed rule")
    void shouldRejectMalformedRule() throws IOException {
        Path file = writeLanguage("""
                ,
                "rules": [
                    {"source": ["t", "a"], "target": ["d"]}
                ]
                """);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(MalformedRuleException.class)
                .hasMessageContaining("Rule at index 0")
                .hasMessageContaining("source has 2 slots but target has 1");
    }

    @Test
    @DisplayName("Should reject two letters with one feature bundle")
    void shouldRejectDuplicateBundle() throws IOException {
        Path file = tempDir.resolve("dup.json");
        Files.writeString(file, """
                {
                    "consonants": [
                        {"symbol": "t", "features": ["voiceless", "dental", "plosive"]},
                        {"symbol": "T", "features": ["plosive", "voiceless", "dental"]}
                    ]
                }
                """);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(DuplicateBundleException.class);
    }

    @Test
    @DisplayName("Should reject affix without attachment marker")
    void shouldRejectAffixWithoutMarker() throws IOException {
        Path file = writeLanguage("""
                ,
                "affixes": {"plural": ["a", "t"]}
                """);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Affix 'plural'");
    }

    @Test
    @DisplayName("Should reject boundary inside a syllable structure")
    void shouldRejectBoundaryInSyllable() throws IOException {
        Path file = writeLanguage("""
                ,
                "syllables": [["#", "V"]]
                """);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("cannot contain '#'");
    }

    @Test
    @DisplayName("Should surface unreadable JSON as IOException")
    void shouldFailOnInvalidJson() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"name\": ");

        assertThatThrownBy(() -> compiler.compile(file)).isInstanceOf(IOException.class);
    }
}
