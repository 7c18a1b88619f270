package org.learningjava.hpes.domain.service.fallback;

import org.junit.jupiter.api.Test;
import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.AstVerdict;
import org.learningjava.hpes.domain.model.BlockType;
import org.learningjava.hpes.domain.model.CandidateRegion;
import org.learningjava.hpes.domain.model.DetectionMethod;
import org.learningjava.hpes.domain.model.ExtractedBlock;
import org.learningjava.hpes.domain.model.ExtractionWarning;
import org.learningjava.hpes.domain.model.RegionOutcome;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.ValidationMethod;
import org.learningjava.hpes.domain.model.WarningKind;
import org.learningjava.hpes.domain.service.language.LanguageProfileLoader;
import org.learningjava.hpes.domain.service.language.LanguageProfileRegistry;
import org.learningjava.hpes.testsupport.Engines;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FallbackExtractorTest {

    private final FallbackExtractor fallback = new FallbackExtractor(Engines.registry(), new ExtractionProperties());

    private static RegionOutcome run(FallbackExtractor extractor, String text, String declared, String hint,
                                     List<ExtractionWarning> warnings) {
        SourceDocument doc = new SourceDocument("t.md", text);
        CandidateRegion region = new CandidateRegion(doc.fullSpan(), declared, hint, DetectionMethod.FENCE);
        return extractor.extract(doc, AstVerdict.rejected(region, warnings));
    }

    private RegionOutcome run(String text, String declared, String hint) {
        return run(fallback, text, declared, hint, List.of());
    }

    @Test
    void declared_language_labels_the_block() {
        RegionOutcome o = run("def f(:\n  return", "py", null);

        assertEquals("python", o.language());
        assertEquals(BlockType.FALLBACK, o.blockType());
        assertEquals(ValidationMethod.RULES_DECLARED, o.validationMethod());
        assertTrue(o.ruleScore() > 0.0);
        assertNull(o.parseReport());
    }

    @Test
    void hint_is_used_when_nothing_is_declared() {
        RegionOutcome o = run("```python\ndef f(x):\n    return x", null, "python");
        assertEquals("python", o.language());
        assertEquals(ValidationMethod.RULES_DECLARED, o.validationMethod());
    }

    @Test
    void unregistered_declaration_defers_to_hint() {
        RegionOutcome o = run("echo hi", "weird-tag", "bash");
        assertEquals("bash", o.language());
    }

    @Test
    void rules_detect_language_when_nothing_is_declared() {
        String script = """
                #!/bin/bash
                if [ -f out.txt ]; then
                  rm out.txt
                fi
                """;
        RegionOutcome o = run(script, null, null);

        assertEquals("bash", o.language());
        assertEquals(ValidationMethod.RULES_DETECTED, o.validationMethod());
        assertEquals(1.0, o.ruleScore(), 1e-9);
    }

    @Test
    void config_files_are_recognised_by_rules() {
        String ios = """
                hostname edge-1
                interface GigabitEthernet0/1
                 ip address 10.0.0.1 255.255.255.0
                 no shutdown
                !
                """;
        assertEquals("cisco_ios", run(ios, null, null).language());
    }

    @Test
    void below_threshold_is_unknown() {
        RegionOutcome o = run("lorem ipsum dolor\nsit amet", null, null);

        assertEquals(ExtractedBlock.UNKNOWN_LANGUAGE, o.language());
        assertTrue(o.isUnknownLanguage());
        assertEquals(ValidationMethod.NONE, o.validationMethod());
        assertEquals(0.0, o.ruleScore(), 1e-9);
    }

    @Test
    void verdict_warnings_are_kept() {
        ExtractionWarning w = ExtractionWarning.of(WarningKind.PARSE_TIMEOUT, "slow");
        RegionOutcome o = run(fallback, "x", null, null, List.of(w));
        assertEquals(List.of(w), o.warnings());
    }

    @Test
    void equal_scores_keep_table_order() throws Exception {
        String yaml = """
                families:
                  - id: config
                languages:
                  - id: first
                    family: config
                    fallback:
                      - { pattern: 'key', weight: 0.5 }
                  - id: second
                    family: config
                    fallback:
                      - { pattern: 'key', weight: 0.5 }
                """;
        LanguageProfileRegistry registry = new LanguageProfileRegistry(
                LanguageProfileLoader.read(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))), List.of());
        FallbackExtractor extractor = new FallbackExtractor(registry, new ExtractionProperties());

        assertEquals("first", extractor.bestMatch("key = value").orElseThrow().profile().id());
        assertTrue(extractor.bestMatch("nothing").isEmpty());
    }
}
