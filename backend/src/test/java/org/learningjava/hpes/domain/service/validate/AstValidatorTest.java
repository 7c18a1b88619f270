package org.learningjava.hpes.domain.service.validate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.AstVerdict;
import org.learningjava.hpes.domain.model.CandidateRegion;
import org.learningjava.hpes.domain.model.DetectionMethod;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.TextSpan;
import org.learningjava.hpes.domain.model.ValidationMethod;
import org.learningjava.hpes.domain.model.WarningKind;
import org.learningjava.hpes.testsupport.Engines;
import org.learningjava.hpes.testsupport.SlowPythonGrammar;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstValidatorTest {

    private Engines.Engine engine = Engines.engine();

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static CandidateRegion whole(SourceDocument doc, String declared) {
        return new CandidateRegion(doc.fullSpan(), declared, null, DetectionMethod.FENCE);
    }

    private AstVerdict validate(String text, String declared) {
        SourceDocument doc = new SourceDocument("t.md", text);
        return engine.validator().validate(doc, List.of(whole(doc, declared))).get(0);
    }

    @Test
    void declared_language_is_checked_with_its_grammar() {
        AstVerdict v = validate("def add(a, b):\n    return a + b", "py");

        assertTrue(v.isAccepted());
        assertEquals("python", v.language());
        assertEquals(ValidationMethod.GRAMMAR_DECLARED, v.validationMethod());
        assertTrue(v.warnings().isEmpty());
    }

    @Test
    void declared_language_that_does_not_parse_goes_to_fallback_with_warning() {
        AstVerdict v = validate("def add(a, b)\n    return a +", "python");

        assertFalse(v.isAccepted());
        assertEquals(ValidationMethod.NONE, v.validationMethod());
        assertEquals(1, v.warnings().size());
        assertEquals(WarningKind.PARSE_FAILURE, v.warnings().get(0).kind());
    }

    @Test
    void declared_rules_only_language_is_unsupported() {
        AstVerdict v = validate("<div><p>hi</p></div>", "html");

        assertFalse(v.isAccepted());
        assertEquals(WarningKind.UNSUPPORTED_LANGUAGE, v.warnings().get(0).kind());
    }

    @Test
    void unregistered_tag_falls_back_to_guessing() {
        AstVerdict v = validate("{\n  \"name\": \"hpes\",\n  \"tags\": [1, 2]\n}", "jsonish");

        assertTrue(v.isAccepted());
        assertEquals("json", v.language());
        assertEquals(ValidationMethod.GRAMMAR_GUESSED, v.validationMethod());
    }

    @Test
    void failed_guesses_add_no_warnings() {
        AstVerdict v = validate("def broken(x):\n    return )", null);

        assertFalse(v.isAccepted());
        assertTrue(v.warnings().isEmpty());
    }

    @Test
    void indented_regions_are_parsed_after_removing_common_indent() {
        AstVerdict v = validate("    def f(x):\n        return x\n", "python");
        assertTrue(v.isAccepted());
    }

    @Test
    void oversized_region_skips_grammars() {
        ExtractionProperties props = new ExtractionProperties();
        props.getValidation().setMaxRegionChars(10);
        engine.close();
        engine = Engines.engine(props, Engines.grammars());

        AstVerdict v = validate("x = 1\ny = 2\nz = 3\n", "python");

        assertFalse(v.isAccepted());
        assertEquals(WarningKind.PARSE_FAILURE, v.warnings().get(0).kind());
        assertTrue(v.warnings().get(0).message().contains("above the grammar limit"));
    }

    @Test
    void slow_declared_parse_becomes_timeout_warning() {
        ExtractionProperties props = new ExtractionProperties();
        props.getValidation().setRegionTimeout(Duration.ofMillis(200));
        engine.close();
        engine = Engines.engine(props, Engines.grammarsWith(new SlowPythonGrammar()));

        AstVerdict v = validate("x = 1  " + SlowPythonGrammar.MARKER + "\n", "python");

        assertFalse(v.isAccepted());
        assertEquals(WarningKind.PARSE_TIMEOUT, v.warnings().get(0).kind());
    }

    @Test
    void verdicts_keep_region_order() {
        String text = "SELECT id FROM users;\n\nx = [1, 2]\n\n<a><b/></a>\n";
        SourceDocument doc = new SourceDocument("t.md", text);
        List<CandidateRegion> regions = List.of(
                new CandidateRegion(new TextSpan(0, 21), "sql", null, DetectionMethod.FENCE),
                new CandidateRegion(new TextSpan(23, 33), "python", null, DetectionMethod.FENCE),
                new CandidateRegion(new TextSpan(35, 46), "xml", null, DetectionMethod.FENCE));

        List<AstVerdict> verdicts = engine.validator().validate(doc, regions);

        assertEquals(List.of("sql", "python", "xml"), verdicts.stream().map(AstVerdict::language).toList());
        assertTrue(verdicts.stream().allMatch(AstVerdict::isAccepted));
    }

    @Test
    void deindent_removes_shared_prefix_only() {
        assertEquals("a\n  b\n\nc", AstValidator.deindent("    a\n      b\n\n    c"));
        assertEquals("a\n b", AstValidator.deindent("a\n b"));
        assertEquals("x\ny", AstValidator.deindent("\tx\n\ty"));
    }
}
