package org.learningjava.hpes.application.usecase;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.BlockStatus;
import org.learningjava.hpes.domain.model.BlockType;
import org.learningjava.hpes.domain.model.DetectionMethod;
import org.learningjava.hpes.domain.model.ExtractedBlock;
import org.learningjava.hpes.domain.model.ExtractionRequest;
import org.learningjava.hpes.domain.model.ExtractionResult;
import org.learningjava.hpes.domain.model.InputDecodeException;
import org.learningjava.hpes.domain.model.SegmentationMode;
import org.learningjava.hpes.domain.model.TextSpan;
import org.learningjava.hpes.domain.model.ValidationMethod;
import org.learningjava.hpes.domain.model.WarningKind;
import org.learningjava.hpes.testsupport.Engines;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExtractBlocksUseCaseTest {

    private static final String NOTES = """
            # Notes

            Some intro text.

            ```python
            def f(x):
                return x + 1
            ```

            Done.
            """;

    private Engines.Engine engine;
    private ExtractBlocksUseCase useCase;

    @BeforeEach
    void setUp() {
        engine = Engines.engine();
        useCase = engine.extractBlocks();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void fenced_python_in_markdown_becomes_ast_block() {
        ExtractionResult r = useCase.extract(ExtractionRequest.of("notes.md", NOTES));

        assertEquals(SegmentationMode.MIXED_CONTENT, r.mode());
        assertEquals(1, r.blocks().size());
        ExtractedBlock b = r.blocks().get(0);
        assertEquals("python", b.language());
        assertEquals(BlockType.AST, b.blockType());
        assertEquals(ValidationMethod.GRAMMAR_DECLARED, b.validationMethod());
        assertEquals(DetectionMethod.FENCE, b.detectionMethod());
        assertEquals(BlockStatus.PENDING, b.status());
        assertEquals(6, b.startLine());
        assertEquals(7, b.endLine());
        assertEquals("def f(x):\n    return x + 1", b.content());
        assertTrue(b.confidenceScore() >= 0.75);
        assertEquals(1, r.stats().astParsed());
        assertTrue(r.warnings().isEmpty());
    }

    @Test
    void unterminated_fence_falls_back_with_hint() {
        String truncated = "Intro.\n\n```python\ndef f(x):\n    return x\n";
        ExtractionResult r = useCase.extract(ExtractionRequest.of("cut.md", truncated));

        assertEquals(1, r.blocks().size());
        ExtractedBlock b = r.blocks().get(0);
        assertEquals(BlockType.FALLBACK, b.blockType());
        assertEquals("python", b.language());
        assertEquals(ValidationMethod.RULES_DECLARED, b.validationMethod());
        assertEquals(DetectionMethod.UNTERMINATED_FENCE, b.detectionMethod());
        assertTrue(b.content().startsWith("```python"));
        assertTrue(b.confidenceScore() <= 0.70);
    }

    @Test
    void prose_in_unknown_file_type_is_low_confidence_unknown() {
        String prose = "The meeting is moved to Friday afternoon.\nPlease bring the quarterly report and your notes.\n";
        ExtractionResult r = useCase.extract(ExtractionRequest.of("data.xyz", prose));

        assertEquals(SegmentationMode.WHOLE_FILE, r.mode());
        assertEquals(1, r.blocks().size());
        ExtractedBlock b = r.blocks().get(0);
        assertEquals(ExtractedBlock.UNKNOWN_LANGUAGE, b.language());
        assertEquals(ValidationMethod.NONE, b.validationMethod());
        assertTrue(b.confidenceScore() <= 0.20);
        assertEquals(1, r.stats().unknownLanguage());
    }

    @Test
    void source_file_is_one_block_labelled_by_extension() {
        String src = "import sys\n\n\ndef main():\n    print(sys.argv)\n";
        ExtractionResult r = useCase.extract(ExtractionRequest.of("src/app.py", src));

        assertEquals(SegmentationMode.WHOLE_FILE, r.mode());
        ExtractedBlock b = r.blocks().get(0);
        assertEquals("python", b.language());
        assertEquals(ValidationMethod.GRAMMAR_DECLARED, b.validationMethod());
        assertEquals(DetectionMethod.WHOLE_FILE, b.detectionMethod());
        assertEquals(1, b.startLine());
        assertEquals(5, b.endLine());
        assertEquals(List.of(new TextSpan(src.length() - 1, src.length())), r.filler());
    }

    @Test
    void declared_language_overrides_document_extension() {
        ExtractionRequest req = new ExtractionRequest("{\"a\": 1}".getBytes(StandardCharsets.UTF_8),
                "snippet.md", " JSON ", null);
        ExtractionResult r = useCase.extract(req);

        assertEquals(SegmentationMode.WHOLE_FILE, r.mode());
        assertEquals("json", r.blocks().get(0).language());
        assertEquals(BlockType.AST, r.blocks().get(0).blockType());
    }

    @Test
    void same_input_gives_identical_result() {
        ExtractionResult first = useCase.extract(ExtractionRequest.of("notes.md", NOTES));
        ExtractionResult second = useCase.extract(ExtractionRequest.of("notes.md", NOTES));
        assertEquals(first, second);
    }

    @Test
    void concurrent_runs_over_many_regions_give_identical_results() throws Exception {
        StringBuilder doc = new StringBuilder("# Many snippets\n\n");
        for (int i = 0; i < 24; i++) {
            doc.append("Step ").append(i).append(" is below.\n\n```python\ndef step")
                    .append(i).append("(x):\n    return x * ").append(i).append("\n```\n\n");
        }
        ExtractionRequest request = ExtractionRequest.of("many.md", doc.toString());
        ExtractionResult expected = useCase.extract(request);
        assertEquals(24, expected.stats().astParsed());

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<ExtractionResult>> runs = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                runs.add(callers.submit(() -> useCase.extract(request)));
            }
            for (Future<ExtractionResult> run : runs) {
                assertEquals(expected, run.get(60, TimeUnit.SECONDS));
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void operator_soup_declared_as_javascript_is_not_an_ast_block() {
        ExtractionRequest req = new ExtractionRequest("= = = ; ( )".getBytes(StandardCharsets.UTF_8),
                "snippet.txt", "javascript", null);
        ExtractionResult r = useCase.extract(req);

        ExtractedBlock b = r.blocks().get(0);
        assertEquals(BlockType.FALLBACK, b.blockType());
        assertEquals("javascript", b.language());
        assertEquals(ValidationMethod.RULES_DECLARED, b.validationMethod());
        assertTrue(b.confidenceScore() <= 0.70);
        assertTrue(r.warnings().stream().anyMatch(w -> w.kind() == WarningKind.PARSE_FAILURE));
    }

    @Test
    void bracket_balanced_prose_is_never_accepted_by_a_grammar() {
        String prose = """
                Our road map => ship it (soon) and then [maybe] more.
                The team agreed on {three} goals; the rest can wait.
                Nobody expects this paragraph to compile (really).
                """;
        ExtractionResult r = useCase.extract(ExtractionRequest.of("notes.dat", prose));

        assertFalse(r.blocks().isEmpty());
        for (ExtractedBlock b : r.blocks()) {
            assertNotEquals(BlockType.AST, b.blockType());
            assertTrue(b.confidenceScore() <= 0.70);
        }
    }

    @Test
    void crashing_grammar_degrades_to_fallback() {
        GrammarParserPort broken = mock(GrammarParserPort.class);
        when(broken.grammarId()).thenReturn("python");
        when(broken.parse(anyString(), any())).thenThrow(new IllegalStateException("boom"));

        try (Engines.Engine degraded = Engines.engine(new ExtractionProperties(), Engines.grammarsWith(broken))) {
            ExtractionResult r = degraded.extractBlocks().extract(ExtractionRequest.of("notes.md", NOTES));

            assertEquals(1, r.blocks().size());
            assertEquals(BlockType.FALLBACK, r.blocks().get(0).blockType());
            assertEquals("python", r.blocks().get(0).language());
            assertEquals(ValidationMethod.RULES_DECLARED, r.blocks().get(0).validationMethod());
            assertTrue(r.warnings().stream().anyMatch(w -> w.kind() == WarningKind.PARSE_FAILURE));
        }
    }

    @Test
    void empty_input_has_no_blocks() {
        ExtractionResult r = useCase.extract(ExtractionRequest.of("empty.md", ""));
        assertTrue(r.blocks().isEmpty());
        assertTrue(r.filler().isEmpty());
        assertFalse(r.hasCode());
    }

    @Test
    void undecodable_input_is_rejected() {
        byte[] garbage = {(byte) 0x80, (byte) 0x81, (byte) 0xFE, (byte) 0xC0};
        assertThrows(InputDecodeException.class, () -> useCase.extract(ExtractionRequest.of("bad.txt", garbage)));
    }

    @Test
    void blocks_and_filler_partition_random_documents() {
        String[] pieces = {"def f(x):", "    return x", "{", "}", "```", "```js", "x = [1, 2];", "Hello there.",
                "SELECT a FROM b;", "", "  ", "# title", "\tindented()", "if (a) { b(); }", "key: value", "<a/>"};
        Random random = new Random(42);
        for (int round = 0; round < 40; round++) {
            StringBuilder sb = new StringBuilder();
            int lines = random.nextInt(30);
            for (int i = 0; i < lines; i++) {
                sb.append(pieces[random.nextInt(pieces.length)]);
                if (i < lines - 1 || random.nextBoolean()) {
                    sb.append('\n');
                }
            }
            String text = sb.toString();
            String name = random.nextBoolean() ? "r" + round + ".md" : "r" + round + ".py";
            ExtractionResult r = useCase.extract(ExtractionRequest.of(name, text));

            List<TextSpan> spans = new ArrayList<>(r.filler());
            for (ExtractedBlock b : r.blocks()) {
                assertEquals(text.substring(b.startOffset(), b.endOffset()), b.content(), name);
                spans.add(b.span());
            }
            spans.sort(Comparator.naturalOrder());
            int cursor = 0;
            for (TextSpan s : spans) {
                assertEquals(cursor, s.start(), name);
                cursor = s.end();
            }
            assertEquals(text.length(), cursor, name);
        }
    }

    @Test
    void select_mode_by_extension_and_declaration() {
        assertEquals(SegmentationMode.MIXED_CONTENT, useCase.selectMode("README.MD", null));
        assertEquals(SegmentationMode.MIXED_CONTENT, useCase.selectMode("docs/manual.pdf", null));
        assertEquals(SegmentationMode.WHOLE_FILE, useCase.selectMode("README.md", "python"));
        assertEquals(SegmentationMode.WHOLE_FILE, useCase.selectMode("Main.java", null));
        assertEquals(SegmentationMode.WHOLE_FILE, useCase.selectMode("Makefile", null));
    }
}
