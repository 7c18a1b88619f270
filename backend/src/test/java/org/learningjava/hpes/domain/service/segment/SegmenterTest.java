package org.learningjava.hpes.domain.service.segment;

import org.junit.jupiter.api.Test;
import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.CandidateRegion;
import org.learningjava.hpes.domain.model.DetectionMethod;
import org.learningjava.hpes.domain.model.SegmentationMode;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.TextSpan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SegmenterTest {

    private final Segmenter segmenter = new Segmenter(new ExtractionProperties());

    private static SourceDocument doc(String text) {
        return new SourceDocument("test.md", text);
    }

    private List<CandidateRegion> mixed(SourceDocument doc) {
        return segmenter.segment(doc, SegmentationMode.MIXED_CONTENT, null);
    }

    private static void assertLines(SourceDocument doc, CandidateRegion region, int first, int last) {
        assertEquals(first, doc.startLine(region.span()), "start line");
        assertEquals(last, doc.endLine(region.span()), "end line");
    }

    @Test
    void whole_file_is_one_region_without_surrounding_blank_lines() {
        SourceDocument d = new SourceDocument("a.py", "\n\nx = 1\ny = 2\n\n");

        List<CandidateRegion> regions = segmenter.segment(d, SegmentationMode.WHOLE_FILE, "python");

        assertEquals(1, regions.size());
        CandidateRegion r = regions.get(0);
        assertEquals(new TextSpan(2, 13), r.span());
        assertEquals("x = 1\ny = 2", d.slice(r.span()));
        assertEquals("python", r.declaredLanguage());
        assertEquals(DetectionMethod.WHOLE_FILE, r.detectionMethod());
    }

    @Test
    void blank_document_has_no_regions() {
        assertTrue(segmenter.segment(doc(""), SegmentationMode.WHOLE_FILE, null).isEmpty());
        assertTrue(mixed(doc("\n   \n\t\n")).isEmpty());
    }

    @Test
    void fence_interior_becomes_declared_region() {
        SourceDocument d = doc("""
                Intro

                ```Python
                def add(a, b):
                    return a + b
                ```
                Outro
                """);

        List<CandidateRegion> regions = mixed(d);

        assertEquals(1, regions.size());
        CandidateRegion r = regions.get(0);
        assertEquals(DetectionMethod.FENCE, r.detectionMethod());
        assertEquals("python", r.declaredLanguage());
        assertNull(r.languageHint());
        assertLines(d, r, 4, 5);
    }

    @Test
    void closing_fence_must_use_same_character_and_at_least_same_length() {
        SourceDocument d = doc("""
                ~~~~
                a = 1
                ```
                b = 2
                ~~~~~
                after
                """);

        List<CandidateRegion> regions = mixed(d);

        assertEquals(1, regions.size());
        assertLines(d, regions.get(0), 2, 4);
        assertNull(regions.get(0).declaredLanguage());
    }

    @Test
    void unterminated_fence_runs_to_end_with_tag_as_hint() {
        SourceDocument d = doc("""
                Some text.

                ```python
                def f(x):
                    return x
                """);

        List<CandidateRegion> regions = mixed(d);

        assertEquals(1, regions.size());
        CandidateRegion r = regions.get(0);
        assertEquals(DetectionMethod.UNTERMINATED_FENCE, r.detectionMethod());
        assertNull(r.declaredLanguage());
        assertEquals("python", r.languageHint());
        assertLines(d, r, 3, 5);
        assertTrue(d.slice(r.span()).startsWith("```python"));
    }

    @Test
    void empty_fence_yields_nothing() {
        assertTrue(mixed(doc("```\n```\ntext\n")).isEmpty());
        assertTrue(mixed(doc("```sh\n\n\n```\n")).isEmpty());
    }

    @Test
    void indented_code_run_is_detected() {
        SourceDocument d = doc("""
                Here is how to do it:

                    for item in items:
                        if item:
                            print(item)

                That is all.
                """);

        List<CandidateRegion> regions = mixed(d);

        assertEquals(1, regions.size());
        assertEquals(DetectionMethod.INDENTATION, regions.get(0).detectionMethod());
        assertLines(d, regions.get(0), 3, 5);
    }

    @Test
    void dense_paragraph_is_detected() {
        SourceDocument d = doc("""
                Assignments below.

                x[i] = (a+b)*c;
                y[j] = (d-e)/f;
                z[k] = {g, h};

                Thanks.
                """);

        List<CandidateRegion> regions = mixed(d);

        assertEquals(1, regions.size());
        assertEquals(DetectionMethod.DENSITY, regions.get(0).detectionMethod());
        assertLines(d, regions.get(0), 3, 5);
    }

    @Test
    void dense_paragraph_with_indented_body_stays_one_region() {
        SourceDocument d = doc("""
                int total = 0;
                for (int i = 0; i < n; i++) {
                    total += values[i];
                    check(total);
                    log(total);
                }
                """);

        List<CandidateRegion> regions = mixed(d);

        assertEquals(1, regions.size());
        assertLines(d, regions.get(0), 1, 6);
    }

    @Test
    void prose_is_not_a_candidate() {
        SourceDocument d = doc("""
                This is a long sentence (with a remark) about the system.
                The second line is also prose. And here is another one. Then more.
                Finally the end of the paragraph is reached; that is all.
                """);

        assertTrue(mixed(d).isEmpty());
    }

    @Test
    void regions_do_not_overlap_and_are_sorted() {
        SourceDocument d = doc("""
                ```js
                const a = 1;
                ```

                    for item in items:
                        if item:
                            print(item)

                ```sql
                SELECT 1;
                ```
                """);

        List<CandidateRegion> regions = mixed(d);

        assertEquals(3, regions.size());
        for (int i = 1; i < regions.size(); i++) {
            assertTrue(regions.get(i - 1).span().end() <= regions.get(i).span().start());
        }
        assertEquals("js", regions.get(0).declaredLanguage());
        assertEquals(DetectionMethod.INDENTATION, regions.get(1).detectionMethod());
        assertEquals("sql", regions.get(2).declaredLanguage());
    }
}
