package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.junit.jupiter.api.Test;
import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;

import static org.junit.jupiter.api.Assertions.*;

class JsonGrammarAdapterTest {

    private final JsonGrammarAdapter adapter = new JsonGrammarAdapter();

    private ParseReport parse(String source) {
        return adapter.parse(source, ParseBudget.unlimited());
    }

    @Test
    void counts_every_node() {
        ParseReport report = parse("{\"a\": [1, 2], \"b\": {\"c\": null}}");
        assertTrue(report.clean());
        // root, array, 1, 2, object, null
        assertEquals(6, report.nodeCount());
    }

    @Test
    void top_level_array_is_accepted() {
        assertTrue(parse("[true, false]").clean());
    }

    @Test
    void rejects_scalars_trailing_tokens_and_duplicates() {
        assertFalse(parse("42").clean());
        assertFalse(parse("{} {}").clean());
        assertFalse(parse("{\"a\": 1, \"a\": 2}").clean());
        assertFalse(parse("{\"a\": 1,}").clean());
    }

    @Test
    void deep_nesting_is_counted_without_recursion() {
        String deep = "[".repeat(500) + "]".repeat(500);
        assertEquals(500, parse(deep).nodeCount());
    }
}
