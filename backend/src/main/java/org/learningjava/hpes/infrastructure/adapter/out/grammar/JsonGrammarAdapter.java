package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;
import org.springframework.stereotype.Component;

/** Strict JSON: a single object or array, nothing after it. */
@Component
public class JsonGrammarAdapter implements GrammarParserPort {

    public static final String GRAMMAR_ID = "json";

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    public ParseReport parse(String source, ParseBudget budget) {
        budget.checkpoint();
        try {
            JsonNode root = mapper.readTree(source);
            if (root == null || !(root.isObject() || root.isArray())) {
                return ParseReport.failed(GRAMMAR_ID, "root is not an object or array");
            }
            return ParseReport.clean(GRAMMAR_ID, TreeNodes.count(root));
        } catch (JsonProcessingException e) {
            return ParseReport.failed(GRAMMAR_ID, e.getOriginalMessage());
        }
    }
}
