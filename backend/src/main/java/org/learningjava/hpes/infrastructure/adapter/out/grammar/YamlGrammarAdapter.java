package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;
import org.learningjava.hpes.domain.model.parse.ParseTimeoutException;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * YAML stream check. Every document must be a mapping or a sequence; a bare scalar
 * is plain text as far as extraction is concerned.
 */
@Component
public class YamlGrammarAdapter implements GrammarParserPort {

    public static final String GRAMMAR_ID = "yaml";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    public ParseReport parse(String source, ParseBudget budget) {
        int documents = 0;
        int nodes = 0;
        try (MappingIterator<JsonNode> it = mapper.readerFor(JsonNode.class).readValues(source)) {
            while (it.hasNextValue()) {
                budget.checkpoint();
                JsonNode doc = it.nextValue();
                if (doc == null || doc.isNull() || doc.isMissingNode()) {
                    continue;
                }
                if (!(doc.isObject() || doc.isArray())) {
                    return ParseReport.failed(GRAMMAR_ID, "document " + (documents + 1) + " is a scalar");
                }
                documents++;
                nodes += TreeNodes.count(doc);
            }
        } catch (ParseTimeoutException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            return ParseReport.failed(GRAMMAR_ID, e.getMessage() == null ? "YAML syntax error"
                    : e.getMessage().lines().findFirst().orElse("YAML syntax error"));
        }
        return documents == 0
                ? ParseReport.failed(GRAMMAR_ID, "no YAML document")
                : ParseReport.clean(GRAMMAR_ID, nodes);
    }
}
