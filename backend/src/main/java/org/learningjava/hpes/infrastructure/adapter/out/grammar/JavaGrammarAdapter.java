package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.Node;
import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Java regions are rarely whole compilation units, so the source is tried as a
 * compilation unit, then as class members, then as a statement block.
 */
@Component
public class JavaGrammarAdapter implements GrammarParserPort {

    private static final Logger log = LoggerFactory.getLogger(JavaGrammarAdapter.class);

    public static final String GRAMMAR_ID = "java";

    private static final String MEMBER_WRAPPER_OPEN = "class HpesRegion {\n";
    private static final String BLOCK_WRAPPER_OPEN = "{\n";
    private static final String WRAPPER_CLOSE = "\n}";

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    public ParseReport parse(String source, ParseBudget budget) {
        List<Function<JavaParser, ParseResult<? extends Node>>> attempts = List.of(
                p -> p.parse(source),
                p -> p.parse(MEMBER_WRAPPER_OPEN + source + WRAPPER_CLOSE),
                p -> p.parseBlock(BLOCK_WRAPPER_OPEN + source + WRAPPER_CLOSE));

        List<Problem> firstProblems = List.of();
        for (int i = 0; i < attempts.size(); i++) {
            budget.checkpoint();
            ParseResult<? extends Node> result = attempts.get(i).apply(newParser());
            if (result.isSuccessful() && result.getResult().isPresent()) {
                if (i > 0) {
                    log.debug("Java region accepted by wrapper attempt {}", i);
                }
                return ParseReport.clean(GRAMMAR_ID, result.getResult().get().findAll(Node.class).size());
            }
            if (i == 0) {
                firstProblems = result.getProblems();
            }
        }
        return ParseReport.failed(GRAMMAR_ID, Math.max(1, firstProblems.size()),
                firstProblems.stream().limit(5).map(Problem::getVerboseMessage).toList());
    }

    private static JavaParser newParser() {
        return new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false));
    }
}
