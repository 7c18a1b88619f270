package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statements;
import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;
import org.springframework.stereotype.Component;

@Component
public class SqlGrammarAdapter implements GrammarParserPort {

    public static final String GRAMMAR_ID = "sql";

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    public ParseReport parse(String source, ParseBudget budget) {
        budget.checkpoint();
        try {
            Statements statements = CCJSqlParserUtil.parseStatements(source);
            if (statements == null || statements.isEmpty()) {
                return ParseReport.failed(GRAMMAR_ID, "no SQL statement");
            }
            return ParseReport.clean(GRAMMAR_ID, statements.size());
        } catch (JSQLParserException e) {
            String message = e.getMessage() == null ? "SQL syntax error" : e.getMessage().lines().findFirst().orElse("");
            return ParseReport.failed(GRAMMAR_ID, message);
        }
    }
}
