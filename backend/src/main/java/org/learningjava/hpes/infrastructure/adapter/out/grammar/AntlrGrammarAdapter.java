package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTreeListener;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Common plumbing for ANTLR generated grammars: collects lexer and parser errors
 * instead of printing them, and checks the parse budget on every rule entry.
 */
public abstract class AntlrGrammarAdapter<P extends Parser> implements GrammarParserPort {

    private static final int MAX_DIAGNOSTICS = 5;

    @Override
    public ParseReport parse(String source, ParseBudget budget) {
        budget.checkpoint();
        ErrorCollector errors = new ErrorCollector();

        Lexer lexer = newLexer(CharStreams.fromString(prepare(source)));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        P parser = newParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        BudgetListener budgetListener = new BudgetListener(budget);
        parser.addParseListener(budgetListener);

        startRule(parser);

        if (errors.count > 0) {
            return ParseReport.failed(grammarId(), errors.count, errors.messages);
        }
        return ParseReport.clean(grammarId(), budgetListener.nodes);
    }

    /** Hook for grammar specific input fix-ups; offsets of the region are not affected. */
    protected String prepare(String source) {
        return source;
    }

    protected abstract Lexer newLexer(CharStream input);

    protected abstract P newParser(TokenStream tokens);

    protected abstract ParserRuleContext startRule(P parser);

    private static final class ErrorCollector extends BaseErrorListener {
        private int count;
        private final List<String> messages = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            count++;
            if (messages.size() < MAX_DIAGNOSTICS) {
                messages.add("line " + line + ":" + charPositionInLine + " " + msg);
            }
        }
    }

    private static final class BudgetListener implements ParseTreeListener {
        private final ParseBudget budget;
        private int nodes;

        private BudgetListener(ParseBudget budget) {
            this.budget = budget;
        }

        @Override
        public void enterEveryRule(ParserRuleContext ctx) {
            budget.checkpoint();
            nodes++;
        }

        @Override
        public void visitTerminal(TerminalNode node) {
            nodes++;
        }

        @Override
        public void visitErrorNode(ErrorNode node) {
        }

        @Override
        public void exitEveryRule(ParserRuleContext ctx) {
        }
    }
}
