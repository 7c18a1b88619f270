package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.TokenStream;
import org.springframework.stereotype.Component;
import python3.Python3Lexer;
import python3.Python3Parser;

@Component
public class PythonGrammarAdapter extends AntlrGrammarAdapter<Python3Parser> {

    public static final String GRAMMAR_ID = "python";

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    // the INDENT/DEDENT lexer closes the last logical line on a newline
    @Override
    protected String prepare(String source) {
        return source.endsWith("\n") ? source : source + "\n";
    }

    @Override
    protected Lexer newLexer(CharStream input) {
        return new Python3Lexer(input);
    }

    @Override
    protected Python3Parser newParser(TokenStream tokens) {
        return new Python3Parser(tokens);
    }

    @Override
    protected ParserRuleContext startRule(Python3Parser parser) {
        return parser.file_input();
    }
}
