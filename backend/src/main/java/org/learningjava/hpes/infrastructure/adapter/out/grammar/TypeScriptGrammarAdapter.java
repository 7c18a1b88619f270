package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterTypescript;

/** Plain TypeScript; TSX markup is left to the fallback rules. */
@Component
public class TypeScriptGrammarAdapter extends TreeSitterGrammarAdapter {

    public static final String GRAMMAR_ID = "typescript";

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    protected TSLanguage language() {
        return new TreeSitterTypescript();
    }
}
