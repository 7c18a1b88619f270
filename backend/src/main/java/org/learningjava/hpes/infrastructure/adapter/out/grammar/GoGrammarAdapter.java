package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterGo;

@Component
public class GoGrammarAdapter extends TreeSitterGrammarAdapter {

    public static final String GRAMMAR_ID = "go";

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    protected TSLanguage language() {
        return new TreeSitterGo();
    }
}
