package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterRust;

@Component
public class RustGrammarAdapter extends TreeSitterGrammarAdapter {

    public static final String GRAMMAR_ID = "rust";

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    protected TSLanguage language() {
        return new TreeSitterRust();
    }
}
