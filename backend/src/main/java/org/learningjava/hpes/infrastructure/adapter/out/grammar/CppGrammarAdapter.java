package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterCpp;

/** C++ grammar, also serving C regions; C sources outside the C++ subset fall back to rules. */
@Component
public class CppGrammarAdapter extends TreeSitterGrammarAdapter {

    public static final String GRAMMAR_ID = "cpp";

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    protected TSLanguage language() {
        return new TreeSitterCpp();
    }
}
