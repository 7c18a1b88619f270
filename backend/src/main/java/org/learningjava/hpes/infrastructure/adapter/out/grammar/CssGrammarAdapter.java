package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterCss;

/** Plain CSS stylesheets; SCSS and LESS nesting usually fails and falls back to rules. */
@Component
public class CssGrammarAdapter extends TreeSitterGrammarAdapter {

    public static final String GRAMMAR_ID = "css";

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    protected TSLanguage language() {
        return new TreeSitterCss();
    }
}
