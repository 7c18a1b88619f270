package org.learningjava.hpes.domain.model.language;

import org.learningjava.hpes.application.port.GrammarParserPort;

/**
 * A profile resolved for one region: either grammar-backed or rules-only.
 */
public record LanguageDispatch(LanguageProfile profile, GrammarParserPort grammar) {

    public static LanguageDispatch rulesOnly(LanguageProfile profile) {
        return new LanguageDispatch(profile, null);
    }

    public boolean hasGrammar() {
        return grammar != null;
    }

    public String languageId() {
        return profile.id();
    }
}
