package org.learningjava.hpes.application.port;

import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;

/**
 * Full structural parse of a text against one grammar. Implementations are pure
 * functions of their input and safe to call from several threads at once.
 */
public interface GrammarParserPort {

    /** Id referenced by the {@code grammar} key of language profiles. */
    String grammarId();

    ParseReport parse(String source, ParseBudget budget);
}
