package org.learningjava.hpes.domain.model.language;

import java.util.regex.Pattern;

/** One declarative rule: a compiled pattern and the weight it contributes when it matches. */
public record WeightedPattern(Pattern pattern, double weight) {

    public boolean matches(CharSequence text) {
        return pattern.matcher(text).find();
    }

    @Override
    public String toString() {
        return pattern.pattern() + " (" + weight + ")";
    }
}
