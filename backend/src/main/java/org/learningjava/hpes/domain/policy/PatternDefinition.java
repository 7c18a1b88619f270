package org.learningjava.hpes.domain.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

public class PatternDefinition {

    @JsonProperty("pattern")
    private String pattern;

    @JsonProperty("weight")
    private double weight;

    @JsonProperty("ignoreCase")
    private boolean ignoreCase;

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    public void setIgnoreCase(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }
}
