package org.learningjava.hpes.domain.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

// rules shared by every language of a family, appended after the language's own rules
public class FamilyDefinition {

    @JsonProperty("id")
    private String id;

    @JsonProperty("fallback")
    private List<PatternDefinition> fallback = new ArrayList<>();

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public List<PatternDefinition> getFallback() {
        return fallback;
    }

    public void setFallback(List<PatternDefinition> fallback) {
        this.fallback = fallback;
    }
}
