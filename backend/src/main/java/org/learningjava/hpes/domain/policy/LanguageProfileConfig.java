package org.learningjava.hpes.domain.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** Root of {@code language_profiles/profiles.yml}. */
public class LanguageProfileConfig {

    @JsonProperty("families")
    private List<FamilyDefinition> families = new ArrayList<>();

    @JsonProperty("languages")
    private List<LanguageProfileDefinition> languages = new ArrayList<>();

    public List<FamilyDefinition> getFamilies() {
        return families;
    }

    public void setFamilies(List<FamilyDefinition> families) {
        this.families = families;
    }

    public List<LanguageProfileDefinition> getLanguages() {
        return languages;
    }

    public void setLanguages(List<LanguageProfileDefinition> languages) {
        this.languages = languages;
    }
}
