package org.learningjava.hpes.domain.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class LanguageProfileDefinition {

    @JsonProperty("id")
    private String id;

    @JsonProperty("displayName")
    private String displayName;

    @JsonProperty("family")
    private String family;

    @JsonProperty("aliases")
    private List<String> aliases = new ArrayList<>();

    @JsonProperty("extensions")
    private List<String> extensions = new ArrayList<>();

    @JsonProperty("fileNames")
    private List<String> fileNames = new ArrayList<>();

    @JsonProperty("shebangs")
    private List<String> shebangs = new ArrayList<>();

    @JsonProperty("grammar")
    private String grammar; // optional, rules-only language when absent

    @JsonProperty("signatures")
    private List<PatternDefinition> signatures = new ArrayList<>();

    @JsonProperty("fallback")
    private List<PatternDefinition> fallback = new ArrayList<>();

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getFamily() {
        return family;
    }

    public void setFamily(String family) {
        this.family = family;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public void setAliases(List<String> aliases) {
        this.aliases = aliases;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public void setExtensions(List<String> extensions) {
        this.extensions = extensions;
    }

    public List<String> getFileNames() {
        return fileNames;
    }

    public void setFileNames(List<String> fileNames) {
        this.fileNames = fileNames;
    }

    public List<String> getShebangs() {
        return shebangs;
    }

    public void setShebangs(List<String> shebangs) {
        this.shebangs = shebangs;
    }

    public String getGrammar() {
        return grammar;
    }

    public void setGrammar(String grammar) {
        this.grammar = grammar;
    }

    public List<PatternDefinition> getSignatures() {
        return signatures;
    }

    public void setSignatures(List<PatternDefinition> signatures) {
        this.signatures = signatures;
    }

    public List<PatternDefinition> getFallback() {
        return fallback;
    }

    public void setFallback(List<PatternDefinition> fallback) {
        this.fallback = fallback;
    }
}
