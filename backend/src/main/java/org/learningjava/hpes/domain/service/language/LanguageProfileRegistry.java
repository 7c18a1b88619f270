package org.learningjava.hpes.domain.service.language;

import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.domain.model.language.LanguageDispatch;
import org.learningjava.hpes.domain.model.language.LanguageProfile;
import org.learningjava.hpes.domain.model.language.ProfileConfigurationException;
import org.learningjava.hpes.domain.model.language.WeightedPattern;
import org.learningjava.hpes.domain.policy.FamilyDefinition;
import org.learningjava.hpes.domain.policy.LanguageProfileConfig;
import org.learningjava.hpes.domain.policy.LanguageProfileDefinition;
import org.learningjava.hpes.domain.policy.PatternDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Closed, validated table of language profiles and the grammar adapters they
 * dispatch to. Built once at start-up and never mutated afterwards, so it is
 * shared between extraction runs without locking.
 */
public final class LanguageProfileRegistry {

    private static final Logger log = LoggerFactory.getLogger(LanguageProfileRegistry.class);

    private final List<LanguageProfile> profiles;
    private final Map<String, LanguageProfile> byKey;
    private final Map<String, LanguageProfile> byExtension;
    private final Map<String, LanguageProfile> byFileName;
    private final Map<String, GrammarParserPort> grammars;

    public LanguageProfileRegistry(LanguageProfileConfig config, Collection<GrammarParserPort> grammarAdapters) {
        if (config == null || config.getLanguages() == null || config.getLanguages().isEmpty()) {
            throw new ProfileConfigurationException("Language profile table is empty");
        }
        this.grammars = indexGrammars(grammarAdapters);
        Map<String, List<WeightedPattern>> familyRules = compileFamilies(config.getFamilies());

        List<LanguageProfile> list = new ArrayList<>();
        Map<String, LanguageProfile> keys = new HashMap<>();
        Map<String, LanguageProfile> extensions = new HashMap<>();
        Map<String, LanguageProfile> fileNames = new HashMap<>();

        for (LanguageProfileDefinition def : config.getLanguages()) {
            LanguageProfile profile = toProfile(def, familyRules);
            list.add(profile);
            register(keys, profile.id(), profile, "id or alias");
            profile.aliases().forEach(a -> register(keys, a, profile, "id or alias"));
            profile.extensions().forEach(e -> register(extensions, e, profile, "extension"));
            profile.fileNames().forEach(f -> register(fileNames, f, profile, "file name"));
        }

        this.profiles = List.copyOf(list);
        this.byKey = Map.copyOf(keys);
        this.byExtension = Map.copyOf(extensions);
        this.byFileName = Map.copyOf(fileNames);

        long withGrammar = profiles.stream().filter(LanguageProfile::hasGrammar).count();
        log.info("Loaded {} language profiles ({} grammar-backed, {} grammar adapters)",
                profiles.size(), withGrammar, grammars.size());
    }

    public List<LanguageProfile> profiles() {
        return profiles;
    }

    public Optional<LanguageProfile> find(String idOrAlias) {
        if (idOrAlias == null || idOrAlias.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(normalize(idOrAlias)));
    }

    public Optional<LanguageDispatch> dispatch(String idOrAlias) {
        return find(idOrAlias).map(this::dispatch);
    }

    public LanguageDispatch dispatch(LanguageProfile profile) {
        return profile.hasGrammar()
                ? new LanguageDispatch(profile, grammars.get(profile.grammarId()))
                : LanguageDispatch.rulesOnly(profile);
    }

    /** Profile for a file name or path: exact file name first, then the last extension. */
    public Optional<LanguageProfile> forFileName(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        String name = fileNameOf(path);
        LanguageProfile byName = byFileName.get(normalize(name));
        if (byName != null) {
            return Optional.of(byName);
        }
        return extensionOf(name).map(byExtension::get);
    }

    /**
     * Grammar-backed profiles whose content signatures match {@code text}, best first.
     * Profiles scoring zero are left out; equal scores keep table order.
     */
    public List<LanguageDispatch> rankGrammarCandidates(String text, int limit) {
        record Ranked(LanguageProfile profile, double score, int order) {}

        List<Ranked> ranked = new ArrayList<>();
        for (int i = 0; i < profiles.size(); i++) {
            LanguageProfile p = profiles.get(i);
            if (!p.hasGrammar()) {
                continue;
            }
            double score = p.signatureScore(text);
            if (score > 0.0) {
                ranked.add(new Ranked(p, score, i));
            }
        }
        return ranked.stream()
                .sorted(Comparator.comparingDouble(Ranked::score).reversed()
                        .thenComparingInt(Ranked::order))
                .limit(Math.max(0, limit))
                .map(r -> dispatch(r.profile()))
                .toList();
    }

    public Set<String> grammarIds() {
        return grammars.keySet();
    }

    public static String fileNameOf(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    public static Optional<String> extensionOf(String path) {
        String name = fileNameOf(path);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static Map<String, GrammarParserPort> indexGrammars(Collection<GrammarParserPort> adapters) {
        Map<String, GrammarParserPort> index = new LinkedHashMap<>();
        for (GrammarParserPort adapter : adapters) {
            if (index.putIfAbsent(adapter.grammarId(), adapter) != null) {
                throw new ProfileConfigurationException("Duplicate grammar adapter id: " + adapter.grammarId());
            }
        }
        return Map.copyOf(index);
    }

    private static Map<String, List<WeightedPattern>> compileFamilies(List<FamilyDefinition> families) {
        Map<String, List<WeightedPattern>> rules = new HashMap<>();
        if (families == null) {
            return rules;
        }
        for (FamilyDefinition family : families) {
            String id = required(family.getId(), "family id");
            if (rules.put(id, compile(family.getFallback(), "family " + id)) != null) {
                throw new ProfileConfigurationException("Duplicate family id: " + id);
            }
        }
        return rules;
    }

    private LanguageProfile toProfile(LanguageProfileDefinition def, Map<String, List<WeightedPattern>> familyRules) {
        String id = normalize(required(def.getId(), "language id"));
        String family = required(def.getFamily(), "family of " + id);
        if (!familyRules.containsKey(family)) {
            throw new ProfileConfigurationException("Language " + id + " references unknown family " + family);
        }

        String grammar = def.getGrammar();
        if (grammar != null && !grammar.isBlank()) {
            if (!grammars.containsKey(grammar)) {
                throw new ProfileConfigurationException(
                        "Language " + id + " references unregistered grammar " + grammar);
            }
        } else {
            grammar = null;
        }

        List<WeightedPattern> fallback = new ArrayList<>(compile(def.getFallback(), id));
        fallback.addAll(familyRules.get(family));
        if (fallback.isEmpty()) {
            throw new ProfileConfigurationException("Language " + id + " has no fallback rules");
        }

        return new LanguageProfile(
                id,
                def.getDisplayName() != null ? def.getDisplayName() : id,
                family,
                normalizeAll(def.getAliases()).stream().toList(),
                normalizeAll(def.getExtensions()),
                normalizeAll(def.getFileNames()),
                def.getShebangs() == null ? List.of() : def.getShebangs(),
                compile(def.getSignatures(), id),
                grammar,
                fallback);
    }

    private static List<WeightedPattern> compile(List<PatternDefinition> definitions, String owner) {
        if (definitions == null) {
            return List.of();
        }
        List<WeightedPattern> out = new ArrayList<>();
        for (PatternDefinition d : definitions) {
            String source = required(d.getPattern(), "pattern of " + owner);
            if (d.getWeight() <= 0.0 || d.getWeight() > 1.0) {
                throw new ProfileConfigurationException(
                        "Weight of " + owner + " pattern '" + source + "' must be in (0, 1]");
            }
            int flags = Pattern.MULTILINE | (d.isIgnoreCase() ? Pattern.CASE_INSENSITIVE : 0);
            try {
                out.add(new WeightedPattern(Pattern.compile(source, flags), d.getWeight()));
            } catch (PatternSyntaxException e) {
                throw new ProfileConfigurationException("Invalid pattern for " + owner + ": " + source, e);
            }
        }
        return List.copyOf(out);
    }

    private static void register(Map<String, LanguageProfile> index, String key, LanguageProfile profile,
                                 String what) {
        LanguageProfile previous = index.putIfAbsent(key, profile);
        if (previous != null) {
            throw new ProfileConfigurationException(
                    "Duplicate " + what + " '" + key + "' in " + previous.id() + " and " + profile.id());
        }
    }

    private static Set<String> normalizeAll(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values != null) {
            values.stream().filter(v -> v != null && !v.isBlank()).map(LanguageProfileRegistry::normalize)
                    .forEach(out::add);
        }
        return out;
    }

    private static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }

    private static String required(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new ProfileConfigurationException("Missing " + what);
        }
        return value;
    }
}
