package com.lumen.query.expansion;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

public class ThesaurusSynonymSource implements SynonymSource {
    private static final Logger log = LoggerFactory.getLogger(ThesaurusSynonymSource.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final Map<String, Set<PartOfSpeech>> partsOfSpeech;
    private final Map<String, List<RelatedTerm>> related;
    private final Map<String, String> acronyms;

    public ThesaurusSynonymSource(
        Map<String, Set<PartOfSpeech>> partsOfSpeech,
        Map<String, List<RelatedTerm>> related,
        Map<String, String> acronyms
    ) {
        this.partsOfSpeech = Map.copyOf(partsOfSpeech);
        this.related = Map.copyOf(related);
        this.acronyms = Map.copyOf(acronyms);
    }

    public static ThesaurusSynonymSource empty() {
        return new ThesaurusSynonymSource(Map.of(), Map.of(), Map.of());
    }

    @SuppressWarnings("unchecked")
    public static ThesaurusSynonymSource load(String location) {
        if (location == null || location.isBlank()) {
            return empty();
        }
        Object parsed;
        try (InputStream input = open(location)) {
            if (input == null) {
                log.warn("thesaurus_not_found location={}", location);
                return empty();
            }
            parsed = new Yaml().load(input);
        } catch (Exception ex) {
            log.warn("thesaurus_load_failed location={}", location, ex);
            return empty();
        }
        if (!(parsed instanceof Map<?, ?> root)) {
            log.warn("thesaurus_malformed location={} reason=root_not_map", location);
            return empty();
        }

        Map<String, Set<PartOfSpeech>> pos = new LinkedHashMap<>();
        Map<String, List<RelatedTerm>> related = new LinkedHashMap<>();
        Object rawTerms = root.get("terms");
        if (rawTerms instanceof Map<?, ?> terms) {
            for (Map.Entry<?, ?> entry : terms.entrySet()) {
                String term = normalize(entry.getKey());
                if (term == null || !(entry.getValue() instanceof Map<?, ?> definition)) {
                    continue;
                }
                pos.put(term, parsePos(definition.get("pos")));
                related.put(term, parseRelated((Map<String, Object>) definition));
            }
        }

        Map<String, String> acronyms = new LinkedHashMap<>();
        Object rawAcronyms = root.get("acronyms");
        if (rawAcronyms instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String acronym = normalize(entry.getKey());
                String expansion = entry.getValue() == null ? null : entry.getValue().toString().trim();
                if (acronym != null && expansion != null && !expansion.isEmpty()) {
                    acronyms.put(acronym, expansion);
                }
            }
        }
        log.info("thesaurus_loaded location={} terms={} acronyms={}", location, related.size(), acronyms.size());
        return new ThesaurusSynonymSource(pos, related, acronyms);
    }

    @Override
    public Set<PartOfSpeech> partsOfSpeech(String term) {
        return partsOfSpeech.getOrDefault(term, Set.of());
    }

    @Override
    public List<RelatedTerm> related(String term) {
        return related.getOrDefault(term, List.of());
    }

    @Override
    public Map<String, String> acronyms() {
        return acronyms;
    }

    private static InputStream open(String location) throws java.io.IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            return ThesaurusSynonymSource.class.getClassLoader().getResourceAsStream(resource);
        }
        Path path = Path.of(location);
        return Files.exists(path) ? Files.newInputStream(path) : null;
    }

    private static List<RelatedTerm> parseRelated(Map<String, Object> definition) {
        Object raw = definition.get("related");
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<RelatedTerm> terms = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                String term = normalize(map.get("term"));
                if (term == null) {
                    continue;
                }
                PartOfSpeech pos = PartOfSpeech.from(map.get("pos") == null ? null : map.get("pos").toString());
                terms.add(new RelatedTerm(term, pos, asDouble(map.get("frequency"), 0.0)));
            } else {
                String term = normalize(item);
                if (term != null) {
                    terms.add(new RelatedTerm(term, null, 0.0));
                }
            }
        }
        return List.copyOf(terms);
    }

    private static Set<PartOfSpeech> parsePos(Object raw) {
        EnumSet<PartOfSpeech> result = EnumSet.noneOf(PartOfSpeech.class);
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                PartOfSpeech pos = item == null ? null : PartOfSpeech.from(item.toString());
                if (pos != null) {
                    result.add(pos);
                }
            }
        } else if (raw != null) {
            PartOfSpeech pos = PartOfSpeech.from(raw.toString());
            if (pos != null) {
                result.add(pos);
            }
        }
        return Set.copyOf(result);
    }

    private static String normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.toString().trim().toLowerCase(Locale.ROOT);
        return value.isEmpty() ? null : value;
    }

    private static double asDouble(Object raw, double fallback) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }
}
