package tokenacl.core.service.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed INI content: named sections of key/value pairs.
 *
 * <p>Section and key names are case-insensitive. Sections are kept in the
 * order of their first appearance; sections whose names differ only by case
 * are merged.
 */
public final class IniDocument {

    private final Map<String, Section> sections;

    IniDocument(Map<String, Section> sections) {
        this.sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    /**
     * Sections in file order.
     */
    public List<Section> sections() {
        return List.copyOf(sections.values());
    }

    public Optional<Section> section(String name) {
        return Optional.ofNullable(sections.get(normalize(name)));
    }

    static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * A named group of key/value pairs.
     *
     * @param name   section name as first written in the file
     * @param values values keyed by lower-cased key name
     */
    public record Section(String name, Map<String, String> values) {

        public Section {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        /**
         * Value of a key, ignoring case. Repeated keys are joined with newlines.
         */
        public Optional<String> get(String key) {
            return Optional.ofNullable(values.get(normalize(key)));
        }

        /**
         * Whether the lower-cased section name starts with {@code prefix}.
         */
        public boolean nameStartsWith(String prefix) {
            return normalize(name).startsWith(normalize(prefix));
        }
    }
}
