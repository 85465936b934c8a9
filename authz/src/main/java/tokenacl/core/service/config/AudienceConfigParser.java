package tokenacl.core.service.config;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import tokenacl.core.model.config.AudienceConfig;
import tokenacl.core.port.in.AudienceManagement.ConfigurationException;

/**
 * Extracts accepted audiences from a parsed INI document.
 *
 * <p>Every section whose name starts with {@code global} (any case) is read,
 * in file order:
 * <ul>
 *   <li>{@code audience}: audiences separated by commas and/or spaces</li>
 *   <li>{@code audience_json}: a JSON array of strings</li>
 * </ul>
 * The result is the concatenation of all values found.
 */
public final class AudienceConfigParser {

    static final String GLOBAL_SECTION_PREFIX = "global";
    static final String AUDIENCE_KEY = "audience";
    static final String AUDIENCE_JSON_KEY = "audience_json";

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private AudienceConfigParser() {}

    /**
     * Read the audiences of a document.
     *
     * @param document   the parsed INI document
     * @param sourceName name of the source, used in error messages
     * @return the audiences found, empty if none are configured
     * @throws ConfigurationException if an {@code audience_json} value is invalid
     */
    public static AudienceConfig parse(IniDocument document, String sourceName) {
        final var audiences = new ArrayList<String>();
        for (IniDocument.Section section : document.sections()) {
            if (!section.nameStartsWith(GLOBAL_SECTION_PREFIX)) {
                continue;
            }
            section.get(AUDIENCE_KEY).ifPresent(value -> audiences.addAll(splitAudiences(value)));
            final var json = section.get(AUDIENCE_JSON_KEY);
            if (json.isPresent() && !json.get().isEmpty()) {
                audiences.addAll(parseJsonAudiences(json.get(), sourceName));
            }
        }
        return new AudienceConfig(audiences);
    }

    /**
     * Split a delimited audience list on commas and spaces, dropping empty fragments.
     */
    static List<String> splitAudiences(String value) {
        final var result = new ArrayList<String>();
        final var current = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            final var c = value.charAt(i);
            if (c == ',' || c == ' ') {
                flush(current, result);
            } else {
                current.append(c);
            }
        }
        flush(current, result);
        return result;
    }

    private static void flush(StringBuilder current, List<String> result) {
        if (current.length() > 0) {
            result.add(current.toString());
            current.setLength(0);
        }
    }

    private static List<String> parseJsonAudiences(String value, String sourceName) {
        final JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(value);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(
                    sourceName, "Unable to parse audience_json: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isArray()) {
            throw new ConfigurationException(sourceName, "audience_json must be a list of strings; not a list.");
        }
        final var result = new ArrayList<String>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new ConfigurationException(
                        sourceName, "audience_json must be a list of strings; value is not a string.");
            }
            result.add(element.asText());
        }
        return result;
    }
}
