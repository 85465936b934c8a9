package tokenacl.core.service.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Map;

import tokenacl.core.port.in.AudienceManagement.ConfigurationException;

/**
 * Reader for the section-based INI configuration format.
 *
 * <p>Accepted syntax:
 * <ul>
 *   <li>{@code [section]} headers</li>
 *   <li>{@code name = value} or {@code name : value} pairs, trimmed</li>
 *   <li>comment lines starting with {@code ;} or {@code #}</li>
 *   <li>inline comments starting at a {@code ;} preceded by whitespace</li>
 *   <li>indented lines continuing the previous value</li>
 * </ul>
 *
 * <p>A repeated key, or a continuation line, is appended to the existing
 * value after a newline. Any other non-blank line is an error reported with
 * its line number.
 */
public final class IniParser {

    private static final char BOM = '\uFEFF';

    private IniParser() {}

    /**
     * Parse INI text.
     *
     * @param reader     the text to parse; not closed by this method
     * @param sourceName name of the source, used in error messages
     * @return the parsed document
     * @throws IOException            if reading fails
     * @throws ConfigurationException if a line cannot be parsed
     */
    public static IniDocument parse(Reader reader, String sourceName) throws IOException {
        final var sections = new LinkedHashMap<String, SectionBuilder>();
        final var buffered = new BufferedReader(reader);

        var current = sections.computeIfAbsent("", key -> new SectionBuilder(""));
        String previousKey = null;
        String raw;
        int lineNumber = 0;

        while ((raw = buffered.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && !raw.isEmpty() && raw.charAt(0) == BOM) {
                raw = raw.substring(1);
            }

            final var line = raw.stripTrailing();
            final var start = line.stripLeading();
            final var indented = start.length() < line.length();

            if (start.isEmpty() || start.charAt(0) == ';' || start.charAt(0) == '#') {
                continue;
            }

            if (previousKey != null && indented) {
                current.append(previousKey, stripInlineComment(start).stripTrailing());
                continue;
            }

            if (start.charAt(0) == '[') {
                final var end = findCharsOrComment(start, 1, "]");
                if (end >= start.length() || start.charAt(end) != ']') {
                    throw new ConfigurationException(sourceName, lineNumber, "Unterminated section header");
                }
                final var name = start.substring(1, end);
                current = sections.computeIfAbsent(IniDocument.normalize(name), key -> new SectionBuilder(name));
                previousKey = null;
                continue;
            }

            final var separator = findCharsOrComment(start, 0, "=:");
            if (separator >= start.length() || (start.charAt(separator) != '=' && start.charAt(separator) != ':')) {
                throw new ConfigurationException(sourceName, lineNumber, "Expected name = value");
            }
            final var key = start.substring(0, separator).stripTrailing();
            final var value = stripInlineComment(start.substring(separator + 1).stripLeading()).stripTrailing();
            current.append(key, value);
            previousKey = key;
        }

        final var result = new LinkedHashMap<String, IniDocument.Section>();
        sections.forEach((name, builder) -> result.put(name, builder.build()));
        return new IniDocument(result);
    }

    private static int findCharsOrComment(String text, int from, String chars) {
        var whitespaceBefore = false;
        int index = from;
        while (index < text.length()) {
            final var c = text.charAt(index);
            if (chars.indexOf(c) >= 0 || (whitespaceBefore && c == ';')) {
                break;
            }
            whitespaceBefore = Character.isWhitespace(c);
            index++;
        }
        return index;
    }

    private static String stripInlineComment(String value) {
        final var end = findCharsOrComment(value, 0, "");
        return value.substring(0, end);
    }

    private static final class SectionBuilder {
        private final String name;
        private final Map<String, String> values = new LinkedHashMap<>();

        SectionBuilder(String name) {
            this.name = name;
        }

        void append(String key, String value) {
            values.merge(IniDocument.normalize(key), value, (existing, added) -> existing + "\n" + added);
        }

        IniDocument.Section build() {
            return new IniDocument.Section(name, values);
        }
    }
}
