package tokenacl.core.port.in;

import java.util.OptionalInt;

import tokenacl.core.model.config.AudienceConfig;
import tokenacl.core.port.out.ConfigurationSource;

/**
 * Use case for loading and inspecting the accepted token audiences.
 */
public interface AudienceManagement {

    /**
     * Replace the active audiences with those read from {@code source}.
     *
     * <p>The replacement is all-or-nothing: if any part of the source is
     * invalid, the previously active audiences stay in effect.
     *
     * @param source the configuration to read
     * @return the newly active audiences
     * @throws ConfigurationException if the source cannot be read or is invalid
     */
    AudienceConfig reconfigure(ConfigurationSource source);

    /**
     * The currently active audiences.
     */
    AudienceConfig current();

    /**
     * Raised when a configuration source cannot be read or contains invalid values.
     */
    class ConfigurationException extends RuntimeException {

        private final String source;
        private final int line;

        public ConfigurationException(String source, String message) {
            this(source, 0, message, null);
        }

        public ConfigurationException(String source, String message, Throwable cause) {
            this(source, 0, message, cause);
        }

        public ConfigurationException(String source, int line, String message) {
            this(source, line, message, null);
        }

        private ConfigurationException(String source, int line, String message, Throwable cause) {
            super(format(source, line, message), cause);
            this.source = source;
            this.line = line;
        }

        public String source() {
            return source;
        }

        /**
         * Line of the parse error, if the failure is tied to one.
         */
        public OptionalInt line() {
            return line > 0 ? OptionalInt.of(line) : OptionalInt.empty();
        }

        private static String format(String source, int line, String message) {
            if (line > 0) {
                return "%s (%s, line %d)".formatted(message, source, line);
            }
            return "%s (%s)".formatted(message, source);
        }
    }
}
