package tokenacl.core.port.out;

import java.io.IOException;
import java.io.Reader;

/**
 * Where configuration text is read from.
 */
public interface ConfigurationSource {

    /**
     * Human-readable name of the source, used in error messages.
     */
    String name();

    /**
     * Open the source for reading. The caller closes the reader.
     *
     * @return a reader positioned at the start of the configuration
     * @throws IOException if the source cannot be opened
     */
    Reader open() throws IOException;
}
