package tokenacl.adapter.out.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import tokenacl.core.port.out.ConfigurationSource;

/**
 * Configuration read from a UTF-8 file.
 */
public final class FileConfigurationSource implements ConfigurationSource {

    private final Path path;

    public FileConfigurationSource(Path path) {
        this.path = path;
    }

    @Override
    public String name() {
        return path.toString();
    }

    @Override
    public Reader open() throws IOException {
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }
}
