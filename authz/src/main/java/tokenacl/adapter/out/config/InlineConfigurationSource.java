package tokenacl.adapter.out.config;

import java.io.Reader;
import java.io.StringReader;

import tokenacl.core.port.out.ConfigurationSource;

/**
 * Configuration held in memory, e.g. submitted through the admin API.
 */
public final class InlineConfigurationSource implements ConfigurationSource {

    private final String name;
    private final String content;

    public InlineConfigurationSource(String name, String content) {
        this.name = name;
        this.content = content == null ? "" : content;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Reader open() {
        return new StringReader(content);
    }
}
