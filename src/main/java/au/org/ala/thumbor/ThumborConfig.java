package au.org.ala.thumbor;

import com.google.common.io.ByteSource;
import com.google.common.io.Resources;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;

/**
 * Connection settings for a Thumbor server: its base URL and the optional security key used to sign URLs.
 */
public class ThumborConfig {

    public static final String DEFAULT_SERVER = "http://localhost:8888";

    public static final String SERVER_PROPERTY = "thumbor.server";
    public static final String KEY_PROPERTY = "thumbor.key";

    public static final String SERVER_ENV = "THUMBOR_SERVER";
    public static final String KEY_ENV = "THUMBOR_KEY";

    private String _server = DEFAULT_SERVER;
    private String _key;

    public ThumborConfig() {
    }

    public ThumborConfig(String server, String key) {
        setServer(server);
        setKey(key);
    }

    /**
     * Read {@code thumbor.server} and {@code thumbor.key}.
     */
    public static ThumborConfig fromProperties(Properties properties) {
        return new ThumborConfig(properties.getProperty(SERVER_PROPERTY), properties.getProperty(KEY_PROPERTY));
    }

    /**
     * Read {@code THUMBOR_SERVER} and {@code THUMBOR_KEY}, typically from {@link System#getenv()}.
     */
    public static ThumborConfig fromEnvironment(Map<String, String> environment) {
        return new ThumborConfig(environment.get(SERVER_ENV), environment.get(KEY_ENV));
    }

    /**
     * Load a properties file.
     */
    public static ThumborConfig load(ByteSource source) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = source.asCharSource(StandardCharsets.UTF_8).openBufferedStream()) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    /**
     * Load a properties file from the classpath.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static ThumborConfig fromClasspath(String resourceName) throws IOException {
        return load(Resources.asByteSource(Resources.getResource(resourceName)));
    }

    public String getServer() { return _server; }

    /**
     * A blank server falls back to {@link #DEFAULT_SERVER}.
     */
    public void setServer(String server) {
        _server = StringUtils.isBlank(server) ? DEFAULT_SERVER : server.trim();
    }

    /**
     * @return the security key, or null when URLs are to be left unsigned
     */
    public String getKey() { return _key; }

    /**
     * A blank key is stored as null.
     */
    public void setKey(String key) {
        _key = StringUtils.isBlank(key) ? null : key;
    }
}
