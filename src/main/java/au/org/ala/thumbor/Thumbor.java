package au.org.ala.thumbor;

import au.org.ala.thumbor.url.UrlBuilder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point: creates {@link UrlBuilder}s for one Thumbor server.
 *
 * <pre>
 * Thumbor thumbor = new Thumbor("https://thumbor.example.com", "my-secret-key");
 * String url = thumbor.url("https://example.com/image.jpg")
 *         .fitIn(640, 480)
 *         .addFilter("quality", 80)
 *         .toString();
 * </pre>
 *
 * Instances are immutable and may be shared between threads; the builders they return may not.
 */
public class Thumbor {

    private static final Logger log = LoggerFactory.getLogger(Thumbor.class);

    private final String server;
    private final String secret;

    public Thumbor(String server) {
        this(server, null);
    }

    /**
     * @param secret the server's security key; null or empty produces unsigned ("unsafe") URLs
     */
    public Thumbor(String server, String secret) {
        this.server = Objects.requireNonNull(server, "server");
        this.secret = secret;
        if (hasSecret()) {
            log.debug("Thumbor URLs for {} will be signed", server);
        } else {
            log.info("No security key configured for {}, generating unsafe URLs", server);
        }
    }

    public static Thumbor construct(String server, String secret) {
        return new Thumbor(server, secret);
    }

    public static Thumbor fromConfig(ThumborConfig config) {
        return new Thumbor(config.getServer(), config.getKey());
    }

    /**
     * A new builder for the image at {@code imageUrl}.
     */
    public UrlBuilder url(String imageUrl) {
        return new UrlBuilder(server, secret, imageUrl);
    }

    public UrlBuilder createBuilder(String imageUrl) {
        return url(imageUrl);
    }

    public String getServer() {
        return server;
    }

    public boolean hasSecret() {
        return StringUtils.isNotEmpty(secret);
    }
}
