package au.org.ala.thumbor.url;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * A complete Thumbor URL: {@code <server>/<signature>/<command>/.../<original>}.
 *
 * The signature is the URL safe base64 HMAC-SHA1 of everything after it, keyed with the server's
 * security key, or the literal {@code unsafe} when no key is configured.
 */
public final class ThumborUrl {

    private static final Logger log = LoggerFactory.getLogger(ThumborUrl.class);

    public static final String UNSAFE = "unsafe";

    private static final Joiner PATH_JOINER = Joiner.on('/');

    private final String server;
    private final String secret;
    private final String original;
    private final List<String> commands;

    public ThumborUrl(String server, String secret, String original, List<String> commands) {
        this.server = Objects.requireNonNull(server, "server");
        this.secret = secret;
        this.original = Objects.requireNonNull(original, "original");
        this.commands = ImmutableList.copyOf(commands);
    }

    public String build() {
        String imgPath = commands.isEmpty()
                ? original
                : PATH_JOINER.join(commands) + "/" + original;

        boolean signed = StringUtils.isNotEmpty(secret);
        String signature = signed ? sign(imgPath, secret) : UNSAFE;

        String base = StringUtils.stripEnd(server, "/");
        log.debug("Built {} url with {} command segment(s) for {}", signed ? "signed" : "unsafe", commands.size(), original);
        return base + "/" + signature + "/" + imgPath;
    }

    /**
     * HMAC-SHA1 of {@code path} keyed by {@code secret}, standard base64 with '+' mapped to '-' and '/' to '_'.
     * Padding is kept.
     *
     * @throws IllegalArgumentException if {@code secret} is null or empty; such URLs are unsigned ({@value #UNSAFE})
     */
    public static String sign(String path, String secret) {
        if (StringUtils.isEmpty(secret)) {
            throw new IllegalArgumentException("Cannot sign with an empty secret, use an unsafe url instead");
        }
        byte[] digest = new HmacUtils(HmacAlgorithms.HMAC_SHA_1, secret).hmac(path);
        return StringUtils.replaceChars(Base64.encodeBase64String(digest), "+/", "-_");
    }

    public String getServer() { return server; }

    public String getOriginal() { return original; }

    public List<String> getCommands() { return commands; }

    @Override
    public String toString() {
        return build();
    }
}
