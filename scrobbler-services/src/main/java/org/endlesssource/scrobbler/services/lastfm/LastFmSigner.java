package org.endlesssource.scrobbler.services.lastfm;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Audioscrobbler 2.0 request signing: md5 over the parameters sorted by name, each as name followed by
 * value, with the shared secret appended. {@code format} and {@code callback} are not signed.
 */
final class LastFmSigner {
    private static final Set<String> UNSIGNED = Set.of("format", "callback");

    private LastFmSigner() {
    }

    static String sign(Map<String, String> params, String apiSecret) {
        StringBuilder payload = new StringBuilder();
        new TreeMap<>(params).forEach((key, value) -> {
            if (!UNSIGNED.contains(key)) {
                payload.append(key).append(value);
            }
        });
        payload.append(apiSecret);
        return md5Hex(payload.toString());
    }

    static String formEncode(Map<String, String> params) {
        StringJoiner body = new StringJoiner("&");
        params.forEach((key, value) -> body.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return body.toString();
    }

    private static String md5Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }
}
