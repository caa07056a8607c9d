package org.endlesssource.scrobbler.services.lastfm;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LastFmSignerTest {

    private static String md5(String text) throws Exception {
        byte[] digest = MessageDigest.getInstance("MD5").digest(text.getBytes(StandardCharsets.UTF_8));
        return String.format("%032x", new BigInteger(1, digest));
    }

    @Test
    void sign_sortsByNameAndAppendsSecret() throws Exception {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("method", "auth.getSession");
        params.put("token", "tok");
        params.put("api_key", "key");

        assertEquals(md5("api_keykeymethodauth.getSessiontoktok" + "secret"), LastFmSigner.sign(params, "secret"));
    }

    @Test
    void sign_ignoresFormatAndCallback() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("method", "track.scrobble");
        params.put("api_key", "key");
        String unformatted = LastFmSigner.sign(params, "s");

        params.put("format", "json");
        params.put("callback", "cb");
        assertEquals(unformatted, LastFmSigner.sign(params, "s"));
    }

    @Test
    void formEncode_escapesValues() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("artist", "Simon & Garfunkel");
        params.put("track", "Mrs. Robinson");
        assertEquals("artist=Simon+%26+Garfunkel&track=Mrs.+Robinson", LastFmSigner.formEncode(params));
    }
}
