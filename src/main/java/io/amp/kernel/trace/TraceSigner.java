package io.amp.kernel.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 chain: each signature covers the previous event's signature and the canonical JSON
 * of the event without its own signature, so edits, reordering and deletions break the chain.
 */
public final class TraceSigner {
    private static final String ALGORITHM = "HmacSHA256";
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .build();

    private final byte[] key;

    private TraceSigner(byte[] key) {
        this.key = key.clone();
    }

    public static TraceSigner fromSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Signing secret must not be blank");
        }
        return new TraceSigner(secret.getBytes(StandardCharsets.UTF_8));
    }

    public static TraceSigner ephemeral() {
        var key = new byte[32];
        new SecureRandom().nextBytes(key);
        return new TraceSigner(key);
    }

    public String sign(String previousSignature, TraceEvent event) {
        var payload = (previousSignature == null ? "" : previousSignature) + "\n" + canonical(event);
        try {
            var mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }

    static String canonical(TraceEvent event) {
        try {
            return CANONICAL.writeValueAsString(event.withSignature(null));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize trace event " + event.seq(), ex);
        }
    }
}
