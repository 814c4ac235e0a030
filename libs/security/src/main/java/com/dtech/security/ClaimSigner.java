package com.dtech.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Keyed HMAC-SHA256 over the JSON serialization of a claim object.
 * <p>
 * Claim records declare their property order, so the same claims always produce the same bytes.
 * Signatures are lower-case hex.
 */
public final class ClaimSigner {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final HexFormat HEX = HexFormat.of();

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SecretKeySpec key;

    public ClaimSigner(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("signing secret must not be null or empty");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    /**
     * Returns the hex HMAC of the serialized claims.
     */
    public String sign(Object claims) {
        return HEX.formatHex(mac(serialize(claims)));
    }

    /**
     * Constant-time check of {@code signature} against the HMAC of {@code claims}.
     */
    public boolean verify(Object claims, String signature) {
        if (signature == null) {
            return false;
        }
        byte[] expected = sign(claims).getBytes(StandardCharsets.US_ASCII);
        byte[] provided = signature.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, provided);
    }

    static byte[] serialize(Object claims) {
        try {
            return MAPPER.writeValueAsBytes(claims);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize claims of type " + claims.getClass().getSimpleName(), e);
        }
    }

    private byte[] mac(byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
