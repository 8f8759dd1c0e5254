package com.github.dimitryivaniuta.guard.proxy.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamRequest;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Derives the in-flight identity of a request.
 *
 * <p>Key = SHA-256(method, normalized path, SHA-256(caller token), SHA-256(canonical body)),
 * rendered as 64 lowercase hex chars. The raw token and body never end up in the key or in
 * any long-lived structure. The full token is hashed, so two tokens that only share a suffix
 * never collide.
 */
@Component
public class CacheKeyBuilder {

    static final String NO_BODY = "__no_body__";
    static final String NO_TOKEN = "__anonymous__";

    private static final char SEPARATOR = '\u0000';

    private final ObjectMapper mapper;
    private final ObjectWriter canonicalWriter;

    public CacheKeyBuilder(ObjectMapper mapper) {
        this.mapper = mapper;
        // Map entries sorted recursively; bodies are converted to plain maps/lists first.
        this.canonicalWriter = mapper.writer()
                .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .without(SerializationFeature.INDENT_OUTPUT);
    }

    public String buildKey(UpstreamRequest request) {
        String method = request.method().name().toUpperCase(Locale.ROOT);
        String path = normalizePath(request.path());
        String tokenHash = request.callerToken() == null
                ? NO_TOKEN
                : sha256Hex(request.callerToken());
        String bodyHash = hasBody(request.body())
                ? sha256Hex(canonicalBody(request.body()))
                : NO_BODY;

        String material = method + SEPARATOR + path + SEPARATOR + tokenHash + SEPARATOR + bodyHash;
        return sha256Hex(material);
    }

    /**
     * Leading slashes are dropped so "/x" and "x" address the same resource.
     */
    public static String normalizePath(String path) {
        if (path == null) return "";
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') i++;
        return path.substring(i);
    }

    private static boolean hasBody(JsonNode body) {
        return body != null && !body.isMissingNode();
    }

    private String canonicalBody(JsonNode body) {
        try {
            Object plain = mapper.convertValue(body, Object.class);
            return canonicalWriter.writeValueAsString(plain);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Request body cannot be serialized for keying", e);
        }
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte x : digest) sb.append(String.format("%02x", x));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
