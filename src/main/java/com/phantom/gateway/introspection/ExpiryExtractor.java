package com.phantom.gateway.introspection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JOSEObject;
import com.nimbusds.jose.util.Base64URL;
import com.phantom.gateway.introspection.ExpiryExtractionException.Reason;

import java.io.IOException;
import java.text.ParseException;
import java.time.Instant;
import java.util.Base64;

/**
 * Expiry Extractor
 *
 * <p>Reads the {@code exp} claim from the payload of a compact
 * (header.payload.signature) token without verifying its signature. The
 * gateway only needs the expiry to bound how long the token is cached;
 * signature verification is left to the upstream services.
 */
public class ExpiryExtractor {

    private final ObjectMapper objectMapper;

    public ExpiryExtractor() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Whether the candidate looks like a compact token (exactly two dots)
     */
    public static boolean isCompactToken(String candidate) {
        if (candidate == null) {
            return false;
        }
        int dots = 0;
        for (int i = 0; i < candidate.length(); i++) {
            if (candidate.charAt(i) == '.') {
                dots++;
            }
        }
        return dots == 2;
    }

    /**
     * Extract the expiration instant of a compact token
     *
     * @param token compact token
     * @return expiry as carried by the {@code exp} claim
     * @throws ExpiryExtractionException describing which step failed
     */
    public Instant extract(String token) throws ExpiryExtractionException {
        Base64URL[] parts;
        try {
            parts = JOSEObject.split(token);
        } catch (ParseException e) {
            throw new ExpiryExtractionException(Reason.NOT_COMPACT, "not a compact JWS", e);
        }
        if (parts.length != 3) {
            throw new ExpiryExtractionException(Reason.NOT_COMPACT, "not a compact JWS");
        }

        byte[] payload;
        try {
            payload = Base64.getUrlDecoder().decode(parts[1].toString());
        } catch (IllegalArgumentException e) {
            throw new ExpiryExtractionException(Reason.PAYLOAD_NOT_DECODABLE,
                "payload b64 decode: " + e.getMessage(), e);
        }

        JsonNode claims;
        try {
            claims = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ExpiryExtractionException(Reason.PAYLOAD_NOT_PARSEABLE,
                "payload json: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ExpiryExtractionException(Reason.PAYLOAD_NOT_PARSEABLE, "payload json: " + e.getMessage(), e);
        }
        if (claims == null || !claims.isObject()) {
            throw new ExpiryExtractionException(Reason.PAYLOAD_NOT_PARSEABLE, "payload json: not an object");
        }

        JsonNode exp = claims.get(ExpirationClaim.CLAIM_NAME);
        if (exp == null) {
            throw new ExpiryExtractionException(Reason.MISSING_EXPIRATION, "no exp claim");
        }
        return ExpirationClaim.of(exp).toInstant();
    }
}
