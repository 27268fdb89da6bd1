package com.phantom.gateway.introspection;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Value of the {@code exp} claim, resolved by JSON type.
 */
sealed interface ExpirationClaim
    permits ExpirationClaim.Numeric, ExpirationClaim.NumericText, ExpirationClaim.Unsupported {

    String CLAIM_NAME = "exp";

    /**
     * Classify a JSON node holding the claim value
     */
    static ExpirationClaim of(JsonNode node) {
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                return new Unsupported("non-finite number");
            }
            return new Numeric(node.decimalValue());
        }
        if (node.isTextual()) {
            try {
                return new NumericText(new BigDecimal(node.textValue().trim()));
            } catch (NumberFormatException e) {
                return new Unsupported("non-numeric text");
            }
        }
        return new Unsupported(node.getNodeType().name().toLowerCase());
    }

    /** JSON number, Unix seconds */
    record Numeric(BigDecimal seconds) implements ExpirationClaim {
    }

    /** JSON string holding a number, Unix seconds */
    record NumericText(BigDecimal seconds) implements ExpirationClaim {
    }

    /** Anything else */
    record Unsupported(String type) implements ExpirationClaim {
    }

    /**
     * Resolve to an instant, truncating fractional seconds
     *
     * @throws ExpiryExtractionException for {@link Unsupported} values and
     *         numbers outside the representable instant range
     */
    default Instant toInstant() throws ExpiryExtractionException {
        if (this instanceof Numeric numeric) {
            return epochSeconds(numeric.seconds());
        }
        if (this instanceof NumericText text) {
            return epochSeconds(text.seconds());
        }
        Unsupported unsupported = (Unsupported) this;
        throw new ExpiryExtractionException(ExpiryExtractionException.Reason.UNSUPPORTED_EXPIRATION_TYPE,
            "exp claim has unsupported type: " + unsupported.type());
    }

    private static Instant epochSeconds(BigDecimal seconds) throws ExpiryExtractionException {
        try {
            return Instant.ofEpochSecond(seconds.toBigInteger().longValueExact());
        } catch (ArithmeticException | DateTimeException e) {
            throw new ExpiryExtractionException(ExpiryExtractionException.Reason.UNSUPPORTED_EXPIRATION_TYPE,
                "exp claim out of range: " + seconds, e);
        }
    }
}
