package com.phillippitts.arithmeticapi.service.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.arithmeticapi.config.properties.ArithmeticProperties;
import com.phillippitts.arithmeticapi.domain.ArithmeticRequest;
import com.phillippitts.arithmeticapi.exception.InvalidOperandException;
import com.phillippitts.arithmeticapi.exception.MissingOperandException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns a raw request body into a validated {@link ArithmeticRequest}.
 *
 * <p>The body is read as a JSON tree regardless of content type. An empty or malformed body
 * counts as an absent payload. A number too long for the JSON reader is an invalid operand.
 * Anything other than a JSON object carrying both {@code num1}
 * and {@code num2} is rejected; the parser never guesses at other shapes.
 *
 * <p>Conversion rules depend on {@link ValidationMode}:
 * <ul>
 *   <li>PERMISSIVE: JSON numbers and decimal strings become doubles</li>
 *   <li>STRICT: only JSON numbers; integers are kept exact as {@link java.math.BigInteger}</li>
 * </ul>
 * Booleans, {@code null}, arrays, objects and non-finite values are rejected in both modes.
 */
@Component
public class OperandParser {

    static final String NUM1 = "num1";
    static final String NUM2 = "num2";

    private static final Logger LOG = LogManager.getLogger(OperandParser.class);

    // Plain decimal notation only: no hex, no "NaN"/"Infinity", no Java "d"/"f" suffixes
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final ObjectMapper objectMapper;
    private final ValidationMode mode;

    public OperandParser(ObjectMapper objectMapper, ArithmeticProperties props) {
        this.objectMapper = objectMapper;
        this.mode = props.getValidationMode();
    }

    public ValidationMode getMode() {
        return mode;
    }

    /**
     * Parses and validates a request body.
     *
     * @param body raw body, may be {@code null}
     * @return validated operands
     * @throws MissingOperandException if the payload is absent or lacks an operand
     * @throws InvalidOperandException if an operand is not numeric under the active mode or
     *         exceeds the reader's number length limit
     */
    public ArithmeticRequest parse(String body) {
        JsonNode payload = readTree(body);
        if (payload == null || !payload.isObject() || !payload.has(NUM1) || !payload.has(NUM2)) {
            throw new MissingOperandException(mode.getMissingMessage());
        }
        return switch (mode) {
            case PERMISSIVE -> ArithmeticRequest.of(
                    toDouble(payload.get(NUM1), NUM1),
                    toDouble(payload.get(NUM2), NUM2));
            case STRICT -> new ArithmeticRequest(
                    toNativeNumber(payload.get(NUM1), NUM1),
                    toNativeNumber(payload.get(NUM2), NUM2));
        };
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            if (exceedsReadConstraints(e)) {
                LOG.debug("Request body exceeds JSON read constraints: {}", e.getOriginalMessage());
                throw new InvalidOperandException(mode.getInvalidMessage(), e);
            }
            LOG.debug("Request body is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static boolean exceedsReadConstraints(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof StreamConstraintsException) {
                return true;
            }
        }
        return false;
    }

    private double toDouble(JsonNode node, String field) {
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual() && DECIMAL.matcher(node.textValue().strip()).matches()) {
            value = Double.parseDouble(node.textValue().strip());
        } else {
            throw invalid(field);
        }
        if (!Double.isFinite(value)) {
            throw invalid(field);
        }
        return value;
    }

    private Number toNativeNumber(JsonNode node, String field) {
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isFloatingPointNumber() && Double.isFinite(node.doubleValue())) {
            return node.doubleValue();
        }
        throw invalid(field);
    }

    private InvalidOperandException invalid(String field) {
        return new InvalidOperandException(mode.getInvalidMessage(), field);
    }
}
