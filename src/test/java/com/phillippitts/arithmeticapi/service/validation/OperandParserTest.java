package com.phillippitts.arithmeticapi.service.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.arithmeticapi.config.properties.ArithmeticProperties;
import com.phillippitts.arithmeticapi.domain.ArithmeticRequest;
import com.phillippitts.arithmeticapi.exception.InvalidOperandException;
import com.phillippitts.arithmeticapi.exception.MissingOperandException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperandParserTest {

    private static OperandParser parser(ValidationMode mode) {
        ArithmeticProperties props = new ArithmeticProperties();
        props.setValidationMode(mode);
        return new OperandParser(new ObjectMapper(), props);
    }

    @Nested
    class Permissive {

        private final OperandParser parser = parser(ValidationMode.PERMISSIVE);

        @Test
        void convertsIntegersToDoubles() {
            ArithmeticRequest request = parser.parse("{\"num1\":10,\"num2\":5}");

            assertThat(request.num1()).isEqualTo(10.0);
            assertThat(request.num2()).isEqualTo(5.0);
            assertThat(request.isIntegral()).isFalse();
        }

        @Test
        void convertsNumericStrings() {
            ArithmeticRequest request = parser.parse("{\"num1\":\" 12.5 \",\"num2\":\"-1e2\"}");

            assertThat(request.num1()).isEqualTo(12.5);
            assertThat(request.num2()).isEqualTo(-100.0);
        }

        @Test
        void ignoresUnknownKeys() {
            ArithmeticRequest request = parser.parse("{\"num1\":1,\"num2\":2,\"operation\":\"divide\"}");

            assertThat(request.num1()).isEqualTo(1.0);
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "not json", "{\"num1\":1", "[1,2]", "42", "{}", "{\"num1\":1}", "{\"num2\":1}"})
        void rejectsAbsentOrIncompletePayload(String body) {
            assertThatThrownBy(() -> parser.parse(body))
                    .isInstanceOf(MissingOperandException.class)
                    .hasMessage("Missing num1 or num2 in JSON payload");
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"num1\":\"abc\",\"num2\":1}",
                "{\"num1\":1,\"num2\":null}",
                "{\"num1\":true,\"num2\":1}",
                "{\"num1\":[1],\"num2\":1}",
                "{\"num1\":{\"v\":1},\"num2\":1}",
                "{\"num1\":\"NaN\",\"num2\":1}",
                "{\"num1\":\"Infinity\",\"num2\":1}",
                "{\"num1\":\"0x10\",\"num2\":1}",
                "{\"num1\":\"1e400\",\"num2\":1}",
                "{\"num1\":1e400,\"num2\":1}"
        })
        void rejectsValuesThatAreNotFiniteNumbers(String body) {
            assertThatThrownBy(() -> parser.parse(body))
                    .isInstanceOf(InvalidOperandException.class)
                    .hasMessage("Invalid input type");
        }

        @Test
        void treatsOverlongNumberAsInvalidOperand() {
            String body = "{\"num1\":1" + "0".repeat(1200) + ",\"num2\":1}";

            assertThatThrownBy(() -> parser.parse(body))
                    .isInstanceOf(InvalidOperandException.class)
                    .hasMessage("Invalid input type");
        }

        @Test
        void reportsOffendingField() {
            assertThatThrownBy(() -> parser.parse("{\"num1\":1,\"num2\":\"x\"}"))
                    .isInstanceOfSatisfying(InvalidOperandException.class,
                            ex -> assertThat(ex.getField()).isEqualTo("num2"));
        }
    }

    @Nested
    class Strict {

        private final OperandParser parser = parser(ValidationMode.STRICT);

        @Test
        void keepsIntegersExact() {
            ArithmeticRequest request = parser.parse("{\"num1\":10,\"num2\":5}");

            assertThat(request.num1()).isEqualTo(BigInteger.TEN);
            assertThat(request.num2()).isEqualTo(BigInteger.valueOf(5));
            assertThat(request.isIntegral()).isTrue();
        }

        @Test
        void keepsIntegersBeyondLongRange() {
            ArithmeticRequest request = parser.parse("{\"num1\":123456789012345678901234567890,\"num2\":1}");

            assertThat(request.num1()).isEqualTo(new BigInteger("123456789012345678901234567890"));
        }

        @Test
        void keepsFloatsAsDoubles() {
            ArithmeticRequest request = parser.parse("{\"num1\":1.5,\"num2\":2}");

            assertThat(request.num1()).isEqualTo(1.5);
            assertThat(request.num2()).isEqualTo(BigInteger.TWO);
            assertThat(request.isIntegral()).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"num1\":\"10\",\"num2\":5}",
                "{\"num1\":10,\"num2\":\"5.0\"}",
                "{\"num1\":true,\"num2\":5}",
                "{\"num1\":null,\"num2\":5}",
                "{\"num1\":10,\"num2\":1e400}"
        })
        void rejectsAnythingButJsonNumbers(String body) {
            assertThatThrownBy(() -> parser.parse(body))
                    .isInstanceOf(InvalidOperandException.class)
                    .hasMessage("Invalid input, please provide numbers.");
        }

        @Test
        void treatsOverlongNumberAsInvalidOperand() {
            String body = "{\"num1\":1,\"num2\":1" + "0".repeat(1200) + "}";

            assertThatThrownBy(() -> parser.parse(body))
                    .isInstanceOf(InvalidOperandException.class)
                    .hasMessage("Invalid input, please provide numbers.");
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"{\"num1\":10}", "[10,5]"})
        void usesSameMessageForMissingOperands(String body) {
            assertThatThrownBy(() -> parser.parse(body))
                    .isInstanceOf(MissingOperandException.class)
                    .hasMessage("Invalid input, please provide numbers.");
        }
    }
}
