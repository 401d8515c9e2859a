package com.phillippitts.arithmeticapi.config.properties;

import com.phillippitts.arithmeticapi.service.validation.ValidationMode;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request handling options for the arithmetic routes.
 *
 * <p>Listen address and port are plain Spring Boot settings ({@code server.address},
 * {@code server.port}) and are not repeated here.
 *
 * <p>Note: Bean created via {@link com.phillippitts.arithmeticapi.ArithmeticApiApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "arithmetic")
@Validated
public class ArithmeticProperties {

    /** Operand validation policy: permissive (convert numeric strings) or strict (JSON numbers only). */
    @NotNull(message = "arithmetic.validation-mode must be set")
    private ValidationMode validationMode = ValidationMode.PERMISSIVE;

    /** Whether success bodies carry the operation name alongside the result. */
    private boolean echoOperation = true;

    public ValidationMode getValidationMode() {
        return validationMode;
    }

    public void setValidationMode(ValidationMode validationMode) {
        this.validationMode = validationMode;
    }

    public boolean isEchoOperation() {
        return echoOperation;
    }

    public void setEchoOperation(boolean echoOperation) {
        this.echoOperation = echoOperation;
    }
}
