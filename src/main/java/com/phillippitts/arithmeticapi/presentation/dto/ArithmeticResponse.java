package com.phillippitts.arithmeticapi.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.arithmeticapi.domain.ArithmeticResult;

/**
 * Success body: {@code {"operation":"add","result":15.0}}, or {@code {"result":15.0}} when the
 * operation name is not echoed.
 *
 * @param operation lower-case operation name, {@code null} to omit it
 * @param result    computed value
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArithmeticResponse(String operation, Number result) {

    public static ArithmeticResponse from(ArithmeticResult result, boolean echoOperation) {
        return new ArithmeticResponse(
                echoOperation ? result.operation().getName() : null,
                result.value());
    }
}
