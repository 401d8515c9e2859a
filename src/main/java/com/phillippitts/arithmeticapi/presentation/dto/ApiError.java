package com.phillippitts.arithmeticapi.presentation.dto;

/**
 * Error body returned for every failed request: {@code {"error":"Cannot divide by zero"}}.
 */
public record ApiError(String error) {
}
