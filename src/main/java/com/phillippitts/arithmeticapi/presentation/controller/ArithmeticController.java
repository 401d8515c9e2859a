package com.phillippitts.arithmeticapi.presentation.controller;

import com.phillippitts.arithmeticapi.config.properties.ArithmeticProperties;
import com.phillippitts.arithmeticapi.domain.ArithmeticResult;
import com.phillippitts.arithmeticapi.domain.Operation;
import com.phillippitts.arithmeticapi.presentation.dto.ArithmeticResponse;
import com.phillippitts.arithmeticapi.service.ArithmeticService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * The four operation routes. The route alone selects the operation; the body only carries
 * operands.
 *
 * <p>The body is bound as a raw string so that an absent, empty or malformed payload reaches
 * {@link com.phillippitts.arithmeticapi.service.validation.OperandParser} and is reported with
 * the same 400 contract as a missing operand. Failures propagate as domain exceptions to
 * {@code GlobalExceptionHandler}.
 */
@RestController
class ArithmeticController {

    private final ArithmeticService arithmeticService;
    private final boolean echoOperation;

    ArithmeticController(ArithmeticService arithmeticService, ArithmeticProperties props) {
        this.arithmeticService = arithmeticService;
        this.echoOperation = props.isEchoOperation();
    }

    @PostMapping(value = "/add", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ArithmeticResponse> add(@RequestBody(required = false) String body) {
        return handle(Operation.ADD, body);
    }

    @PostMapping(value = "/subtract", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ArithmeticResponse> subtract(@RequestBody(required = false) String body) {
        return handle(Operation.SUBTRACT, body);
    }

    @PostMapping(value = "/multiply", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ArithmeticResponse> multiply(@RequestBody(required = false) String body) {
        return handle(Operation.MULTIPLY, body);
    }

    @PostMapping(value = "/divide", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ArithmeticResponse> divide(@RequestBody(required = false) String body) {
        return handle(Operation.DIVIDE, body);
    }

    private ResponseEntity<ArithmeticResponse> handle(Operation operation, String body) {
        ArithmeticResult result = arithmeticService.calculate(operation, body);
        return ResponseEntity.ok(ArithmeticResponse.from(result, echoOperation));
    }
}
