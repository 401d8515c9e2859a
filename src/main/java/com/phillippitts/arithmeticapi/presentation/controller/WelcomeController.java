package com.phillippitts.arithmeticapi.presentation.controller;

import com.phillippitts.arithmeticapi.domain.Operation;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Plaintext landing page listing the operation routes.
 */
@RestController
class WelcomeController {

    static final String WELCOME_MESSAGE = "Welcome to the Arithmetic API! Use "
            + Arrays.stream(Operation.values()).map(Operation::getPath).collect(Collectors.joining(", "))
            + " endpoints.";

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    ResponseEntity<String> welcome() {
        return ResponseEntity.ok(WELCOME_MESSAGE);
    }
}
