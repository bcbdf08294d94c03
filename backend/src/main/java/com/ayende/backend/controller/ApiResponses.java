package com.ayende.backend.controller;

import com.ayende.backend.core.result.OperationResult;
import com.ayende.backend.dto.ApiError;
import org.springframework.http.ResponseEntity;

import java.util.function.Function;

/** Maps service results to HTTP: the value as 200, a refusal with its code and details. */
final class ApiResponses {

    static <T, R> ResponseEntity<?> of(OperationResult<T> result, Function<T, R> body) {
        if (result.isOk()) {
            return ResponseEntity.ok(body.apply(result.value()));
        }
        return ResponseEntity.status(result.error().status())
                .body(new ApiError(result.error().name(), result.message(), result.details()));
    }

    private ApiResponses() {
    }
}
