package com.healthauth.api.error;

import com.healthauth.core.domain.LedgerErrorKind;
import com.healthauth.core.domain.LedgerResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.function.Function;

/**
 * Maps authority results to HTTP responses.
 */
public final class LedgerResponses {

    private LedgerResponses() {}

    public static HttpStatus statusFor(LedgerErrorKind error) {
        return switch (error) {
            case UNAUTHORIZED, ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case INVALID_IDENTITY -> HttpStatus.BAD_REQUEST;
            case INVALID_COUNTERPARTY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NOT_GRANTED, REPLAY_DETECTED -> HttpStatus.CONFLICT;
        };
    }

    public static <T> ResponseEntity<?> toResponse(
            LedgerResult<T> result, HttpStatus successStatus, Function<T, ?> body) {
        if (result.isFailure()) {
            return failure(result);
        }
        return ResponseEntity.status(successStatus).body(body.apply(result.value()));
    }

    public static ResponseEntity<?> toEmptyResponse(LedgerResult<Void> result) {
        if (result.isFailure()) {
            return failure(result);
        }
        return ResponseEntity.noContent().build();
    }

    public static ResponseEntity<ErrorResponse> failure(LedgerResult<?> result) {
        return ResponseEntity.status(statusFor(result.error()))
                .body(new ErrorResponse(result.error().name(), result.message()));
    }
}
