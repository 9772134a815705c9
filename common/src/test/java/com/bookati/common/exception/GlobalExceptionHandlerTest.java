package com.bookati.common.exception;

import com.bookati.common.dto.BaseResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("conflicts map to 409 and keep their error code so clients can offer another slot")
    void conflict_is409() {
        ResponseEntity<BaseResponse<?>> response = handler.handleConflict(
                new ConflictException("Slot is full", "CAPACITY_EXHAUSTED"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getErrorCode()).isEqualTo("CAPACITY_EXHAUSTED");
    }

    @Test
    @DisplayName("validation errors map to 400, distinct from conflicts")
    void validation_is400() {
        ResponseEntity<BaseResponse<?>> response = handler.handleValidation(
                new ValidationException("Phone number is invalid", "INVALID_PHONE"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getErrorCode()).isEqualTo("INVALID_PHONE");
    }

    @Test
    @DisplayName("not found, forbidden and unavailable map to 404, 403 and 503")
    void otherKinds() {
        assertThat(handler.handleResourceNotFoundException(new ResourceNotFoundException("Slot", "x"))
                .getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handleForbidden(new ForbiddenException("other tenant"))
                .getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(handler.handleTransientDataAccess(new CannotAcquireLockException("lock wait"))
                .getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    @DisplayName("unexpected errors are reported generically as 500")
    void generic_is500() {
        ResponseEntity<BaseResponse<?>> response = handler.handleGenericException(
                new IllegalStateException("connection reset by peer"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
        assertThat(response.getBody().getErrorCode()).isEqualTo("INTERNAL_ERROR");
    }
}
