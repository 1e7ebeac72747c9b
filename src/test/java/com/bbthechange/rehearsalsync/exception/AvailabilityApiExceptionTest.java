package com.bbthechange.rehearsalsync.exception;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityApiExceptionTest {

    @ParameterizedTest
    @CsvSource({
        "400, REJECTED, BAD_GATEWAY",
        "404, REJECTED, BAD_GATEWAY",
        "429, REJECTED, BAD_GATEWAY",
        "500, SERVICE_UNAVAILABLE, SERVICE_UNAVAILABLE",
        "503, SERVICE_UNAVAILABLE, SERVICE_UNAVAILABLE"
    })
    void forStatus_MapsStatusToErrorType(int statusCode, AvailabilityApiException.ErrorType expectedType,
                                         HttpStatus expectedHttpStatus) {
        AvailabilityApiException exception = AvailabilityApiException.forStatus("bulkCreateSlots", statusCode);

        assertThat(exception.getErrorType()).isEqualTo(expectedType);
        assertThat(exception.getHttpStatus()).isEqualTo(expectedHttpStatus);
        assertThat(exception.getMessage()).contains("bulkCreateSlots").contains(String.valueOf(statusCode));
    }
}
