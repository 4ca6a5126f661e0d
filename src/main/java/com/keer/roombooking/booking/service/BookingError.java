package com.keer.roombooking.booking.service;

import org.springframework.http.HttpStatus;

public enum BookingError {

    // policy rejections, correctable by the caller
    LEAD_TIME_VIOLATION(HttpStatus.BAD_REQUEST),
    DURATION_VIOLATION(HttpStatus.BAD_REQUEST),
    OUTSIDE_OPERATING_HOURS(HttpStatus.BAD_REQUEST),
    SLOT_CONFLICT(HttpStatus.CONFLICT),

    // request errors
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INVALID_TRANSITION(HttpStatus.CONFLICT),

    // infrastructure
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    BookingError(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
