package com.keer.roombooking.booking.service;

public class BookingException extends RuntimeException {

    private final BookingError error;

    public BookingException(BookingError error, String message) {
        super(message);
        this.error = error;
    }

    public BookingError getError() {
        return error;
    }
}
