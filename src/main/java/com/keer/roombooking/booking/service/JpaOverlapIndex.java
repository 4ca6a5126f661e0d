package com.keer.roombooking.booking.service;

import com.keer.roombooking.booking.model.Booking;
import com.keer.roombooking.booking.model.BookingStatus;
import com.keer.roombooking.booking.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Component
@RequiredArgsConstructor
public class JpaOverlapIndex implements OverlapIndex {

    private final BookingRepository bookingRepository;

    @Override
    public boolean conflicts(Long roomId, Instant start, Instant end, Long excludeBookingId) {
        return findConflicts(roomId, start, end).stream()
                .anyMatch(b -> !Objects.equals(b.getId(), excludeBookingId));
    }

    @Override
    public List<Booking> findConflicts(Long roomId, Instant start, Instant end) {
        return bookingRepository.findOverlapping(roomId, BookingStatus.OCCUPYING, start, end);
    }
}
