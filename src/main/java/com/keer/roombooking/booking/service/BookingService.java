package com.keer.roombooking.booking.service;

import com.keer.roombooking.booking.event.BookingCancelledEvent;
import com.keer.roombooking.booking.model.Booking;
import com.keer.roombooking.booking.model.BookingStatus;
import com.keer.roombooking.booking.model.TimeInterval;
import com.keer.roombooking.booking.policy.BookingPolicyProperties;
import com.keer.roombooking.booking.repository.BookingRepository;
import com.keer.roombooking.room.repository.RoomRepository;
import com.keer.roombooking.selection.AvailabilitySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;
    private final RoomRepository roomRepository;
    private final OverlapIndex overlapIndex;
    private final BookingPolicyProperties policy;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Cancels a CONFIRMED booking on behalf of its owner or an administrator.
     * The row stays locked until commit so a concurrent completion cannot interleave.
     */
    @Transactional
    public Booking cancel(Long bookingId, Long requesterId, boolean requesterIsAdmin, String reason) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> notFound(bookingId));

        if (!requesterIsAdmin && !Objects.equals(booking.getOwnerId(), requesterId)) {
            throw new BookingException(BookingError.FORBIDDEN, "You can only cancel your own bookings");
        }

        booking.cancel(reason);
        Booking saved = bookingRepository.save(booking);

        eventPublisher.publishEvent(new BookingCancelledEvent(
                saved.getId(),
                saved.getOwnerId(),
                saved.getRoom().getName(),
                saved.getStartTime(),
                saved.getEndTime(),
                reason));

        log.info("Booking {} cancelled by member {}. Reason: {}", saved.getId(), requesterId,
                reason == null ? "None" : reason);
        return saved;
    }

    @Transactional(readOnly = true)
    public Booking getBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> notFound(bookingId));
    }

    /**
     * Non-cancelled bookings, optionally narrowed to a room and/or an owner, earliest first.
     */
    @Transactional(readOnly = true)
    public List<Booking> listActive(Long roomId, Long ownerId) {
        return bookingRepository.findActive(BookingStatus.CANCELLED, roomId, ownerId);
    }

    @Transactional(readOnly = true)
    public List<Booking> listAll() {
        return bookingRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public List<Booking> findConflicts(Long roomId, Instant start, Instant end) {
        TimeInterval interval = new TimeInterval(start, end);
        return overlapIndex.findConflicts(roomId, interval.start(), interval.end());
    }

    /**
     * Occupied intervals of one room for one calendar day of the operating window.
     */
    @Transactional(readOnly = true)
    public AvailabilitySnapshot availability(Long roomId, LocalDate date) {
        if (!roomRepository.existsById(roomId)) {
            throw new BookingException(BookingError.NOT_FOUND, "Room " + roomId + " not found");
        }
        ZonedDateTime dayStart = date.atStartOfDay(policy.getZone());
        List<TimeInterval> occupied = overlapIndex
                .findConflicts(roomId, dayStart.toInstant(), dayStart.plusDays(1).toInstant()).stream()
                .map(Booking::interval)
                .toList();
        return new AvailabilitySnapshot(roomId, occupied);
    }

    private BookingException notFound(Long bookingId) {
        return new BookingException(BookingError.NOT_FOUND, "Booking " + bookingId + " not found");
    }
}
