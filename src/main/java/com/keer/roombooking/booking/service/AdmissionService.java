package com.keer.roombooking.booking.service;

import com.keer.roombooking.booking.model.Booking;
import com.keer.roombooking.booking.repository.BookingRepository;
import com.keer.roombooking.member.model.Member;
import com.keer.roombooking.member.service.MemberDirectory;
import com.keer.roombooking.room.model.Room;
import com.keer.roombooking.room.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;

/**
 * The only path that creates bookings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdmissionService {

    private final RoomRepository roomRepository;
    private final BookingRepository bookingRepository;
    private final MemberDirectory memberDirectory;
    private final AdmissionPolicy admissionPolicy;
    private final OverlapIndex overlapIndex;
    private final Clock clock;

    /**
     * Validates the request and commits a CONFIRMED booking.
     * <p>
     * The room row is locked for the rest of the transaction, so admissions on one room are
     * serialised while other rooms proceed. The overlap check runs once before the lock as a
     * cheap rejection and again under it; only the second result is authoritative.
     *
     * @throws BookingException for unknown room or owner and for every policy rejection
     */
    @Transactional
    public Booking admit(AdmissionRequest request) {
        if (!roomRepository.existsById(request.roomId())) {
            throw new BookingException(BookingError.NOT_FOUND, "Room " + request.roomId() + " not found");
        }
        Member owner = memberDirectory.require(request.ownerId());

        admissionPolicy.validate(request.start(), request.end());
        if (overlapIndex.conflicts(request.roomId(), request.start(), request.end())) {
            throw slotConflict(request);
        }

        Room room = roomRepository.findByIdForUpdate(request.roomId())
                .orElseThrow(() -> new BookingException(BookingError.NOT_FOUND,
                        "Room " + request.roomId() + " not found"));
        if (overlapIndex.conflicts(room.getId(), request.start(), request.end())) {
            throw slotConflict(request);
        }

        Booking booking = new Booking();
        booking.setRoom(room);
        booking.setOwnerId(owner.getId());
        booking.setOwnerName(owner.getName());
        booking.setStartTime(request.start());
        booking.setEndTime(request.end());
        booking.setPurpose(request.purpose());
        booking.setAttendees(new ArrayList<>(request.attendees()));
        booking.setCreatedAt(clock.instant());

        Booking saved = bookingRepository.saveAndFlush(booking);
        log.info("Admitted booking {} room={} owner={} [{}, {})",
                saved.getId(), room.getId(), owner.getId(), saved.getStartTime(), saved.getEndTime());
        return saved;
    }

    private BookingException slotConflict(AdmissionRequest request) {
        log.warn("Booking conflict detected for room {} at {}-{}", request.roomId(), request.start(), request.end());
        return new BookingException(BookingError.SLOT_CONFLICT,
                "Requested interval " + request.start() + " - " + request.end()
                        + " conflicts with an existing booking");
    }
}
