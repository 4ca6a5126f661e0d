package com.keer.roombooking.booking.model;

import com.keer.roombooking.booking.service.BookingError;
import com.keer.roombooking.booking.service.BookingException;
import com.keer.roombooking.room.model.Room;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "booking", indexes = {
        @Index(name = "idx_booking_room_start", columnList = "room_id, start_time"),
        @Index(name = "idx_booking_status_start", columnList = "status, start_time")
})
@Data
@NoArgsConstructor
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "room_id", nullable = false)
    private Room room;

    @Column(nullable = false)
    private Long ownerId;

    // Snapshot taken at admission; later renames do not rewrite history.
    @Column(nullable = false)
    private String ownerName;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private BookingStatus status = BookingStatus.CONFIRMED;

    @Column(length = 500)
    private String purpose;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_attendee", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "position")
    private List<Attendee> attendees = new ArrayList<>();

    @Column(nullable = false)
    private boolean reminderSent = false;

    private String cancellationReason;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    public TimeInterval interval() {
        return new TimeInterval(startTime, endTime);
    }

    public void cancel(String reason) {
        transitionTo(BookingStatus.CANCELLED);
        this.cancellationReason = reason;
    }

    private void transitionTo(BookingStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new BookingException(BookingError.INVALID_TRANSITION,
                    "Cannot move booking " + id + " from " + status + " to " + target);
        }
        this.status = target;
    }
}
