package com.keer.roombooking.booking.dto;

import com.keer.roombooking.booking.model.Booking;
import com.keer.roombooking.booking.model.BookingStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingResponse {

    private Long id;

    private Long roomId;

    private String roomName;

    private Long ownerId;

    private String ownerName;

    private Instant startTime;

    private Instant endTime;

    private BookingStatus status;

    private String purpose;

    private List<AttendeeDto> attendees;

    private boolean reminderSent;

    private String cancellationReason;

    private Instant createdAt;

    public static BookingResponse from(Booking booking) {
        return BookingResponse.builder()
                .id(booking.getId())
                .roomId(booking.getRoom().getId())
                .roomName(booking.getRoom().getName())
                .ownerId(booking.getOwnerId())
                .ownerName(booking.getOwnerName())
                .startTime(booking.getStartTime())
                .endTime(booking.getEndTime())
                .status(booking.getStatus())
                .purpose(booking.getPurpose())
                .attendees(booking.getAttendees().stream().map(AttendeeDto::from).toList())
                .reminderSent(booking.isReminderSent())
                .cancellationReason(booking.getCancellationReason())
                .createdAt(booking.getCreatedAt())
                .build();
    }
}
