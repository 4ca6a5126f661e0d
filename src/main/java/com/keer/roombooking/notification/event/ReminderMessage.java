package com.keer.roombooking.notification.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReminderMessage {

    private Long bookingId;
    private String recipientAddress;
    private String recipientName;
    private String roomName;
    private Instant startTime;
    private Instant endTime;
    private Instant timestamp;
}
