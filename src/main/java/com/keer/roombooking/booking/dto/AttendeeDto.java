package com.keer.roombooking.booking.dto;

import com.keer.roombooking.booking.model.Attendee;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttendeeDto {

    @NotBlank(message = "attendee name is required")
    private String name;

    private String studentId;

    private Boolean companion;

    public Attendee toAttendee() {
        return new Attendee(name, studentId, companion == null || companion);
    }

    public static AttendeeDto from(Attendee attendee) {
        return new AttendeeDto(attendee.getName(), attendee.getStudentId(), attendee.isCompanion());
    }
}
