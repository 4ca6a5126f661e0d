package com.keer.roombooking.booking.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Attendee {

    @Column(nullable = false)
    private String name;

    private String studentId;

    @Column(nullable = false)
    private boolean companion = true;
}
