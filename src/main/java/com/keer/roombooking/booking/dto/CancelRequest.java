package com.keer.roombooking.booking.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelRequest {

    @Size(max = 255, message = "reason must be at most 255 characters")
    private String reason;
}
