package com.keer.roombooking.booking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConflictCheckResponse {

    private boolean hasConflicts;

    private List<BookingResponse> conflicts;
}
