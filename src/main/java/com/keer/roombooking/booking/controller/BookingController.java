package com.keer.roombooking.booking.controller;

import com.keer.roombooking.booking.dto.AttendeeDto;
import com.keer.roombooking.booking.dto.AvailabilityResponse;
import com.keer.roombooking.booking.dto.BookingRequest;
import com.keer.roombooking.booking.dto.BookingResponse;
import com.keer.roombooking.booking.dto.CancelRequest;
import com.keer.roombooking.booking.dto.ConflictCheckRequest;
import com.keer.roombooking.booking.dto.ConflictCheckResponse;
import com.keer.roombooking.booking.model.Booking;
import com.keer.roombooking.booking.service.AdmissionRequest;
import com.keer.roombooking.booking.service.AdmissionService;
import com.keer.roombooking.booking.service.BookingError;
import com.keer.roombooking.booking.service.BookingException;
import com.keer.roombooking.booking.service.BookingService;
import com.keer.roombooking.member.model.Member;
import com.keer.roombooking.member.service.MemberDirectory;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
public class BookingController {

    static final String MEMBER_HEADER = "X-Member-Id";

    private final AdmissionService admissionService;
    private final BookingService bookingService;
    private final MemberDirectory memberDirectory;

    @PostMapping("/api/bookings")
    public ResponseEntity<BookingResponse> createBooking(@RequestHeader(MEMBER_HEADER) Long memberId,
                                                        @Valid @RequestBody BookingRequest request) {
        List<AttendeeDto> attendees = request.getAttendees() == null ? List.of() : request.getAttendees();
        Booking booking = admissionService.admit(new AdmissionRequest(
                request.getRoomId(),
                memberId,
                request.getStartTime(),
                request.getEndTime(),
                request.getPurpose(),
                attendees.stream().map(AttendeeDto::toAttendee).toList()));
        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    @PostMapping("/api/bookings/{id}/cancel")
    public ResponseEntity<BookingResponse> cancelBooking(@RequestHeader(MEMBER_HEADER) Long memberId,
                                                        @PathVariable Long id,
                                                        @Valid @RequestBody(required = false) CancelRequest request) {
        Member requester = memberDirectory.require(memberId);
        String reason = request == null ? null : request.getReason();
        Booking booking = bookingService.cancel(id, requester.getId(), requester.isAdmin(), reason);
        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    @GetMapping("/api/bookings")
    public ResponseEntity<List<BookingResponse>> listBookings(@RequestParam(required = false) Long roomId,
                                                             @RequestParam(required = false) Long ownerId) {
        return ResponseEntity.ok(toResponses(bookingService.listActive(roomId, ownerId)));
    }

    @GetMapping("/api/bookings/{id}")
    public ResponseEntity<BookingResponse> getBooking(@PathVariable Long id) {
        return ResponseEntity.ok(BookingResponse.from(bookingService.getBooking(id)));
    }

    @GetMapping("/api/admin/bookings")
    public ResponseEntity<List<BookingResponse>> listAllBookings(@RequestHeader(MEMBER_HEADER) Long memberId) {
        if (!memberDirectory.require(memberId).isAdmin()) {
            throw new BookingException(BookingError.FORBIDDEN, "Administrator access required");
        }
        return ResponseEntity.ok(toResponses(bookingService.listAll()));
    }

    @PostMapping("/api/bookings/check-conflicts")
    public ResponseEntity<ConflictCheckResponse> checkConflicts(@Valid @RequestBody ConflictCheckRequest request) {
        List<BookingResponse> conflicts = toResponses(bookingService.findConflicts(
                request.getRoomId(), request.getStartTime(), request.getEndTime()));
        return ResponseEntity.ok(ConflictCheckResponse.builder()
                .hasConflicts(!conflicts.isEmpty())
                .conflicts(conflicts)
                .build());
    }

    @GetMapping("/api/bookings/availability")
    public ResponseEntity<AvailabilityResponse> availability(
            @RequestParam Long roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(AvailabilityResponse.from(date, bookingService.availability(roomId, date)));
    }

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<Map<String, String>> handleBookingException(BookingException e) {
        return ResponseEntity.status(e.getError().getHttpStatus())
                .body(Map.of("error", e.getError().name(), "message", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().isEmpty()
                ? "Invalid request"
                : e.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", message));
    }

    @ExceptionHandler({MissingRequestHeaderException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", e.getMessage()));
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<Map<String, String>> handleStoreFailure(RuntimeException e) {
        log.error("Booking store unavailable: {}", e.getMessage(), e);
        return ResponseEntity.status(BookingError.STORE_UNAVAILABLE.getHttpStatus())
                .body(Map.of("error", BookingError.STORE_UNAVAILABLE.name(),
                        "message", "Booking store is temporarily unavailable, please retry"));
    }

    private List<BookingResponse> toResponses(List<Booking> bookings) {
        return bookings.stream().map(BookingResponse::from).toList();
    }
}
