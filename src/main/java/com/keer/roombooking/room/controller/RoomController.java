package com.keer.roombooking.room.controller;

import com.keer.roombooking.booking.service.BookingError;
import com.keer.roombooking.booking.service.BookingException;
import com.keer.roombooking.member.service.MemberDirectory;
import com.keer.roombooking.room.dto.RoomRequest;
import com.keer.roombooking.room.dto.RoomResponse;
import com.keer.roombooking.room.service.RoomService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/rooms")
@RequiredArgsConstructor
public class RoomController {

    private final RoomService roomService;
    private final MemberDirectory memberDirectory;

    @PostMapping
    public ResponseEntity<RoomResponse> createRoom(@RequestHeader("X-Member-Id") Long memberId,
                                                   @Valid @RequestBody RoomRequest request) {
        requireAdmin(memberId);
        RoomResponse response = roomService.createRoom(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{id}")
    public ResponseEntity<RoomResponse> updateRoom(@RequestHeader("X-Member-Id") Long memberId,
                                                   @PathVariable Long id,
                                                   @Valid @RequestBody RoomRequest request) {
        requireAdmin(memberId);
        RoomResponse response = roomService.updateRoom(id, request);
        if (response == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable Long id) {
        RoomResponse response = roomService.getRoom(id);
        if (response == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping
    public ResponseEntity<List<RoomResponse>> getAllRooms() {
        return ResponseEntity.ok(roomService.getAllRooms());
    }

    // Room changes are reserved for administrators.
    private void requireAdmin(Long memberId) {
        if (!memberDirectory.require(memberId).isAdmin()) {
            throw new BookingException(BookingError.FORBIDDEN, "Administrator access required");
        }
    }

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<Map<String, String>> handleBookingException(BookingException e) {
        return ResponseEntity.status(e.getError().getHttpStatus())
                .body(Map.of("error", e.getError().name(), "message", e.getMessage()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().isEmpty()
                ? "Invalid request"
                : e.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
