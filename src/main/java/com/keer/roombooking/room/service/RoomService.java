package com.keer.roombooking.room.service;

import com.keer.roombooking.config.CacheConfig;
import com.keer.roombooking.room.dto.RoomRequest;
import com.keer.roombooking.room.dto.RoomResponse;
import com.keer.roombooking.room.model.Room;
import com.keer.roombooking.room.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class RoomService {

    private final RoomRepository roomRepository;

    @Transactional
    public RoomResponse createRoom(RoomRequest request) {
        Room room = new Room();
        apply(room, request);
        Room saved = roomRepository.save(room);
        log.info("Created room {} ({})", saved.getId(), saved.getName());
        return toResponse(saved);
    }

    /**
     * Returns {@code null} when the room does not exist.
     */
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.ROOMS_CACHE, key = "#id")
    public RoomResponse updateRoom(Long id, RoomRequest request) {
        Room room = roomRepository.findById(id).orElse(null);
        if (room == null) {
            return null;
        }
        apply(room, request);
        return toResponse(roomRepository.save(room));
    }

    @Cacheable(cacheNames = CacheConfig.ROOMS_CACHE, key = "#id", unless = "#result == null")
    public RoomResponse getRoom(Long id) {
        return roomRepository.findById(id)
                .map(this::toResponse)
                .orElse(null);
    }

    public List<RoomResponse> getAllRooms() {
        return roomRepository.findAllByOrderByNameAsc().stream()
                .map(this::toResponse)
                .toList();
    }

    private void apply(Room room, RoomRequest request) {
        if (request.getMinCapacity() > request.getMaxCapacity()) {
            throw new IllegalArgumentException("Minimum capacity cannot be greater than maximum capacity");
        }
        room.setName(request.getName());
        room.setDescription(request.getDescription());
        room.setMinCapacity(request.getMinCapacity());
        room.setMaxCapacity(request.getMaxCapacity());
        room.setFeatures(request.getFeatures() == null ? new ArrayList<>() : new ArrayList<>(request.getFeatures()));
    }

    private RoomResponse toResponse(Room room) {
        return RoomResponse.builder()
                .id(room.getId())
                .name(room.getName())
                .description(room.getDescription())
                .minCapacity(room.getMinCapacity())
                .maxCapacity(room.getMaxCapacity())
                .features(new ArrayList<>(room.getFeatures()))
                .build();
    }
}
