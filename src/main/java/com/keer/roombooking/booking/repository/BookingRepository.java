package com.keer.roombooking.booking.repository;

import com.keer.roombooking.booking.model.Booking;
import com.keer.roombooking.booking.model.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    // [start, end) overlap: existing.start < end AND existing.end > start
    @Query("SELECT b FROM Booking b WHERE b.room.id = :roomId AND b.status IN :statuses "
            + "AND b.startTime < :end AND b.endTime > :start ORDER BY b.startTime ASC")
    List<Booking> findOverlapping(@Param("roomId") Long roomId,
                                  @Param("statuses") Collection<BookingStatus> statuses,
                                  @Param("start") Instant start,
                                  @Param("end") Instant end);

    @Query("SELECT b FROM Booking b WHERE b.status <> :excluded "
            + "AND (:roomId IS NULL OR b.room.id = :roomId) "
            + "AND (:ownerId IS NULL OR b.ownerId = :ownerId) "
            + "ORDER BY b.startTime ASC, b.id ASC")
    List<Booking> findActive(@Param("excluded") BookingStatus excluded,
                             @Param("roomId") Long roomId,
                             @Param("ownerId") Long ownerId);

    List<Booking> findAllByOrderByCreatedAtDescIdDesc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT b FROM Booking b WHERE b.status = :status AND b.reminderSent = false "
            + "AND b.startTime >= :from AND b.startTime <= :to ORDER BY b.startTime ASC")
    List<Booking> findReminderCandidates(@Param("status") BookingStatus status,
                                         @Param("from") Instant from,
                                         @Param("to") Instant to);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Booking b SET b.status = :completed, b.version = b.version + 1 "
            + "WHERE b.status = :confirmed AND b.endTime < :now")
    int completeEndedBefore(@Param("confirmed") BookingStatus confirmed,
                            @Param("completed") BookingStatus completed,
                            @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Booking b SET b.reminderSent = true, b.version = b.version + 1 "
            + "WHERE b.id = :id AND b.status = :confirmed AND b.reminderSent = false")
    int markReminderSent(@Param("id") Long id, @Param("confirmed") BookingStatus confirmed);
}
