package com.appointments.booking.repository;

import com.appointments.booking.enums.BookingStatus;
import com.appointments.booking.model.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    Optional<Booking> findByToken(String token);

    boolean existsByBookingDateAndBookingTimeAndStatus(String bookingDate, String bookingTime, BookingStatus status);

    @Query("""
            select b from Booking b
            where b.status = :status
              and b.bookingDate is not null and b.bookingTime is not null
              and b.bookingDate between :fromDate and :toDate
            """)
    List<Booking> findScheduledBetween(@Param("status") BookingStatus status,
                                       @Param("fromDate") String fromDate,
                                       @Param("toDate") String toDate);

    /**
     * Schedule order; rows without a date or time come last.
     */
    @Query("""
            select b from Booking b
            order by case when b.bookingDate is null then 1 else 0 end, b.bookingDate,
                     case when b.bookingTime is null then 1 else 0 end, b.bookingTime,
                     b.createdAt
            """)
    List<Booking> findAllInScheduleOrder();

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("update Booking b set b.thankedAt = :thankedAt where b.id = :id and b.thankedAt is null")
    int markThanked(@Param("id") Long id, @Param("thankedAt") Instant thankedAt);
}
