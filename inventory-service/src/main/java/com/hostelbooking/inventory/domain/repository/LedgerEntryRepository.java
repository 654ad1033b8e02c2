package com.hostelbooking.inventory.domain.repository;

import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerOrigin;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    /**
     * Entries in the given statuses whose half-open interval overlaps {@code [checkIn, checkOut)}.
     */
    @Query("""
           SELECT e FROM LedgerEntry e
           WHERE e.roomId = :roomId
             AND e.status IN :statuses
             AND e.checkIn < :checkOut
             AND e.checkOut > :checkIn
           ORDER BY e.id
           """)
    List<LedgerEntry> findOverlapping(@Param("roomId") String roomId,
                                      @Param("statuses") Collection<LedgerStatus> statuses,
                                      @Param("checkIn") LocalDate checkIn,
                                      @Param("checkOut") LocalDate checkOut);

    @Query("""
           SELECT e FROM LedgerEntry e
           WHERE e.status IN :statuses
             AND e.checkIn < :checkOut
             AND e.checkOut > :checkIn
           ORDER BY e.roomId, e.id
           """)
    List<LedgerEntry> findOverlappingAllRooms(@Param("statuses") Collection<LedgerStatus> statuses,
                                              @Param("checkIn") LocalDate checkIn,
                                              @Param("checkOut") LocalDate checkOut);

    Optional<LedgerEntry> findFirstByRoomIdAndOriginAndExternalPlatformAndExternalIdAndStatusOrderByIdDesc(
            String roomId, LedgerOrigin origin, String externalPlatform, String externalId, LedgerStatus status);

    List<LedgerEntry> findByFeedIdAndOriginAndStatusAndCheckOutAfterOrderById(
            Long feedId, LedgerOrigin origin, LedgerStatus status, LocalDate checkOutAfter);

    List<LedgerEntry> findByStatusAndExpiresAtLessThanEqualOrderByExpiresAt(LedgerStatus status, LocalDateTime now);

    List<LedgerEntry> findByRoomIdAndStatusAndCheckOutAfterOrderByCheckIn(
            String roomId, LedgerStatus status, LocalDate checkOutAfter);
}
