package com.hostelbooking.inventory.domain.availability;

import com.hostelbooking.inventory.domain.exception.InvalidRangeException;
import com.hostelbooking.inventory.domain.ledger.InventoryLedger;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.Room;
import com.hostelbooking.inventory.domain.model.StayCategory;
import com.hostelbooking.inventory.domain.model.StayInterval;
import com.hostelbooking.inventory.domain.room.RoomCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Reads the ledger and answers which beds are free. Never cached; write paths call it inside the
 * room lock to re-validate a claim.
 * <p>
 * free beds = {1..capacity} minus the beds of every active entry overlapping the stay.
 * Expired holds are not active even before the sweep has marked them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityCalculator {

    private final InventoryLedger ledger;
    private final RoomCatalog roomCatalog;
    private final SwingRoomPolicy swingRoomPolicy;
    private final AvailabilityProperties properties;
    private final Clock clock;

    /**
     * Builds the interval and rejects check-ins further in the past than the grace window.
     */
    public StayInterval validate(LocalDate checkIn, LocalDate checkOut) {
        StayInterval interval = StayInterval.of(checkIn, checkOut);
        LocalDate earliest = LocalDate.now(clock).minusDays(properties.pastGraceDays());
        if (interval.checkIn().isBefore(earliest)) {
            throw new InvalidRangeException(
                    String.format("Check-in %s is in the past (earliest allowed %s)", checkIn, earliest));
        }
        return interval;
    }

    public AvailabilityResult calculate(AvailabilityQuery query) {
        if (query.bedsNeeded() < 1) {
            throw new InvalidRangeException("At least one bed must be requested");
        }
        StayInterval interval = validate(query.checkIn(), query.checkOut());
        LocalDateTime now = LocalDateTime.now(clock);

        List<RoomAvailabilityView> perRoom = perRoom(interval, query.category(), query.bedsNeeded(), now);
        int total = perRoom.stream().mapToInt(RoomAvailabilityView::availableBeds).sum();
        boolean available = total >= query.bedsNeeded();
        boolean fitsOneRoom = perRoom.stream().anyMatch(view -> view.availableBeds() >= query.bedsNeeded());

        List<AlternativeDates> alternatives = available
                ? List.of()
                : findAlternatives(interval, query.category(), query.bedsNeeded(), now);
        log.debug("Availability {} {} beds={} -> {} free across {} room(s)",
                interval, query.category(), query.bedsNeeded(), total, perRoom.size());

        return new AvailabilityResult(
                interval.checkIn(),
                interval.checkOut(),
                query.bedsNeeded(),
                query.category(),
                available,
                total,
                available && !fitsOneRoom,
                perRoom,
                alternatives);
    }

    /**
     * Availability of a single room, read straight from the ledger.
     */
    public RoomAvailabilityView forRoom(Room room, StayInterval interval, StayCategory category, int bedsNeeded) {
        LocalDateTime now = LocalDateTime.now(clock);
        return view(room, interval, category, bedsNeeded, ledger.findLiveOverlapping(room.getId(), interval), now);
    }

    /**
     * Free bed indices in ascending order.
     */
    public List<Integer> freeBeds(Room room, Collection<LedgerEntry> roomEntries, LocalDateTime now) {
        Set<Integer> occupied = occupiedBeds(roomEntries, now);
        return IntStream.rangeClosed(1, room.getCapacity())
                .filter(bed -> !occupied.contains(bed))
                .boxed()
                .toList();
    }

    public Set<Integer> occupiedBeds(Collection<LedgerEntry> roomEntries, LocalDateTime now) {
        Set<Integer> occupied = new TreeSet<>();
        for (LedgerEntry entry : roomEntries) {
            if (entry.isActiveAt(now)) {
                occupied.addAll(entry.getBeds());
            }
        }
        return occupied;
    }

    private List<RoomAvailabilityView> perRoom(StayInterval interval, StayCategory category, int bedsNeeded,
                                               LocalDateTime now) {
        Map<String, List<LedgerEntry>> byRoom = ledger.findLiveOverlapping(interval).stream()
                .collect(Collectors.groupingBy(LedgerEntry::getRoomId));
        List<RoomAvailabilityView> views = new ArrayList<>();
        for (Room room : roomCatalog.all()) {
            views.add(view(room, interval, category, bedsNeeded, byRoom.getOrDefault(room.getId(), List.of()), now));
        }
        return views;
    }

    private RoomAvailabilityView view(Room room, StayInterval interval, StayCategory category, int bedsNeeded,
                                      List<LedgerEntry> roomEntries, LocalDateTime now) {
        boolean eligible = swingRoomPolicy.isEligible(room, category, interval, roomEntries, now);
        List<Integer> free = freeBeds(room, roomEntries, now);
        int buffer = properties.bufferFor(room.getId());
        int available = eligible ? Math.max(0, free.size() - buffer) : 0;
        List<Integer> offered = free.subList(0, Math.min(Math.max(bedsNeeded, 0), available));
        return new RoomAvailabilityView(
                room.getId(),
                room.getName(),
                room.getCategory(),
                room.getCapacity(),
                eligible,
                free.size(),
                buffer,
                available,
                List.copyOf(offered));
    }

    /**
     * Same-length stays shifted by 1..N days, nearest first, earlier before later on a tie.
     * Stays that would start before today are skipped.
     */
    private List<AlternativeDates> findAlternatives(StayInterval interval, StayCategory category, int bedsNeeded,
                                                    LocalDateTime now) {
        List<AlternativeDates> alternatives = new ArrayList<>();
        LocalDate today = now.toLocalDate();
        for (int offset = 1; offset <= properties.alternativeSearchDays(); offset++) {
            for (int shift : new int[]{-offset, offset}) {
                if (alternatives.size() >= properties.maxAlternatives()) {
                    return alternatives;
                }
                StayInterval candidate = interval.shiftDays(shift);
                if (candidate.checkIn().isBefore(today)) {
                    continue;
                }
                int free = perRoom(candidate, category, bedsNeeded, now).stream()
                        .mapToInt(RoomAvailabilityView::availableBeds)
                        .sum();
                if (free >= bedsNeeded) {
                    alternatives.add(new AlternativeDates(candidate.checkIn(), candidate.checkOut(), shift, free));
                }
            }
        }
        return alternatives;
    }
}
