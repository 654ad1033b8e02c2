package com.hostelbooking.inventory.sync;

import com.hostelbooking.inventory.calendar.ParsedStay;
import com.hostelbooking.inventory.calendar.StayStatus;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerOrigin;
import com.hostelbooking.inventory.domain.model.Room;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Decides how an imported stay meets the ledger. Runs inside the room lock and only reads what it
 * is given.
 * <ul>
 *   <li>A stay whose external id is already imported updates that entry in place.</li>
 *   <li>A new stay overlapping nothing but a same-platform import that has vanished from the feed is
 *       that booking re-issued under a new id, and updates it.</li>
 *   <li>Otherwise the stay claims {@code guestCount} beds (the whole room for a block), lowest index
 *       first, among beds no active entry holds.</li>
 *   <li>If the claim cannot be met the stay is refused. Existing entries are never evicted, and a
 *       hostel-owned booking among the occupants makes it an external conflict.</li>
 * </ul>
 */
@Component
public class ConflictResolver {

    /**
     * @param existing       the CONFIRMED import carrying the stay's external id, if any
     * @param activeEntries  active entries of the room overlapping the stay
     * @param feedExternalIds every external id present in the current feed document
     */
    public Resolution resolve(Room room, ParsedStay stay, Optional<LedgerEntry> existing,
                              List<LedgerEntry> activeEntries, Set<String> feedExternalIds) {
        if (stay.status() == StayStatus.CANCELLED) {
            return existing.map(Resolution::cancel)
                    .orElseGet(() -> Resolution.skip("cancelled stay was never imported"));
        }
        int claim = claimSize(room, stay);

        if (existing.isPresent()) {
            LedgerEntry target = existing.get();
            List<LedgerEntry> others = activeEntries.stream()
                    .filter(entry -> !Objects.equals(entry.getId(), target.getId()))
                    .toList();
            return allocate(room, stay, claim, others, target);
        }

        List<LedgerEntry> reissued = activeEntries.stream()
                .filter(entry -> entry.getOrigin() == LedgerOrigin.PLATFORM_IMPORT)
                .filter(entry -> Objects.equals(entry.getExternalPlatform(), stay.platform()))
                .filter(entry -> !feedExternalIds.contains(entry.getExternalId()))
                .toList();
        boolean onlySamePlatform = !activeEntries.isEmpty() && activeEntries.stream()
                .allMatch(entry -> entry.getOrigin() == LedgerOrigin.PLATFORM_IMPORT
                        && Objects.equals(entry.getExternalPlatform(), stay.platform()));
        if (onlySamePlatform && !reissued.isEmpty()) {
            LedgerEntry target = reissued.get(0);
            List<LedgerEntry> others = activeEntries.stream()
                    .filter(entry -> !Objects.equals(entry.getId(), target.getId()))
                    .toList();
            return allocate(room, stay, claim, others, target);
        }

        return allocate(room, stay, claim, activeEntries, null);
    }

    private Resolution allocate(Room room, ParsedStay stay, int claim, List<LedgerEntry> occupants, LedgerEntry target) {
        Set<Integer> occupied = new TreeSet<>();
        occupants.forEach(entry -> occupied.addAll(entry.getBeds()));

        if (target != null && target.getBeds().size() == claim
                && target.getBeds().stream().noneMatch(occupied::contains)) {
            if (isSame(target, stay)) {
                return Resolution.unchanged(target);
            }
            return Resolution.update(target, new TreeSet<>(target.getBeds()));
        }

        List<Integer> free = IntStream.rangeClosed(1, room.getCapacity())
                .filter(bed -> !occupied.contains(bed))
                .boxed()
                .toList();
        if (free.size() >= claim) {
            Set<Integer> beds = new TreeSet<>(free.subList(0, claim));
            return target == null ? Resolution.create(beds) : Resolution.update(target, beds);
        }

        if (stay.status() == StayStatus.BLOCKED) {
            return Resolution.skip("block overlaps existing occupancy");
        }
        List<Long> ids = occupants.stream().map(LedgerEntry::getId).toList();
        boolean direct = occupants.stream().anyMatch(LedgerEntry::isDirect);
        return Resolution.conflict(ids, direct, String.format(
                "needs %d bed(s), %d free in room %s", claim, free.size(), room.getId()));
    }

    private static int claimSize(Room room, ParsedStay stay) {
        if (stay.status() == StayStatus.BLOCKED) {
            return room.getCapacity();
        }
        int guests = stay.guestCount() == null ? 1 : stay.guestCount();
        return Math.max(1, Math.min(guests, room.getCapacity()));
    }

    private static boolean isSame(LedgerEntry entry, ParsedStay stay) {
        return entry.interval().equals(stay.interval())
                && Objects.equals(entry.getExternalId(), stay.externalId())
                && Objects.equals(entry.getGuestLabel(), stay.guestLabel())
                && entry.isBlock() == (stay.status() == StayStatus.BLOCKED);
    }
}
