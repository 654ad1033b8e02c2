package com.hostelbooking.inventory.domain.availability;

import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.Room;
import com.hostelbooking.inventory.domain.model.StayCategory;
import com.hostelbooking.inventory.domain.model.StayInterval;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Decides whether a room may take a party of a given category.
 * <p>
 * A swing room is female-only by default. It opens to a mixed party for a night only once that
 * night is less than {@code conversionLeadHours} away and no active female-only entry covers it.
 * The decision is derived from the clock and the ledger every time; nothing is stored.
 */
@Component
public class SwingRoomPolicy {

    static final int DEFAULT_LEAD_HOURS = 48;

    /**
     * @param roomEntries entries of this room overlapping the interval
     */
    public boolean isEligible(Room room, StayCategory requested, StayInterval interval,
                              List<LedgerEntry> roomEntries, LocalDateTime now) {
        StayCategory category = StayCategory.orDefault(requested);
        return switch (room.getCategory()) {
            case MIXED -> true;
            case DESIGNATED -> category == StayCategory.FEMALE_ONLY;
            case SWING -> category == StayCategory.FEMALE_ONLY
                    || interval.nightsList().stream()
                    .allMatch(night -> isConvertedToMixed(room, night, roomEntries, now));
        };
    }

    public boolean isConvertedToMixed(Room room, LocalDate night, List<LedgerEntry> roomEntries, LocalDateTime now) {
        int leadHours = room.getConversionLeadHours() == null ? DEFAULT_LEAD_HOURS : room.getConversionLeadHours();
        if (now.isBefore(night.atStartOfDay().minusHours(leadHours))) {
            return false;
        }
        return roomEntries.stream()
                .filter(entry -> entry.isActiveAt(now))
                .filter(entry -> entry.getStayCategory() == StayCategory.FEMALE_ONLY)
                .noneMatch(entry -> entry.interval().coversNight(night));
    }
}
