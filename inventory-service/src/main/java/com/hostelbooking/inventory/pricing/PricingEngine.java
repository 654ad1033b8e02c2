package com.hostelbooking.inventory.pricing;

import com.hostelbooking.inventory.domain.exception.InvalidRangeException;
import com.hostelbooking.inventory.domain.exception.MinimumStayException;
import com.hostelbooking.inventory.domain.model.Room;
import com.hostelbooking.inventory.domain.model.StayInterval;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Quotes a stay. Pure: the result depends only on the arguments and the season table.
 * <pre>
 * subtotal   = sum(basePricePerBed x beds x nights)
 * discounted = subtotal - subtotal x tierRate(partyBeds)
 * total      = discounted x max(season multiplier over the nights)
 * deposit    = total x (partyBeds >= 15 ? 50% : 30%)
 * </pre>
 */
@Component
public class PricingEngine {

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final int LARGE_PARTY_BEDS = 15;
    private static final BigDecimal LARGE_PARTY_DEPOSIT_RATE = new BigDecimal("0.50");
    private static final BigDecimal STANDARD_DEPOSIT_RATE = new BigDecimal("0.30");

    private final SeasonCalendar seasonCalendar;
    private final int remainingDueDays;

    public PricingEngine(SeasonCalendar seasonCalendar, PricingProperties properties) {
        this.seasonCalendar = seasonCalendar;
        this.remainingDueDays = properties.remainingDueDaysBeforeCheckIn();
    }

    public PriceBreakdown quote(StayInterval interval, List<RoomBeds> selection) {
        return quote(interval, selection, null);
    }

    /**
     * @param partyBeds beds of the whole party when this quote covers only part of it;
     *                  null means the selection is the whole party
     */
    public PriceBreakdown quote(StayInterval interval, List<RoomBeds> selection, Integer partyBeds) {
        if (selection == null || selection.isEmpty()) {
            throw new InvalidRangeException("At least one room must be selected");
        }
        int nights = interval.nights();
        int totalBeds = 0;
        BigDecimal subtotal = BigDecimal.ZERO;
        List<PriceBreakdown.RoomLine> lines = new ArrayList<>();
        for (RoomBeds roomBeds : selection) {
            Room room = roomBeds.room();
            if (roomBeds.beds() < 1 || roomBeds.beds() > room.getCapacity()) {
                throw new InvalidRangeException(String.format(
                        "Room %s sells 1 to %d beds, %d requested", room.getId(), room.getCapacity(), roomBeds.beds()));
            }
            BigDecimal amount = room.getBasePricePerBed()
                    .multiply(BigDecimal.valueOf(roomBeds.beds()))
                    .multiply(BigDecimal.valueOf(nights))
                    .setScale(SCALE, ROUNDING);
            lines.add(new PriceBreakdown.RoomLine(
                    room.getId(), room.getName(), roomBeds.beds(), room.getBasePricePerBed(), amount));
            subtotal = subtotal.add(amount);
            totalBeds += roomBeds.beds();
        }
        int tierBeds = partyBeds != null && partyBeds > totalBeds ? partyBeds : totalBeds;

        GroupDiscountTier tier = GroupDiscountTier.forBeds(tierBeds);
        BigDecimal discountAmount = subtotal.multiply(tier.getRate()).setScale(SCALE, ROUNDING);
        BigDecimal discounted = subtotal.subtract(discountAmount);

        Season season = governingSeason(interval);
        if (nights < season.getMinimumNights()) {
            throw new MinimumStayException(season.name(), season.getMinimumNights(), nights);
        }
        BigDecimal seasonalAdjustment = discounted
                .multiply(season.getMultiplier().subtract(BigDecimal.ONE))
                .setScale(SCALE, ROUNDING);
        BigDecimal total = discounted.add(seasonalAdjustment);

        BigDecimal depositRate = tierBeds >= LARGE_PARTY_BEDS ? LARGE_PARTY_DEPOSIT_RATE : STANDARD_DEPOSIT_RATE;
        BigDecimal depositAmount = total.multiply(depositRate).setScale(SCALE, ROUNDING);
        BigDecimal remainingAmount = total.subtract(depositAmount);

        return new PriceBreakdown(
                interval.checkIn(),
                interval.checkOut(),
                nights,
                totalBeds,
                tierBeds,
                List.copyOf(lines),
                subtotal,
                tier.getRate(),
                discountAmount,
                season,
                season.getMultiplier(),
                seasonalAdjustment,
                total,
                depositRate,
                depositAmount,
                remainingAmount,
                interval.checkIn().minusDays(remainingDueDays));
    }

    /**
     * Season with the highest multiplier among the nights of the stay.
     */
    public Season governingSeason(StayInterval interval) {
        Season governing = null;
        for (LocalDate night : interval.nightsList()) {
            Season season = seasonCalendar.seasonOf(night);
            if (governing == null || season.getMultiplier().compareTo(governing.getMultiplier()) > 0) {
                governing = season;
            }
        }
        return governing;
    }
}
