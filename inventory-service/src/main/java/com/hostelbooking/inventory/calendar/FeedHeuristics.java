package com.hostelbooking.inventory.calendar;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Free-text inference for calendar events. Rules are tried in order and the first match wins,
 * so a new platform is one more entry in the list.
 */
@Component
public class FeedHeuristics {

    static final List<PatternRule<String>> DEFAULT_PLATFORM_RULES = List.of(
            PatternRule.of("airbnb|airb&b", "airbnb"),
            PatternRule.of("booking\\.com", "booking.com"),
            PatternRule.of("expedia|hotels\\.com", "expedia"),
            PatternRule.of("vrbo|homeaway", "vrbo"),
            PatternRule.of("hostelworld|hostel world", "hostelworld"),
            PatternRule.of("direct booking|phone|e-?mail|walk-in", "direct"),
            PatternRule.of("\\bbooking\\b", "booking.com"));

    static final List<PatternRule<StayStatus>> DEFAULT_STATUS_RULES = List.of(
            PatternRule.of("\\bcancell?ed\\b", StayStatus.CANCELLED),
            PatternRule.of("blocked|unavailable|not available|maintenance|owner block", StayStatus.BLOCKED));

    private static final List<Pattern> GUEST_COUNT_PATTERNS = List.of(
            Pattern.compile("(\\d{1,3})[ \\t]*(?:guests?|adults?|pax|people|persons?|h[óo]spedes)\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("(?:guests?|adults?|pax|h[óo]spedes)[ \\t]*[:=][ \\t]*(\\d{1,3})",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));

    private static final int MAX_GUESTS = 50;

    private final List<PatternRule<String>> platformRules;
    private final List<PatternRule<StayStatus>> statusRules;

    public FeedHeuristics() {
        this(DEFAULT_PLATFORM_RULES, DEFAULT_STATUS_RULES);
    }

    public FeedHeuristics(List<PatternRule<String>> platformRules, List<PatternRule<StayStatus>> statusRules) {
        this.platformRules = List.copyOf(platformRules);
        this.statusRules = List.copyOf(statusRules);
    }

    public Optional<String> inferPlatform(String text) {
        return firstMatch(platformRules, text);
    }

    /**
     * An explicit {@code STATUS:CANCELLED} wins over keywords; no match means a booking.
     */
    public StayStatus inferStatus(String icalStatus, String text) {
        if (icalStatus != null && icalStatus.trim().equalsIgnoreCase("CANCELLED")) {
            return StayStatus.CANCELLED;
        }
        return firstMatch(statusRules, text).orElse(StayStatus.CONFIRMED);
    }

    /**
     * Guest count written in the text ("3 guests", "Adults: 2"), or null when absent or implausible.
     */
    public Integer extractGuestCount(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (Pattern pattern : GUEST_COUNT_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                int count = Integer.parseInt(matcher.group(1));
                return count >= 1 && count <= MAX_GUESTS ? count : null;
            }
        }
        return null;
    }

    private static <T> Optional<T> firstMatch(List<PatternRule<T>> rules, String text) {
        return rules.stream()
                .filter(rule -> rule.matches(text))
                .map(PatternRule::value)
                .findFirst();
    }
}
