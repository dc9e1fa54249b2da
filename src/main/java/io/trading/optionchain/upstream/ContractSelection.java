package io.trading.optionchain.upstream;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Expiry and strike filters applied to the contract catalog.
 * The weekly and monthly rules are heuristics over the listed expiries, not an exchange calendar.
 *
 * @param expiryMode           Expiry selection rule
 * @param explicitExpiries     Expiries used by {@link ExpiryMode#EXPLICIT_LIST}
 * @param maxStrikeDistance    Maximum distance of a strike from spot, in points
 * @param weeklyExpiryCount    Number of upcoming expiries kept in weekly mode
 * @param monthlyMinDay        Earliest day of month treated as a monthly expiry
 * @param monthlyExpiryCount   Number of monthly expiries kept
 */
public record ContractSelection(
    ExpiryMode expiryMode,
    List<LocalDate> explicitExpiries,
    double maxStrikeDistance,
    int weeklyExpiryCount,
    int monthlyMinDay,
    int monthlyExpiryCount
) {
    public static final double DEFAULT_MAX_STRIKE_DISTANCE = 2500;
    public static final int DEFAULT_WEEKLY_EXPIRY_COUNT = 4;
    public static final int DEFAULT_MONTHLY_MIN_DAY = 22;
    public static final int DEFAULT_MONTHLY_EXPIRY_COUNT = 3;

    public ContractSelection {
        if (expiryMode == null) {
            throw new IllegalArgumentException("expiryMode cannot be null");
        }
        explicitExpiries = explicitExpiries == null ? List.of() : List.copyOf(explicitExpiries);
        if (expiryMode == ExpiryMode.EXPLICIT_LIST && explicitExpiries.isEmpty()) {
            throw new IllegalArgumentException("expiry_list is required for explicit_list mode");
        }
        if (!(maxStrikeDistance > 0)) {
            throw new IllegalArgumentException("max_strike_distance must be positive");
        }
        if (weeklyExpiryCount <= 0 || monthlyExpiryCount <= 0) {
            throw new IllegalArgumentException("expiry counts must be positive");
        }
        if (monthlyMinDay < 1 || monthlyMinDay > 31) {
            throw new IllegalArgumentException("monthly_min_day must be between 1 and 31");
        }
    }

    /**
     * Nearest expiry, 2500 points either side of spot.
     */
    public static ContractSelection defaults() {
        return new ContractSelection(
            ExpiryMode.NEAREST,
            List.of(),
            DEFAULT_MAX_STRIKE_DISTANCE,
            DEFAULT_WEEKLY_EXPIRY_COUNT,
            DEFAULT_MONTHLY_MIN_DAY,
            DEFAULT_MONTHLY_EXPIRY_COUNT
        );
    }

    /**
     * Picks expiries from the listed ones.
     *
     * @param listed Expiries available for one underlying
     * @param today  Current exchange date; earlier expiries are ignored
     * @return Selected expiries in ascending order
     */
    public List<LocalDate> selectExpiries(Set<LocalDate> listed, LocalDate today) {
        List<LocalDate> upcoming = new ArrayList<>();
        for (LocalDate expiry : new TreeSet<>(listed)) {
            if (!expiry.isBefore(today)) {
                upcoming.add(expiry);
            }
        }
        if (upcoming.isEmpty()) {
            return List.of();
        }

        return switch (expiryMode) {
            case NEAREST -> List.of(upcoming.get(0));
            case WEEKLY -> List.copyOf(upcoming.subList(0, Math.min(weeklyExpiryCount, upcoming.size())));
            case MONTHLY -> monthly(upcoming);
            case EXPLICIT_LIST -> upcoming.stream().filter(explicitExpiries::contains).toList();
        };
    }

    private List<LocalDate> monthly(List<LocalDate> upcoming) {
        List<LocalDate> monthly = new ArrayList<>();
        Set<YearMonth> seenMonths = new HashSet<>();
        for (LocalDate expiry : upcoming) {
            if (expiry.getDayOfMonth() >= monthlyMinDay && seenMonths.add(YearMonth.from(expiry))) {
                monthly.add(expiry);
                if (monthly.size() == monthlyExpiryCount) {
                    break;
                }
            }
        }
        return monthly;
    }

    /**
     * True when the strike lies within the band around spot. Without a spot every strike is kept.
     */
    public boolean strikeInBand(double strike, Double spot) {
        if (spot == null) {
            return true;
        }
        return strike >= spot - maxStrikeDistance && strike <= spot + maxStrikeDistance;
    }
}
