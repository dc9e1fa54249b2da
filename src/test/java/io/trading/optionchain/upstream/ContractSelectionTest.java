package io.trading.optionchain.upstream;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContractSelectionTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 1, 9);

    // Thursday expiries: weeklies in January, then the last Thursdays of February and March
    private static final Set<LocalDate> LISTED = Set.of(
        LocalDate.of(2025, 1, 2),
        LocalDate.of(2025, 1, 9),
        LocalDate.of(2025, 1, 16),
        LocalDate.of(2025, 1, 23),
        LocalDate.of(2025, 1, 30),
        LocalDate.of(2025, 2, 27),
        LocalDate.of(2025, 3, 27)
    );

    private static ContractSelection selection(ExpiryMode mode, List<LocalDate> explicit) {
        return new ContractSelection(mode, explicit, 2500, 2, 22, 2);
    }

    @Test
    void testNearestIncludesToday() {
        assertEquals(List.of(LocalDate.of(2025, 1, 9)),
            selection(ExpiryMode.NEAREST, null).selectExpiries(LISTED, TODAY));
    }

    @Test
    void testWeekly() {
        assertEquals(List.of(LocalDate.of(2025, 1, 9), LocalDate.of(2025, 1, 16)),
            selection(ExpiryMode.WEEKLY, null).selectExpiries(LISTED, TODAY));
    }

    @Test
    void testMonthlyTakesFirstLateExpiryPerMonth() {
        assertEquals(List.of(LocalDate.of(2025, 1, 23), LocalDate.of(2025, 2, 27)),
            selection(ExpiryMode.MONTHLY, null).selectExpiries(LISTED, TODAY));
    }

    @Test
    void testExplicitListIgnoresUnlistedAndPast() {
        ContractSelection selection = selection(ExpiryMode.EXPLICIT_LIST, List.of(
            LocalDate.of(2025, 1, 2),
            LocalDate.of(2025, 1, 30),
            LocalDate.of(2025, 2, 6)
        ));

        assertEquals(List.of(LocalDate.of(2025, 1, 30)), selection.selectExpiries(LISTED, TODAY));
    }

    @Test
    void testNoUpcomingExpiries() {
        assertTrue(ContractSelection.defaults().selectExpiries(LISTED, LocalDate.of(2025, 4, 1)).isEmpty());
    }

    @Test
    void testStrikeBand() {
        ContractSelection selection = ContractSelection.defaults();

        assertTrue(selection.strikeInBand(21500, 24000.0));
        assertTrue(selection.strikeInBand(26500, 24000.0));
        assertFalse(selection.strikeInBand(26550, 24000.0));
        assertTrue(selection.strikeInBand(99999, null));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> selection(ExpiryMode.EXPLICIT_LIST, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ContractSelection(null, null, 2500, 4, 22, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new ContractSelection(ExpiryMode.NEAREST, null, 0, 4, 22, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new ContractSelection(ExpiryMode.NEAREST, null, 2500, 4, 32, 3));
    }

    @Test
    void testModeFromName() {
        assertEquals(ExpiryMode.NEAREST, ExpiryMode.fromName(null));
        assertEquals(ExpiryMode.NEAREST, ExpiryMode.fromName(" "));
        assertEquals(ExpiryMode.EXPLICIT_LIST, ExpiryMode.fromName("explicit_list"));
        assertThrows(IllegalArgumentException.class, () -> ExpiryMode.fromName("daily"));
    }
}
