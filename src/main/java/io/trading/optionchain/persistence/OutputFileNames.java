package io.trading.optionchain.persistence;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Output file naming: {@code {UNDERLYING}_{VENUE}_OPTION_CHAIN_1S_{START}_{END}.csv}
 * with dates as yyyyMMdd.
 */
public final class OutputFileNames {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private OutputFileNames() {
    }

    public static String fileName(String underlying, String venueToken, LocalDate start, LocalDate end) {
        return underlying + "_" + venueToken + "_OPTION_CHAIN_1S_"
            + start.format(FILE_DATE) + "_" + end.format(FILE_DATE) + ".csv";
    }

    /**
     * Name of a freshly opened file, START = END = date.
     */
    public static String fileName(String underlying, String venueToken, LocalDate date) {
        return fileName(underlying, venueToken, date, date);
    }
}
