package io.trading.optionchain.upstream;

import io.trading.optionchain.config.ConfigurationException;
import io.trading.optionchain.model.ContractMeta;
import io.trading.optionchain.model.OptionType;
import io.trading.optionchain.snapshot.SpotPriceLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the option catalog from a CSV file with the header
 * {@code instrument_token,tradingsymbol,underlying,expiry,strike,instrument_type,lot_size}
 * and applies the {@link ContractSelection} filters per underlying.
 * Columns may appear in any order; {@code lot_size} is optional. Invalid lines are skipped
 * with a warning. The file is re-read on every call so an external job can refresh it.
 */
public class UniverseFileProvider implements InstrumentProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(UniverseFileProvider.class);

    static final List<String> REQUIRED_COLUMNS = List.of(
        "instrument_token", "tradingsymbol", "underlying", "expiry", "strike", "instrument_type"
    );

    private final Path universeFile;
    private final Map<String, Double> seedSpotPrices;
    private final ContractSelection selection;
    private final SpotPriceLookup liveSpots;
    private final Clock clock;

    public UniverseFileProvider(Path universeFile, Map<String, Double> seedSpotPrices) {
        this(universeFile, seedSpotPrices, ContractSelection.defaults(), SpotPriceLookup.none(), Clock.systemDefaultZone());
    }

    /**
     * @param universeFile   Catalog CSV
     * @param seedSpotPrices Configured spot prices
     * @param selection      Expiry and strike filters
     * @param liveSpots      Current spots, preferred over the seeds when centering the strike band
     * @param clock          Clock in the exchange zone, used to ignore past expiries
     */
    public UniverseFileProvider(
        Path universeFile,
        Map<String, Double> seedSpotPrices,
        ContractSelection selection,
        SpotPriceLookup liveSpots,
        Clock clock
    ) {
        if (universeFile == null) {
            throw new ConfigurationException("universe_file is required");
        }
        this.universeFile = universeFile;
        this.seedSpotPrices = Map.copyOf(seedSpotPrices);
        this.selection = selection;
        this.liveSpots = liveSpots;
        this.clock = clock;
    }

    @Override
    public Map<Long, ContractMeta> universe(List<String> underlyings) {
        Set<String> wanted = new HashSet<>();
        for (String underlying : underlyings) {
            wanted.add(underlying.toUpperCase(Locale.ROOT));
        }

        List<ContractMeta> catalog = readCatalog(wanted);
        LocalDate today = LocalDate.now(clock);

        Map<Long, ContractMeta> universe = new LinkedHashMap<>();
        for (String underlying : underlyings) {
            String symbol = underlying.toUpperCase(Locale.ROOT);
            Set<LocalDate> listed = new HashSet<>();
            for (ContractMeta meta : catalog) {
                if (meta.underlying().equals(symbol)) {
                    listed.add(meta.expiryDate());
                }
            }
            List<LocalDate> expiries = selection.selectExpiries(listed, today);
            if (expiries.isEmpty()) {
                LOGGER.warn("[Universe] No expiries selected for {}", symbol);
                continue;
            }

            Double spot = spotFor(symbol);
            if (spot == null) {
                LOGGER.warn("[Universe] No spot price for {}, strike band not applied", symbol);
            }
            int selected = 0;
            for (ContractMeta meta : catalog) {
                if (meta.underlying().equals(symbol)
                    && expiries.contains(meta.expiryDate())
                    && selection.strikeInBand(meta.strike(), spot)
                    && universe.putIfAbsent(meta.token(), meta) == null) {
                    selected++;
                }
            }
            LOGGER.info("[Universe] {}: {} contracts, expiries {}, spot {}", symbol, selected, expiries, spot);
        }
        return universe;
    }

    private List<ContractMeta> readCatalog(Set<String> wanted) {
        List<ContractMeta> catalog = new ArrayList<>();
        Set<Long> seenTokens = new HashSet<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(universeFile, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                LOGGER.warn("[Universe] {} is empty", universeFile);
                return catalog;
            }
            Map<String, Integer> header = header(headerLine);

            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    ContractMeta meta = parse(line.split(",", -1), header);
                    if (!wanted.contains(meta.underlying())) {
                        continue;
                    }
                    if (!seenTokens.add(meta.token())) {
                        LOGGER.warn("[Universe] Duplicate token {} at line {}", meta.token(), lineNumber);
                        continue;
                    }
                    catalog.add(meta);
                } catch (IllegalArgumentException | DateTimeParseException | IndexOutOfBoundsException e) {
                    skipped++;
                    LOGGER.warn("[Universe] Skipping line {}: {}", lineNumber, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read universe file " + universeFile, e);
        }

        LOGGER.info("[Universe] Read {} contracts for {} from {} ({} lines skipped)",
            catalog.size(), wanted, universeFile, skipped);
        return catalog;
    }

    private Double spotFor(String underlying) {
        Double live = liveSpots.spotFor(underlying);
        return live != null ? live : seedSpotPrices.get(underlying);
    }

    @Override
    public Map<String, Double> spotPrices(List<String> underlyings) {
        Map<String, Double> spots = new HashMap<>();
        for (String underlying : underlyings) {
            Double spot = seedSpotPrices.get(underlying.toUpperCase(Locale.ROOT));
            if (spot != null) {
                spots.put(underlying.toUpperCase(Locale.ROOT), spot);
            }
        }
        return spots;
    }

    private Map<String, Integer> header(String headerLine) {
        String[] names = headerLine.split(",", -1);
        Map<String, Integer> header = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            header.put(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!header.containsKey(required)) {
                throw new ConfigurationException("universe file " + universeFile + " is missing column " + required);
            }
        }
        return header;
    }

    private static ContractMeta parse(String[] fields, Map<String, Integer> header) {
        long token = Long.parseLong(field(fields, header, "instrument_token"));
        String lotSize = header.containsKey("lot_size") ? field(fields, header, "lot_size") : "";
        return new ContractMeta(
            token,
            field(fields, header, "tradingsymbol"),
            field(fields, header, "underlying").toUpperCase(Locale.ROOT),
            LocalDate.parse(field(fields, header, "expiry")),
            Double.parseDouble(field(fields, header, "strike")),
            OptionType.fromCode(field(fields, header, "instrument_type")),
            null,
            lotSize.isEmpty() ? 1 : Integer.parseInt(lotSize)
        );
    }

    private static String field(String[] fields, Map<String, Integer> header, String column) {
        return fields[header.get(column)].trim();
    }
}
