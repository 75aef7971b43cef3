package org.mitre.dispersion.catalog;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.isNull;
import static java.util.Objects.requireNonNull;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.*;
import java.util.*;

import org.mitre.caasd.commons.LatLong;
import org.mitre.dispersion.CandidateRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns tabular city data into validated CandidateRecords.
 * <p>
 * The columns "lat", "lng", and "population" are required, "id" and "city" (the name) are
 * optional. When "id" is absent the 1-based row number is used, when "city" is absent the id is
 * used as the name. Rows with missing or out-of-range coordinates are dropped, a missing
 * population counts as 0.
 * <p>
 * CSV files are read with DuckDB, which runs entirely within this JVM process.
 */
public class CityCatalog {

    static final Logger LOGGER = LoggerFactory.getLogger(CityCatalog.class);

    public static final String ID = "id";
    public static final String CITY = "city";
    public static final String LAT = "lat";
    public static final String LNG = "lng";
    public static final String POPULATION = "population";

    static final List<String> REQUIRED_COLUMNS = List.of(LAT, LNG, POPULATION);

    /** An in-process DuckDB database that lives only as long as its connection. */
    static final String IN_MEMORY_DB = "jdbc:duckdb:";

    private CityCatalog() {}

    /**
     * Load city data from a CSV file and filter by minimum population.
     *
     * @param csvFile       A CSV file with a header row
     * @param populationMin Minimum population threshold (0 disables filtering)
     *
     * @return Every city with valid coordinates and population >= populationMin, in file order
     * @throws SchemaException  if a required column is missing
     * @throws CatalogException if the file is missing or cannot be read
     */
    public static List<CandidateRecord> loadCsv(Path csvFile, long populationMin) {
        return loadCsv(csvFile, populationMin, IN_MEMORY_DB);
    }

    static List<CandidateRecord> loadCsv(Path csvFile, long populationMin, String jdbcUrl) {
        requireNonNull(csvFile);
        requireNonNull(jdbcUrl);
        if (!Files.isRegularFile(csvFile)) {
            throw new CatalogException(
                    "Could not read city data from " + csvFile, new NoSuchFileException(csvFile.toString()));
        }

        LOGGER.atInfo().setMessage("Loading city data from {}").addArgument(csvFile).log();

        String query = "SELECT * FROM read_csv_auto('" + sqlLiteral(csvFile) + "', header = true)";

        try (Connection conn = DriverManager.getConnection(jdbcUrl);
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(query)) {

            ResultSetMetaData meta = rs.getMetaData();
            List<String> columns = new ArrayList<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                columns.add(meta.getColumnName(i));
            }
            verifySchema(columns);

            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new HashMap<>();
                for (int i = 1; i <= columns.size(); i++) {
                    row.put(columns.get(i - 1), rs.getObject(i));
                }
                rows.add(row);
            }

            return toRecords(rows, populationMin);
        } catch (SQLException e) {
            throw new CatalogException("Could not read city data from " + csvFile, e);
        }
    }

    /**
     * Apply the same schema and filtering rules as {@code loadCsv} to in-memory rows (column name
     * to value).
     *
     * @throws SchemaException if a required column is absent from every row
     */
    public static List<CandidateRecord> fromRows(List<? extends Map<String, ?>> rows, long populationMin) {
        requireNonNull(rows);

        if (!rows.isEmpty()) {
            Set<String> columns = new HashSet<>();
            rows.forEach(row -> columns.addAll(row.keySet()));
            verifySchema(columns);
        }
        return toRecords(rows, populationMin);
    }

    static void verifySchema(Collection<String> columns) {
        Set<String> missing = new TreeSet<>(REQUIRED_COLUMNS);
        missing.removeAll(columns);
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }
    }

    private static List<CandidateRecord> toRecords(List<? extends Map<String, ?>> rows, long populationMin) {
        checkArgument(populationMin >= 0, "populationMin cannot be negative");

        if (populationMin > 0) {
            LOGGER.atInfo()
                    .setMessage("Filtering cities with population >= {}")
                    .addArgument(populationMin)
                    .log();
        }

        Map<String, CandidateRecord> records = new LinkedHashMap<>();
        int invalidCoordinates = 0;
        int rowNumber = 0;

        for (Map<String, ?> row : rows) {
            rowNumber++;

            long population = asPopulation(row.get(POPULATION));
            if (population < populationMin) {
                continue;
            }

            Double lat = asDouble(row.get(LAT));
            Double lng = asDouble(row.get(LNG));
            if (!isValid(lat, lng)) {
                invalidCoordinates++;
                continue;
            }

            String id = row.containsKey(ID) && row.get(ID) != null ? asId(row.get(ID)) : Integer.toString(rowNumber);
            String name = row.get(CITY) != null ? row.get(CITY).toString() : id;

            CandidateRecord prior = records.putIfAbsent(id, new CandidateRecord(id, name, LatLong.of(lat, lng), population));
            if (prior != null) {
                LOGGER.atWarn()
                        .setMessage("Ignoring row {}, id {} was already loaded")
                        .addArgument(rowNumber)
                        .addArgument(id)
                        .log();
            }
        }

        if (invalidCoordinates > 0) {
            LOGGER.atInfo()
                    .setMessage("Dropped {} cities with missing or invalid coordinates")
                    .addArgument(invalidCoordinates)
                    .log();
        }
        LOGGER.atInfo().setMessage("Loaded {} cities").addArgument(records.size()).log();

        return List.copyOf(records.values());
    }

    private static boolean isValid(Double lat, Double lng) {
        return !isNull(lat) && !isNull(lng) && -90 <= lat && lat <= 90 && -180 <= lng && lng <= 180;
    }

    /** @return The value as a double, or null when it is blank, NaN, or not a number. */
    static Double asDouble(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if (s.isEmpty()) {
                return null;
            }
            try {
                return asDouble(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static long asPopulation(Object value) {
        Double d = asDouble(value);
        return isNull(d) ? 0L : Math.round(d);
    }

    /** Whole-number ids should not pick up a ".0" suffix when a reader typed them as doubles. */
    private static String asId(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
        }
        return value.toString();
    }

    private static String sqlLiteral(Path path) {
        return path.toAbsolutePath().toString().replace("'", "''");
    }
}
