package com.seasonalesd.batch;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seasonalesd.core.model.InvalidInputException;
import com.seasonalesd.core.model.TimeSeries;
import com.seasonalesd.core.model.TimestampType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads a {@link TimeSeries} from a JSON array of observation objects.
 *
 * <pre>
 * [
 *   {"timestamp": "2024-03-01 00:00:00", "value": 12.5},
 *   {"timestamp": "2024-03-01 01:00:00", "value": null}
 * ]
 * </pre>
 *
 * <p>
 * The timestamp field of the first element decides the kind of series: a
 * string makes a date/time series (ISO-8601 instant,
 * {@code yyyy-MM-dd HH:mm:ss} or {@code yyyy-MM-dd}, all UTC), a number an
 * ordinal series, and no timestamp at all an ordinal series indexed 1..n.
 * A {@code null} or absent value is a missing observation.
 * </p>
 */
public class SeriesReader {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesReader.class);

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** Tried in order: ISO-8601 instant, date-time, date. */
    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            text -> LocalDateTime.parse(text, DATE_TIME).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));

    private final String timestampField;
    private final String valueField;

    private ObjectMapper mapper;

    public SeriesReader(String timestampField, String valueField) {
        this.timestampField = Objects.requireNonNull(timestampField, "timestampField must not be null");
        this.valueField = Objects.requireNonNull(valueField, "valueField must not be null");
    }

    /**
     * @param input JSON source; not closed
     * @return the series
     * @throws IOException           if the input is not valid JSON
     * @throws InvalidInputException if the JSON does not describe a series
     */
    public TimeSeries read(InputStream input) throws IOException {
        Objects.requireNonNull(input, "input must not be null");
        JsonNode root = objectMapper().readTree(input);
        if (root == null || !root.isArray()) {
            throw new InvalidInputException("Expected a JSON array of observations");
        }

        TimestampType type = timestampType(root);
        TimeSeries.Builder builder = TimeSeries.builder(type);
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                throw new InvalidInputException("Observation " + i + " is not a JSON object");
            }
            builder.add(timestamp(element.get(timestampField), type, i), value(element.get(valueField), i));
        }
        TimeSeries series = builder.build();
        LOG.info("Read {} observation(s) ({} timestamps)", series.size(), type);
        return series;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private TimestampType timestampType(JsonNode root) {
        if (root.isEmpty()) {
            return TimestampType.INDEX;
        }
        JsonNode first = root.get(0).get(timestampField);
        return first != null && first.isTextual() ? TimestampType.EPOCH_MILLIS : TimestampType.INDEX;
    }

    private long timestamp(JsonNode node, TimestampType type, int position) {
        boolean absent = node == null || node.isNull();
        if (type == TimestampType.EPOCH_MILLIS) {
            if (absent || !node.isTextual()) {
                throw new InvalidInputException("Observation " + position
                        + " needs a date/time string in '" + timestampField + "'");
            }
            return parseInstant(node.asText(), position).toEpochMilli();
        }
        if (absent) {
            return position + 1L;
        }
        if (!node.canConvertToLong()) {
            throw new InvalidInputException("Observation " + position
                    + " has a non-integral ordinal timestamp: " + node);
        }
        return node.asLong();
    }

    private static Instant parseInstant(String text, int position) {
        DateTimeParseException failure = null;
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        throw new InvalidInputException("Observation " + position
                + " has an unparseable timestamp: '" + text + "'", failure);
    }

    private double value(JsonNode node, int position) {
        if (node == null || node.isNull()) {
            return Double.NaN;
        }
        if (!node.isNumber()) {
            throw new InvalidInputException("Observation " + position
                    + " has a non-numeric '" + valueField + "': " + node);
        }
        return node.doubleValue();
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
