package com.meteoharvest.ingest.encode;

import com.meteoharvest.core.model.HourlyVariable;
import com.meteoharvest.core.model.ObservationRecord;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Tabular export of hourly records: {@code datetime_utc}, the hourly schema in request order, then
 * {@code city}.
 */
public final class CsvArtifactEncoder {
    public static final String EXTENSION = "csv";
    public static final String TIMESTAMP_COLUMN = "datetime_utc";
    public static final String CITY_COLUMN = "city";

    public static List<String> header() {
        List<String> header = new ArrayList<>();
        header.add(TIMESTAMP_COLUMN);
        header.addAll(HourlyVariable.wireNames());
        header.add(CITY_COLUMN);
        return header;
    }

    public byte[] encode(List<ObservationRecord> records) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(
                out,
                ICSVWriter.DEFAULT_SEPARATOR,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
                "\n")) {
            writer.writeNext(header().toArray(String[]::new), false);
            HourlyVariable[] variables = HourlyVariable.values();
            for (ObservationRecord record : records) {
                String[] row = new String[variables.length + 2];
                row[0] = record.timestamp().toString();
                for (int i = 0; i < variables.length; i++) {
                    row[i + 1] = format(record.value(variables[i]));
                }
                row[row.length - 1] = record.locationLabel();
                writer.writeNext(row, false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed encoding CSV artifact", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    static String format(double value) {
        if (Double.isNaN(value)) {
            return "";
        }
        if (Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
