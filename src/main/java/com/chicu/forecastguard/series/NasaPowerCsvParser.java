package com.chicu.forecastguard.series;

import lombok.experimental.UtilityClass;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Разбор daily CSV NASA POWER:
 * <pre>
 * -BEGIN HEADER-
 * ...
 * -END HEADER-
 * YEAR,DOY,T2M
 * 2026,1,21.54
 * </pre>
 */
@UtilityClass
public class NasaPowerCsvParser {

    public static List<Observation> parse(String csv, String parameter) {
        if (csv == null || csv.isBlank()) return List.of();

        String[] lines = csv.split("\\r?\\n");
        int headerIdx = -1;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].trim().toUpperCase(Locale.ROOT).startsWith("YEAR,")) {
                headerIdx = i;
                break;
            }
        }
        if (headerIdx < 0) {
            throw new IllegalArgumentException("CSV без строки заголовка YEAR,DOY,...");
        }

        String[] cols = lines[headerIdx].split(",");
        int yearCol = -1, doyCol = -1, valueCol = -1;
        for (int c = 0; c < cols.length; c++) {
            String name = cols[c].trim().toUpperCase(Locale.ROOT);
            if (name.equals("YEAR")) yearCol = c;
            else if (name.equals("DOY")) doyCol = c;
            else if (name.equals(parameter)) valueCol = c;
        }
        if (yearCol < 0 || doyCol < 0 || valueCol < 0) {
            throw new IllegalArgumentException("CSV без колонок YEAR/DOY/" + parameter);
        }

        List<Observation> out = new ArrayList<>();
        for (int i = headerIdx + 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) continue;

            String[] parts = line.split(",");
            if (parts.length <= Math.max(valueCol, Math.max(yearCol, doyCol))) continue;

            int year = Integer.parseInt(parts[yearCol].trim());
            int doy = Integer.parseInt(parts[doyCol].trim());
            double value = parseValue(parts[valueCol]);

            LocalDate date = LocalDate.ofYearDay(year, doy);
            out.add(new Observation(date.atStartOfDay().toInstant(ZoneOffset.UTC), value));
        }
        return out;
    }

    private static double parseValue(String s) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
