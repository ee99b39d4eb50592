package com.chicu.forecastguard.series;

import com.chicu.forecastguard.common.error.SourceUnavailableException;
import com.chicu.forecastguard.common.util.ParameterCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

@Slf4j
@Component
@RequiredArgsConstructor
public class NasaPowerTimeSeriesSource implements TimeSeriesSource {

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final OkHttpClient baseClient;
    private final SourceProperties props;
    private final SeriesCleaner cleaner;
    private final Clock clock;

    @Override
    public List<Observation> fetch(String parameter, int windowLength) {
        String p = ParameterCodes.normalize(parameter);
        if (windowLength <= 0) return List.of();

        LocalDate end = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate start = end.minusDays(windowLength + Math.max(0, props.getMarginDays()));

        HttpUrl base = HttpUrl.parse(props.getBaseUrl());
        if (base == null) {
            throw new SourceUnavailableException(p, "bad source url: " + props.getBaseUrl());
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("parameters", p)
                .addQueryParameter("community", props.getCommunity())
                .addQueryParameter("longitude", String.format(Locale.ROOT, "%.4f", props.getLongitude()))
                .addQueryParameter("latitude", String.format(Locale.ROOT, "%.4f", props.getLatitude()))
                .addQueryParameter("start", DAY.format(start))
                .addQueryParameter("end", DAY.format(end))
                .addQueryParameter("format", "CSV")
                .build();

        log.info("📡 FETCH param={} days={} start={} end={}", p, windowLength, start, end);

        String body;
        OkHttpClient client = baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(Math.max(1000, props.getTimeoutMs())))
                .build();
        try (Response resp = client.newCall(new Request.Builder().url(url).get().build()).execute()) {
            body = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                throw new SourceUnavailableException(p, "NASA POWER HTTP " + resp.code());
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(p, "NASA POWER IO error: " + e.getMessage(), e);
        }

        List<Observation> raw;
        try {
            raw = NasaPowerCsvParser.parse(body, p);
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(p, "NASA POWER bad CSV: " + e.getMessage(), e);
        }

        List<Observation> cleaned = cleaner.clean(p, raw);
        log.info("📡 FETCH DONE param={} raw={} cleaned={}", p, raw.size(), cleaned.size());

        if (cleaned.size() <= windowLength) return cleaned;
        return List.copyOf(cleaned.subList(cleaned.size() - windowLength, cleaned.size()));
    }
}
