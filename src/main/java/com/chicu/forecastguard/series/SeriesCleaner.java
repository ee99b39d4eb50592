package com.chicu.forecastguard.series;

import com.chicu.forecastguard.common.util.ParameterCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * sentinel -> пропуск, интерполяция по времени, клип по диапазону параметра,
 * хвосты без значений отбрасываются.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeriesCleaner {

    private final SourceProperties props;

    public List<Observation> clean(String parameter, List<Observation> raw) {
        if (raw == null || raw.isEmpty()) return List.of();
        String p = ParameterCodes.normalize(parameter);

        List<Observation> series = new ArrayList<>(raw);
        series.sort(Comparator.comparing(Observation::timestamp));

        // 1. sentinel -> NaN
        int missing = 0;
        for (int i = 0; i < series.size(); i++) {
            Observation o = series.get(i);
            if (o.missing() || o.value() == props.getSentinelValue()) {
                series.set(i, o.withValue(Double.NaN));
                missing++;
            }
        }

        // 2. внутренние дыры
        if (missing > 0) {
            log.debug("🧹 param={} missing={} -> interpolate", p, missing);
            interpolate(series);
        }

        // 3. клип
        SourceProperties.ClipRange range = props.getClip() != null ? props.getClip().get(p) : null;
        if (range != null) {
            for (int i = 0; i < series.size(); i++) {
                Observation o = series.get(i);
                if (o.missing()) continue;
                series.set(i, o.withValue(clip(o.value(), range)));
            }
        }

        // 4. то, что интерполировать не из чего (начало/конец)
        List<Observation> out = new ArrayList<>(series.size());
        for (Observation o : series) {
            if (!o.missing()) out.add(o);
        }
        if (out.size() < series.size()) {
            log.debug("🧹 param={} dropped {} rows without value", p, series.size() - out.size());
        }
        return out;
    }

    static void interpolate(List<Observation> series) {
        int prev = -1;
        for (int i = 0; i < series.size(); i++) {
            if (series.get(i).missing()) continue;

            if (prev >= 0 && i - prev > 1) {
                Observation left = series.get(prev);
                Observation right = series.get(i);
                double t0 = left.timestamp().getEpochSecond();
                double t1 = right.timestamp().getEpochSecond();
                for (int k = prev + 1; k < i; k++) {
                    Observation gap = series.get(k);
                    double w = (t1 == t0) ? 0.0 : (gap.timestamp().getEpochSecond() - t0) / (t1 - t0);
                    series.set(k, gap.withValue(left.value() + w * (right.value() - left.value())));
                }
            }
            prev = i;
        }
    }

    private static double clip(double v, SourceProperties.ClipRange range) {
        double x = v;
        if (range.getMin() != null) x = Math.max(range.getMin(), x);
        if (range.getMax() != null) x = Math.min(range.getMax(), x);
        return x;
    }
}
