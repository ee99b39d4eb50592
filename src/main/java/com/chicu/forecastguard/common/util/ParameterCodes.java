package com.chicu.forecastguard.common.util;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@UtilityClass
public class ParameterCodes {

    /**
     * " t2m " -> "T2M". Пустое/null -> исключение, параметр обязателен везде.
     */
    public static String normalize(String parameter) {
        if (parameter == null) throw new IllegalArgumentException("parameter=null");
        String p = parameter.trim().toUpperCase(Locale.ROOT);
        if (p.isEmpty()) throw new IllegalArgumentException("parameter is blank");
        return p;
    }

    /**
     * Нормализует список, сохраняя порядок и выкидывая дубли.
     */
    public static List<String> normalizeAll(List<String> parameters) {
        if (parameters == null) return List.of();
        Set<String> out = new LinkedHashSet<>();
        for (String p : parameters) {
            if (p == null || p.isBlank()) continue;
            out.add(normalize(p));
        }
        return List.copyOf(new ArrayList<>(out));
    }

    public static String safe(String s) {
        if (s == null) return "";
        String x = s.trim();
        return x.length() > 200 ? x.substring(0, 200) : x;
    }
}
