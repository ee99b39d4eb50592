package com.chicu.forecastguard.ml.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictRequestDto {

    private String modelKey;

    /** нормализованное окно длины T_IN */
    private double[] window;

    private int horizon;
}
