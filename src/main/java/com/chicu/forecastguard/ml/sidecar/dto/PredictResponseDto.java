package com.chicu.forecastguard.ml.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictResponseDto {

    private boolean ok;

    /** нормализованный прогноз длины T_OUT */
    private double[] forecast;

    private String modelVersion;

    private String message;

    public static PredictResponseDto fail(String message) {
        return PredictResponseDto.builder()
                .ok(false)
                .forecast(new double[0])
                .message(message)
                .build();
    }
}
