package com.chicu.forecastguard.ml.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainRequestDto {

    private String parameter;

    /** T_IN */
    private int inputWindow;

    /** T_OUT */
    private int horizon;

    @Builder.Default
    private Map<String, Object> params = Map.of();

    @Builder.Default
    private Map<String, Object> meta = Map.of();
}
