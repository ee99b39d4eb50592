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
public class TrainResponseDto {

    private boolean ok;

    /** state_dict, сериализованный в python и закодированный base64 */
    private String weightsBase64;

    private Double testMse;
    private Double testMae;

    @Builder.Default
    private Map<String, Object> metrics = Map.of();

    private String message;
}
