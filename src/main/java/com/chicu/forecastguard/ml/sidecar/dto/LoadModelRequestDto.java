package com.chicu.forecastguard.ml.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadModelRequestDto {

    private String modelKey;
    private String parameter;
    private String modelVersion;
    private String weightsBase64;
}
