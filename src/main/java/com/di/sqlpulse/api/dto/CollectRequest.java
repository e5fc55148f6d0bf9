package com.di.sqlpulse.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of {@code POST /api/monitoring/collect}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectRequest {

    @NotBlank
    private String connectionId;
}
