package com.segs.alert.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BulkResolveRequest {

    @NotEmpty(message = "alert_ids must not be empty")
    @Size(max = 1000)
    private List<@NotNull UUID> alertIds;

    @NotBlank(message = "resolved_by is required")
    private String resolvedBy;

    @Size(max = 1000)
    private String resolution;
}
