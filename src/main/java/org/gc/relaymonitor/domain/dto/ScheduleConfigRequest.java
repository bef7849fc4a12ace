package org.gc.relaymonitor.domain.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleConfigRequest {

    @NotNull(message = "enabled is required")
    private Boolean enabled;

    @NotNull(message = "hour is required")
    @Min(value = 0, message = "hour must be between 0 and 23")
    @Max(value = 23, message = "hour must be between 0 and 23")
    private Integer hour;

    @NotNull(message = "minute is required")
    @Min(value = 0, message = "minute must be between 0 and 59")
    @Max(value = 59, message = "minute must be between 0 and 59")
    private Integer minute;

    @NotNull(message = "interval is required")
    @Min(value = 5, message = "interval must be between 5 and 300 seconds")
    @Max(value = 300, message = "interval must be between 5 and 300 seconds")
    private Integer interval;

    private Boolean overrideIndividual;
}
