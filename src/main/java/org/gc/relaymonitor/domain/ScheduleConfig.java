package org.gc.relaymonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;

import java.time.Instant;
import java.util.UUID;

/**
 * Singleton record holding the global default schedule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(indexName = "schedule_config")
public class ScheduleConfig {

    @Id
    private String id;

    @Field(type = FieldType.Boolean)
    private boolean enabled;

    @Field(type = FieldType.Integer)
    private Integer hour;

    @Field(type = FieldType.Integer)
    private Integer minute;

    /** Seconds to wait between two site checks of the global batch. */
    @Field(type = FieldType.Integer)
    private Integer interval;

    @Field(type = FieldType.Boolean)
    private boolean overrideIndividual;

    @Field(type = FieldType.Keyword)
    private String timezone;

    @Field(type = FieldType.Date)
    private Instant lastRun;

    @Field(type = FieldType.Date)
    private Instant createdAt;

    @Field(type = FieldType.Date)
    private Instant updatedAt;

    public boolean overridesIndividualSchedules() {
        return enabled && overrideIndividual;
    }

    public static ScheduleConfig create(int hour, int minute, int interval, String timezone) {
        Instant now = Instant.now();

        return ScheduleConfig.builder()
                .id(UUID.randomUUID().toString())
                .enabled(false)
                .hour(hour)
                .minute(minute)
                .interval(interval)
                .overrideIndividual(false)
                .timezone(timezone)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
