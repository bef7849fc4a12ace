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
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(indexName = "sites")
public class Site {

    @Id
    private String id;

    @Field(type = FieldType.Text)
    private String name;

    @Field(type = FieldType.Keyword)
    private String baseUrl;

    @Field(type = FieldType.Keyword, index = false)
    private String apiKey;

    /**
     * Own schedule in 5-field cron form ("minute hour day month weekday").
     * Blank means the site falls through to its category or the global default.
     */
    @Field(type = FieldType.Keyword)
    private String scheduleCron;

    @Field(type = FieldType.Keyword)
    private String timezone;

    @Field(type = FieldType.Keyword)
    private String categoryId;

    /** Left out of category batches and manual batches. */
    @Field(type = FieldType.Boolean)
    private boolean pinned;

    /** Left out of manual "check all" / "check category" runs only. */
    @Field(type = FieldType.Boolean)
    private boolean excludeFromBatch;

    @Field(type = FieldType.Keyword)
    private List<String> models;

    @Field(type = FieldType.Date)
    private Instant lastCheckedAt;

    @Field(type = FieldType.Text)
    private String lastError;

    @Field(type = FieldType.Date)
    private Instant createdAt;

    @Field(type = FieldType.Date)
    private Instant updatedAt;

    public boolean hasOwnSchedule() {
        return scheduleCron != null && !scheduleCron.trim().isEmpty();
    }
}
