package com.xcc.challenge.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents one record of the raw event log, as it appears in the input file.
 *
 * Shape: {@code {"id": ..., "type": ..., "event": {"customer-id": ..., "timestamp": ...}}}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawEvent {

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private String type;

    @JsonProperty("event")
    private Payload event;

    /**
     * Nested part of the record carrying customer identity and event time.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Payload {

        @JsonProperty("customer-id")
        private String customerId;

        // kept as text so that a bad value is reported with the record index
        @JsonProperty("timestamp")
        private String timestamp;
    }
}
