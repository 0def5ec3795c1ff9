package com.ward.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a span ingestion request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResult {

    /**
     * Spans queued for correlation.
     */
    private int accepted;

    /**
     * Malformed spans dropped.
     */
    private int skipped;

    /**
     * Id of the queued batch (null when nothing was queued).
     */
    private String batchId;
}
