package com.lynkvertx.tbce.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Fully resolved in-memory bracket snapshot, as stored with the project.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectSnapshotDTO {

    /** Distance between the two drop rods (mm) */
    @JsonProperty("span_mm")
    private Double spanMm;

    /** Number of tiers, 1..3 */
    @JsonProperty("tier_count")
    private Integer tierCount;

    /**
     * Raw loads per tier number. Each value is either a legacy array of bare magnitudes (N)
     * or an array of {"N", "x_mm", "label"} records; kept as a JSON tree because persisted
     * project state may hold either shape, or garbage.
     */
    @JsonProperty("loads")
    private Map<Integer, JsonNode> loads;

    @JsonProperty("profile_id")
    private String profileId;

    @JsonProperty("rod_id")
    private String rodId;

    @JsonProperty("washer_id")
    private String washerId;

    @JsonProperty("anchor_id")
    private String anchorId;

    /** Selected drop rod size label, e.g. "M10" */
    @JsonProperty("drop_rod_size")
    private String dropRodSize;
}
