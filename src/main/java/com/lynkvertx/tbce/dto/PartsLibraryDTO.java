package com.lynkvertx.tbce.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Catalog records resolved for the snapshot's selections.
 * Each record is the raw field map of the imported part; an empty map when nothing was resolved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PartsLibraryDTO {

    private Map<String, Object> profile;

    private Map<String, Object> rod;

    private Map<String, Object> washer;

    private Map<String, Object> anchor;

    /** Tension capacity (N) per rod size label across the imported rod catalog, e.g. "M10" -> 7000 */
    @JsonProperty("rod_capacities")
    private Map<String, Double> rodCapacities;
}
