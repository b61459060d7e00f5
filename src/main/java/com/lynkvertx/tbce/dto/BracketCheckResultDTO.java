package com.lynkvertx.tbce.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lynkvertx.tbce.model.CheckStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Result DTO for a trapeze bracket check.
 * Per-tier maps are keyed "tier1".."tierN" plus "total"; weights are keyed "1".."N".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BracketCheckResultDTO {

    /** PASS when no check failed */
    private CheckStatus status;

    /** First failing check in priority order (bending, deflection, rod, anchor), or "none" */
    @JsonProperty("governing_check")
    private String governingCheck;

    /** Tier carrying the largest moment ("tier2"); absent when no tier is loaded */
    @JsonProperty("governing_tier")
    private String governingTier;

    @JsonProperty("total_weight_kg")
    private BigDecimal totalWeightKg;

    @JsonProperty("per_tier_weight_kg")
    private Map<String, BigDecimal> perTierWeightKg;

    /** Verdict per check category, in priority order */
    private Map<String, CheckStatus> checks;

    /** One explanatory line per failed check */
    private List<String> notes;

    /** Checks reported PASS only because the catalog carried no capacity, e.g. ["anchor"] */
    @JsonProperty("skipped_checks")
    private List<String> skippedChecks;

    @JsonProperty("reactions_N")
    private Map<String, Reaction> reactionsN;

    @JsonProperty("max_moment_kNm")
    private Map<String, BigDecimal> maxMomentKNm;

    @JsonProperty("max_deflection_mm")
    private Map<String, BigDecimal> maxDeflectionMm;

    @JsonProperty("deflection_limit_mm")
    private BigDecimal deflectionLimitMm;

    @JsonProperty("bending_stress_N_per_mm2")
    private BigDecimal bendingStressNPerMm2;

    @JsonProperty("allowable_stress_N_per_mm2")
    private BigDecimal allowableStressNPerMm2;

    @JsonProperty("yield_stress_N_per_mm2")
    private BigDecimal yieldStressNPerMm2;

    /** Tension per rod at the governing support (N) */
    @JsonProperty("rod_demand_N")
    private BigDecimal rodDemandN;

    /** Rod tension capacity (N); absent when the catalog record carries none */
    @JsonProperty("rod_capacity_N")
    private BigDecimal rodCapacityN;

    @JsonProperty("anchor_demand_N")
    private BigDecimal anchorDemandN;

    @JsonProperty("anchor_capacity_N")
    private BigDecimal anchorCapacityN;

    /** Smallest standard rod size whose catalog capacity covers the rod demand */
    @JsonProperty("rod_min_size")
    private String rodMinSize;

    /** Advisory message (e.g. selected rod below minimum size); does not affect status */
    private String warning;

    @JsonProperty("library_used")
    private Map<String, Object> libraryUsed;

    /** Step-by-step calculation info */
    @JsonProperty("calculation_steps")
    private List<String> calculationSteps;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Reaction {
        private BigDecimal left;
        private BigDecimal right;
    }
}
