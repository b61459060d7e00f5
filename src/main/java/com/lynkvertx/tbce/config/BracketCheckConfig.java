package com.lynkvertx.tbce.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.Positive;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the trapeze bracket checks.
 * All working-stress factors, section defaults and sampling constants are externalized here,
 * making the check engine fully configurable via application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "tbce.check")
public class BracketCheckConfig {

    /** Gravitational acceleration used to convert load (N) to mass (kg) */
    @Positive
    private double gravity = 9.81;

    /** Allowable bending stress = yield stress * this factor (working-stress placeholder rule) */
    @Positive
    private double allowableStressFactor = 0.6;

    /** Deflection limit = span / this ratio */
    @Positive
    private double deflectionRatio = 200;

    /** Yield stress (N/mm2) assumed when the grade label matches no entry */
    @Positive
    private double defaultYieldStress = 235;

    /**
     * Grade label fragment to yield stress (N/mm2).
     * Matched by substring in configured order, so the first matching fragment wins.
     * Starts empty so a configured table replaces the built-in one instead of merging into it;
     * see {@link #resolveGradeYieldStresses()}.
     */
    private Map<String, Double> gradeYieldStresses = new LinkedHashMap<>();

    /** Elastic modulus (N/mm2) substituted when the profile carries none */
    @Positive
    private double defaultElasticModulus = 200000;

    /** Second moment of area (mm4) substituted when missing; minimal so that checks fail loudly */
    @Positive
    private double defaultIxx = 1;

    /** Elastic section modulus (mm3) substituted when missing; minimal so that bending fails */
    @Positive
    private double defaultZxx = 1;

    /** Deflection sampling step = span / this divisor, clamped to [min, max] */
    @Positive
    private double deflectionStepDivisor = 120;

    @Positive
    private double minDeflectionStepMm = 10;

    @Positive
    private double maxDeflectionStepMm = 50;

    /** Upper bound on deflection samples per span; the step widens beyond it */
    @Min(2)
    private int maxDeflectionSamples = 2000;

    /** Library field names holding a tension capacity (N), tried in order */
    @NotEmpty
    private List<String> capacityFieldNames = Arrays.asList("tension_capacity_N", "capacity_N", "tension_N");

    /** Rods/anchors sharing one support reaction: 1 (whole reaction per rod) or 2 (split equally) */
    @Min(1)
    @Max(2)
    private int supportsPerReaction = 1;

    /** Standard drop rod sizes, smallest first */
    @NotEmpty
    private List<String> rodSizeOrder = Arrays.asList("M6", "M8", "M10", "M12", "M16", "M20");

    /** Upper bound of tiers analysed per bracket */
    @Min(1)
    private int maxTierCount = 3;

    /** The configured grade table, or the built-in 355/275/235 table when none is configured */
    public Map<String, Double> resolveGradeYieldStresses() {
        return gradeYieldStresses == null || gradeYieldStresses.isEmpty()
            ? defaultGradeYieldStresses()
            : gradeYieldStresses;
    }

    private static Map<String, Double> defaultGradeYieldStresses() {
        Map<String, Double> map = new LinkedHashMap<>();
        // Structural steel grades, strongest first (e.g. "S355JR", "S275", "S235")
        map.put("355", 355.0);
        map.put("275", 275.0);
        map.put("235", 235.0);
        return map;
    }
}
