package com.lynkvertx.tbce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lynkvertx.tbce.config.BracketCheckConfig;
import com.lynkvertx.tbce.dto.BracketCheckResultDTO;
import com.lynkvertx.tbce.dto.BracketCheckResultDTO.Reaction;
import com.lynkvertx.tbce.dto.PartsLibraryDTO;
import com.lynkvertx.tbce.dto.ProjectSnapshotDTO;
import com.lynkvertx.tbce.model.CheckCategory;
import com.lynkvertx.tbce.model.CheckStatus;
import com.lynkvertx.tbce.model.MaterialProperties;
import com.lynkvertx.tbce.model.PointLoad;
import com.lynkvertx.tbce.model.PropertyValue;
import com.lynkvertx.tbce.model.SupportReactions;
import com.lynkvertx.tbce.model.TierResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Trapeze Bracket Check Service
 *
 * Check evaluator for multi-tier trapeze supports. Each tier is analysed as an independent
 * simply-supported span on the shared channel section; the worst tier governs the member checks,
 * the summed reactions govern the rod and anchor checks.
 *
 * Pure computation over the resolved snapshot and library: no I/O, no shared mutable state.
 * Malformed domain data never raises; it degrades to a conservative figure or a skipped check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BracketCheckService {

    static final String NO_FAILURE = "none";
    static final String TOTAL = "total";
    static final String FIELD_BEARING_MULTIPLIER = "bearing_area_multiplier";

    private final BracketCheckConfig config;
    private final LoadNormalizer loadNormalizer;
    private final BeamStatics beamStatics;
    private final DeflectionModel deflectionModel;
    private final AllowableDerivation allowableDerivation;
    private final RodSizeSelector rodSizeSelector;

    /**
     * Main entry point: orchestrates all check steps.
     *
     * Steps:
     * 1. Resolve span, tier count and section properties (defaults for missing data)
     * 2. Per tier: normalize loads, reactions, max moment, max deflection, weight
     * 3. Aggregate tiers: reactions and weight summed, moment and deflection enveloped
     * 4. Bending check against factor x yield
     * 5. Deflection check against span / ratio
     * 6. Rod and anchor tension checks at the governing support
     * 7. Governing check by fixed priority, rod sizing advisory
     *
     * @param snapshot resolved project snapshot
     * @param library  resolved catalog records; null is treated as an empty library
     * @return complete check result
     */
    public BracketCheckResultDTO evaluate(ProjectSnapshotDTO snapshot, PartsLibraryDTO library) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Project snapshot is required");
        }
        PartsLibraryDTO lib = library != null ? library : new PartsLibraryDTO();
        List<String> steps = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        List<String> skippedChecks = new ArrayList<>();

        // === Step 1: Geometry and section ===
        double spanMm = sanitizeSpan(snapshot.getSpanMm());
        int tierCount = clampTierCount(snapshot.getTierCount());
        MaterialProperties material = MaterialProperties.fromProfile(lib.getProfile());
        double e = resolveSectionValue("E", material.getElasticModulus(), config.getDefaultElasticModulus(), steps);
        double ixx = resolveSectionValue("Ixx", material.getIxx(), config.getDefaultIxx(), steps);
        double zxx = resolveSectionValue("Zxx", material.getZxx(), config.getDefaultZxx(), steps);
        steps.add(0, format("Step 1: Span=%.1fmm, tiers=%d, E=%.0fN/mm², Ixx=%.0fmm⁴, Zxx=%.0fmm³, grade='%s'",
            spanMm, tierCount, e, ixx, zxx, material.getGradeLabel()));

        // === Step 2: Per-tier analysis ===
        Map<Integer, JsonNode> rawLoads = snapshot.getLoads() != null ? snapshot.getLoads() : Collections.emptyMap();
        Map<Integer, TierResult> tiers = new LinkedHashMap<>();
        for (int tier = 1; tier <= tierCount; tier++) {
            List<PointLoad> loads = loadNormalizer.normalizeTierLoads(rawLoads.get(tier), spanMm);
            TierResult result = analyseTier(spanMm, loads, e, ixx);
            tiers.put(tier, result);
            steps.add(format("Step 2.%d: Tier %d — %d loads, R=%.1f/%.1fN, Mmax=%.3fkNm, δmax=%.3fmm, weight=%.2fkg",
                tier, tier, loads.size(), result.getReactions().getLeftN(), result.getReactions().getRightN(),
                result.getMaxMomentKNm(), result.getMaxDeflectionMm(), result.getWeightKg()));
            log.debug("Tier {}: loads={}, Mmax={} N·mm, δmax={} mm", tier, loads.size(),
                result.getMaxMomentNmm(), result.getMaxDeflectionMm());
        }

        // === Step 3: Envelope over tiers ===
        TierResult total = TierResult.EMPTY;
        for (TierResult tier : tiers.values()) {
            total = total.envelope(tier);
        }
        String governingTier = findGoverningTier(tiers);
        steps.add(format("Step 3: Total R=%.1f/%.1fN, envelope Mmax=%.3fkNm, δmax=%.3fmm, weight=%.2fkg (governing tier: %s)",
            total.getReactions().getLeftN(), total.getReactions().getRightN(), total.getMaxMomentKNm(),
            total.getMaxDeflectionMm(), total.getWeightKg(), governingTier != null ? governingTier : NO_FAILURE));

        Map<CheckCategory, CheckStatus> checks = new EnumMap<>(CheckCategory.class);
        for (CheckCategory category : CheckCategory.values()) {
            checks.put(category, CheckStatus.PASS);
        }

        // === Step 4: Bending ===
        double yieldStress = allowableDerivation.yieldStress(material.getGradeLabel());
        double allowableStress = allowableDerivation.allowableStress(material.getGradeLabel());
        double bendingStress = total.getMaxMomentNmm() / zxx;
        if (bendingStress > allowableStress) {
            checks.put(CheckCategory.BENDING, CheckStatus.FAIL);
            notes.add(format("Bending stress %.1f N/mm² exceeds allowable %.1f N/mm² (Mmax=%.3f kNm, Zxx=%.0f mm³).",
                bendingStress, allowableStress, total.getMaxMomentKNm(), zxx));
        }
        steps.add(format("Step 4: Bending stress = %.3fkNm / Zxx(%.0f) = %.1fN/mm², allowable = %.2f × %.0f = %.1fN/mm² → %s",
            total.getMaxMomentKNm(), zxx, bendingStress, config.getAllowableStressFactor(), yieldStress,
            allowableStress, checks.get(CheckCategory.BENDING)));

        // === Step 5: Deflection ===
        double deflectionLimit = allowableDerivation.deflectionLimit(spanMm);
        if (deflectionLimit > 0 && total.getMaxDeflectionMm() > deflectionLimit) {
            checks.put(CheckCategory.DEFLECTION, CheckStatus.FAIL);
            notes.add(format("Deflection %.3f mm exceeds limit %.3f mm (span/%.0f).",
                total.getMaxDeflectionMm(), deflectionLimit, config.getDeflectionRatio()));
        }
        steps.add(format("Step 5: Deflection %.3fmm vs limit %.3fmm → %s",
            total.getMaxDeflectionMm(), deflectionLimit, checks.get(CheckCategory.DEFLECTION)));

        // === Step 6: Rod and anchor tension ===
        double demandN = total.getReactions().governingN() / config.getSupportsPerReaction();
        OptionalDouble rodCapacity = findCapacity(lib.getRod());
        OptionalDouble anchorCapacity = findCapacity(lib.getAnchor());
        checkTension(CheckCategory.ROD, "Rod", demandN, rodCapacity, checks, notes, steps);
        checkTension(CheckCategory.ANCHOR, "Anchor", demandN, anchorCapacity, checks, notes, steps);
        if (rodCapacity.isEmpty()) {
            skippedChecks.add(CheckCategory.ROD.getKey());
        }
        if (anchorCapacity.isEmpty()) {
            skippedChecks.add(CheckCategory.ANCHOR.getKey());
        }

        // === Step 7: Governing check and rod sizing ===
        String governingCheck = NO_FAILURE;
        for (Map.Entry<CheckCategory, CheckStatus> check : checks.entrySet()) {
            if (check.getValue() == CheckStatus.FAIL) {
                governingCheck = check.getKey().getKey();
                break;
            }
        }
        CheckStatus status = NO_FAILURE.equals(governingCheck) ? CheckStatus.PASS : CheckStatus.FAIL;

        String selectedRod = snapshot.getDropRodSize() != null ? RodSizeSelector.parseRodSize(snapshot.getDropRodSize()) : null;
        Map<String, Double> rodCapacities = lib.getRodCapacities() != null ? lib.getRodCapacities() : Collections.emptyMap();
        String rodMinSize = rodCapacities.isEmpty() ? selectedRod : rodSizeSelector.requiredRodSize(demandN, rodCapacities);
        String warning = null;
        if (selectedRod != null && rodSizeSelector.isBelowMinimum(selectedRod, rodMinSize)) {
            warning = format("Selected rod %s below minimum %s (based on imported rod capacities).", selectedRod, rodMinSize);
            steps.add("Step 7a: WARNING — " + warning);
        }
        steps.add(format("Step 7: Status %s, governing check: %s", status, governingCheck));

        log.info("Bracket check completed: status={}, governing={}, span={}mm, tiers={}",
            status, governingCheck, spanMm, tierCount);

        return BracketCheckResultDTO.builder()
            .status(status)
            .governingCheck(governingCheck)
            .governingTier(governingTier)
            .totalWeightKg(round(total.getWeightKg(), 2))
            .perTierWeightKg(perTierWeights(tiers))
            .checks(checkMap(checks))
            .notes(notes)
            .skippedChecks(skippedChecks)
            .reactionsN(reactionMap(tiers, total))
            .maxMomentKNm(tierMap(tiers, total, true))
            .maxDeflectionMm(tierMap(tiers, total, false))
            .deflectionLimitMm(round(deflectionLimit, 3))
            .bendingStressNPerMm2(round(bendingStress, 1))
            .allowableStressNPerMm2(round(allowableStress, 1))
            .yieldStressNPerMm2(round(yieldStress, 1))
            .rodDemandN(round(demandN, 1))
            .rodCapacityN(rodCapacity.isPresent() ? round(rodCapacity.getAsDouble(), 1) : null)
            .anchorDemandN(round(demandN, 1))
            .anchorCapacityN(anchorCapacity.isPresent() ? round(anchorCapacity.getAsDouble(), 1) : null)
            .rodMinSize(rodMinSize)
            .warning(warning)
            .libraryUsed(libraryUsed(snapshot, lib, material))
            .calculationSteps(steps)
            .build();
    }

    /**
     * Reactions, moment and deflection of one tier; a tier without loads is exactly zero.
     * Weight = sum of load magnitudes / g.
     */
    TierResult analyseTier(double spanMm, List<PointLoad> loads, double e, double ixx) {
        if (loads.isEmpty()) {
            return TierResult.EMPTY;
        }
        SupportReactions reactions = beamStatics.reactions(spanMm, loads);
        double maxMoment = beamStatics.maxMoment(spanMm, loads);
        double maxDeflection = deflectionModel.maxDeflection(spanMm, loads, e, ixx);
        double totalN = 0.0;
        for (PointLoad load : loads) {
            totalN += load.getMagnitudeN();
        }
        return new TierResult(reactions, maxMoment, maxDeflection, totalN / config.getGravity());
    }

    /**
     * Tension capacity of a catalog record: the first configured field holding a positive number.
     * Empty when the record carries none, in which case the check is skipped.
     */
    OptionalDouble findCapacity(Map<String, Object> record) {
        if (record == null || record.isEmpty()) {
            return OptionalDouble.empty();
        }
        for (String field : config.getCapacityFieldNames()) {
            PropertyValue value = PropertyValue.parse(record.get(field));
            if (value.isPresent()) {
                return value.toOptional();
            }
            if (value.getState() == PropertyValue.State.INVALID) {
                log.warn("Ignoring non-numeric capacity field {}={}", field, record.get(field));
            }
        }
        return OptionalDouble.empty();
    }

    // ==================== Internal helpers ====================

    private void checkTension(CheckCategory category, String name, double demandN, OptionalDouble capacity,
                              Map<CheckCategory, CheckStatus> checks, List<String> notes, List<String> steps) {
        if (capacity.isEmpty()) {
            steps.add(format("Step 6: %s demand %.1fN, no capacity in catalog → check skipped", name, demandN));
            return;
        }
        double capacityN = capacity.getAsDouble();
        if (demandN > capacityN) {
            checks.put(category, CheckStatus.FAIL);
            notes.add(format("%s tension %.1f N exceeds capacity %.1f N.", name, demandN, capacityN));
        }
        steps.add(format("Step 6: %s demand %.1fN (%d per support) vs capacity %.1fN → %s",
            name, demandN, config.getSupportsPerReaction(), capacityN, checks.get(category)));
    }

    private double resolveSectionValue(String name, PropertyValue value, double defaultValue, List<String> steps) {
        if (!value.isPresent()) {
            steps.add(format("Step 1a: %s %s in profile, default %.0f substituted",
                name, value.getState().name().toLowerCase(Locale.ROOT).replace('_', ' '), defaultValue));
        }
        return value.orDefault(defaultValue);
    }

    private double sanitizeSpan(Double spanMm) {
        if (spanMm == null || !Double.isFinite(spanMm) || spanMm < 0) {
            return 0.0;
        }
        return spanMm;
    }

    private int clampTierCount(Integer tierCount) {
        int count = tierCount != null ? tierCount : 1;
        return Math.min(Math.max(count, 1), config.getMaxTierCount());
    }

    /** Tier with the largest moment; null when no tier carries any moment */
    private String findGoverningTier(Map<Integer, TierResult> tiers) {
        String governing = null;
        double max = 0.0;
        for (Map.Entry<Integer, TierResult> tier : tiers.entrySet()) {
            if (tier.getValue().getMaxMomentNmm() > max) {
                max = tier.getValue().getMaxMomentNmm();
                governing = tierKey(tier.getKey());
            }
        }
        return governing;
    }

    private Map<String, BigDecimal> perTierWeights(Map<Integer, TierResult> tiers) {
        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        tiers.forEach((tier, result) -> weights.put(String.valueOf(tier), round(result.getWeightKg(), 2)));
        return weights;
    }

    private Map<String, CheckStatus> checkMap(Map<CheckCategory, CheckStatus> checks) {
        Map<String, CheckStatus> map = new LinkedHashMap<>();
        checks.forEach((category, verdict) -> map.put(category.getKey(), verdict));
        return map;
    }

    private Map<String, Reaction> reactionMap(Map<Integer, TierResult> tiers, TierResult total) {
        Map<String, Reaction> map = new LinkedHashMap<>();
        tiers.forEach((tier, result) -> map.put(tierKey(tier), toReaction(result.getReactions())));
        map.put(TOTAL, toReaction(total.getReactions()));
        return map;
    }

    private Map<String, BigDecimal> tierMap(Map<Integer, TierResult> tiers, TierResult total, boolean moment) {
        Map<String, BigDecimal> map = new LinkedHashMap<>();
        tiers.forEach((tier, result) -> map.put(tierKey(tier),
            round(moment ? result.getMaxMomentKNm() : result.getMaxDeflectionMm(), 3)));
        map.put(TOTAL, round(moment ? total.getMaxMomentKNm() : total.getMaxDeflectionMm(), 3));
        return map;
    }

    private Map<String, Object> libraryUsed(ProjectSnapshotDTO snapshot, PartsLibraryDTO lib, MaterialProperties material) {
        PropertyValue bearing = PropertyValue.parse(lib.getWasher() != null ? lib.getWasher().get(FIELD_BEARING_MULTIPLIER) : null);
        Map<String, Object> used = new LinkedHashMap<>();
        used.put("profile", snapshot.getProfileId());
        used.put("rod", snapshot.getRodId());
        used.put("washer", snapshot.getWasherId());
        used.put("anchor", snapshot.getAnchorId());
        used.put("grade", material.getGradeLabel());
        used.put(FIELD_BEARING_MULTIPLIER, bearing.orDefault(1.0));
        used.put("supports_per_reaction", config.getSupportsPerReaction());
        return used;
    }

    private static Reaction toReaction(SupportReactions reactions) {
        return new Reaction(round(reactions.getLeftN(), 1), round(reactions.getRightN(), 1));
    }

    private static String tierKey(int tier) {
        return "tier" + tier;
    }

    /** Display rounding, HALF_UP; null for a non-finite figure */
    private static BigDecimal round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }
}
