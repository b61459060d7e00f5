package com.lynkvertx.tbce.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lynkvertx.tbce.config.BracketCheckConfig;
import com.lynkvertx.tbce.dto.BracketCheckResultDTO;
import com.lynkvertx.tbce.dto.PartsLibraryDTO;
import com.lynkvertx.tbce.dto.ProjectSnapshotDTO;
import com.lynkvertx.tbce.model.CheckStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the application context: configuration bound from application.yml and the
 * evaluator wired with its components.
 */
@SpringBootTest
class BracketCheckServiceIntegrationTest {

    @Autowired
    private BracketCheckService service;

    @Autowired
    private BracketCheckConfig config;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void bindsCheckProperties() {
        assertThat(config.getSupportsPerReaction()).isEqualTo(1);
        assertThat(config.getCapacityFieldNames()).containsExactly("tension_capacity_N", "capacity_N", "tension_N");
        assertThat(config.getRodSizeOrder()).startsWith("M6").endsWith("M20");
        assertThat(config.getGradeYieldStresses()).containsKeys("355", "275", "235");
        assertThat(config.getDeflectionRatio()).isEqualTo(200.0);
    }

    @Test
    void evaluatesPersistedSnapshotJson() throws Exception {
        ProjectSnapshotDTO snapshot = objectMapper.readValue("{"
            + "\"span_mm\": 1800, \"tier_count\": 2,"
            + "\"loads\": {\"1\": [{\"N\": 2200, \"x_mm\": 600, \"label\": \"Cable tray\"}], \"2\": [900, 900]},"
            + "\"profile_id\": \"acme:C41D\", \"rod_id\": \"acme:M10\", \"anchor_id\": \"acme:HSA-M10\","
            + "\"drop_rod_size\": \"M10\"}", ProjectSnapshotDTO.class);
        PartsLibraryDTO library = objectMapper.readValue("{"
            + "\"profile\": {\"E_N_per_mm2\": 200000, \"Ixx_mm4\": 180000, \"Zxx_mm3\": 8000, \"material_grade\": \"S275\"},"
            + "\"rod\": {\"tension_capacity_N\": 6000},"
            + "\"anchor\": {\"capacity_N\": 4500},"
            + "\"rod_capacities\": {\"M8\": 3500, \"M10\": 6000}}", PartsLibraryDTO.class);

        BracketCheckResultDTO result = service.evaluate(snapshot, library);

        assertThat(result.getChecks()).containsOnlyKeys("bending", "deflection", "rod", "anchor");
        assertThat(result.getChecks().get("rod")).isEqualTo(CheckStatus.PASS);
        assertThat(result.getChecks().get("anchor")).isEqualTo(CheckStatus.PASS);
        assertThat(result.getRodMinSize()).isEqualTo("M8");
        assertThat(result.getYieldStressNPerMm2()).isEqualByComparingTo("275");
        assertThat(result.getPerTierWeightKg()).containsOnlyKeys("1", "2");
        assertThat(result.getLibraryUsed()).containsEntry("anchor", "acme:HSA-M10");

        String json = objectMapper.writeValueAsString(result);
        assertThat(json).contains("\"reactions_N\"", "\"max_deflection_mm\"", "\"deflection_limit_mm\":9.000");
    }
}
