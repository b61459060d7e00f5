package com.lynkvertx.tbce.model;

import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Section and material properties of the bracket channel, taken from the resolved profile record.
 */
@Value
public class MaterialProperties {

    public static final String FIELD_E = "E_N_per_mm2";
    public static final String FIELD_IXX = "Ixx_mm4";
    public static final String FIELD_ZXX = "Zxx_mm3";
    public static final String FIELD_GRADE = "material_grade";
    public static final String FIELD_GRADE_ALT = "grade_label";

    /** Elastic modulus (N/mm2) */
    PropertyValue elasticModulus;

    /** Second moment of area about the strong axis (mm4) */
    PropertyValue ixx;

    /** Elastic section modulus about the strong axis (mm3) */
    PropertyValue zxx;

    /** Material grade label, e.g. "S275"; empty when unknown */
    String gradeLabel;

    public static MaterialProperties fromProfile(Map<String, Object> profile) {
        Map<String, Object> fields = profile != null ? profile : Collections.emptyMap();
        Object grade = fields.get(FIELD_GRADE);
        if (grade == null) {
            grade = fields.get(FIELD_GRADE_ALT);
        }
        return new MaterialProperties(
            PropertyValue.parse(fields.get(FIELD_E)),
            PropertyValue.parse(fields.get(FIELD_IXX)),
            PropertyValue.parse(fields.get(FIELD_ZXX)),
            grade != null ? grade.toString() : "");
    }
}
