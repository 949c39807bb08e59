package com.agenticImaging.protocolReview.normalization.service;

import com.agenticImaging.protocolReview.normalization.model.PatientRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldNormalizerTest {
    
    private final FieldNormalizer normalizer = new FieldNormalizer();
    
    @Test
    @DisplayName("every alias maps to its canonical field")
    void everyAliasMapsToCanonicalField() {
        FieldNormalizer.FIELD_ALIASES.forEach((alias, canonical) ->
                assertThat(normalizer.normalize(Map.of(alias, 1.0))).containsOnlyKeys(canonical));
    }
    
    @Test
    void casingAndWhitespaceAreIgnoredForAliases() {
        Map<String, Object> normalized = normalizer.normalize(Map.of("  Serum_Creatinine ", 1.4, "GFR", 55));
        
        assertThat(normalized)
                .containsEntry(FieldNormalizer.CREATININE, 1.4)
                .containsEntry(FieldNormalizer.EGFR, 55)
                .hasSize(2);
    }
    
    @Test
    void unknownKeysAreOnlyLowerCasedAndTrimmed() {
        Map<String, Object> normalized = normalizer.normalize(Map.of(" Contrast_Allergy ", "iodine", "AGE", 67));
        
        assertThat(normalized)
                .containsEntry("contrast_allergy", "iodine")
                .containsEntry("age", 67);
    }
    
    @Test
    void valuesAreNotTouched() {
        Map<String, Object> normalized = normalizer.normalize(Map.of("K_MEQ_L", "5.9 (hemolyzed)"));
        
        assertThat(normalized).containsEntry(FieldNormalizer.POTASSIUM, "5.9 (hemolyzed)");
    }
    
    @Test
    void laterDuplicateOverwritesEarlier() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("creatinine", 1.1);
        input.put("cr", 2.3);
        
        assertThat(normalizer.normalize(input)).containsExactly(Map.entry(FieldNormalizer.CREATININE, 2.3));
    }
    
    @Test
    void normalizeIsIdempotent() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("Potassium", 4.1);
        input.put("BUN_mgdl", 18);
        input.put("Body_Mass_Index", 31.2);
        input.put(" Indication ", "aortic dissection");
        input.put("eGFR", 48);
        
        Map<String, Object> once = normalizer.normalize(input);
        
        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }
    
    @Test
    void nullRecordNormalizesToEmpty() {
        assertThat(normalizer.normalize(null)).isEmpty();
    }
    
    @Test
    void toRecordExposesNumericValuesIncludingNumericStrings() {
        PatientRecord record = normalizer.toRecord(Map.of("egfr", "42", "creatinine", 1.7, "potassium", "n/a"));
        
        assertThat(record.numeric(FieldNormalizer.EGFR)).isEqualTo(42.0);
        assertThat(record.numeric(FieldNormalizer.CREATININE)).isEqualTo(1.7);
        assertThat(record.numeric(FieldNormalizer.POTASSIUM)).isNull();
        assertThat(record.numeric(FieldNormalizer.BUN)).isNull();
    }
}
