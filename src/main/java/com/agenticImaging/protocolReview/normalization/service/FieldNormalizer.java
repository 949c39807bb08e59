package com.agenticImaging.protocolReview.normalization.service;

import com.agenticImaging.protocolReview.normalization.model.PatientRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Canonicalizes heterogeneous patient record keys.
 * 
 * Keys are lower-cased and trimmed, then looked up in a fixed alias table. Unmapped keys pass
 * through lower-cased and trimmed. Values are never touched. When two input keys collapse to the
 * same canonical name, the later one wins.
 */
@Slf4j
@Service
public class FieldNormalizer {
    
    public static final String POTASSIUM = "potassium_mmol_l";
    public static final String BUN = "bun_mg_dl";
    public static final String CREATININE = "creatinine_mg_dl";
    public static final String EGFR = "egfr_ckd_epi";
    public static final String BMI = "bmi";
    
    /**
     * Synonym spelling (lower case) to canonical field name.
     */
    public static final Map<String, String> FIELD_ALIASES = Map.ofEntries(
            // potassium
            Map.entry("potassium_meq_l", POTASSIUM),
            Map.entry("k_meq_l", POTASSIUM),
            Map.entry("k_mmol_l", POTASSIUM),
            Map.entry("potassium", POTASSIUM),
            Map.entry("serum_potassium", POTASSIUM),
            // bun
            Map.entry("bun", BUN),
            Map.entry("bun_mmol_l", BUN),
            Map.entry("bun_mgdl", BUN),
            // creatinine
            Map.entry("creatinine", CREATININE),
            Map.entry("creatinine_mgdl", CREATININE),
            Map.entry("serum_creatinine", CREATININE),
            Map.entry("cr", CREATININE),
            // egfr
            Map.entry("gfr", EGFR),
            Map.entry("egfr", EGFR),
            Map.entry("estimated_gfr", EGFR),
            // bmi
            Map.entry("body_mass_index", BMI),
            Map.entry("body_mass_idx", BMI)
    );
    
    /**
     * Rewrites every key of the input to its canonical name.
     * 
     * @param record Raw input record, may be null
     * @return New map with canonical keys in input order
     */
    public Map<String, Object> normalize(Map<String, ?> record) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (record == null) {
            return normalized;
        }
        for (Map.Entry<String, ?> entry : record.entrySet()) {
            String canonical = canonicalName(entry.getKey());
            if (normalized.containsKey(canonical)) {
                log.debug("Duplicate field after normalization, later value wins - field: {}", canonical);
            }
            normalized.put(canonical, entry.getValue());
        }
        return normalized;
    }
    
    /**
     * Normalizes the input and wraps it as an immutable record.
     * 
     * @param record Raw input record
     * @return Patient record with canonical keys
     */
    public PatientRecord toRecord(Map<String, ?> record) {
        return PatientRecord.of(normalize(record));
    }
    
    /**
     * Resolves a single key to its canonical name.
     * 
     * @param key Raw key, may be null
     * @return Canonical name
     */
    public String canonicalName(String key) {
        String keyLower = String.valueOf(key).trim().toLowerCase(Locale.ROOT);
        return FIELD_ALIASES.getOrDefault(keyLower, keyLower);
    }
}
