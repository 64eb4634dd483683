package com.goldminer.backend.services.sms.pipeline;

import java.util.List;

import com.goldminer.backend.dto.sms.ExtractedFields;

/**
 * Validated fields (currency upper-cased, text capped, confidence possibly lowered) and the
 * warnings that explain any change.
 */
public record FieldValidation(ExtractedFields fields, List<String> warnings) {

    public FieldValidation {
        warnings = List.copyOf(warnings);
    }
}
