package com.goldminer.backend.services.sms.extraction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One template entry of the templates file, before compilation.
 */
@Data
@NoArgsConstructor
public class TemplateDefinition {
    private String name;
    private Map<String, String> patterns = new LinkedHashMap<>();
    private List<String> requiredFields = new ArrayList<>();
}
