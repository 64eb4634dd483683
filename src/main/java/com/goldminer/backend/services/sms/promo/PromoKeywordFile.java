package com.goldminer.backend.services.sms.promo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * YAML shape: {@code keywords: {english: [...], arabic: [...]}}. Any language key is accepted.
 */
@Data
@NoArgsConstructor
public class PromoKeywordFile {
    private Map<String, List<String>> keywords = new LinkedHashMap<>();
}
