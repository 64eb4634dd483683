package com.goldminer.backend.classification.rules;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * YAML shape: {@code merchants: [{canonical: ..., aliases: [...]}]}.
 */
@Data
@NoArgsConstructor
public class MerchantAliasFile {

    private List<Entry> merchants = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class Entry {
        private String canonical;
        private List<String> aliases = new ArrayList<>();
    }
}
