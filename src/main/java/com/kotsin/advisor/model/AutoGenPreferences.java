package com.kotsin.advisor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Persisted auto-generation switches, one entry per category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoGenPreferences {

    @Builder.Default
    private Map<SignalCategory, CategoryPreference> categories = new EnumMap<>(SignalCategory.class);

    public CategoryPreference get(SignalCategory category) {
        return categories.computeIfAbsent(category, c -> new CategoryPreference());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryPreference {
        private boolean enabled;
        private Long lastGeneratedAt;
        private GenerationConfig config;
    }
}
