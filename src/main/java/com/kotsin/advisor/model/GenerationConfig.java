package com.kotsin.advisor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationConfig {
    @Builder.Default
    private VenueKind venue = VenueKind.CRYPTO;
    @Builder.Default
    private MarketKind marketKind = MarketKind.FUTURE;
}
