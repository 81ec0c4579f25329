package com.lungrisk.common.feature;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Self-describing meaning of a binary feature: what {@code 1} and {@code 0} stand for,
 * plus any feature-specific tokens that encode {@code 1} (for example {@code "male"}).
 * Persisted in the metadata document so consumers can interpret the encoded vector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class BinaryFeatureSemantics {

    private String positive;
    private String negative;

    @Builder.Default
    private Set<String> positiveAliases = Set.of();

    public static BinaryFeatureSemantics yesNo() {
        return BinaryFeatureSemantics.builder()
            .positive("Yes")
            .negative("No")
            .build();
    }

    public static BinaryFeatureSemantics of(String positive, String negative, String... aliases) {
        return BinaryFeatureSemantics.builder()
            .positive(positive)
            .negative(negative)
            .positiveAliases(Set.of(aliases))
            .build();
    }

    /**
     * Aliases normalised to trimmed lower case, ready for token lookup.
     */
    public Set<String> normalizedAliases() {
        if (positiveAliases == null || positiveAliases.isEmpty()) {
            return Set.of();
        }
        return positiveAliases.stream()
            .map(alias -> alias.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(TreeSet::new));
    }

    public String describe(int encoded) {
        return encoded == 1 ? positive : negative;
    }
}
