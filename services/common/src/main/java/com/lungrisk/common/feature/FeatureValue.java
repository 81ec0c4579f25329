package com.lungrisk.common.feature;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single loosely-typed input value, classified as exactly one of
 * {@link Kind#ABSENT}, {@link Kind#BOOLEAN}, {@link Kind#NUMBER} or {@link Kind#STRING}.
 *
 * <p>Callers send whatever their upstream system produced ({@code true}, {@code 1},
 * {@code "1"}, {@code "Yes"}); this type pins the representation down before
 * {@link FeatureParser} maps it to the canonical numeric form.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FeatureValue {

    public enum Kind {
        ABSENT,
        BOOLEAN,
        NUMBER,
        STRING
    }

    private static final FeatureValue ABSENT = new FeatureValue(Kind.ABSENT, null);

    private final Kind kind;
    private final Object value;

    private FeatureValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static FeatureValue absent() {
        return ABSENT;
    }

    public static FeatureValue of(boolean value) {
        return new FeatureValue(Kind.BOOLEAN, value);
    }

    public static FeatureValue of(double value) {
        return new FeatureValue(Kind.NUMBER, value);
    }

    public static FeatureValue of(String value) {
        return value == null ? ABSENT : new FeatureValue(Kind.STRING, value);
    }

    /**
     * Classifies an arbitrary decoded value (as produced by Jackson or a CSV reader).
     * Anything that is neither boolean nor number is treated by its text form.
     */
    public static FeatureValue of(Object raw) {
        if (raw == null) {
            return ABSENT;
        }
        if (raw instanceof FeatureValue featureValue) {
            return featureValue;
        }
        if (raw instanceof Boolean bool) {
            return of(bool.booleanValue());
        }
        if (raw instanceof Number number) {
            return of(number.doubleValue());
        }
        return of(raw.toString());
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    public boolean asBoolean() {
        return (Boolean) value;
    }

    public double asNumber() {
        return (Double) value;
    }

    public String asText() {
        return (String) value;
    }
}
