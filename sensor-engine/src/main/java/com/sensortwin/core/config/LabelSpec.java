package com.sensortwin.core.config;

import java.util.Objects;

/**
 * Declares one ground-truth label a modality can emit and the configuration
 * keys that tune it.
 *
 * <p>
 * A {@link Kind#CONDITION} label is driven by an environment field; its keys
 * are {@code <prefix>_field}, {@code <prefix>_severity_scale} and
 * {@code <prefix>_confidence}. A {@link Kind#THRESHOLD} label compares the
 * observed primary value with {@code <prefix>_threshold}, and also reads
 * {@code <prefix>_severity_scale} and {@code <prefix>_confidence}.
 * </p>
 *
 * @since 1.0.0
 */
public final class LabelSpec {

    public enum Kind {
        CONDITION,
        THRESHOLD
    }

    private final Kind kind;
    private final String labelType;
    private final String prefix;
    private final String defaultField;
    private final double defaultThreshold;
    private final double defaultSeverityScale;
    private final double defaultConfidence;

    private LabelSpec(Kind kind, String labelType, String prefix, String defaultField,
            double defaultThreshold, double defaultSeverityScale, double defaultConfidence) {
        this.kind = kind;
        this.labelType = Objects.requireNonNull(labelType, "labelType");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.defaultField = defaultField;
        this.defaultThreshold = defaultThreshold;
        this.defaultSeverityScale = defaultSeverityScale;
        this.defaultConfidence = defaultConfidence;
    }

    public static LabelSpec condition(String labelType, String prefix, String defaultField,
            double defaultSeverityScale, double defaultConfidence) {
        return new LabelSpec(Kind.CONDITION, labelType, prefix,
                Objects.requireNonNull(defaultField, "defaultField"),
                Double.NaN, defaultSeverityScale, defaultConfidence);
    }

    public static LabelSpec threshold(String labelType, String prefix, double defaultThreshold,
            double defaultSeverityScale, double defaultConfidence) {
        return new LabelSpec(Kind.THRESHOLD, labelType, prefix, null,
                defaultThreshold, defaultSeverityScale, defaultConfidence);
    }

    public Kind getKind() {
        return kind;
    }

    public String getLabelType() {
        return labelType;
    }

    public String fieldKey() {
        return prefix + "_field";
    }

    public String thresholdKey() {
        return prefix + "_threshold";
    }

    public String severityScaleKey() {
        return prefix + "_severity_scale";
    }

    public String confidenceKey() {
        return prefix + "_confidence";
    }

    void declare(ParameterTable.Builder builder) {
        if (kind == Kind.CONDITION) {
            builder.text(fieldKey(), defaultField,
                    "Environment field that signals " + labelType);
        } else {
            builder.number(thresholdKey(), defaultThreshold, Domain.ANY,
                    "Observed value above which " + labelType + " is labeled");
        }
        builder.number(severityScaleKey(), defaultSeverityScale, Domain.NON_NEGATIVE,
                "Severity scale for " + labelType);
        builder.number(confidenceKey(), defaultConfidence, Domain.UNIT_INTERVAL,
                "Confidence attached to " + labelType);
    }

    @Override
    public String toString() {
        return "LabelSpec{" + kind + ' ' + labelType + '}';
    }
}
