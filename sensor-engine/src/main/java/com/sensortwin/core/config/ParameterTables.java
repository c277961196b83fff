package com.sensortwin.core.config;

import com.sensortwin.core.model.Modality;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The documented default table of every sensor parameter, per modality.
 *
 * <p>
 * Shared parameters (calibration, drift, noise) are declared once and reused by
 * all modalities; each modality then adds the parameter groups of the stages it
 * runs and the keys of the labels it emits. This is the single place where
 * parameter names, defaults and validity domains are defined.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParameterTables {

    // --- Shared ---
    public static final String INITIAL_OPERATING_HOURS = "initial_operating_hours";
    public static final String CALIBRATION_GAIN_ERROR_FACTOR = "calibration_gain_error_factor";
    public static final String CALIBRATION_GAIN_DRIFT_PER_HOUR = "calibration_gain_drift_per_hour";
    public static final String CALIBRATION_OFFSET = "calibration_offset";
    public static final String CALIBRATION_OFFSET_DRIFT_PER_HOUR = "calibration_offset_drift_per_hour";
    public static final String CALIBRATION_NONLINEARITY_FACTOR = "calibration_nonlinearity_factor";
    public static final String BASELINE_DRIFT_PER_HOUR = "drift_parameters.baseline_drift_per_hour";
    public static final String NOISE_TYPE = "noise_characteristics.type";
    public static final String NOISE_MEAN = "noise_characteristics.mean";
    public static final String NOISE_STDDEV = "noise_characteristics.stddev";

    // --- Spectrum analysis ---
    public static final String ENABLE_SPECTRUM_OUTPUT = "enable_spectrum_output";
    public static final String FREQUENCY_RANGE_HZ = "frequency_range_hz";
    public static final String BASE_FREQUENCY = "base_frequency";
    public static final String FREQUENCY_NOISE = "frequency_noise";
    public static final String FREQUENCY_NOISE_STDDEV = "frequency_noise_stddev";
    public static final String CORONA_HF_NOISE_FACTOR = "corona_hf_noise_factor";
    public static final String DISCHARGE_CONDITION_FIELD = "discharge_condition_field";

    // --- Frequency response ---
    public static final String FREQUENCY_RESPONSE_CURVE = "frequency_response_curve";
    public static final String FREQUENCY_RESPONSE_DEFAULT_MULTIPLIER = "frequency_response_default_multiplier";
    public static final String FREQUENCY_RESPONSE_TEMP_COEFF = "frequency_response_temp_coeff_per_10c";
    public static final String FREQUENCY_RESPONSE_REF_TEMP = "frequency_response_ref_temp_c";
    public static final String AMBIENT_TEMPERATURE_FIELD = "ambient_temperature_field";
    public static final String FREQUENCY_RESPONSE_GAIN = "frequency_response_gain";
    public static final String FREQUENCY_TOLERANCE_HZ = "frequency_tolerance_hz";
    public static final String DEFAULT_FREQUENCY_GAIN = "default_frequency_gain";

    // --- Axis misalignment ---
    public static final String AXIS_MISALIGNMENT_ENABLED = "axis_misalignment_effect_on_spectrum";
    public static final String AXIS_MISALIGNMENT_DEGREES = "axis_misalignment_degrees";

    // --- Directional sensitivity ---
    public static final String ORIENTATION = "orientation";
    public static final String ORIENTATION_UNCERTAINTY = "orientation_uncertainty";
    public static final String ORIENTATION_UNCERTAINTY_STDDEV = "orientation_uncertainty_stddev";
    public static final String DIRECTIONAL_FOR_SCALAR = "apply_directional_sensitivity_to_scalar";
    public static final String ASSUMED_FIELD_DIRECTION = "assumed_dominant_field_direction";
    public static final String SCALE_SPECTRUM_WITH_ALIGNMENT = "recalculate_harmonics_post_directionality";

    // --- Interference coupling ---
    public static final String EMI_RADIUS_M = "emi_sources_config.radius_m";
    public static final String EMI_FREQUENCY_COUPLING_FACTOR = "emi_frequency_coupling_factor";
    public static final String EMI_SPECTRUM_IMPACT_FACTOR = "emi_spectrum_impact_factor";
    public static final String EMI_FIELD_STRENGTH_IMPACT_FACTOR = "emi_field_strength_impact_factor";
    public static final String EMI_FIELD_STRENGTH_RANDOM_STDDEV = "emi_field_strength_random_stddev";

    // --- Chemical ---
    public static final String TARGET_SPECIES = "target_species";
    public static final String CROSS_SENSITIVITY = "cross_sensitivity";

    /** Noise distributions understood by the noise injection stage. */
    public static final Set<String> NOISE_TYPES = Set.of("gaussian", "none");

    private static final Map<Modality, List<LabelSpec>> LABELS = Map.of(
            Modality.EMF, List.of(
                    LabelSpec.condition("corona_discharge", "corona", "corona_discharge", 100.0, 0.9),
                    LabelSpec.condition("arcing", "arcing", "arcing_intensity", 50.0, 0.85),
                    LabelSpec.threshold("overload", "overload", 500.0, 1.0, 0.95)),
            Modality.ACOUSTIC, List.of(
                    LabelSpec.condition("corona_discharge", "corona", "corona_discharge", 100.0, 0.8),
                    LabelSpec.condition("arcing", "arcing", "arcing_intensity", 50.0, 0.8),
                    LabelSpec.threshold("overload", "overload", 120.0, 1.0, 0.9)),
            Modality.PARTICULATE, List.of(
                    LabelSpec.condition("smoke", "smoke", "smoke_density", 100.0, 0.9),
                    LabelSpec.threshold("pm_exceedance", "pm_exceedance", 35.0, 1.0, 0.9)),
            Modality.THERMAL, List.of(
                    LabelSpec.condition("hotspot", "hotspot", "hotspot_intensity", 100.0, 0.9),
                    LabelSpec.threshold("overheat", "overheat", 90.0, 1.0, 0.9)),
            Modality.CHEMICAL, List.of(
                    LabelSpec.condition("chemical_release", "chemical_release", "chemical_release", 100.0, 0.9),
                    LabelSpec.threshold("exposure_limit", "exposure_limit", 1000.0, 1.0, 0.9)));

    private ParameterTables() {
        // static helpers only
    }

    /**
     * Build the parameter table for {@code modality}.
     *
     * @param modality the sensing modality; must not be {@code null}
     * @return the complete, ordered table
     */
    public static ParameterTable forModality(Modality modality) {
        Objects.requireNonNull(modality, "Modality must not be null");
        ParameterTable.Builder b = ParameterTable.builder();
        declareShared(b);

        switch (modality) {
            case EMF -> {
                declareSpectrum(b, 60.0, List.of(50.0, 60.0));
                declareFrequencyResponse(b);
                declareAxisMisalignment(b);
                declareDirectional(b);
                declareInterference(b);
                // Field-strength instruments drift slowly and are mildly non-linear.
                b.number(CALIBRATION_GAIN_DRIFT_PER_HOUR, 0.000001, Domain.ANY,
                        "Fractional gain drift per operating hour");
                b.number(CALIBRATION_OFFSET_DRIFT_PER_HOUR, 0.01, Domain.ANY,
                        "Offset drift per operating hour");
                b.number(CALIBRATION_NONLINEARITY_FACTOR, 0.0001, Domain.ANY,
                        "Quadratic non-linearity coefficient");
            }
            case ACOUSTIC -> {
                declareSpectrum(b, 120.0, List.of(20.0, 20_000.0));
                declareFrequencyResponse(b);
                declareDirectional(b);
                declareInterference(b);
            }
            case CHEMICAL -> {
                b.requiredText(TARGET_SPECIES, "Environment field of the measured species");
                b.numberMap(CROSS_SENSITIVITY, Map.of(), Domain.ANY,
                        "Interfering species mapped to the fraction of their concentration picked up");
            }
            case PARTICULATE, THERMAL -> {
                // calibration, drift and noise only
            }
            default -> throw new IllegalStateException("Unhandled modality " + modality);
        }

        for (LabelSpec label : labelSpecs(modality)) {
            label.declare(b);
        }
        return b.build();
    }

    /**
     * @return the ground-truth labels {@code modality} can emit, in evaluation
     *         order
     */
    public static List<LabelSpec> labelSpecs(Modality modality) {
        return LABELS.getOrDefault(Objects.requireNonNull(modality, "modality"), List.of());
    }

    // ---------------------------------------------------------------
    // Parameter groups
    // ---------------------------------------------------------------

    private static void declareShared(ParameterTable.Builder b) {
        b.number(INITIAL_OPERATING_HOURS, 0.0, Domain.NON_NEGATIVE,
                "Operating hours accumulated before the run starts");
        b.number(CALIBRATION_GAIN_ERROR_FACTOR, 1.0, Domain.NON_NEGATIVE,
                "Static multiplicative gain error");
        b.number(CALIBRATION_GAIN_DRIFT_PER_HOUR, 0.0, Domain.ANY,
                "Fractional gain drift per operating hour");
        b.number(CALIBRATION_OFFSET, 0.0, Domain.ANY,
                "Static additive offset");
        b.number(CALIBRATION_OFFSET_DRIFT_PER_HOUR, 0.0, Domain.ANY,
                "Offset drift per operating hour");
        b.number(CALIBRATION_NONLINEARITY_FACTOR, 0.0, Domain.ANY,
                "Quadratic non-linearity coefficient");
        b.number(BASELINE_DRIFT_PER_HOUR, 0.0, Domain.ANY,
                "Additive baseline drift per operating hour");
        b.choice(NOISE_TYPE, "gaussian", NOISE_TYPES,
                "Distribution of the final additive noise");
        b.number(NOISE_MEAN, 0.0, Domain.ANY, "Mean of the final additive noise");
        b.number(NOISE_STDDEV, 0.0, Domain.NON_NEGATIVE, "Standard deviation of the final additive noise");
    }

    private static void declareSpectrum(ParameterTable.Builder b, double baseFrequency, List<Double> range) {
        b.flag(ENABLE_SPECTRUM_OUTPUT, true, "Emit a spectrum with every reading");
        b.numberList(FREQUENCY_RANGE_HZ, range, Domain.POSITIVE, "Sensitive band [min, max] in Hz");
        b.number(BASE_FREQUENCY, baseFrequency, Domain.POSITIVE, "Nominal fundamental frequency in Hz");
        for (int order : List.of(3, 5, 7, 9)) {
            b.number("harmonic_" + order + "_ratio", 0.1, Domain.NON_NEGATIVE,
                    "Ratio of harmonic " + order + " to the fundamental");
        }
        b.flag(FREQUENCY_NOISE, true, "Jitter harmonic strengths");
        b.number(FREQUENCY_NOISE_STDDEV, 0.02, Domain.NON_NEGATIVE,
                "Relative jitter of harmonic strengths, scaled by sqrt(order)");
        b.number(CORONA_HF_NOISE_FACTOR, 0.15, Domain.NON_NEGATIVE,
                "High-frequency noise relative to the fundamental while discharging");
        b.text(DISCHARGE_CONDITION_FIELD, "corona_discharge",
                "Environment field that activates high-frequency noise");
    }

    private static void declareFrequencyResponse(ParameterTable.Builder b) {
        Map<String, Double> curve = new LinkedHashMap<>();
        curve.put("fundamental", 1.0);
        curve.put("3rd", 0.95);
        curve.put("5th", 0.85);
        curve.put("7th", 0.70);
        curve.put("9th", 0.50);
        curve.put("high_frequency_noise", 0.30);
        b.numberMap(FREQUENCY_RESPONSE_CURVE, curve, Domain.NON_NEGATIVE,
                "Multiplier per spectrum component");
        b.number(FREQUENCY_RESPONSE_DEFAULT_MULTIPLIER, 1.0, Domain.NON_NEGATIVE,
                "Multiplier for components missing from the curve");
        b.number(FREQUENCY_RESPONSE_TEMP_COEFF, 0.001, Domain.ANY,
                "Relative change of the curve per 10 degC from the reference");
        b.number(FREQUENCY_RESPONSE_REF_TEMP, 25.0, Domain.ANY, "Reference temperature in degC");
        b.text(AMBIENT_TEMPERATURE_FIELD, "ambient_temperature_c", "Environment field of the ambient temperature");
        b.numberMap(FREQUENCY_RESPONSE_GAIN, Map.of(), Domain.NON_NEGATIVE,
                "Scalar gain per dominant frequency (Hz as key)");
        b.number(FREQUENCY_TOLERANCE_HZ, 1.0, Domain.NON_NEGATIVE,
                "Maximum distance between dominant frequency and a gain table entry");
        b.number(DEFAULT_FREQUENCY_GAIN, 1.0, Domain.NON_NEGATIVE, "Gain when no table entry matches");
    }

    private static void declareAxisMisalignment(ParameterTable.Builder b) {
        b.flag(AXIS_MISALIGNMENT_ENABLED, false, "Attenuate the spectrum by the axis misalignment");
        b.number(AXIS_MISALIGNMENT_DEGREES, 1.0, Domain.ANY, "Axis misalignment angle in degrees");
    }

    private static void declareDirectional(ParameterTable.Builder b) {
        b.vector(ORIENTATION, List.of(0.0, 0.0, 1.0), "Sensor axis");
        b.flag(ORIENTATION_UNCERTAINTY, true, "Perturb the alignment to model mounting uncertainty");
        b.number(ORIENTATION_UNCERTAINTY_STDDEV, 0.05, Domain.NON_NEGATIVE,
                "Standard deviation of the alignment perturbation");
        b.flag(DIRECTIONAL_FOR_SCALAR, false,
                "Apply directional sensitivity when only a scalar field is available");
        b.vector(ASSUMED_FIELD_DIRECTION, List.of(0.0, 0.0, 1.0),
                "Field direction assumed for scalar fields");
        b.flag(SCALE_SPECTRUM_WITH_ALIGNMENT, true, "Scale the spectrum by the alignment factor");
    }

    private static void declareInterference(ParameterTable.Builder b) {
        b.number(EMI_RADIUS_M, 50.0, Domain.NON_NEGATIVE, "Search radius for interference sources in metres");
        b.number(EMI_FREQUENCY_COUPLING_FACTOR, 1000.0, Domain.POSITIVE,
                "Frequency difference in Hz at which coupling halves");
        b.number(EMI_SPECTRUM_IMPACT_FACTOR, 0.1, Domain.NON_NEGATIVE,
                "Share of the interference reported as the EMI noise floor");
        b.number(EMI_FIELD_STRENGTH_IMPACT_FACTOR, 1.0, Domain.NON_NEGATIVE,
                "Share of the interference added to the primary value");
        b.number(EMI_FIELD_STRENGTH_RANDOM_STDDEV, 0.2, Domain.NON_NEGATIVE,
                "Spread of the per-sample constructive/destructive multiplier");
    }
}
