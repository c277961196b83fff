package com.sensortwin.core.pipeline;

import com.sensortwin.core.config.ParameterTables;
import com.sensortwin.core.config.SensorConfig;
import com.sensortwin.core.environment.Environments;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Adds {@code factor * concentration} for every configured interfering
 * species present in the environment.
 *
 * @since 1.0.0
 */
public final class CrossSensitivityStage implements ImperfectionStage {

    private final Map<String, Double> factors;

    public CrossSensitivityStage(Map<String, Double> factors) {
        this.factors = new LinkedHashMap<>(Objects.requireNonNull(factors, "factors"));
    }

    public static CrossSensitivityStage fromConfig(SensorConfig config) {
        return new CrossSensitivityStage(config.getNumberMap(ParameterTables.CROSS_SENSITIVITY));
    }

    @Override
    public StageKind kind() {
        return StageKind.CROSS_SENSITIVITY;
    }

    @Override
    public ReadingState apply(ReadingState state, StageContext context) {
        double added = 0.0;
        for (Map.Entry<String, Double> entry : factors.entrySet()) {
            OptionalDouble concentration = Environments.fieldValue(context.getEnvironment(), entry.getKey(),
                    context.getPosition());
            if (concentration.isPresent()) {
                added += entry.getValue() * concentration.getAsDouble();
            }
        }
        return added == 0.0 ? state : state.withPrimary(state.getPrimary() + added);
    }
}
