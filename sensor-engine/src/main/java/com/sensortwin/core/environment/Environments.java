package com.sensortwin.core.environment;

import com.sensortwin.core.model.InterferenceSource;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Lookups against an {@link EnvironmentQuery} that never fail.
 *
 * <p>
 * An {@link EnvironmentQueryMiss}, a {@code null} result and a non-finite
 * value are all reported as "absent". Misses are logged at debug level only
 * because they are expected for fields a scenario does not model.
 * </p>
 *
 * @since 1.0.0
 */
public final class Environments {

    private static final Logger LOG = LoggerFactory.getLogger(Environments.class);

    private Environments() {
        // static helpers only
    }

    public static OptionalDouble fieldValue(EnvironmentQuery env, String fieldName, Position3D position) {
        try {
            OptionalDouble value = env.getFieldValue(fieldName, position);
            if (value == null || value.isEmpty()) {
                return OptionalDouble.empty();
            }
            if (!Double.isFinite(value.getAsDouble())) {
                LOG.warn("Ignoring non-finite value {} for field '{}' at {}",
                        value.getAsDouble(), fieldName, position);
                return OptionalDouble.empty();
            }
            return value;
        } catch (EnvironmentQueryMiss e) {
            LOG.debug("Field '{}' unavailable at {}: {}", fieldName, position, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    public static Optional<Vector3> fieldVector(EnvironmentQuery env, String fieldName, Position3D position) {
        try {
            Optional<Vector3> value = env.getFieldVector(fieldName, position);
            return value != null ? value : Optional.empty();
        } catch (EnvironmentQueryMiss e) {
            LOG.debug("Vector field '{}' unavailable at {}: {}", fieldName, position, e.getMessage());
            return Optional.empty();
        }
    }

    public static List<InterferenceSource> nearbySources(EnvironmentQuery env, Position3D position, double radius) {
        try {
            List<InterferenceSource> sources = env.getNearbySources(position, radius);
            return sources != null ? sources : List.of();
        } catch (EnvironmentQueryMiss e) {
            LOG.debug("Interference sources unavailable at {}: {}", position, e.getMessage());
            return List.of();
        }
    }
}
