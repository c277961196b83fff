package com.sensortwin.core.environment;

import com.sensortwin.core.model.InterferenceSource;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.Vector3;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only view of the digital-twin environment state.
 *
 * <p>
 * Sensors query the field at their own position by name (for example
 * {@code ac_field_strength} or {@code corona_discharge}) and ask for nearby
 * interference sources. Implementations must be safe to call from several
 * threads at once and must not have side effects.
 * </p>
 *
 * <p>
 * An implementation may return an empty value for a field it does not know, or
 * throw {@link EnvironmentQueryMiss} when the field or position cannot be
 * resolved at all. Callers inside the engine go through {@link Environments},
 * which treats both the same way.
 * </p>
 *
 * @since 1.0.0
 */
public interface EnvironmentQuery {

    /**
     * Scalar value of {@code fieldName} at {@code position}.
     *
     * @param fieldName field name; must not be {@code null}
     * @param position  query position; must not be {@code null}
     * @return the value, or empty if the field is not defined
     * @throws EnvironmentQueryMiss if the field or position cannot be resolved
     */
    OptionalDouble getFieldValue(String fieldName, Position3D position);

    /**
     * Vector value of {@code fieldName} at {@code position}. Environments
     * without vector fields keep the default.
     *
     * @throws EnvironmentQueryMiss if the field or position cannot be resolved
     */
    default Optional<Vector3> getFieldVector(String fieldName, Position3D position) {
        return Optional.empty();
    }

    /**
     * Interference sources within {@code radius} metres of {@code position}.
     *
     * @return the sources in a stable order; never {@code null}
     * @throws EnvironmentQueryMiss if the position cannot be resolved
     */
    List<InterferenceSource> getNearbySources(Position3D position, double radius);
}
