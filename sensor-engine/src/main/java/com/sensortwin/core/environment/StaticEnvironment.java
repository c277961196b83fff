package com.sensortwin.core.environment;

import com.sensortwin.core.model.InterferenceSource;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.Vector3;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * An immutable environment with spatially uniform fields and a fixed list of
 * point interference sources.
 *
 * <p>
 * Optional axis-aligned bounds limit the region that can be queried; a query
 * outside them throws {@link EnvironmentQueryMiss}. Unknown fields resolve to
 * empty.
 * </p>
 *
 * @since 1.0.0
 */
public final class StaticEnvironment implements EnvironmentQuery {

    private final Map<String, Double> fields;
    private final Map<String, Vector3> vectors;
    private final List<InterferenceSource> sources;
    private final Position3D boundsMin;
    private final Position3D boundsMax;

    private StaticEnvironment(Builder b) {
        this.fields = Map.copyOf(b.fields);
        this.vectors = Map.copyOf(b.vectors);
        this.sources = List.copyOf(b.sources);
        this.boundsMin = b.boundsMin;
        this.boundsMax = b.boundsMax;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** An environment with no fields and no sources. */
    public static StaticEnvironment empty() {
        return new Builder().build();
    }

    @Override
    public OptionalDouble getFieldValue(String fieldName, Position3D position) {
        Objects.requireNonNull(fieldName, "Field name must not be null");
        checkBounds(position);
        Double value = fields.get(fieldName);
        if (value != null) {
            return OptionalDouble.of(value);
        }
        Vector3 vector = vectors.get(fieldName);
        return vector != null ? OptionalDouble.of(vector.norm()) : OptionalDouble.empty();
    }

    @Override
    public Optional<Vector3> getFieldVector(String fieldName, Position3D position) {
        Objects.requireNonNull(fieldName, "Field name must not be null");
        checkBounds(position);
        return Optional.ofNullable(vectors.get(fieldName));
    }

    @Override
    public List<InterferenceSource> getNearbySources(Position3D position, double radius) {
        checkBounds(position);
        List<InterferenceSource> nearby = new ArrayList<>();
        for (InterferenceSource source : sources) {
            if (source.getPosition().distanceTo(position) <= radius) {
                nearby.add(source);
            }
        }
        return nearby;
    }

    private void checkBounds(Position3D position) {
        Objects.requireNonNull(position, "Position must not be null");
        if (boundsMin == null) {
            return;
        }
        if (position.getX() < boundsMin.getX() || position.getX() > boundsMax.getX()
                || position.getY() < boundsMin.getY() || position.getY() > boundsMax.getY()
                || position.getZ() < boundsMin.getZ() || position.getZ() > boundsMax.getZ()) {
            throw new EnvironmentQueryMiss("Position " + position + " is outside the environment bounds "
                    + boundsMin + " .. " + boundsMax);
        }
    }

    @Override
    public String toString() {
        return "StaticEnvironment{fields=" + fields.keySet()
                + ", vectors=" + vectors.keySet()
                + ", sources=" + sources.size() + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private final Map<String, Double> fields = new LinkedHashMap<>();
        private final Map<String, Vector3> vectors = new LinkedHashMap<>();
        private final List<InterferenceSource> sources = new ArrayList<>();
        private Position3D boundsMin;
        private Position3D boundsMax;

        private Builder() {
        }

        public Builder field(String name, double value) {
            fields.put(Objects.requireNonNull(name, "Field name must not be null"), value);
            return this;
        }

        /**
         * Register a vector field. Its norm also answers scalar queries for the
         * same name unless a scalar field of that name exists.
         */
        public Builder vector(String name, Vector3 value) {
            vectors.put(Objects.requireNonNull(name, "Field name must not be null"),
                    Objects.requireNonNull(value, "Vector must not be null"));
            return this;
        }

        public Builder source(InterferenceSource source) {
            sources.add(Objects.requireNonNull(source, "Source must not be null"));
            return this;
        }

        public Builder bounds(Position3D min, Position3D max) {
            Objects.requireNonNull(min, "Lower bound must not be null");
            Objects.requireNonNull(max, "Upper bound must not be null");
            if (min.getX() > max.getX() || min.getY() > max.getY() || min.getZ() > max.getZ()) {
                throw new IllegalArgumentException("Lower bound " + min + " exceeds upper bound " + max);
            }
            this.boundsMin = min;
            this.boundsMax = max;
            return this;
        }

        public StaticEnvironment build() {
            return new StaticEnvironment(this);
        }
    }
}
