package com.sensortwin.core.environment;

import com.sensortwin.core.model.InterferenceSource;
import com.sensortwin.core.model.Position3D;
import com.sensortwin.core.model.Vector3;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StaticEnvironment} and the {@link Environments}
 * lookups.
 */
class StaticEnvironmentTest {

    private final StaticEnvironment env = StaticEnvironment.builder()
            .field("corona_discharge", 0.4)
            .vector("ac_field_vector", new Vector3(3, 0, 4))
            .source(new InterferenceSource(new Position3D(3, 0, 0), 120.0, 2.0))
            .source(new InterferenceSource(new Position3D(30, 0, 0), 120.0, 2.0))
            .bounds(new Position3D(-10, -10, -10), new Position3D(10, 10, 10))
            .build();

    @Test
    @DisplayName("Fields should be uniform inside the bounds")
    void fieldsShouldBeUniform() {
        assertThat(env.getFieldValue("corona_discharge", Position3D.ORIGIN)).hasValue(0.4);
        assertThat(env.getFieldValue("corona_discharge", new Position3D(9, -9, 9))).hasValue(0.4);
    }

    @Test
    @DisplayName("Unknown fields should be empty, vector fields should answer with their norm")
    void unknownFieldsShouldBeEmpty() {
        assertThat(env.getFieldValue("arcing_intensity", Position3D.ORIGIN)).isEmpty();
        assertThat(env.getFieldValue("ac_field_vector", Position3D.ORIGIN)).hasValue(5.0);
        assertThat(env.getFieldVector("ac_field_vector", Position3D.ORIGIN)).contains(new Vector3(3, 0, 4));
    }

    @Test
    @DisplayName("Queries outside the bounds should miss")
    void outOfBoundsShouldMiss() {
        assertThatThrownBy(() -> env.getFieldValue("corona_discharge", new Position3D(11, 0, 0)))
                .isInstanceOf(EnvironmentQueryMiss.class)
                .hasMessageContaining("outside");
    }

    @Test
    @DisplayName("Only sources within the radius should be returned")
    void shouldFilterSourcesByRadius() {
        List<InterferenceSource> nearby = env.getNearbySources(Position3D.ORIGIN, 5.0);

        assertThat(nearby).hasSize(1);
        assertThat(nearby.get(0).getPosition()).isEqualTo(new Position3D(3, 0, 0));
    }

    @Test
    @DisplayName("Safe lookups should turn misses and non-finite values into absent")
    void safeLookupsShouldNeverThrow() {
        Position3D outside = new Position3D(50, 0, 0);
        StaticEnvironment withNaN = StaticEnvironment.builder().field("broken", Double.NaN).build();

        assertThat(Environments.fieldValue(env, "corona_discharge", outside)).isEmpty();
        assertThat(Environments.fieldVector(env, "ac_field_vector", outside)).isEmpty();
        assertThat(Environments.nearbySources(env, outside, 100.0)).isEmpty();
        assertThat(Environments.fieldValue(withNaN, "broken", Position3D.ORIGIN)).isEmpty();
    }

    @Test
    @DisplayName("Safe lookups should tolerate implementations returning null")
    void safeLookupsShouldTolerateNull() {
        EnvironmentQuery sloppy = new EnvironmentQuery() {
            @Override
            public OptionalDouble getFieldValue(String fieldName, Position3D position) {
                return null;
            }

            @Override
            public List<InterferenceSource> getNearbySources(Position3D position, double radius) {
                return null;
            }
        };

        assertThat(Environments.fieldValue(sloppy, "x", Position3D.ORIGIN)).isEmpty();
        assertThat(Environments.nearbySources(sloppy, Position3D.ORIGIN, 1.0)).isEmpty();
        assertThat(Environments.fieldVector(sloppy, "x", Position3D.ORIGIN)).isEmpty();
    }

    @Test
    @DisplayName("Bounds must be ordered")
    void boundsMustBeOrdered() {
        assertThatThrownBy(() -> StaticEnvironment.builder()
                .bounds(new Position3D(1, 0, 0), new Position3D(0, 0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
