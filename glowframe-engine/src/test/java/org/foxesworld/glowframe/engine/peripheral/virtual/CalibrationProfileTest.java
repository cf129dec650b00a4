package org.foxesworld.glowframe.engine.peripheral.virtual;

import com.jme3.math.Matrix3f;
import com.jme3.math.Vector3f;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class CalibrationProfileTest {

    @Test
    void identityLeavesSampleUnchanged() {
        Map<String, Double> out = CalibrationProfile.identity().apply(Map.of("x", 1.5, "y", -2, "z", 0));

        assertEquals(Map.of("x", 1.5, "y", -2.0, "z", 0.0), out);
    }

    @Test
    void offsetThenScale() {
        CalibrationProfile p = new CalibrationProfile(new Vector3f(1, 2, 3), new Vector3f(2, 2, 2), null, null);

        assertEquals(Map.of("x", 4.0, "y", 0.0, "z", 1.0), p.apply(Map.of("x", 3, "y", 2, "z", 3.5)));
    }

    @Test
    void matrixAppliedBetweenOffsetAndScale() {
        // swap x and y
        Matrix3f swap = new Matrix3f(0, 1, 0, 1, 0, 0, 0, 0, 1);
        CalibrationProfile p = new CalibrationProfile(new Vector3f(1, 0, 0), new Vector3f(1, 3, 1), swap, null);

        assertEquals(Map.of("x", 5.0, "y", 6.0, "z", 7.0), p.apply(Map.of("x", 3, "y", 5, "z", 7)));
    }

    @Test
    void precisionRoundsHalfUp() {
        CalibrationProfile p = new CalibrationProfile(null, null, null, 1);

        Map<String, Double> out = p.apply(Map.of("x", 0.25, "y", 1.04, "z", -0.25));

        assertEquals(0.3, out.get("x"));
        assertEquals(1.0, out.get("y"));
        assertEquals(-0.3, out.get("z"));
    }

    @Test
    void referenceRemovesBias() {
        CalibrationProfile p = CalibrationProfile.fromReference(
                Map.of("x", 0.5, "y", 0.25, "z", 10.5), Map.of("x", 0, "y", 0, "z", 9.5), 2);

        assertEquals(Map.of("x", 0.0, "y", 0.0, "z", 10.5), p.apply(Map.of("x", 0.5, "y", 0.25, "z", 11.5)));
    }

    @Test
    void missingOrBadAxisIsRejected() {
        CalibrationProfile p = CalibrationProfile.identity();

        assertThrows(NoSuchElementException.class, () -> p.apply(Map.of("x", 1, "y", 2)));
        assertThrows(IllegalArgumentException.class, () -> p.apply(Map.of("x", 1, "y", "two", "z", 3)));
    }

    @Test
    void profileKeepsItsOwnVectors() {
        Vector3f offset = new Vector3f(1, 1, 1);
        CalibrationProfile p = new CalibrationProfile(offset, null, null, null);
        offset.set(5, 5, 5);

        assertEquals(new Vector3f(1, 1, 1), p.offset());
    }

    @Test
    void describeListsParameters() {
        CalibrationProfile p = new CalibrationProfile(new Vector3f(1, 0, 0), null, Matrix3f.IDENTITY, 2);

        Map<String, Object> d = p.describe();

        assertEquals(CalibrationProfile.AXES, d.get("axes"));
        assertEquals(List.of(1.0, 0.0, 0.0), d.get("offset"));
        assertEquals(List.of(1.0, 1.0, 1.0), d.get("scale"));
        assertEquals(List.of(List.of(1.0, 0.0, 0.0), List.of(0.0, 1.0, 0.0), List.of(0.0, 0.0, 1.0)), d.get("matrix"));
        assertEquals(2, d.get("precision"));
    }
}
