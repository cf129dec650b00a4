package org.foxesworld.glowframe.engine.peripheral.virtual;

import com.jme3.math.Matrix3f;
import com.jme3.math.Vector3f;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Linear correction for three-axis sensor samples: {@code scale * (matrix * (v - offset))}.
 *
 * <p>Samples are maps with numeric {@code x}, {@code y} and {@code z}. Without a matrix only
 * offset and scale apply. With a precision, results are rounded half-up to that many decimals.</p>
 *
 * @param matrix    may be null
 * @param precision decimal places, or null for no rounding
 */
public record CalibrationProfile(Vector3f offset, Vector3f scale, Matrix3f matrix, Integer precision) {

    public static final List<String> AXES = List.of("x", "y", "z");

    public CalibrationProfile {
        offset = (offset == null) ? new Vector3f(Vector3f.ZERO) : offset.clone();
        scale = (scale == null) ? new Vector3f(Vector3f.UNIT_XYZ) : scale.clone();
        matrix = (matrix == null) ? null : matrix.clone();
        if (precision != null && precision < 0) throw new IllegalArgumentException("precision must be >= 0");
    }

    public static CalibrationProfile identity() {
        return new CalibrationProfile(null, null, null, null);
    }

    /** Profile that removes the bias between a raw reading and its expected value. */
    public static CalibrationProfile fromReference(Map<String, ?> raw, Map<String, ?> expected, Integer precision) {
        Vector3f r = vector(raw, "reference sample");
        Vector3f e = vector(expected, "expected sample");
        return new CalibrationProfile(r.subtract(e), null, null, precision);
    }

    /**
     * @throws NoSuchElementException when an axis is missing
     * @throws IllegalArgumentException when an axis is not numeric
     */
    public Map<String, Double> apply(Map<String, ?> sample) {
        Vector3f v = vector(sample, "payload").subtractLocal(offset);
        if (matrix != null) v = matrix.mult(v);
        v.multLocal(scale);

        Map<String, Double> out = new LinkedHashMap<>();
        out.put("x", round(v.x));
        out.put("y", round(v.y));
        out.put("z", round(v.z));
        return out;
    }

    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("axes", AXES);
        out.put("offset", List.of((double) offset.x, (double) offset.y, (double) offset.z));
        out.put("scale", List.of((double) scale.x, (double) scale.y, (double) scale.z));
        if (matrix != null) {
            out.put("matrix", List.of(row(0), row(1), row(2)));
        }
        if (precision != null) out.put("precision", precision);
        return Collections.unmodifiableMap(out);
    }

    private List<Double> row(int r) {
        return List.of((double) matrix.get(r, 0), (double) matrix.get(r, 1), (double) matrix.get(r, 2));
    }

    private double round(float value) {
        double d = value;
        if (precision == null) return d;
        return new BigDecimal(Float.toString(value)).setScale(precision, RoundingMode.HALF_UP).doubleValue();
    }

    private static Vector3f vector(Map<String, ?> sample, String what) {
        Objects.requireNonNull(sample, what);
        float[] xyz = new float[3];
        for (int i = 0; i < 3; i++) {
            String axis = AXES.get(i);
            if (!sample.containsKey(axis)) {
                throw new NoSuchElementException("Missing axis '" + axis + "' in " + what);
            }
            Object v = sample.get(axis);
            if (!(v instanceof Number n)) {
                throw new IllegalArgumentException("Axis '" + axis + "' in " + what + " is not numeric: " + v);
            }
            xyz[i] = n.floatValue();
        }
        return new Vector3f(xyz[0], xyz[1], xyz[2]);
    }
}
