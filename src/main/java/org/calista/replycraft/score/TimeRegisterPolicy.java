package org.calista.replycraft.score;

import org.calista.replycraft.catalog.Register;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hour-of-day fit per register.
 *
 * <p>
 * Buckets: night 0-5, morning 6-8, work 9-17, evening 18-23. Total over all 24 hours.
 * </p>
 */
public final class TimeRegisterPolicy {

    public enum Bucket {
        NIGHT, MORNING, WORK, EVENING;

        public static Bucket of(int hour) {
            if (hour < 0 || hour > 23) throw new IllegalArgumentException("hour must be in [0,23]: " + hour);
            if (hour <= 5) return NIGHT;
            if (hour <= 8) return MORNING;
            if (hour <= 17) return WORK;
            return EVENING;
        }
    }

    private final EnumMap<Register, EnumMap<Bucket, Double>> table;

    public TimeRegisterPolicy(Map<Register, Map<Bucket, Double>> table) {
        Objects.requireNonNull(table, "table");
        EnumMap<Register, EnumMap<Bucket, Double>> t = new EnumMap<>(Register.class);
        for (Register r : Register.values()) {
            Map<Bucket, Double> row = table.get(r);
            if (row == null) throw new IllegalArgumentException("Missing time row for register " + r);
            EnumMap<Bucket, Double> copy = new EnumMap<>(Bucket.class);
            for (Bucket b : Bucket.values()) {
                Double v = row.get(b);
                if (v == null || !(v >= 0.0 && v <= 1.0)) {
                    throw new IllegalArgumentException("Time score for " + r + "/" + b + " must be in [0,1]: " + v);
                }
                copy.put(b, v);
            }
            t.put(r, copy);
        }
        this.table = t;
    }

    public static TimeRegisterPolicy defaults() {
        EnumMap<Register, Map<Bucket, Double>> t = new EnumMap<>(Register.class);
        t.put(Register.PROFESSIONAL, row(0.3, 0.6, 0.9, 0.4));
        t.put(Register.CASUAL, row(0.8, 0.6, 0.4, 0.9));
        t.put(Register.NEUTRAL, row(0.5, 0.5, 0.5, 0.5));
        return new TimeRegisterPolicy(t);
    }

    public double score(Register register, int hour) {
        Register r = register == null ? Register.NEUTRAL : register;
        return table.get(r).get(Bucket.of(hour));
    }

    private static Map<Bucket, Double> row(double night, double morning, double work, double evening) {
        EnumMap<Bucket, Double> m = new EnumMap<>(Bucket.class);
        m.put(Bucket.NIGHT, night);
        m.put(Bucket.MORNING, morning);
        m.put(Bucket.WORK, work);
        m.put(Bucket.EVENING, evening);
        return m;
    }
}
