package com.dendrol.tree;

import com.dendrol.exceptions.StructuralException;

import java.time.Instant;
import java.util.Objects;

/**
 * Postfix temporal or multiplicity constraint on an observation-level node.
 */
public sealed interface Qualifier {
    record StartStop(Instant start, Instant stop) implements Qualifier {
        public StartStop {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(stop, "stop");
        }
    }

    record Within(long value, String unit) implements Qualifier {
        public static final String SECONDS = "SECONDS";

        public Within {
            Objects.requireNonNull(unit, "unit");
            if (value < 0) {
                throw new StructuralException("WITHIN value must not be negative: " + value);
            }
            if (!SECONDS.equals(unit)) {
                throw new StructuralException("Unsupported WITHIN unit: " + unit);
            }
        }

        public static Within seconds(long value) {
            return new Within(value, SECONDS);
        }
    }

    record Repeats(long value) implements Qualifier {
        public Repeats {
            if (value < 1) {
                throw new StructuralException("REPEATS value must be positive: " + value);
            }
        }
    }
}
