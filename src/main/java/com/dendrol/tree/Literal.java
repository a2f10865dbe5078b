package com.dendrol.tree;

import org.eclipse.collections.api.list.primitive.ImmutableByteList;
import org.eclipse.collections.impl.factory.primitive.ByteLists;

import java.time.Instant;
import java.util.Objects;

public sealed interface Literal {
    record StringValue(String value) implements Literal {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record BooleanValue(boolean value) implements Literal {}

    record IntegerValue(long value) implements Literal {}

    record FloatValue(double value) implements Literal {}

    /**
     * Always UTC; an {@link Instant} carries no offset of its own.
     */
    record TimestampValue(Instant value) implements Literal {
        public TimestampValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record BinaryValue(ImmutableByteList value) implements Literal {
        public BinaryValue {
            Objects.requireNonNull(value, "value");
        }

        public static BinaryValue of(byte... bytes) {
            return new BinaryValue(ByteLists.immutable.of(bytes));
        }

        public byte[] toByteArray() {
            return value.toArray();
        }
    }

    static Literal of(String value) {
        return new StringValue(value);
    }

    static Literal of(boolean value) {
        return new BooleanValue(value);
    }

    static Literal of(long value) {
        return new IntegerValue(value);
    }

    static Literal of(double value) {
        return new FloatValue(value);
    }

    static Literal of(Instant value) {
        return new TimestampValue(value);
    }
}
