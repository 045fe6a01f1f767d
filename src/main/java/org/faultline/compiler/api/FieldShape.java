package org.faultline.compiler.api;

import java.util.List;

/**
 * The field layout of a variant. A closed set: named fields, positional fields or none.
 */
public sealed interface FieldShape permits FieldShape.Named, FieldShape.Positional, FieldShape.Unit {

    /**
     * @return The number of fields of this shape.
     */
    int fieldCount();

    /**
     * Fields addressed by name, in declaration order.
     * @param names The field names.
     */
    record Named(List<String> names) implements FieldShape {
        public Named {
            names = List.copyOf(names);
        }

        @Override
        public int fieldCount() {
            return names.size();
        }
    }

    /**
     * Fields addressed by position.
     * @param count The number of fields.
     */
    record Positional(int count) implements FieldShape {
        @Override
        public int fieldCount() {
            return count;
        }
    }

    /**
     * A variant without fields.
     */
    record Unit() implements FieldShape {
        /** The single instance. */
        public static final Unit INSTANCE = new Unit();

        @Override
        public int fieldCount() {
            return 0;
        }
    }
}
