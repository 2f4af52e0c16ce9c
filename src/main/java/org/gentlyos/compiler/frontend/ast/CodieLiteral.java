package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * A literal value. CODIE numbers are floating point.
 */
public sealed interface CodieLiteral {

    record StringValue(String value) implements CodieLiteral {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record NumberValue(double value) implements CodieLiteral {
    }

    record BoolValue(boolean value) implements CodieLiteral {
    }

    record NullValue() implements CodieLiteral {
    }
}
