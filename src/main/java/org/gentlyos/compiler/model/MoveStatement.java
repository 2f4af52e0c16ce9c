package org.gentlyos.compiler.model;

import java.util.List;
import java.util.Objects;

/**
 * A statement inside a Move function body.
 */
public sealed interface MoveStatement {

    /**
     * {@code let name[: type] = value;}
     *
     * @param typeName The declared type, or null to let Move infer it.
     */
    record Let(String name, String typeName, String value) implements MoveStatement {
        public Let {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * {@code let name = &source;} or {@code let name = &mut source;}
     */
    record Borrow(String name, String source, boolean mutable) implements MoveStatement {
        public Borrow {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(source, "source");
        }
    }

    /**
     * Trailing return expression.
     */
    record Return(String expression) implements MoveStatement {
        public Return {
            Objects.requireNonNull(expression, "expression");
        }
    }

    /**
     * {@code event::emit(Type { field: value, ... });}
     */
    record Emit(String eventType, List<EmitField> fields) implements MoveStatement {
        public Emit {
            Objects.requireNonNull(eventType, "eventType");
            fields = List.copyOf(fields);
        }
    }

    /**
     * A field initializer of an emitted event.
     */
    record EmitField(String name, String value) {
        public EmitField {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * {@code assert!(condition, errorCode);}
     */
    record Assert(String condition, long errorCode) implements MoveStatement {
        public Assert {
            Objects.requireNonNull(condition, "condition");
        }
    }

    /**
     * {@code transfer::transfer(object, recipient);}
     */
    record Transfer(String object, String recipient) implements MoveStatement {
        public Transfer {
            Objects.requireNonNull(object, "object");
            Objects.requireNonNull(recipient, "recipient");
        }
    }

    /**
     * Line comment.
     */
    record Comment(String text) implements MoveStatement {
        public Comment {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Verbatim Move code, used for loop and block scaffolding.
     */
    record Raw(String code) implements MoveStatement {
        public Raw {
            Objects.requireNonNull(code, "code");
        }
    }
}
