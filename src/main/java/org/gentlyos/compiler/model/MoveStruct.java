package org.gentlyos.compiler.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A Move struct definition.
 *
 * <p>Instances are only created through the factory methods, one per kind of CODIE
 * construct, so a resource can never end up with {@code copy} or {@code drop}.
 * Instances are immutable; {@link #withField(MoveField)} returns a new struct.
 */
public final class MoveStruct {

    private static final List<MoveAbility> RESOURCE_ABILITIES = List.of(MoveAbility.KEY, MoveAbility.STORE);
    private static final List<MoveAbility> FLEXIBLE_ABILITIES =
            List.of(MoveAbility.KEY, MoveAbility.STORE, MoveAbility.DROP);
    private static final List<MoveAbility> EVENT_ABILITIES = List.of(MoveAbility.COPY, MoveAbility.DROP);

    private final String name;
    private final List<MoveAbility> abilities;
    private final List<MoveField> fields;

    private MoveStruct(String name, List<MoveAbility> abilities, List<MoveField> fields) {
        this.name = Objects.requireNonNull(name, "name");
        this.abilities = abilities;
        this.fields = List.copyOf(fields);
    }

    /**
     * Creates a linear resource: {@code key, store}.
     *
     * @param name   The struct name.
     * @param fields The fields, in declaration order.
     * @return The new struct.
     */
    public static MoveStruct resource(String name, List<MoveField> fields) {
        return new MoveStruct(name, RESOURCE_ABILITIES, fields);
    }

    /**
     * Creates a flexible struct that may be destroyed: {@code key, store, drop}.
     *
     * @param name   The struct name.
     * @param fields The fields, in declaration order.
     * @return The new struct.
     */
    public static MoveStruct flexible(String name, List<MoveField> fields) {
        return new MoveStruct(name, FLEXIBLE_ABILITIES, fields);
    }

    /**
     * Creates an event payload type: {@code copy, drop}.
     *
     * @param name   The struct name.
     * @param fields The fields, in declaration order.
     * @return The new struct.
     */
    public static MoveStruct event(String name, List<MoveField> fields) {
        return new MoveStruct(name, EVENT_ABILITIES, fields);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the abilities in rendering order.
     */
    public List<MoveAbility> abilities() {
        return abilities;
    }

    public List<MoveField> fields() {
        return fields;
    }

    public boolean hasAbility(MoveAbility ability) {
        return abilities.contains(ability);
    }

    /**
     * A struct is linear when its values can neither be copied nor dropped.
     */
    public boolean isLinear() {
        return !hasAbility(MoveAbility.COPY) && !hasAbility(MoveAbility.DROP);
    }

    /**
     * Returns whether this struct looks like an event payload ({@code copy} and {@code drop}).
     */
    public boolean isEventLike() {
        return hasAbility(MoveAbility.COPY) && hasAbility(MoveAbility.DROP);
    }

    /**
     * Returns a copy of this struct with one more field appended. Abilities are kept.
     *
     * @param field The field to append.
     * @return The extended struct.
     */
    public MoveStruct withField(MoveField field) {
        List<MoveField> extended = new ArrayList<>(fields);
        extended.add(Objects.requireNonNull(field, "field"));
        return new MoveStruct(name, abilities, extended);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MoveStruct other)) return false;
        return name.equals(other.name) && abilities.equals(other.abilities) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, abilities, fields);
    }

    @Override
    public String toString() {
        return "MoveStruct{name=" + name + ", abilities=" + abilities + ", fields=" + fields + "}";
    }
}
