package org.gentlyos.compiler.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MoveStructTest {

    private static final List<MoveField> ID_ONLY = List.of(new MoveField("id", MoveTypes.UID));

    @Test
    @Tag("unit")
    void resourceIsLinear() {
        MoveStruct token = MoveStruct.resource("AuthToken", List.of(
                new MoveField("id", MoveTypes.UID),
                new MoveField("owner", MoveTypes.ADDRESS)));

        assertThat(token.abilities()).containsExactly(MoveAbility.KEY, MoveAbility.STORE);
        assertThat(token.hasAbility(MoveAbility.COPY)).isFalse();
        assertThat(token.hasAbility(MoveAbility.DROP)).isFalse();
        assertThat(token.isLinear()).isTrue();
        assertThat(token.isEventLike()).isFalse();
    }

    @Test
    @Tag("unit")
    void flexibleCanBeDroppedButNotCopied() {
        MoveStruct data = MoveStruct.flexible("TempData", ID_ONLY);

        assertThat(data.abilities()).containsExactly(MoveAbility.KEY, MoveAbility.STORE, MoveAbility.DROP);
        assertThat(data.hasAbility(MoveAbility.COPY)).isFalse();
        assertThat(data.isLinear()).isFalse();
        assertThat(data.isEventLike()).isFalse();
    }

    @Test
    @Tag("unit")
    void eventIsCopyAndDrop() {
        MoveStruct event = MoveStruct.event("Event_abc", List.of(new MoveField("hash", MoveTypes.BYTES)));

        assertThat(event.abilities()).containsExactly(MoveAbility.COPY, MoveAbility.DROP);
        assertThat(event.isEventLike()).isTrue();
    }

    @Test
    @Tag("unit")
    void withFieldKeepsAbilitiesAndLeavesOriginalUntouched() {
        MoveStruct resource = MoveStruct.resource("Vault", ID_ONLY);
        MoveStruct extended = resource.withField(new MoveField("balance", MoveTypes.U64));

        assertThat(extended.fields()).extracting(MoveField::name).containsExactly("id", "balance");
        assertThat(extended.abilities()).isEqualTo(resource.abilities());
        assertThat(resource.fields()).hasSize(1);
        assertThat(extended).isNotEqualTo(resource);
        assertThat(resource.withField(new MoveField("balance", MoveTypes.U64))).isEqualTo(extended);
    }

    @Test
    @Tag("unit")
    void abilityKeywords() {
        assertThat(MoveAbility.KEY).hasToString("key");
        assertThat(MoveAbility.STORE).hasToString("store");
        assertThat(MoveAbility.COPY).hasToString("copy");
        assertThat(MoveAbility.DROP).hasToString("drop");
    }

    @Test
    @Tag("unit")
    void leadingStatementsArePrepended() {
        MoveFunction function = new MoveFunction("mint", MoveVisibility.PUBLIC_ENTRY, List.of(), null,
                List.of(new MoveStatement.Comment("body")));

        MoveFunction guarded = function.withLeadingStatements(List.of(new MoveStatement.Assert("amount > 0", 1)));

        assertThat(guarded.body()).containsExactly(
                new MoveStatement.Assert("amount > 0", 1),
                new MoveStatement.Comment("body"));
        assertThat(function.withLeadingStatements(List.of())).isSameAs(function);
        assertThat(function.optionalReturnType()).isEmpty();
    }
}
