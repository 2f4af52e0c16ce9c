package org.gentlyos.compiler.backend.render;

import org.gentlyos.compiler.config.ConfigLoader;
import org.gentlyos.compiler.config.TranspilerOptions;
import org.gentlyos.compiler.model.MoveField;
import org.gentlyos.compiler.model.MoveFunction;
import org.gentlyos.compiler.model.MoveParam;
import org.gentlyos.compiler.model.MoveStatement;
import org.gentlyos.compiler.model.MoveStruct;
import org.gentlyos.compiler.model.MoveVisibility;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MoveRendererTest {

    private final MoveRenderer renderer = new MoveRenderer(TranspilerOptions.defaults());

    @Test
    @Tag("unit")
    void rendersEmptyModule() {
        assertThat(renderer.render("demo", List.of(), List.of(), List.of())).isEqualTo("""
                module demo::demo  {
                    use sui::object::{Self, UID};
                    use sui::tx_context::TxContext;
                    use sui::transfer;

                }
                """);
    }

    @Test
    @Tag("unit")
    void rendersStructsFunctionsAndDependencies() {
        MoveStruct token = MoveStruct.resource("AuthToken",
                List.of(new MoveField("id", "UID"), new MoveField("value", "u64")));
        MoveFunction mint = new MoveFunction("mint", MoveVisibility.PUBLIC_ENTRY,
                List.of(MoveParam.mutableRef("ctx", "TxContext"), MoveParam.byValue("amount", "u64")),
                null,
                List.of(new MoveStatement.Assert("amount > 0", 1),
                        new MoveStatement.Let("memo", "vector<u8>", "b\"hi\"")));
        MoveFunction output = new MoveFunction("output", MoveVisibility.PUBLIC_PACKAGE, List.of(), "bool",
                List.of(new MoveStatement.Return("true")));

        String source = renderer.render("login", List.of(token), List.of(mint, output), List.of("api"));

        assertThat(source).isEqualTo("""
                module login::login  {
                    use sui::object::{Self, UID};
                    use sui::tx_context::TxContext;
                    use sui::transfer;
                    use api;

                    struct AuthToken has key, store {
                        id: UID,
                        value: u64,
                    }

                    public entry fun mint(ctx: &mut TxContext, amount: u64) {
                        assert!(amount > 0, 1);
                        let memo: vector<u8> = b"hi";
                    }

                    public fun output(): bool {
                        true
                    }

                }
                """);
    }

    @Test
    @Tag("unit")
    void eventImportOnlyWhenModuleDefinesEvents() {
        MoveStruct event = MoveStruct.event("Event_ab", List.of(new MoveField("hash", "vector<u8>")));
        MoveStruct flexible = MoveStruct.flexible("Cache", List.of(new MoveField("id", "UID")));

        assertThat(renderer.render("m", List.of(flexible), List.of(), List.of())).doesNotContain("use sui::event;");
        assertThat(renderer.render("m", List.of(flexible, event), List.of(), List.of()))
                .contains("    use sui::transfer;\n    use sui::event;\n")
                .contains("    struct Event_ab has copy, drop {\n");
    }

    @Test
    @Tag("unit")
    void rendersEveryStatementKind() {
        MoveFunction function = new MoveFunction("all", MoveVisibility.INTERNAL,
                List.of(new MoveParam("cfg", "Config", true, false)), null, List.of(
                new MoveStatement.Let("n", null, "1"),
                new MoveStatement.Borrow("users", "@database/users", true),
                new MoveStatement.Borrow("prices", "@api/prices", false),
                new MoveStatement.Emit("Event_ab", List.of(new MoveStatement.EmitField("hash", "b\"ab\""))),
                new MoveStatement.Emit("Ping", List.of()),
                new MoveStatement.Transfer("token", "recipient"),
                new MoveStatement.Comment("note"),
                new MoveStatement.Raw("break")));

        String source = renderer.render("m", List.of(), List.of(function), List.of());

        assertThat(source).contains("""
                    fun all(cfg: &Config) {
                        let n = 1;
                        let users = &mut @database/users;
                        let prices = &@api/prices;
                        event::emit(Event_ab {
                            hash: b"ab",
                        });
                        event::emit(Ping {});
                        transfer::transfer(token, recipient);
                        // note
                        break
                    }
                """);
    }

    @Test
    @Tag("unit")
    void renderingIsDeterministic() {
        List<MoveStruct> structs = List.of(MoveStruct.resource("A", List.of(new MoveField("id", "UID"))));
        List<MoveFunction> functions = List.of(new MoveFunction("f", MoveVisibility.INTERNAL, List.of(), null,
                List.of(new MoveStatement.Raw("x"))));

        assertThat(renderer.render("m", structs, functions, List.of("dep")))
                .isEqualTo(renderer.render("m", structs, functions, List.of("dep")));
    }

    @Test
    @Tag("unit")
    void importsComeFromOptions() {
        TranspilerOptions options = TranspilerOptions.fromConfig(ConfigLoader.parse(
                "codie-move.base-imports = [\"std::vector\"]"));

        assertThat(new MoveRenderer(options).render("m", List.of(), List.of(), List.of()))
                .isEqualTo("module m::m  {\n    use std::vector;\n\n}\n");
    }
}
