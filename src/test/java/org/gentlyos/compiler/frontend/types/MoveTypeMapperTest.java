package org.gentlyos.compiler.frontend.types;

import org.gentlyos.compiler.frontend.ast.BreakNode;
import org.gentlyos.compiler.frontend.ast.CallNode;
import org.gentlyos.compiler.frontend.ast.CodieType;
import org.gentlyos.compiler.frontend.ast.IdentifierNode;
import org.gentlyos.compiler.frontend.ast.ListNode;
import org.gentlyos.compiler.frontend.ast.LiteralNode;
import org.gentlyos.compiler.frontend.ast.ObjectNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MoveTypeMapperTest {

    @Test
    @Tag("unit")
    void mapsPrimitiveTypes() {
        assertThat(MoveTypeMapper.mapDeclaredType(CodieType.Primitive.TEXT)).isEqualTo("vector<u8>");
        assertThat(MoveTypeMapper.mapDeclaredType(CodieType.Primitive.NUMBER)).isEqualTo("u64");
        assertThat(MoveTypeMapper.mapDeclaredType(CodieType.Primitive.BOOL)).isEqualTo("bool");
        assertThat(MoveTypeMapper.mapDeclaredType(CodieType.Primitive.UUID)).isEqualTo("vector<u8>");
        assertThat(MoveTypeMapper.mapDeclaredType(CodieType.Primitive.HASH)).isEqualTo("vector<u8>");
        assertThat(MoveTypeMapper.mapDeclaredType(CodieType.Primitive.ANY)).isEqualTo("vector<u8>");
    }

    @Test
    @Tag("unit")
    void mapsContainersRecursively() {
        CodieType nested = new CodieType.ListOf(new CodieType.ListOf(CodieType.Primitive.BOOL));
        assertThat(MoveTypeMapper.mapDeclaredType(nested)).isEqualTo("vector<vector<bool>>");
        CodieType map = new CodieType.MapOf(CodieType.Primitive.TEXT, CodieType.Primitive.NUMBER);
        assertThat(MoveTypeMapper.mapDeclaredType(map)).isEqualTo("vector<u8>");
    }

    @Test
    @Tag("unit")
    void mapsCustomNamesCaseInsensitively() {
        assertThat(MoveTypeMapper.mapDeclaredType(new CodieType.Custom("address"))).isEqualTo("address");
        assertThat(MoveTypeMapper.mapDeclaredType(new CodieType.Custom("Who"))).isEqualTo("address");
        assertThat(MoveTypeMapper.mapDeclaredType(new CodieType.Custom("UID"))).isEqualTo("ID");
        assertThat(MoveTypeMapper.mapDeclaredType(new CodieType.Custom("money"))).isEqualTo("Coin<SUI>");
        assertThat(MoveTypeMapper.mapDeclaredType(new CodieType.Custom("Raw"))).isEqualTo("vector<u8>");
        assertThat(MoveTypeMapper.mapDeclaredType(new CodieType.Custom("Ticket"))).isEqualTo("Ticket");
    }

    @Test
    @Tag("unit")
    void infersFromLiteralKind() {
        assertThat(MoveTypeMapper.inferType(LiteralNode.ofNumber(3))).isEqualTo("u64");
        assertThat(MoveTypeMapper.inferType(LiteralNode.ofBool(true))).isEqualTo("bool");
        assertThat(MoveTypeMapper.inferType(LiteralNode.ofString("x"))).isEqualTo("vector<u8>");
        assertThat(MoveTypeMapper.inferType(LiteralNode.ofNull())).isEqualTo("vector<u8>");
    }

    @Test
    @Tag("unit")
    void infersBytesForCompositesAndU64ForOtherExpressions() {
        assertThat(MoveTypeMapper.inferType(new ObjectNode(List.of()))).isEqualTo("vector<u8>");
        assertThat(MoveTypeMapper.inferType(new ListNode(List.of()))).isEqualTo("vector<u8>");
        assertThat(MoveTypeMapper.inferType(new CallNode("f", List.of()))).isEqualTo("u64");
        assertThat(MoveTypeMapper.inferType(new BreakNode())).isEqualTo("u64");
    }

    @Test
    @Tag("unit")
    void infersFromIdentifierName() {
        assertThat(MoveTypeMapper.inferType(new IdentifierNode("sender"))).isEqualTo("address");
        assertThat(MoveTypeMapper.inferFromName("owner_addr")).isEqualTo("address");
        assertThat(MoveTypeMapper.inferFromName("recipient")).isEqualTo("address");
        assertThat(MoveTypeMapper.inferFromName("user_id")).isEqualTo("ID");
        assertThat(MoveTypeMapper.inferFromName("total_amount")).isEqualTo("u64");
        assertThat(MoveTypeMapper.inferFromName("flag")).isEqualTo("bool");
        assertThat(MoveTypeMapper.inferFromName("is_open")).isEqualTo("bool");
        assertThat(MoveTypeMapper.inferFromName("x")).isEqualTo("u64");
    }

    @Test
    @Tag("unit")
    void nameRulesApplyInOrder() {
        // "id" wins over "has_" because it is checked first
        assertThat(MoveTypeMapper.inferFromName("has_valid")).isEqualTo("ID");
        assertThat(MoveTypeMapper.inferFromName("sender_id")).isEqualTo("address");
    }
}
