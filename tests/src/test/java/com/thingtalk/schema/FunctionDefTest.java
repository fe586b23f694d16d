package com.thingtalk.schema;

import com.thingtalk.exception.ResolutionException;
import com.thingtalk.test.TestBase;
import com.thingtalk.test.TestCategories;
import com.thingtalk.types.ArrayType;
import com.thingtalk.types.CompoundType;
import com.thingtalk.types.EntityType;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.values.BooleanValue;
import com.thingtalk.values.Value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for function signatures: flattening, inheritance and projections.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Function Definition Tests")
public class FunctionDefTest extends TestBase {

    private static FunctionDef query(String name, List<String> extendsList, List<ArgumentDef> args) {
        return new FunctionDef(null, FunctionType.QUERY, null, name, extendsList, true, true, args,
            Collections.emptyMap(), Collections.emptyMap());
    }

    private static ClassDef classOf(FunctionDef... queries) {
        Map<String, FunctionDef> map = new LinkedHashMap<>();
        for (FunctionDef q : queries) {
            map.put(q.name(), q);
        }
        return new ClassDef("com.example", map, Collections.emptyMap());
    }

    private static CompoundType point() {
        Map<String, ArgumentDef> fields = new LinkedHashMap<>();
        fields.put("x", new ArgumentDef(null, "x", PrimitiveType.NUMBER));
        fields.put("y", new ArgumentDef(null, "y", PrimitiveType.NUMBER));
        return new CompoundType(null, fields);
    }

    @Nested
    @DisplayName("Compound flattening")
    class FlatteningTests {

        @Test
        @DisplayName("A compound argument is followed by its dotted fields")
        void testFlattenCompound() {
            logStep("Given: an in req argument p of type {x: Number, y: Number}");
            ExpressionSignature sig = new ExpressionSignature(FunctionType.ACTION,
                List.of(new ArgumentDef(ArgDirection.IN_REQ, "p", point())));

            logStep("Then: p, p.x and p.y are arguments, all required inputs");
            assertThat(sig.args()).containsExactly("p", "p.x", "p.y");
            assertThat(sig.hasArgument("p.x")).isTrue();
            assertThat(sig.getArgType("p.y")).isSameAs(PrimitiveType.NUMBER);
            assertThat(sig.isArgRequired("p.x")).isTrue();
            assertThat(sig.inReq()).containsOnlyKeys("p", "p.x", "p.y");
        }

        @Test
        @DisplayName("An array of compounds flattens to the element fields")
        void testFlattenArrayOfCompound() {
            ExpressionSignature sig = new ExpressionSignature(FunctionType.QUERY,
                List.of(new ArgumentDef(ArgDirection.OUT, "points", new ArrayType(point()))));

            assertThat(sig.args()).containsExactly("points", "points.x", "points.y");
            assertThat(sig.getArgType("points.x")).isSameAs(PrimitiveType.NUMBER);
            assertThat(sig.isArgInput("points.y")).isFalse();
            assertThat(sig.out()).containsOnlyKeys("points", "points.x", "points.y");
        }

        @Test
        @DisplayName("Nested compounds flatten depth first")
        void testFlattenNestedCompound() {
            Map<String, ArgumentDef> fields = new LinkedHashMap<>();
            fields.put("coords", new ArgumentDef(null, "coords", point()));
            fields.put("label", new ArgumentDef(null, "label", PrimitiveType.STRING));
            ExpressionSignature sig = new ExpressionSignature(FunctionType.ACTION,
                List.of(new ArgumentDef(ArgDirection.IN_OPT, "place", new CompoundType(null, fields))));

            logData("args", sig.args());
            assertThat(sig.args())
                .containsExactly("place", "place.coords", "place.coords.x", "place.coords.y", "place.label");
            assertThat(sig.getArgType("place.coords.y")).isSameAs(PrimitiveType.NUMBER);
            assertThat(sig.isArgInput("place.coords.x")).isTrue();
            assertThat(sig.isArgRequired("place.coords.x")).isFalse();
        }

        @Test
        @DisplayName("Appending an argument that already exists is rejected")
        void testAddExistingArgument() {
            ExpressionSignature sig = new ExpressionSignature(FunctionType.QUERY,
                List.of(new ArgumentDef(ArgDirection.OUT, "title", PrimitiveType.STRING)));

            assertThat(sig.addArguments(List.of(new ArgumentDef(ArgDirection.OUT, "score", PrimitiveType.NUMBER)))
                .args()).containsExactly("title", "score");
            assertThatThrownBy(() -> sig.addArguments(
                List.of(new ArgumentDef(ArgDirection.OUT, "title", PrimitiveType.NUMBER))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate argument title");
        }

        @Test
        @DisplayName("Duplicate argument names are rejected")
        void testDuplicateArgument() {
            assertThatThrownBy(() -> new ExpressionSignature(FunctionType.QUERY, List.of(
                new ArgumentDef(ArgDirection.OUT, "a", PrimitiveType.STRING),
                new ArgumentDef(ArgDirection.OUT, "a", PrimitiveType.NUMBER))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
        }
    }

    @Nested
    @DisplayName("Inheritance")
    class InheritanceTests {

        @Test
        @DisplayName("A function sees the arguments of its parent")
        void testInheritedArgument() {
            logStep("Given: f with argument a, and g extending f with no arguments");
            FunctionDef f = query("f", List.of(), List.of(new ArgumentDef(ArgDirection.OUT, "a", PrimitiveType.STRING)));
            FunctionDef g = query("g", List.of("f"), List.of());
            classOf(f, g);

            logStep("Then: g resolves a through f");
            assertThat(g.hasArgument("a")).isTrue();
            assertThat(g.getArgType("a")).isEqualTo(f.getArgType("a"));
            assertThat(g.iterateBaseFunctions()).containsExactly("g", "f");
        }

        @Test
        @DisplayName("Turning off inherit_arguments hides the parent arguments")
        void testInheritArgumentsDisabled() {
            Map<String, Value> annotations = Map.of("inherit_arguments", new BooleanValue(false));
            FunctionDef f = query("f", List.of(), List.of(new ArgumentDef(ArgDirection.OUT, "a", PrimitiveType.STRING)));
            FunctionDef g = new FunctionDef(null, FunctionType.QUERY, null, "g", List.of("f"), true, false,
                List.of(), Collections.emptyMap(), annotations);
            classOf(f, g);

            assertThat(g.hasArgument("a")).isFalse();
        }

        @Test
        @DisplayName("The first parent that has an argument answers for it")
        void testFirstParentWins() {
            FunctionDef text = query("text", List.of(), List.of(new ArgumentDef(ArgDirection.OUT, "a", PrimitiveType.STRING)));
            FunctionDef number = query("number", List.of(), List.of(new ArgumentDef(ArgDirection.OUT, "a", PrimitiveType.NUMBER)));
            FunctionDef g = query("g", List.of("text", "number"), List.of());
            FunctionDef h = query("h", List.of("number", "text"), List.of());
            classOf(text, number, g, h);

            assertThat(g.getArgType("a")).isSameAs(PrimitiveType.STRING);
            assertThat(h.getArgType("a")).isSameAs(PrimitiveType.NUMBER);
            assertThat(g.iterateArguments()).extracting(ArgumentDef::name).containsExactly("a");
        }

        @Test
        @DisplayName("A chain declared child first resolves through every level")
        void testThreeLevelChain() {
            logStep("Given: a extends b, b extends c, only c declares arguments");
            FunctionDef a = query("a", List.of("b"), List.of());
            FunctionDef b = query("b", List.of("c"), List.of());
            FunctionDef c = query("c", List.of(), List.of(
                new ArgumentDef(ArgDirection.OUT, "id", new EntityType("com.example:item")),
                new ArgumentDef(ArgDirection.OUT, "x", PrimitiveType.NUMBER)));

            logStep("When: the class is built");
            classOf(a, b, c);

            logStep("Then: a sees the arguments and the id of c");
            assertThat(a.hasArgument("x")).isTrue();
            assertThat(a.getArgType("x")).isSameAs(PrimitiveType.NUMBER);
            assertThat(a.iterateBaseFunctions()).containsExactly("a", "b", "c");
            assertThat(a.minimalProjection()).containsExactly("id");
            assertThat(b.minimalProjection()).containsExactly("id");
        }

        @Test
        @DisplayName("A missing parent fails when the class is built")
        void testMissingParent() {
            FunctionDef g = query("g", List.of("nope"), List.of());

            assertThatThrownBy(() -> classOf(g))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("Parent function nope");
        }

        @Test
        @DisplayName("A detached function cannot resolve its parents")
        void testDetachedFunction() {
            FunctionDef g = query("g", List.of("f"), List.of());

            assertThatThrownBy(g::iterateBaseFunctions).isInstanceOf(ResolutionException.class);
        }

        @Test
        @DisplayName("Cyclic extends chains are rejected when the class is built")
        void testCycleRejected() {
            FunctionDef a = query("a", List.of("b"), List.of());
            FunctionDef b = query("b", List.of("c"), List.of());
            FunctionDef c = query("c", List.of("a"), List.of());

            assertThatThrownBy(() -> classOf(a, b, c))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cyclic");
        }

        @Test
        @DisplayName("Functions of a cloned class resolve against the clone")
        void testCloneReattaches() {
            FunctionDef f = query("f", List.of(), List.of(new ArgumentDef(ArgDirection.OUT, "a", PrimitiveType.STRING)));
            FunctionDef g = query("g", List.of("f"), List.of());
            ClassDef original = classOf(f, g);

            ClassDef copy = original.clone();

            FunctionDef copiedG = copy.queries().get("g");
            assertThat(copiedG).isNotSameAs(g);
            assertThat(copiedG.classDef()).isSameAs(copy);
            assertThat(copiedG.hasArgument("a")).isTrue();
            assertThat(copy).isEqualTo(original);
        }
    }

    @Nested
    @DisplayName("Projections")
    class ProjectionTests {

        @Test
        @DisplayName("Minimal projection defaults to id when id is an output")
        void testMinimalProjectionWithId() {
            FunctionDef f = query("f", List.of(), List.of(
                new ArgumentDef(ArgDirection.OUT, "id", new EntityType("com.example:item")),
                new ArgumentDef(ArgDirection.OUT, "title", PrimitiveType.STRING)));
            classOf(f);

            assertThat(f.minimalProjection()).containsExactly("id");
        }

        @Test
        @DisplayName("Minimal projection is empty without an id")
        void testMinimalProjectionWithoutId() {
            FunctionDef f = query("f", List.of(), List.of(new ArgumentDef(ArgDirection.OUT, "title", PrimitiveType.STRING)));
            classOf(f);

            assertThat(f.minimalProjection()).isEmpty();
        }

        @Test
        @DisplayName("An inherited id counts for the minimal projection")
        void testMinimalProjectionInherited() {
            FunctionDef f = query("f", List.of(), List.of(
                new ArgumentDef(ArgDirection.OUT, "id", new EntityType("com.example:item"))));
            FunctionDef g = query("g", List.of("f"), List.of());
            classOf(f, g);

            assertThat(g.minimalProjection()).containsExactly("id");
        }

        @Test
        @DisplayName("Removing the minimal projection leaves it empty")
        void testRemoveMinimalProjection() {
            FunctionDef f = query("f", List.of(), List.of(
                new ArgumentDef(ArgDirection.OUT, "id", new EntityType("com.example:item"))));
            classOf(f);

            f.removeMinimalProjection();

            assertThat(f.minimalProjection()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Qualifiers")
    class QualifierTests {

        @Test
        @DisplayName("Actions cannot be lists or monitorable")
        void testActionQualifiers() {
            assertThatThrownBy(() -> new FunctionDef(null, FunctionType.ACTION, null, "post", List.of(), true, false,
                List.of(), Collections.emptyMap(), Collections.emptyMap()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Only actions need confirmation by default")
        void testConfirm() {
            FunctionDef action = new FunctionDef(FunctionType.ACTION, "post", List.of());
            FunctionDef q = new FunctionDef(FunctionType.QUERY, "get", List.of());
            assertThat(action.confirm()).isTrue();
            assertThat(q.confirm()).isFalse();
        }

        @Test
        @DisplayName("Qualified name includes the class kind once attached")
        void testQualifiedName() {
            FunctionDef f = query("f", List.of(), List.of());
            classOf(f);
            assertThat(f.qualifiedName()).isEqualTo("com.example.f");
        }

        @Test
        @DisplayName("Canonical form of an argument falls back to its cleaned name")
        void testArgumentCanonical() {
            ArgumentDef arg = new ArgumentDef(ArgDirection.OUT, "inReplyTo", PrimitiveType.STRING);
            assertThat(arg.canonical()).isEqualTo("in reply to");

            ArgumentDef annotated = new ArgumentDef(null, ArgDirection.OUT, "v_title", PrimitiveType.STRING,
                Map.of("canonical", Map.of("base", List.of("headline", "title"))), Collections.emptyMap());
            assertThat(annotated.canonical()).isEqualTo("headline");
        }
    }
}
