package com.thingtalk.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.thingtalk.ast.InputParam;
import com.thingtalk.exception.ManifestException;
import com.thingtalk.schema.ArgDirection;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.schema.ClassDef;
import com.thingtalk.schema.FunctionDef;
import com.thingtalk.schema.MixinImport;
import com.thingtalk.test.TestBase;
import com.thingtalk.test.TestCategories;
import com.thingtalk.types.ArrayType;
import com.thingtalk.types.EntityType;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.values.ArgMapValue;
import com.thingtalk.values.ArrayValue;
import com.thingtalk.values.MeasureValue;
import com.thingtalk.values.StringValue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for conversion between classes and legacy JSON manifests.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Interchange
@DisplayName("Class Manifest Converter Tests")
public class ClassManifestConverterTest extends TestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SEARCH_MANIFEST = "{"
        + "\"module_type\": \"org.thingpedia.v2\","
        + "\"params\": {},"
        + "\"auth\": {\"type\": \"none\"},"
        + "\"types\": [\"com.parent\"],"
        + "\"category\": \"data\","
        + "\"queries\": {"
        + "  \"search\": {"
        + "    \"args\": ["
        + "      {\"name\": \"query\", \"type\": \"String\", \"question\": \"What do you want to search?\","
        + "       \"is_input\": true, \"required\": true},"
        + "      {\"name\": \"title\", \"type\": \"String\", \"question\": \"\", \"is_input\": false, \"required\": false}"
        + "    ],"
        + "    \"canonical\": \"search\","
        + "    \"is_list\": true,"
        + "    \"poll_interval\": 60000,"
        + "    \"confirmation\": \"results for $query\","
        + "    \"formatted\": [],"
        + "    \"url\": \"https://example.com/api\""
        + "  }"
        + "},"
        + "\"actions\": {}"
        + "}";

    private static List<String> argNames(JsonNode function) {
        List<String> names = new ArrayList<>();
        function.get("args").forEach(arg -> names.add(arg.get("name").asText()));
        return names;
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTripTests {

        @Test
        @DisplayName("Query arguments survive manifest to class to manifest")
        void testQueryRoundTrip() throws Exception {
            logStep("Given: a manifest with one query of two string arguments");
            JsonNode manifest = MAPPER.readTree(SEARCH_MANIFEST);

            logStep("When: converting to a class and back");
            ClassDef classDef = ClassManifestConverter.fromManifest("com.example", manifest);
            ObjectNode back = ClassManifestConverter.toManifest(classDef);
            logData("Manifest", back);

            logStep("Then: the query has the same argument names and types");
            JsonNode original = manifest.get("queries").get("search");
            JsonNode converted = back.get("queries").get("search");
            assertThat(argNames(converted)).isEqualTo(argNames(original));
            for (int i = 0; i < original.get("args").size(); i++) {
                assertThat(converted.get("args").get(i).get("type").asText())
                    .isEqualTo(original.get("args").get(i).get("type").asText());
                assertThat(converted.get("args").get(i).get("is_input").asBoolean())
                    .isEqualTo(original.get("args").get(i).get("is_input").asBoolean());
            }
            assertThat(converted.get("poll_interval").asLong()).isEqualTo(60000);
            assertThat(converted.get("url").asText()).isEqualTo("https://example.com/api");
            assertThat(back.get("types")).hasSize(1);
            assertThat(back.get("category").asText()).isEqualTo("data");
        }

        @Test
        @DisplayName("Form parameters become a config mixin and come back as params")
        void testFormParams() throws Exception {
            String json = "{\"module_type\": \"org.thingpedia.v2\","
                + "\"params\": {\"username\": [\"Username\", \"text\"], \"password\": [\"Password\", \"password\"]},"
                + "\"auth\": {\"type\": \"none\"}, \"queries\": {}, \"actions\": {}}";

            ClassDef classDef = ClassManifestConverter.fromManifest("com.example", json);

            MixinImport config = classDef.config();
            assertThat(config.module()).isEqualTo(ManifestConstants.CONFIG_FORM);
            assertThat(config.inParams()).hasSize(1);
            ArgMapValue params = (ArgMapValue) config.inParams().get(0).value();
            assertThat(params.value())
                .containsEntry("username", PrimitiveType.STRING)
                .containsEntry("password", new EntityType("tt:password"));

            ObjectNode back = ClassManifestConverter.toManifest(classDef);
            assertThat(back.get("auth").get("type").asText()).isEqualTo("none");
            assertThat(back.get("params").get("password").get(1).asText()).isEqualTo("password");
            assertThat(back.get("category").asText()).isEqualTo("online");
        }

        @Test
        @DisplayName("Bluetooth discovery metadata is encoded in types")
        void testBluetoothDiscovery() throws Exception {
            String json = "{\"module_type\": \"org.thingpedia.v2\", \"params\": {},"
                + "\"auth\": {\"type\": \"discovery\", \"discoveryType\": \"bluetooth\"},"
                + "\"types\": [\"com.parent\", \"bluetooth-uuid-abcd\", \"bluetooth-class-health\"],"
                + "\"queries\": {}, \"actions\": {}}";

            ClassDef classDef = ClassManifestConverter.fromManifest("com.example.scale", json);

            assertThat(classDef.extendsList()).containsExactly("com.parent");
            MixinImport config = classDef.config();
            assertThat(config.module()).isEqualTo(ManifestConstants.CONFIG_DISCOVERY_BLUETOOTH);
            assertThat(config.inParams()).extracting(InputParam::name).containsExactly("uuids", "device_class");

            ObjectNode back = ClassManifestConverter.toManifest(classDef);
            assertThat(back.get("auth").get("type").asText()).isEqualTo("discovery");
            assertThat(back.get("auth").get("discoveryType").asText()).isEqualTo("bluetooth");
            assertThat(back.get("types").toString())
                .contains("bluetooth-uuid-abcd")
                .contains("bluetooth-class-health");
            assertThat(back.get("category").asText()).isEqualTo("physical");
        }

        @Test
        @DisplayName("UPnP search targets drop and restore their urn prefix")
        void testUpnpDiscovery() {
            String json = "{\"params\": {},"
                + "\"auth\": {\"type\": \"discovery\", \"discoveryType\": \"upnp\"},"
                + "\"types\": [\"upnp-schemas-upnp-org-device-light-1\"],"
                + "\"queries\": {}, \"actions\": {}}";

            ClassDef classDef = ClassManifestConverter.fromManifest("com.example.light", json);

            ArrayValue targets = (ArrayValue) classDef.config().inParams().get(0).value();
            assertThat(targets.toJS()).isEqualTo(List.of("urn:schemas-upnp-org-device-light-1"));

            ObjectNode back = ClassManifestConverter.toManifest(classDef);
            assertThat(back.get("types").get(0).asText()).isEqualTo("upnp-schemas-upnp-org-device-light-1");
        }
    }

    @Nested
    @DisplayName("Class to manifest")
    class ToManifestTests {

        @Test
        @DisplayName("Class level fields are written")
        void testClassFields() {
            ArgumentDef to = new ArgumentDef(null, ArgDirection.IN_REQ, "to", new EntityType("tt:email_address"),
                Map.of("prompt", "Who should receive it?"), Map.of());
            FunctionDef send = new FunctionDef(null, com.thingtalk.schema.FunctionType.ACTION, null, "send",
                List.of(), false, false, List.of(to), Map.of("confirmation", "send an email to $to"), Map.of());
            ClassDef classDef = new ClassDef(null, "com.example.mail", List.of(),
                List.of(new MixinImport(List.of("config"), ManifestConstants.CONFIG_OAUTH2,
                    new ArrayList<>(List.of(new InputParam("client_id", new StringValue("abc")))))),
                List.of(), Map.of(), Map.of("send", send),
                Map.of("name", "Mail", "description", "Send email"),
                Map.of("child_types", new ArrayValue(List.of(new StringValue("com.example.child")))),
                false);

            ObjectNode manifest = ClassManifestConverter.toManifest(classDef);

            assertThat(manifest.get("module_type").asText()).isEqualTo(ManifestConstants.DEFAULT_LOADER);
            assertThat(manifest.get("kind").asText()).isEqualTo("com.example.mail");
            assertThat(manifest.get("auth").get("type").asText()).isEqualTo("oauth2");
            assertThat(manifest.get("auth").get("client_id").asText()).isEqualTo("abc");
            assertThat(manifest.get("child_types").get(0).asText()).isEqualTo("com.example.child");
            assertThat(manifest.get("name").asText()).isEqualTo("Mail");
            assertThat(manifest.has("version")).isFalse();

            JsonNode action = manifest.get("actions").get("send");
            assertThat(action.get("poll_interval").asInt()).isEqualTo(-1);
            assertThat(action.get("is_list").asBoolean()).isFalse();
            assertThat(action.get("confirmation").asText()).isEqualTo("send an email to $to");
            JsonNode arg = action.get("args").get(0);
            assertThat(arg.get("type").asText()).isEqualTo("Entity(tt:email_address)");
            assertThat(arg.get("question").asText()).isEqualTo("Who should receive it?");
            assertThat(arg.get("required").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("Monitorable queries write their poll interval in milliseconds")
        void testPollInterval() {
            FunctionDef query = new FunctionDef(null, com.thingtalk.schema.FunctionType.QUERY, null, "get",
                List.of(), false, true, List.of(new ArgumentDef(ArgDirection.OUT, "v", new ArrayType(PrimitiveType.NUMBER))),
                Map.of(), Map.of("poll_interval", new MeasureValue(5, "min")));
            ClassDef classDef = new ClassDef("com.example", Map.of("get", query), Map.of());

            JsonNode manifest = ClassManifestConverter.toManifest(classDef).get("queries").get("get");

            assertThat(manifest.get("poll_interval").asLong()).isEqualTo(300000);
            assertThat(manifest.has("poll_interval")).isTrue();
        }
    }

    @Nested
    @DisplayName("Malformed manifests")
    class ErrorTests {

        @Test
        @DisplayName("Invalid JSON is reported with the class kind")
        void testInvalidJson() {
            assertThatThrownBy(() -> ClassManifestConverter.fromManifest("com.broken", "{not json"))
                .isInstanceOf(ManifestException.class)
                .satisfies(e -> assertThat(((ManifestException) e).getKind()).isEqualTo("com.broken"));
        }

        @Test
        @DisplayName("Unknown HTML input types are rejected")
        void testUnknownInputType() {
            String json = "{\"params\": {\"color\": [\"Color\", \"color\"]}, \"auth\": {\"type\": \"none\"},"
                + "\"queries\": {}, \"actions\": {}}";

            assertThatThrownBy(() -> ClassManifestConverter.fromManifest("com.example", json))
                .isInstanceOf(ManifestException.class)
                .hasMessageContaining("color");
        }

        @Test
        @DisplayName("Malformed argument types are rejected")
        void testBadArgumentType() {
            String json = "{\"queries\": {\"q\": {\"args\": [{\"name\": \"a\", \"type\": \"Array(\","
                + "\"is_input\": false}], \"poll_interval\": -1}}, \"actions\": {}}";

            assertThatThrownBy(() -> ClassManifestConverter.fromManifest("com.example", json))
                .isInstanceOf(ManifestException.class)
                .hasMessageContaining("argument a");
        }
    }
}
