package com.thingtalk.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.thingtalk.ast.InputParam;
import com.thingtalk.exception.ManifestException;
import com.thingtalk.exception.NotConstantException;
import com.thingtalk.schema.ArgDirection;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.schema.ClassDef;
import com.thingtalk.schema.FunctionDef;
import com.thingtalk.schema.FunctionType;
import com.thingtalk.schema.MixinImport;
import com.thingtalk.types.ArrayType;
import com.thingtalk.types.EnumType;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.types.TypeParser;
import com.thingtalk.util.Names;
import com.thingtalk.values.ArgMapValue;
import com.thingtalk.values.ArrayValue;
import com.thingtalk.values.BooleanValue;
import com.thingtalk.values.EntityValue;
import com.thingtalk.values.MeasureValue;
import com.thingtalk.values.NumberValue;
import com.thingtalk.values.StringValue;
import com.thingtalk.values.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts class definitions to and from the legacy JSON manifest format.
 *
 * <p>A manifest describes a class as a JSON object:
 * <pre>
 * {
 *   "module_type": "org.thingpedia.v2",
 *   "kind": "com.example",
 *   "params": {"username": ["username", "text"]},
 *   "auth": {"type": "basic"},
 *   "queries": {"get": {"args": [...], "is_list": true, "poll_interval": -1, ...}},
 *   "actions": {},
 *   "version": 1,
 *   "types": ["com.parent", "bluetooth-uuid-0000"],
 *   "child_types": [],
 *   "category": "online"
 * }
 * </pre>
 *
 * <p>The {@code config} mixin of the class is encoded in {@code auth},
 * {@code params} and {@code types}. Converting a manifest to a class and back
 * preserves functions, arguments and imports, although the order of the
 * config parameters may change.
 */
public final class ClassManifestConverter {

    private static final Logger logger = LoggerFactory.getLogger(ClassManifestConverter.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final Set<String> ARGUMENT_KEYS = Set.of("is_input", "required", "type", "name", "question");
    private static final Set<String> FUNCTION_KEYS = Set.of("args", "is_list", "is_monitorable", "poll_interval",
        "canonical", "confirmation", "confirmation_remote", "formatted");

    private ClassManifestConverter() {} // Utility class

    // ==================== Class to manifest ====================

    /**
     * Converts a class definition to a manifest.
     *
     * @param classDef the class
     * @return the manifest
     * @throws ManifestException if an annotation is not a constant or a
     *         config parameter has no HTML input type
     */
    public static ObjectNode toManifest(ClassDef classDef) {
        Objects.requireNonNull(classDef, "classDef must not be null");
        String kind = classDef.kind();
        logger.debug("Converting class {} to manifest", kind);

        ObjectNode queries = objectMapper.createObjectNode();
        for (FunctionDef query : classDef.queries().values()) {
            queries.set(query.name(), functionToManifest(query, kind));
        }
        ObjectNode actions = objectMapper.createObjectNode();
        for (FunctionDef action : classDef.actions().values()) {
            actions.set(action.name(), functionToManifest(action, kind));
        }

        List<String> extraKinds = new ArrayList<>();
        ObjectNode auth = authToManifest(classDef.config(), extraKinds, kind);

        ObjectNode manifest = objectMapper.createObjectNode();
        MixinImport loader = classDef.loader();
        manifest.put("module_type", loader != null ? loader.module() : ManifestConstants.DEFAULT_LOADER);
        manifest.put("kind", kind);
        manifest.set("params", paramsToManifest(classDef.config(), kind));
        manifest.set("auth", auth);
        manifest.set("queries", queries);
        manifest.set("actions", actions);
        Integer version = classDef.version();
        if (version != null) {
            manifest.put("version", version);
        }

        ArrayNode types = manifest.putArray("types");
        classDef.extendsList().forEach(types::add);
        extraKinds.forEach(types::add);

        ArrayNode childTypes = manifest.putArray("child_types");
        Value children = classDef.annotations().get("child_types");
        if (children instanceof ArrayValue) {
            for (Value child : ((ArrayValue) children).values()) {
                childTypes.add(stringOf(child));
            }
        }
        manifest.put("category", category(classDef));

        Object name = classDef.metadata().get("name");
        if (name != null) {
            manifest.set("name", objectMapper.valueToTree(name));
        }
        Object description = classDef.metadata().get("description");
        if (description != null) {
            manifest.set("description", objectMapper.valueToTree(description));
        }
        return manifest;
    }

    private static String stringOf(Value value) {
        if (value instanceof EntityValue) {
            return ((EntityValue) value).value();
        }
        return String.valueOf(value.toJS());
    }

    private static ObjectNode paramsToManifest(MixinImport config, String kind) {
        ObjectNode params = objectMapper.createObjectNode();
        if (config == null) {
            return params;
        }
        String module = config.module();
        if (!module.equals(ManifestConstants.CONFIG_FORM) && !module.equals(ManifestConstants.CONFIG_BASIC_AUTH)) {
            return params;
        }
        for (InputParam param : config.inParams()) {
            if (!(param.value() instanceof ArgMapValue)) {
                continue;
            }
            for (Map.Entry<String, Type> entry : ((ArgMapValue) param.value()).value().entrySet()) {
                ArrayNode label = params.putArray(entry.getKey());
                label.add(Names.clean(entry.getKey()));
                label.add(HtmlInputTypes.toHtml(entry.getValue(), kind));
            }
        }
        return params;
    }

    private static ObjectNode authToManifest(MixinImport config, List<String> extraKinds, String kind) {
        ObjectNode auth = objectMapper.createObjectNode();
        if (config == null) {
            auth.put("type", "none");
            return auth;
        }

        for (InputParam param : config.inParams()) {
            Value value = param.value();
            if (value instanceof ArgMapValue) {
                continue;
            }
            switch (param.name()) {
                case "device_class":
                    extraKinds.add(ManifestConstants.BLUETOOTH_CLASS_PREFIX + toJS(value, kind));
                    break;
                case "uuids":
                    for (Object uuid : asList(toJS(value, kind))) {
                        extraKinds.add(ManifestConstants.BLUETOOTH_UUID_PREFIX
                            + String.valueOf(uuid).toLowerCase(Locale.ROOT));
                    }
                    break;
                case "search_target":
                    for (Object target : asList(toJS(value, kind))) {
                        String encoded = String.valueOf(target).toLowerCase(Locale.ROOT)
                            .replaceFirst("^urn:", "")
                            .replace(':', '-');
                        extraKinds.add(ManifestConstants.UPNP_PREFIX + encoded);
                    }
                    break;
                default:
                    auth.set(param.name(), objectMapper.valueToTree(toJS(value, kind)));
            }
        }

        switch (config.module()) {
            case ManifestConstants.CONFIG_OAUTH2:
                auth.put("type", "oauth2");
                break;
            case ManifestConstants.CONFIG_CUSTOM_OAUTH:
                auth.put("type", "custom_oauth");
                break;
            case ManifestConstants.CONFIG_BASIC_AUTH:
                auth.put("type", "basic");
                break;
            case ManifestConstants.CONFIG_DISCOVERY_BLUETOOTH:
                auth.put("type", "discovery");
                auth.put("discoveryType", "bluetooth");
                break;
            case ManifestConstants.CONFIG_DISCOVERY_UPNP:
                auth.put("type", "discovery");
                auth.put("discoveryType", "upnp");
                break;
            case ManifestConstants.CONFIG_INTERACTIVE:
                auth.put("type", "interactive");
                break;
            case ManifestConstants.CONFIG_BUILTIN:
                auth.put("type", "builtin");
                break;
            default:
                auth.put("type", "none");
        }
        return auth;
    }

    private static List<?> asList(Object value) {
        return value instanceof List ? (List<?>) value : Collections.singletonList(value);
    }

    private static String category(ClassDef classDef) {
        if (Boolean.TRUE.equals(classDef.getImplementationAnnotation("system"))) {
            return ManifestConstants.CATEGORY_SYSTEM;
        }
        MixinImport config = classDef.config();
        if (config == null) {
            return ManifestConstants.CATEGORY_DATA;
        }
        switch (config.module()) {
            case ManifestConstants.CONFIG_BUILTIN:
            case ManifestConstants.CONFIG_NONE:
                return ManifestConstants.CATEGORY_DATA;
            case ManifestConstants.CONFIG_DISCOVERY_BLUETOOTH:
            case ManifestConstants.CONFIG_DISCOVERY_UPNP:
                return ManifestConstants.CATEGORY_PHYSICAL;
            default:
                return ManifestConstants.CATEGORY_ONLINE;
        }
    }

    private static ObjectNode functionToManifest(FunctionDef function, String kind) {
        ObjectNode obj = objectMapper.createObjectNode();
        ArrayNode args = obj.putArray("args");
        for (String name : function.args()) {
            ArgumentDef arg = function.getArgument(name);
            // flattened compound fields are rebuilt from the parent's type
            if (name.indexOf('.') >= 0) {
                continue;
            }
            args.add(argumentToManifest(arg, kind));
        }
        if (function.canonical() != null) {
            obj.put("canonical", function.canonical());
        }
        obj.put("is_list", function.isList());
        double interval = pollInterval(function, kind);
        if (interval == Math.rint(interval)) {
            obj.put("poll_interval", (long) interval);
        } else {
            obj.put("poll_interval", interval);
        }
        if (function.confirmation() != null) {
            obj.put("confirmation", function.confirmation());
        }
        Object formatted = function.metadata().get("formatted");
        obj.set("formatted", formatted == null ? objectMapper.createArrayNode() : objectMapper.valueToTree(formatted));

        for (Map.Entry<String, Value> entry : function.annotations().entrySet()) {
            if (entry.getKey().equals("poll_interval")) {
                continue;
            }
            obj.set(entry.getKey(), objectMapper.valueToTree(toJS(entry.getValue(), kind)));
        }
        return obj;
    }

    private static double pollInterval(FunctionDef function, String kind) {
        if (!function.isMonitorable()) {
            return ManifestConstants.NOT_MONITORABLE;
        }
        Value interval = function.annotations().get("poll_interval");
        if (interval == null) {
            // monitorable without polling: the device pushes its events
            return 0;
        }
        return ((Number) toJS(interval, kind)).doubleValue();
    }

    private static ObjectNode argumentToManifest(ArgumentDef arg, String kind) {
        ObjectNode obj = objectMapper.createObjectNode();
        obj.put("name", arg.name());
        obj.put("type", arg.type().toString());
        Object prompt = arg.metadata().get("prompt");
        obj.put("question", prompt == null ? "" : String.valueOf(prompt));
        obj.put("is_input", arg.isInput());
        obj.put("required", arg.isRequired());
        for (Map.Entry<String, Value> entry : arg.annotations().entrySet()) {
            obj.set(entry.getKey(), objectMapper.valueToTree(toJS(entry.getValue(), kind)));
        }
        return obj;
    }

    private static Object toJS(Value value, String kind) {
        try {
            return value.toJS();
        } catch (NotConstantException | IllegalStateException e) {
            throw new ManifestException("Cannot serialize " + value.toSource() + ": " + e.getMessage(), kind, e);
        }
    }

    // ==================== Manifest to class ====================

    /**
     * Parses a manifest and converts it to a class definition.
     *
     * @param kind the class identifier
     * @param json the manifest text
     * @return the class
     * @throws ManifestException if the text is not valid JSON or the manifest
     *         is malformed
     */
    public static ClassDef fromManifest(String kind, String json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode manifest;
        try {
            manifest = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ManifestException("Failed to parse manifest: " + e.getOriginalMessage(), kind, e);
        }
        return fromManifest(kind, manifest);
    }

    /**
     * Converts a manifest to a class definition.
     *
     * @param kind the class identifier
     * @param manifest the manifest object
     * @return the class
     * @throws ManifestException if the manifest is malformed
     */
    public static ClassDef fromManifest(String kind, JsonNode manifest) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(manifest, "manifest must not be null");
        if (!manifest.isObject()) {
            throw new ManifestException("Manifest must be a JSON object", kind);
        }
        logger.debug("Converting manifest of {} to class", kind);

        List<String> types = new ArrayList<>();
        for (JsonNode type : manifest.path("types")) {
            types.add(type.asText());
        }
        List<String> extendsList = new ArrayList<>();
        for (String type : types) {
            if (!type.startsWith(ManifestConstants.BLUETOOTH_PREFIX) && !type.startsWith(ManifestConstants.UPNP_PREFIX)) {
                extendsList.add(type);
            }
        }

        List<MixinImport> imports = extractImports(manifest, kind);

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (manifest.hasNonNull("name")) {
            metadata.put("name", manifest.get("name").asText());
        }
        if (manifest.hasNonNull("description")) {
            metadata.put("description", manifest.get("description").asText());
        }

        Map<String, Value> annotations = new LinkedHashMap<>();
        JsonNode childTypes = manifest.path("child_types");
        if (childTypes.isArray() && childTypes.size() > 0) {
            List<Value> children = new ArrayList<>();
            for (JsonNode child : childTypes) {
                children.add(new StringValue(child.asText()));
            }
            annotations.put("child_types", new ArrayValue(null, children, PrimitiveType.STRING));
        }
        if (manifest.hasNonNull("version")) {
            annotations.put("version", new NumberValue(manifest.get("version").asDouble()));
        }
        if (ManifestConstants.CATEGORY_SYSTEM.equals(manifest.path("category").asText(null))) {
            annotations.put("system", new BooleanValue(true));
        }

        Map<String, FunctionDef> queries = functionsFromManifest(FunctionType.QUERY, manifest.path("queries"), kind);
        Map<String, FunctionDef> actions = functionsFromManifest(FunctionType.ACTION, manifest.path("actions"), kind);

        addDiscoveryParams(imports, types);

        try {
            return new ClassDef(null, kind, extendsList, imports, Collections.emptyList(),
                queries, actions, metadata, annotations, false);
        } catch (IllegalArgumentException e) {
            throw new ManifestException("Invalid class in manifest: " + e.getMessage(), kind, e);
        }
    }

    private static List<MixinImport> extractImports(JsonNode manifest, String kind) {
        List<MixinImport> imports = new ArrayList<>();
        if (manifest.hasNonNull("module_type")) {
            imports.add(new MixinImport(List.of(ManifestConstants.FACET_LOADER),
                manifest.get("module_type").asText(), new ArrayList<>()));
        }

        Map<String, Type> argMap = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> params = manifest.path("params").fields();
        while (params.hasNext()) {
            Map.Entry<String, JsonNode> param = params.next();
            argMap.put(param.getKey(), HtmlInputTypes.toType(param.getValue().path(1).asText(null), kind));
        }

        JsonNode auth = manifest.get("auth");
        if (auth == null || !auth.isObject()) {
            return imports;
        }

        List<InputParam> inParams = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> entries = auth.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getKey().equals("type") || entry.getKey().equals("discoveryType")) {
                continue;
            }
            Value value = legacyValue(entry.getValue());
            if (value == null) {
                logger.warn("Ignoring auth parameter {} of {}: unsupported value {}", entry.getKey(), kind, entry.getValue());
                continue;
            }
            inParams.add(new InputParam(entry.getKey(), value));
        }

        String authType = auth.path("type").asText("none");
        String module;
        switch (authType) {
            case "oauth2":
            case "custom_oauth":
                module = ManifestConstants.CONFIG_PREFIX + authType;
                break;
            case "interactive":
                module = ManifestConstants.CONFIG_INTERACTIVE;
                break;
            case "discovery":
                module = ManifestConstants.CONFIG_DISCOVERY_PREFIX + auth.path("discoveryType").asText();
                break;
            case "basic":
                if (!argMap.isEmpty()) {
                    inParams.add(new InputParam("extra_params", new ArgMapValue(argMap)));
                }
                module = ManifestConstants.CONFIG_BASIC_AUTH;
                break;
            case "builtin":
                module = ManifestConstants.CONFIG_BUILTIN;
                break;
            case "none":
                if (!argMap.isEmpty()) {
                    if (inParams.stream().noneMatch(p -> p.name().equals("params"))) {
                        inParams.add(new InputParam("params", new ArgMapValue(argMap)));
                    }
                    module = ManifestConstants.CONFIG_FORM;
                } else {
                    module = ManifestConstants.CONFIG_NONE;
                }
                break;
            default:
                logger.warn("Unknown auth type {} in manifest of {}, using no configuration", authType, kind);
                module = ManifestConstants.CONFIG_NONE;
        }
        imports.add(new MixinImport(List.of(ManifestConstants.FACET_CONFIG), module, inParams));
        return imports;
    }

    private static void addDiscoveryParams(List<MixinImport> imports, List<String> types) {
        MixinImport config = null;
        for (MixinImport mixin : imports) {
            if (mixin.hasFacet(ManifestConstants.FACET_CONFIG)) {
                config = mixin;
                break;
            }
        }
        if (config == null) {
            return;
        }

        List<Object> uuids = new ArrayList<>();
        List<Object> searchTargets = new ArrayList<>();
        String bluetoothClass = null;
        for (String type : types) {
            if (type.startsWith(ManifestConstants.BLUETOOTH_UUID_PREFIX)) {
                uuids.add(type.substring(ManifestConstants.BLUETOOTH_UUID_PREFIX.length()));
            } else if (type.startsWith(ManifestConstants.BLUETOOTH_CLASS_PREFIX)) {
                bluetoothClass = type.substring(ManifestConstants.BLUETOOTH_CLASS_PREFIX.length());
            } else if (type.startsWith(ManifestConstants.UPNP_PREFIX)) {
                searchTargets.add("urn:" + type.substring(ManifestConstants.UPNP_PREFIX.length()));
            }
        }

        Type stringArray = new ArrayType(PrimitiveType.STRING);
        switch (config.module()) {
            case ManifestConstants.CONFIG_DISCOVERY_BLUETOOTH:
                config.inParams().add(new InputParam("uuids", Value.fromJS(stringArray, uuids)));
                if (bluetoothClass != null) {
                    config.inParams().add(new InputParam("device_class",
                        Value.fromJS(new EnumType(null), bluetoothClass)));
                }
                break;
            case ManifestConstants.CONFIG_DISCOVERY_UPNP:
                config.inParams().add(new InputParam("search_target", Value.fromJS(stringArray, searchTargets)));
                break;
            default:
                break;
        }
    }

    private static Map<String, FunctionDef> functionsFromManifest(FunctionType type, JsonNode functions, String kind) {
        Map<String, FunctionDef> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = functions.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            result.put(entry.getKey(), functionFromManifest(type, entry.getKey(), entry.getValue(), kind));
        }
        return result;
    }

    private static FunctionDef functionFromManifest(FunctionType type, String name, JsonNode manifest, String kind) {
        List<ArgumentDef> args = new ArrayList<>();
        for (JsonNode arg : manifest.path("args")) {
            args.add(argumentFromManifest(arg, kind));
        }

        boolean isQuery = type == FunctionType.QUERY;
        boolean isList = isQuery && manifest.path("is_list").asBoolean(false);
        double pollInterval = manifest.path("poll_interval").asDouble(ManifestConstants.NOT_MONITORABLE);
        boolean isMonitorable = isQuery && pollInterval != ManifestConstants.NOT_MONITORABLE;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("canonical", manifest.path("canonical").asText(""));
        metadata.put("confirmation", manifest.path("confirmation").asText(""));
        metadata.put("confirmation_remote", manifest.path("confirmation_remote").asText(""));
        if (isQuery) {
            JsonNode formatted = manifest.get("formatted");
            metadata.put("formatted", formatted == null || formatted.isNull()
                ? new ArrayList<>() : objectMapper.convertValue(formatted, Object.class));
        }

        Map<String, Value> annotations = new LinkedHashMap<>();
        if (isMonitorable) {
            annotations.put("poll_interval", new MeasureValue(pollInterval, "ms"));
        }
        Iterator<Map.Entry<String, JsonNode>> entries = manifest.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (FUNCTION_KEYS.contains(entry.getKey())) {
                continue;
            }
            Value value = legacyValue(entry.getValue());
            if (value == null) {
                logger.warn("Ignoring key {} of function {}.{}: unsupported value", entry.getKey(), kind, name);
                continue;
            }
            annotations.put(entry.getKey(), value);
        }

        try {
            return new FunctionDef(null, type, null, name, Collections.emptyList(), isList, isMonitorable,
                args, metadata, annotations);
        } catch (IllegalArgumentException e) {
            throw new ManifestException("Invalid function " + name + ": " + e.getMessage(), kind, e);
        }
    }

    private static ArgumentDef argumentFromManifest(JsonNode manifest, String kind) {
        String name = manifest.path("name").asText(null);
        if (name == null) {
            throw new ManifestException("Argument without a name", kind);
        }
        boolean isInput = manifest.path("is_input").asBoolean(false);
        boolean required = manifest.path("required").asBoolean(false);
        ArgDirection direction = isInput ? (required ? ArgDirection.IN_REQ : ArgDirection.IN_OPT) : ArgDirection.OUT;

        Type type;
        try {
            type = TypeParser.parse(manifest.path("type").asText(null));
        } catch (IllegalArgumentException e) {
            throw new ManifestException("Invalid type of argument " + name + ": " + e.getMessage(), kind, e);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        String question = manifest.path("question").asText("");
        if (!question.isEmpty()) {
            metadata.put("prompt", question);
        }

        Map<String, Value> annotations = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = manifest.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (ARGUMENT_KEYS.contains(entry.getKey())) {
                continue;
            }
            Value value = legacyValue(entry.getValue());
            if (value == null) {
                logger.warn("Ignoring key {} of argument {} in {}: unsupported value", entry.getKey(), name, kind);
                continue;
            }
            annotations.put(entry.getKey(), value);
        }
        return new ArgumentDef(null, direction, name, type, metadata, annotations);
    }

    /**
     * Converts a JSON scalar or array to a value. Objects and nulls have no
     * legacy representation.
     */
    private static Value legacyValue(JsonNode node) {
        if (node.isTextual()) {
            return new StringValue(node.asText());
        }
        if (node.isBoolean()) {
            return new BooleanValue(node.asBoolean());
        }
        if (node.isNumber()) {
            return new NumberValue(node.asDouble());
        }
        if (node.isArray()) {
            List<Value> values = new ArrayList<>();
            for (JsonNode element : node) {
                Value value = legacyValue(element);
                if (value == null) {
                    return null;
                }
                values.add(value);
            }
            return new ArrayValue(values);
        }
        return null;
    }
}
