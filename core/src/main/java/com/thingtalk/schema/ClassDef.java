package com.thingtalk.schema;

import com.thingtalk.ast.Node;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.exception.ResolutionException;
import com.thingtalk.util.Names;
import com.thingtalk.util.SourceFormat;
import com.thingtalk.values.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A class of devices or services: its queries and actions, the mixins it
 * imports and the entity types it declares.
 *
 * <p>A class owns its functions. On construction (and therefore on
 * {@link #clone()}) it attaches itself to every function, so that functions
 * of a cloned class resolve their parents against the clone.
 *
 * <p>Cycles in the {@code extends} lists of the functions are rejected at
 * construction.
 */
public final class ClassDef extends Node {

    private final String kind;
    private final List<String> extendsList;
    private final List<MixinImport> imports;
    private final List<EntityDef> entities;
    private final Map<String, FunctionDef> queries;
    private final Map<String, FunctionDef> actions;
    private final Map<String, Object> metadata;
    private final Map<String, Value> annotations;
    private final boolean isAbstract;

    /**
     * Creates a class definition.
     *
     * @param location the source location, or null
     * @param kind the class identifier, e.g. {@code com.twitter}
     * @param extendsList kinds of the parent classes
     * @param imports mixin imports
     * @param entities entity declarations
     * @param queries query functions by name
     * @param actions action functions by name
     * @param metadata natural-language annotations
     * @param annotations implementation annotations
     * @param isAbstract whether the class has no implementation
     * @throws IllegalArgumentException if a function is registered under
     *         another name or type, or function inheritance is cyclic
     * @throws ResolutionException if a function extends a function the class
     *         does not declare
     */
    public ClassDef(SourceRange location,
                    String kind,
                    List<String> extendsList,
                    List<MixinImport> imports,
                    List<EntityDef> entities,
                    Map<String, FunctionDef> queries,
                    Map<String, FunctionDef> actions,
                    Map<String, Object> metadata,
                    Map<String, Value> annotations,
                    boolean isAbstract) {
        super(location);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.extendsList = extendsList == null ? new ArrayList<>() : new ArrayList<>(extendsList);
        this.imports = imports == null ? new ArrayList<>() : new ArrayList<>(imports);
        this.entities = entities == null ? new ArrayList<>() : new ArrayList<>(entities);
        this.queries = queries == null ? new LinkedHashMap<>() : new LinkedHashMap<>(queries);
        this.actions = actions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(actions);
        this.metadata = new LinkedHashMap<>(Objects.requireNonNull(metadata, "metadata must not be null"));
        this.annotations = new LinkedHashMap<>(Objects.requireNonNull(annotations, "annotations must not be null"));
        this.isAbstract = isAbstract;

        checkMembers(this.queries, FunctionType.QUERY);
        checkMembers(this.actions, FunctionType.ACTION);
        checkParentsExist(this.queries);
        checkParentsExist(this.actions);
        checkInheritanceCycles(this.queries);
        checkInheritanceCycles(this.actions);
        adjustParentPointers();
    }

    public ClassDef(String kind, Map<String, FunctionDef> queries, Map<String, FunctionDef> actions) {
        this(null, kind, Collections.emptyList(), Collections.emptyList(), Collections.emptyList(),
            queries, actions, Collections.emptyMap(), Collections.emptyMap(), false);
    }

    private static void checkMembers(Map<String, FunctionDef> functions, FunctionType expected) {
        for (Map.Entry<String, FunctionDef> entry : functions.entrySet()) {
            FunctionDef function = entry.getValue();
            if (!entry.getKey().equals(function.name())) {
                throw new IllegalArgumentException("Function " + function.name()
                    + " registered under name " + entry.getKey());
            }
            if (function.functionType() != expected) {
                throw new IllegalArgumentException("Function " + function.name() + " is a "
                    + function.functionType().keyword() + ", expected " + expected.keyword());
            }
        }
    }

    private void checkParentsExist(Map<String, FunctionDef> functions) {
        for (FunctionDef function : functions.values()) {
            for (String parent : function.extendsList()) {
                if (!functions.containsKey(parent)) {
                    throw new ResolutionException("Parent function " + parent + " of " + function.name()
                        + " not found in class " + kind);
                }
            }
        }
    }

    private enum Mark { VISITING, DONE }

    private static void checkInheritanceCycles(Map<String, FunctionDef> functions) {
        Map<String, Mark> marks = new HashMap<>();
        for (String name : functions.keySet()) {
            visitParents(functions, name, marks, new ArrayList<>());
        }
    }

    private static void visitParents(Map<String, FunctionDef> functions, String name,
                                     Map<String, Mark> marks, List<String> path) {
        Mark mark = marks.get(name);
        if (mark == Mark.DONE) {
            return;
        }
        path.add(name);
        if (mark == Mark.VISITING) {
            throw new IllegalArgumentException("Cyclic function inheritance: " + String.join(" -> ", path));
        }
        marks.put(name, Mark.VISITING);
        FunctionDef function = functions.get(name);
        if (function != null) {
            for (String parent : function.extendsList()) {
                visitParents(functions, parent, marks, path);
            }
        }
        marks.put(name, Mark.DONE);
        path.remove(path.size() - 1);
    }

    // all functions must be attached before any projection is derived,
    // since derivation resolves parents through this class
    private void adjustParentPointers() {
        for (FunctionDef query : queries.values()) {
            query.attachClass(this);
        }
        for (FunctionDef action : actions.values()) {
            action.attachClass(this);
        }
        for (FunctionDef query : queries.values()) {
            query.updateMinimalProjection();
        }
        for (FunctionDef action : actions.values()) {
            action.updateMinimalProjection();
        }
    }

    // ==================== Accessors ====================

    public String kind() {
        return kind;
    }

    public List<String> extendsList() {
        return Collections.unmodifiableList(extendsList);
    }

    public List<MixinImport> imports() {
        return Collections.unmodifiableList(imports);
    }

    public List<EntityDef> entities() {
        return Collections.unmodifiableList(entities);
    }

    public Map<String, FunctionDef> queries() {
        return Collections.unmodifiableMap(queries);
    }

    public Map<String, FunctionDef> actions() {
        return Collections.unmodifiableMap(actions);
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public Map<String, Value> annotations() {
        return annotations;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    /**
     * Looks up a function of this class.
     *
     * @param type query or action; streams are not declared in classes
     * @param name the function name
     * @return the function, or null if there is none
     */
    public FunctionDef getFunction(FunctionType type, String name) {
        if (type == FunctionType.QUERY) {
            return queries.get(name);
        }
        if (type == FunctionType.ACTION) {
            return actions.get(name);
        }
        return null;
    }

    public Object getImplementationAnnotation(String key) {
        Value value = annotations.get(key);
        return value == null ? null : value.toJS();
    }

    public Object getNaturalLanguageAnnotation(String key) {
        return metadata.get(key);
    }

    /**
     * Returns the mixin imported with the {@code loader} facet.
     *
     * @return the loader, or null
     */
    public MixinImport loader() {
        return findImport("loader");
    }

    /**
     * Returns the mixin imported with the {@code config} facet.
     *
     * @return the config mixin, or null
     */
    public MixinImport config() {
        return findImport("config");
    }

    private MixinImport findImport(String facet) {
        for (MixinImport mixin : imports) {
            if (mixin.hasFacet(facet)) {
                return mixin;
            }
        }
        return null;
    }

    /**
     * Returns the user-visible name of this class: the {@code canonical}
     * annotation, or a name derived from the kind.
     *
     * @return the canonical form, never null
     */
    public String canonical() {
        Object canonical = metadata.get("canonical");
        if (canonical instanceof String && !((String) canonical).isEmpty()) {
            return (String) canonical;
        }
        return Names.cleanKind(kind);
    }

    /**
     * Returns the {@code version} implementation annotation.
     *
     * @return the version, or null if not annotated
     */
    public Integer version() {
        Object version = getImplementationAnnotation("version");
        return version instanceof Number ? ((Number) version).intValue() : null;
    }

    // ==================== Node ====================

    @Override
    public ClassDef clone() {
        List<MixinImport> importsCopy = new ArrayList<>(imports.size());
        for (MixinImport mixin : imports) {
            importsCopy.add(mixin.clone());
        }
        List<EntityDef> entitiesCopy = new ArrayList<>(entities.size());
        for (EntityDef entity : entities) {
            entitiesCopy.add(entity.clone());
        }
        Map<String, FunctionDef> queriesCopy = new LinkedHashMap<>();
        queries.forEach((name, query) -> queriesCopy.put(name, query.clone()));
        Map<String, FunctionDef> actionsCopy = new LinkedHashMap<>();
        actions.forEach((name, action) -> actionsCopy.put(name, action.clone()));
        Map<String, Value> impl = new LinkedHashMap<>();
        annotations.forEach((key, value) -> impl.put(key, value.clone()));

        return new ClassDef(location, kind, extendsList, importsCopy, entitiesCopy,
            queriesCopy, actionsCopy, new LinkedHashMap<>(metadata), impl, isAbstract);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitClassDef(this)) {
            for (MixinImport mixin : imports) {
                mixin.visit(visitor);
            }
            for (EntityDef entity : entities) {
                entity.visit(visitor);
            }
            for (FunctionDef query : queries.values()) {
                query.visit(visitor);
            }
            for (FunctionDef action : actions.values()) {
                action.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        StringBuilder sb = new StringBuilder();
        if (isAbstract) {
            sb.append("abstract ");
        }
        sb.append("class @").append(kind);
        if (!extendsList.isEmpty()) {
            sb.append(" extends ");
            sb.append(SourceFormat.join(extendsList, parent -> "@" + parent, ", "));
        }
        sb.append(SourceFormat.annotations(metadata, annotations));
        sb.append(" {\n");
        for (MixinImport mixin : imports) {
            sb.append("  ").append(mixin.toSource()).append('\n');
        }
        for (EntityDef entity : entities) {
            sb.append("  ").append(entity.toSource()).append('\n');
        }
        for (FunctionDef query : queries.values()) {
            sb.append("  ").append(query.toSource()).append('\n');
        }
        for (FunctionDef action : actions.values()) {
            sb.append("  ").append(action.toSource()).append('\n');
        }
        sb.append('}');
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ClassDef)) return false;
        ClassDef that = (ClassDef) obj;
        return kind.equals(that.kind)
            && isAbstract == that.isAbstract
            && extendsList.equals(that.extendsList)
            && imports.equals(that.imports)
            && entities.equals(that.entities)
            && queries.equals(that.queries)
            && actions.equals(that.actions)
            && metadata.equals(that.metadata)
            && annotations.equals(that.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, queries.keySet(), actions.keySet());
    }

    @Override
    public String toString() {
        return "ClassDef(" + kind + ", queries=" + queries.keySet() + ", actions=" + actions.keySet() + ")";
    }
}
