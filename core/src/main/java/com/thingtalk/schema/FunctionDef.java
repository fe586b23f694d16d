package com.thingtalk.schema;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.exception.ResolutionException;
import com.thingtalk.util.SourceFormat;
import com.thingtalk.values.ArrayValue;
import com.thingtalk.values.BooleanValue;
import com.thingtalk.values.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named query or action declared inside a class.
 *
 * <p>The {@code require_filter}, {@code default_projection} and
 * {@code minimal_projection} implementation annotations initialize the
 * corresponding signature properties. The {@code inherit_arguments}
 * annotation set to false turns off argument inheritance from the parent
 * functions.
 *
 * <p>When no minimal projection is annotated, it is derived once the owning
 * class is known ({@link #setClass}), since an {@code id} argument may be
 * inherited.
 */
public final class FunctionDef extends ExpressionSignature {

    private final String name;
    private String qualifiedName;
    private final Map<String, Object> metadata;
    private final Map<String, Value> annotations;

    /**
     * Creates a function definition.
     *
     * @param location the source location, or null
     * @param functionType query or action (stream when converted from a query)
     * @param classDef the owning class, or null if not yet known
     * @param name the function name
     * @param extendsList names of parent functions
     * @param isList whether the query returns more than one result
     * @param isMonitorable whether the query can be monitored
     * @param args the declared arguments
     * @param metadata natural-language annotations
     * @param annotations implementation annotations
     * @throws IllegalArgumentException if an action is list or monitorable
     */
    public FunctionDef(SourceRange location,
                       FunctionType functionType,
                       ClassDef classDef,
                       String name,
                       List<String> extendsList,
                       boolean isList,
                       boolean isMonitorable,
                       List<ArgumentDef> args,
                       Map<String, Object> metadata,
                       Map<String, Value> annotations) {
        super(location, functionType, classDef, extendsList, args, isList, isMonitorable,
            booleanAnnotation(annotations, "require_filter"),
            stringListAnnotation(annotations, "default_projection"),
            stringListAnnotation(annotations, "minimal_projection"),
            false);
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        if (functionType == FunctionType.ACTION && (isList || isMonitorable)) {
            throw new IllegalArgumentException("Action " + name + " cannot be list or monitorable");
        }
        this.name = name;
        this.qualifiedName = (classDef == null ? "" : classDef.kind()) + "." + name;
        this.metadata = new LinkedHashMap<>(metadata);
        this.annotations = new LinkedHashMap<>(annotations);
        updateMinimalProjection();
    }

    public FunctionDef(FunctionType functionType, String name, List<ArgumentDef> args) {
        this(null, functionType, null, name, Collections.emptyList(), false, false, args,
            Collections.emptyMap(), Collections.emptyMap());
    }

    private static boolean booleanAnnotation(Map<String, Value> annotations, String key) {
        Objects.requireNonNull(annotations, "annotations must not be null");
        Value value = annotations.get(key);
        return value instanceof BooleanValue && ((BooleanValue) value).value();
    }

    private static List<String> stringListAnnotation(Map<String, Value> annotations, String key) {
        Value value = annotations.get(key);
        if (!(value instanceof ArrayValue)) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Value element : ((ArrayValue) value).values()) {
            result.add(String.valueOf(element.toJS()));
        }
        return result;
    }

    // ==================== Accessors ====================

    public String name() {
        return name;
    }

    /**
     * Returns {@code <class kind>.<name>}, or {@code .<name>} when the
     * function has no class.
     *
     * @return the qualified name
     */
    public String qualifiedName() {
        return qualifiedName;
    }

    /**
     * Returns the natural-language annotations (canonical, confirmation,
     * formatted, ...). The map is live.
     *
     * @return the annotations
     */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * Returns the implementation annotations (url, poll_interval, ...). The
     * map is live.
     *
     * @return the annotations
     */
    public Map<String, Value> annotations() {
        return annotations;
    }

    public Object getImplementationAnnotation(String key) {
        Value value = annotations.get(key);
        return value == null ? null : value.toJS();
    }

    public Object getNaturalLanguageAnnotation(String key) {
        return metadata.get(key);
    }

    /**
     * Returns the {@code canonical} annotation.
     *
     * @return the canonical form, or null if not annotated
     */
    public String canonical() {
        Object canonical = metadata.get("canonical");
        return canonical == null ? null : String.valueOf(canonical);
    }

    /**
     * Returns the {@code confirmation} annotation.
     *
     * @return the confirmation string, or null if not annotated
     */
    public String confirmation() {
        Object confirmation = metadata.get("confirmation");
        return confirmation == null ? null : String.valueOf(confirmation);
    }

    /**
     * Returns whether running this function needs user confirmation: the
     * {@code confirm} annotation when present, otherwise true for actions
     * only.
     *
     * @return whether to confirm
     */
    public boolean confirm() {
        Value confirm = annotations.get("confirm");
        if (confirm instanceof BooleanValue) {
            return ((BooleanValue) confirm).value();
        }
        return functionType == FunctionType.ACTION;
    }

    @Override
    protected boolean inheritsArguments() {
        return super.inheritsArguments() && !Boolean.FALSE.equals(getImplementationAnnotation("inherit_arguments"));
    }

    // ==================== Class attachment ====================

    /**
     * Attaches this function to its class and derives the minimal projection
     * if it was not annotated.
     *
     * @param klass the owning class, or null to detach
     */
    public void setClass(ClassDef klass) {
        attachClass(klass);
        updateMinimalProjection();
    }

    /**
     * Sets the class back-pointer without deriving projections, so that a
     * class can attach all its functions before any of them walks its
     * parents.
     */
    void attachClass(ClassDef klass) {
        this.classDef = klass;
        this.qualifiedName = (klass == null ? "" : klass.kind()) + "." + name;
    }

    public void removeDefaultProjection() {
        this.defaultProjection = new ArrayList<>();
        annotations.remove("default_projection");
    }

    public void removeMinimalProjection() {
        this.minimalProjection = new ArrayList<>();
        this.minimalProjectionExplicit = true;
        annotations.remove("minimal_projection");
    }

    /**
     * Lists the name of this function, then the names of all its parents,
     * depth first in declaration order.
     *
     * @return the function names
     * @throws ResolutionException if the class is missing or a parent does not exist
     */
    public List<String> iterateBaseFunctions() {
        List<String> result = new ArrayList<>();
        result.add(name);
        if (extendsList.isEmpty()) {
            return result;
        }
        if (classDef == null) {
            throw new ResolutionException("Class information missing from the function definition " + name);
        }
        for (String parentName : extendsList) {
            FunctionDef parent = classDef.getFunction(functionType.parentLookupType(), parentName);
            if (parent == null) {
                throw new ResolutionException("Parent function " + parentName + " not found");
            }
            result.addAll(parent.iterateBaseFunctions());
        }
        return result;
    }

    // ==================== Derived definitions ====================

    @Override
    protected FunctionDef cloneInternal(List<ArgumentDef> newArgs, boolean flattened, FunctionType newType) {
        Map<String, Value> impl = new LinkedHashMap<>();
        annotations.forEach((key, value) -> impl.put(key, value.clone()));
        FunctionDef clone = new FunctionDef(location, newType, classDef, name,
            flattened ? Collections.emptyList() : extendsList,
            isList, isMonitorable, cloneAll(newArgs), new LinkedHashMap<>(metadata), impl);
        clone.requireFilter = requireFilter;
        clone.noFilter = noFilter;
        clone.defaultProjection = new ArrayList<>(defaultProjection);
        if (minimalProjectionExplicit) {
            clone.minimalProjection = new ArrayList<>(minimalProjection);
            clone.minimalProjectionExplicit = true;
        }
        clone.updateMinimalProjection();
        return clone;
    }

    @Override
    public FunctionDef clone() {
        return cloneInternal(localArguments(), false, functionType);
    }

    @Override
    public FunctionDef addArguments(List<ArgumentDef> toAdd) {
        return (FunctionDef) super.addArguments(toAdd);
    }

    @Override
    public FunctionDef removeArgument(String argName) {
        return (FunctionDef) super.removeArgument(argName);
    }

    @Override
    public FunctionDef filterArguments(Predicate<ArgumentDef> filter) {
        return (FunctionDef) super.filterArguments(filter);
    }

    @Override
    public FunctionDef asType(FunctionType type) {
        return (FunctionDef) super.asType(type);
    }

    // ==================== Node ====================

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitFunctionDef(this)) {
            visitArguments(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        StringBuilder sb = new StringBuilder(qualifiersSource());
        sb.append(functionType.keyword()).append(' ').append(name);
        if (!extendsList.isEmpty()) {
            sb.append(" extends ").append(String.join(", ", extendsList));
        }
        sb.append(argumentsSource());
        sb.append(SourceFormat.annotations(metadata, annotations));
        sb.append(';');
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        FunctionDef that = (FunctionDef) obj;
        return name.equals(that.name)
            && metadata.equals(that.metadata)
            && annotations.equals(that.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), name);
    }

    @Override
    public String toString() {
        return "FunctionDef(" + qualifiedName + ")";
    }
}
