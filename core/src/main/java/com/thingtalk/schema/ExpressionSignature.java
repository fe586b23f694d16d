package com.thingtalk.schema;

import com.thingtalk.ast.Node;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.exception.ResolutionException;
import com.thingtalk.types.ArrayType;
import com.thingtalk.types.CompoundType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The functional type of a query, stream or action expression: an ordered
 * list of named, typed and directioned arguments.
 *
 * <p>Compound arguments are flattened on construction: each (nested) field
 * of a compound or array-of-compound argument becomes an extra argument
 * named by its dotted path ({@code p.x}), with the direction of the
 * top-level argument. A flattened field whose name is already present is
 * skipped; two top-level arguments with the same name are rejected.
 *
 * <p>A signature may extend other functions of its class by name. Argument
 * lookups check the local arguments first and then each parent in
 * declaration order; the first parent that has the argument answers.
 * Parents are looked up through the owning {@link ClassDef}, so a signature
 * with a non-empty {@code extends} list that is not attached to a class
 * fails with a {@link ResolutionException} as soon as it needs a parent.
 *
 * <p>Signatures are semi-immutable: {@link #addArguments}, {@link #removeArgument},
 * {@link #filterArguments} and {@link #asType} return new instances.
 */
public class ExpressionSignature extends Node {

    protected final FunctionType functionType;
    protected ClassDef classDef;
    protected final List<String> extendsList;

    private final List<String> args;
    private final Map<String, ArgumentDef> argMap;
    private final Map<String, Type> inReq;
    private final Map<String, Type> inOpt;
    private final Map<String, Type> out;

    protected boolean isList;
    protected boolean isMonitorable;
    protected boolean requireFilter;
    protected boolean noFilter;
    protected List<String> defaultProjection;
    protected List<String> minimalProjection;
    protected boolean minimalProjectionExplicit;

    /**
     * Creates a signature.
     *
     * @param location the source location, or null
     * @param functionType whether this is a query, stream or action
     * @param classDef the owning class, or null
     * @param extendsList names of the parent functions
     * @param args the arguments, before flattening
     * @param isList whether the query returns a list
     * @param isMonitorable whether the query can be monitored
     * @param requireFilter whether the query must be filtered
     * @param defaultProjection the default projection, empty for none
     * @param minimalProjection the minimal projection, or null to derive it
     * @param noFilter whether filters are disallowed
     */
    public ExpressionSignature(SourceRange location,
                               FunctionType functionType,
                               ClassDef classDef,
                               List<String> extendsList,
                               List<ArgumentDef> args,
                               boolean isList,
                               boolean isMonitorable,
                               boolean requireFilter,
                               List<String> defaultProjection,
                               List<String> minimalProjection,
                               boolean noFilter) {
        super(location);
        this.functionType = Objects.requireNonNull(functionType, "functionType must not be null");
        Objects.requireNonNull(args, "args must not be null");
        this.classDef = classDef;
        this.extendsList = extendsList == null ? new ArrayList<>() : new ArrayList<>(extendsList);

        this.args = new ArrayList<>();
        this.argMap = new LinkedHashMap<>();
        this.inReq = new LinkedHashMap<>();
        this.inOpt = new LinkedHashMap<>();
        this.out = new LinkedHashMap<>();
        loadArguments(flattenCompoundArguments(args));

        this.isList = isList;
        this.isMonitorable = isMonitorable;
        this.requireFilter = requireFilter;
        this.noFilter = noFilter;
        this.defaultProjection = defaultProjection == null ? new ArrayList<>() : new ArrayList<>(defaultProjection);
        this.minimalProjectionExplicit = minimalProjection != null;
        this.minimalProjection = minimalProjection == null ? null : new ArrayList<>(minimalProjection);
    }

    /**
     * Creates a plain signature with no qualifiers and no parents.
     *
     * @param functionType the function type
     * @param args the arguments
     */
    public ExpressionSignature(FunctionType functionType, List<ArgumentDef> args) {
        this(null, functionType, null, Collections.emptyList(), args, false, false, false,
            Collections.emptyList(), null, false);
    }

    // ==================== Flattening ====================

    private static List<ArgumentDef> flattenCompoundArguments(List<ArgumentDef> args) {
        List<ArgumentDef> flattened = new ArrayList<>(args);
        Set<String> existed = new HashSet<>();
        for (ArgumentDef arg : args) {
            if (!existed.add(arg.name())) {
                throw new IllegalArgumentException("Duplicate argument " + arg.name());
            }
        }
        for (ArgumentDef arg : args) {
            flattenFields(existed, arg, flattened);
        }
        return flattened;
    }

    private static void flattenFields(Set<String> existed, ArgumentDef parent, List<ArgumentDef> into) {
        CompoundType compound = compoundOf(parent.type());
        if (compound == null) {
            return;
        }
        for (ArgumentDef field : compound.fields().values()) {
            ArgumentDef hoisted = new ArgumentDef(field.location(), parent.direction(),
                parent.name() + "." + field.name(), field.type(), field.metadata(), field.annotations());
            if (existed.add(hoisted.name())) {
                into.add(hoisted);
            }
            flattenFields(existed, hoisted, into);
        }
    }

    private static CompoundType compoundOf(Type type) {
        if (type instanceof CompoundType) {
            return (CompoundType) type;
        }
        if (type instanceof ArrayType && ((ArrayType) type).elementType() instanceof CompoundType) {
            return (CompoundType) ((ArrayType) type).elementType();
        }
        return null;
    }

    private void loadArguments(List<ArgumentDef> flattened) {
        for (ArgumentDef arg : flattened) {
            args.add(arg.name());
            argMap.put(arg.name(), arg);
            if (arg.isInput() && arg.isRequired()) {
                inReq.put(arg.name(), arg.type());
            } else if (arg.isInput()) {
                inOpt.put(arg.name(), arg.type());
            } else {
                out.put(arg.name(), arg.type());
            }
        }
    }

    // ==================== Accessors ====================

    public FunctionType functionType() {
        return functionType;
    }

    /**
     * Returns the class this signature belongs to.
     *
     * @return the owning class, or null if detached
     */
    public ClassDef classDef() {
        return classDef;
    }

    /**
     * Returns the names of the parent functions.
     *
     * @return an unmodifiable list
     */
    public List<String> extendsList() {
        return Collections.unmodifiableList(extendsList);
    }

    /**
     * Returns the names of the local arguments, including flattened fields
     * but not inherited arguments.
     *
     * @return an unmodifiable list of names, in declaration order
     */
    public List<String> args() {
        return Collections.unmodifiableList(args);
    }

    /**
     * Returns the types of all arguments, inherited ones included, in
     * {@link #iterateArguments()} order.
     *
     * @return the argument types
     */
    public List<Type> types() {
        List<Type> types = new ArrayList<>();
        for (ArgumentDef arg : iterateArguments()) {
            types.add(arg.type());
        }
        return types;
    }

    /**
     * Returns the position of each local argument.
     *
     * @return argument index by name
     * @throws IllegalStateException if this signature extends other functions
     */
    public Map<String, Integer> index() {
        if (!extendsList.isEmpty()) {
            throw new IllegalStateException("The argument index cannot be used with function inheritance");
        }
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < args.size(); i++) {
            index.put(args.get(i), i);
        }
        return index;
    }

    public Map<String, Type> inReq() {
        if (extendsList.isEmpty()) {
            return Collections.unmodifiableMap(inReq);
        }
        Map<String, Type> result = new LinkedHashMap<>();
        for (ArgumentDef arg : iterateArguments()) {
            if (arg.isInput() && arg.isRequired()) {
                result.put(arg.name(), arg.type());
            }
        }
        return result;
    }

    public Map<String, Type> inOpt() {
        if (extendsList.isEmpty()) {
            return Collections.unmodifiableMap(inOpt);
        }
        Map<String, Type> result = new LinkedHashMap<>();
        for (ArgumentDef arg : iterateArguments()) {
            if (arg.isInput() && !arg.isRequired()) {
                result.put(arg.name(), arg.type());
            }
        }
        return result;
    }

    public Map<String, Type> out() {
        if (extendsList.isEmpty()) {
            return Collections.unmodifiableMap(out);
        }
        Map<String, Type> result = new LinkedHashMap<>();
        for (ArgumentDef arg : iterateArguments()) {
            if (!arg.isInput()) {
                result.put(arg.name(), arg.type());
            }
        }
        return result;
    }

    public boolean isList() {
        return isList;
    }

    public void setList(boolean isList) {
        this.isList = isList;
    }

    public boolean isMonitorable() {
        return isMonitorable;
    }

    public void setMonitorable(boolean isMonitorable) {
        this.isMonitorable = isMonitorable;
    }

    public boolean requireFilter() {
        return requireFilter;
    }

    public void setRequireFilter(boolean requireFilter) {
        this.requireFilter = requireFilter;
    }

    public boolean noFilter() {
        return noFilter;
    }

    public void setNoFilter(boolean noFilter) {
        this.noFilter = noFilter;
    }

    public List<String> defaultProjection() {
        return Collections.unmodifiableList(defaultProjection);
    }

    public void setDefaultProjection(List<String> defaultProjection) {
        Objects.requireNonNull(defaultProjection, "defaultProjection must not be null");
        this.defaultProjection = new ArrayList<>(defaultProjection);
        checkProjections();
    }

    /**
     * Returns the arguments present in every result.
     *
     * <p>Unless set explicitly, this is {@code ["id"]} when an output
     * argument named {@code id} exists (possibly inherited), and empty
     * otherwise.
     *
     * @return the minimal projection
     * @throws ResolutionException if it must be derived from parents and
     *         this signature is not attached to a class
     */
    public List<String> minimalProjection() {
        if (minimalProjection == null) {
            minimalProjection = deriveMinimalProjection();
            checkProjections();
        }
        return Collections.unmodifiableList(minimalProjection);
    }

    public void setMinimalProjection(List<String> minimalProjection) {
        Objects.requireNonNull(minimalProjection, "minimalProjection must not be null");
        this.minimalProjection = new ArrayList<>(minimalProjection);
        this.minimalProjectionExplicit = true;
        checkProjections();
    }

    /**
     * Recomputes the derived minimal projection, if it can be computed
     * without an owning class or the class is known.
     */
    protected void updateMinimalProjection() {
        if (minimalProjectionExplicit) {
            checkProjections();
            return;
        }
        if (classDef != null || !inheritsArguments()) {
            minimalProjection = deriveMinimalProjection();
            checkProjections();
        } else {
            minimalProjection = null;
        }
    }

    private List<String> deriveMinimalProjection() {
        ArgumentDef id = getArgument("id");
        List<String> result = new ArrayList<>();
        if (id != null && !id.isInput()) {
            result.add("id");
        }
        return result;
    }

    private void checkProjections() {
        if (defaultProjection.isEmpty() || minimalProjection == null) {
            return;
        }
        for (String arg : minimalProjection) {
            if (!defaultProjection.contains(arg)) {
                throw new IllegalArgumentException("Minimal projection argument " + arg
                    + " must be part of the default projection " + defaultProjection);
            }
        }
    }

    // ==================== Inheritance ====================

    /**
     * Returns whether argument lookups continue into the parent functions.
     *
     * @return true if this signature has parents whose arguments it inherits
     */
    protected boolean inheritsArguments() {
        return !extendsList.isEmpty();
    }

    private List<ExpressionSignature> parents() {
        if (!inheritsArguments()) {
            return Collections.emptyList();
        }
        if (classDef == null) {
            throw new ResolutionException("Class information missing from the function definition");
        }
        List<ExpressionSignature> parents = new ArrayList<>(extendsList.size());
        for (String parentName : extendsList) {
            FunctionDef parent = classDef.getFunction(functionType.parentLookupType(), parentName);
            if (parent == null) {
                throw new ResolutionException("Parent function " + parentName + " not found in class "
                    + classDef.kind());
            }
            parents.add(parent);
        }
        return parents;
    }

    /**
     * Returns whether this signature or one of its parents has the argument.
     *
     * @param name the argument name, possibly dotted
     * @return true if the argument exists
     */
    public boolean hasArgument(String name) {
        return getArgument(name) != null;
    }

    /**
     * Looks up an argument locally, then in each parent in order.
     *
     * @param name the argument name
     * @return the definition, or null if no signature in the chain has it
     */
    public ArgumentDef getArgument(String name) {
        ArgumentDef local = argMap.get(name);
        if (local != null) {
            return local;
        }
        for (ExpressionSignature parent : parents()) {
            ArgumentDef inherited = parent.getArgument(name);
            if (inherited != null) {
                return inherited;
            }
        }
        return null;
    }

    public Type getArgType(String name) {
        ArgumentDef arg = getArgument(name);
        return arg == null ? null : arg.type();
    }

    public String getArgCanonical(String name) {
        ArgumentDef arg = getArgument(name);
        return arg == null ? null : arg.canonical();
    }

    public Map<String, Object> getArgMetadata(String name) {
        ArgumentDef arg = getArgument(name);
        return arg == null ? null : arg.metadata();
    }

    /**
     * Returns whether the argument is an input.
     *
     * @param name the argument name
     * @return true or false, or null if the argument does not exist
     */
    public Boolean isArgInput(String name) {
        ArgumentDef arg = getArgument(name);
        return arg == null ? null : arg.isInput();
    }

    /**
     * Returns whether the argument is required.
     *
     * @param name the argument name
     * @return true or false, or null if the argument does not exist
     */
    public Boolean isArgRequired(String name) {
        ArgumentDef arg = getArgument(name);
        return arg == null ? null : arg.isRequired();
    }

    /**
     * Lists every argument of this signature, local ones first, then those
     * of each parent in order. A name is listed once, at its first
     * occurrence.
     *
     * @return the arguments
     */
    public List<ArgumentDef> iterateArguments() {
        List<ArgumentDef> result = new ArrayList<>();
        collectArguments(new HashSet<>(), result);
        return result;
    }

    private void collectArguments(Set<String> returned, List<ArgumentDef> into) {
        for (String name : args) {
            if (returned.add(name)) {
                into.add(argMap.get(name));
            }
        }
        for (ExpressionSignature parent : parents()) {
            parent.collectArguments(returned, into);
        }
    }

    public boolean hasAnyInputArg() {
        return iterateArguments().stream().anyMatch(ArgumentDef::isInput);
    }

    public boolean hasAnyOutputArg() {
        return iterateArguments().stream().anyMatch(arg -> !arg.isInput());
    }

    // ==================== Derived signatures ====================

    /**
     * Creates a copy of this signature with the given local arguments.
     *
     * @param newArgs the arguments of the copy
     * @param flattened whether inherited arguments were materialized, in
     *        which case the copy has no parents
     * @param newType the function type of the copy
     * @return the copy
     */
    protected ExpressionSignature cloneInternal(List<ArgumentDef> newArgs, boolean flattened, FunctionType newType) {
        ExpressionSignature clone = new ExpressionSignature(location, newType, classDef,
            flattened ? Collections.emptyList() : extendsList, cloneAll(newArgs),
            isList, isMonitorable, requireFilter, defaultProjection,
            minimalProjectionExplicit ? minimalProjection : null, noFilter);
        clone.updateMinimalProjection();
        return clone;
    }

    protected static List<ArgumentDef> cloneAll(List<ArgumentDef> args) {
        List<ArgumentDef> copy = new ArrayList<>(args.size());
        for (ArgumentDef arg : args) {
            copy.add(arg.clone());
        }
        return copy;
    }

    protected List<ArgumentDef> localArguments() {
        List<ArgumentDef> local = new ArrayList<>(args.size());
        for (String name : args) {
            local.add(argMap.get(name));
        }
        return local;
    }

    protected boolean hasLocalArgument(String name) {
        return argMap.containsKey(name);
    }

    @Override
    public ExpressionSignature clone() {
        return cloneInternal(localArguments(), false, functionType);
    }

    /**
     * Returns a copy of this signature with extra arguments appended.
     *
     * <p>Top-level names must be new: appending an argument whose name is
     * already declared locally is rejected rather than shadowing it.
     * Flattened fields of the appended arguments skip names that already
     * exist.
     *
     * @param toAdd the arguments to add
     * @return the new signature
     * @throws IllegalArgumentException if an appended argument has the name
     *         of an existing local argument
     */
    public ExpressionSignature addArguments(List<ArgumentDef> toAdd) {
        List<ArgumentDef> newArgs = localArguments();
        newArgs.addAll(toAdd);
        return cloneInternal(newArgs, false, functionType);
    }

    /**
     * Returns a copy of this signature without the named argument.
     *
     * <p>Removing an inherited argument materializes all inherited arguments
     * in the copy, which no longer extends any function. Removing an argument
     * that does not exist returns this signature.
     *
     * @param name the argument to remove
     * @return the new signature, or this one
     */
    public ExpressionSignature removeArgument(String name) {
        if (hasLocalArgument(name)) {
            List<ArgumentDef> newArgs = localArguments();
            newArgs.removeIf(arg -> arg.name().equals(name));
            return cloneInternal(newArgs, false, functionType);
        }
        if (hasArgument(name)) {
            List<ArgumentDef> newArgs = iterateArguments();
            newArgs.removeIf(arg -> arg.name().equals(name));
            return cloneInternal(newArgs, true, functionType);
        }
        return this;
    }

    /**
     * Returns a copy of this signature with only the arguments, inherited
     * ones included, that pass the filter. The copy extends no function.
     *
     * @param filter the argument filter
     * @return the new signature
     */
    public ExpressionSignature filterArguments(Predicate<ArgumentDef> filter) {
        List<ArgumentDef> newArgs = new ArrayList<>();
        for (ArgumentDef arg : iterateArguments()) {
            if (filter.test(arg)) {
                newArgs.add(arg);
            }
        }
        return cloneInternal(newArgs, true, functionType);
    }

    /**
     * Returns a copy of this signature with a different function type, as
     * when a monitored query becomes a stream.
     *
     * @param type the new function type
     * @return the new signature
     */
    public ExpressionSignature asType(FunctionType type) {
        return cloneInternal(localArguments(), false, type);
    }

    // ==================== Node ====================

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitExpressionSignature(this)) {
            visitArguments(visitor);
        }
        visitor.exit(this);
    }

    protected void visitArguments(NodeVisitor visitor) {
        for (String name : args) {
            argMap.get(name).visit(visitor);
        }
    }

    /**
     * Prints the top-level arguments in parentheses; flattened fields are
     * part of their compound's type and are not printed.
     *
     * @return the argument list
     */
    protected String argumentsSource() {
        List<ArgumentDef> topLevel = new ArrayList<>();
        for (String name : args) {
            if (name.indexOf('.') < 0) {
                topLevel.add(argMap.get(name));
            }
        }
        return "(" + SourceFormat.join(topLevel, ArgumentDef::toSource, ", ") + ")";
    }

    protected String qualifiersSource() {
        return (isMonitorable ? "monitorable " : "") + (isList ? "list " : "");
    }

    @Override
    public String toSource() {
        return qualifiersSource() + functionType.keyword() + " " + argumentsSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || obj.getClass() != getClass()) return false;
        ExpressionSignature that = (ExpressionSignature) obj;
        return functionType == that.functionType
            && extendsList.equals(that.extendsList)
            && localArguments().equals(that.localArguments())
            && isList == that.isList
            && isMonitorable == that.isMonitorable
            && requireFilter == that.requireFilter
            && noFilter == that.noFilter
            && defaultProjection.equals(that.defaultProjection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionType, extendsList, args);
    }

    @Override
    public String toString() {
        return "ExpressionSignature(" + functionType.keyword() + ", " + args + ")";
    }
}
