package com.thingtalk.ast;

import com.thingtalk.schema.ClassDef;
import com.thingtalk.slots.FieldSlot;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.types.EntityType;
import com.thingtalk.values.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A complete program: locally defined classes, declarations and the
 * executable statements.
 *
 * <p>The principal, when set, is the contact that runs the program on
 * behalf of the user.
 */
public final class Program extends Node {

    private final List<ClassDef> classes;
    private final List<Declaration> declarations;
    private final List<Statement> statements;
    private Value principal;

    /**
     * @param location the source location, or null
     * @param classes the locally defined classes
     * @param declarations the declarations
     * @param statements rules, commands and assignments
     * @param principal the executor of the program, or null
     */
    public Program(SourceRange location, List<ClassDef> classes, List<Declaration> declarations,
                   List<Statement> statements, Value principal) {
        super(location);
        Objects.requireNonNull(classes, "classes must not be null");
        Objects.requireNonNull(declarations, "declarations must not be null");
        Objects.requireNonNull(statements, "statements must not be null");
        for (Statement statement : statements) {
            if (statement instanceof Declaration) {
                throw new IllegalArgumentException("Declarations must be passed separately from statements");
            }
        }
        this.classes = new ArrayList<>(classes);
        this.declarations = new ArrayList<>(declarations);
        this.statements = new ArrayList<>(statements);
        this.principal = principal;
    }

    public Program(List<Statement> statements) {
        this(null, Collections.emptyList(), Collections.emptyList(), statements, null);
    }

    public List<ClassDef> classes() {
        return Collections.unmodifiableList(classes);
    }

    public List<Declaration> declarations() {
        return Collections.unmodifiableList(declarations);
    }

    public List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }

    public Value principal() {
        return principal;
    }

    public void setPrincipal(Value principal) {
        this.principal = principal;
    }

    /**
     * Adds the slots of the program: the principal if there is one, then
     * the declarations, then the statements.
     *
     * @param into the list to append to
     */
    public void iterateSlots2(List<SlotItem> into) {
        if (principal != null) {
            into.add(new FieldSlot(null, Collections.emptyMap(), new EntityType("tt:contact"),
                "program", "principal", this::principal, this::setPrincipal));
        }
        for (Declaration declaration : declarations) {
            declaration.iterateSlots2(into);
        }
        for (Statement statement : statements) {
            statement.iterateSlots2(into);
        }
    }

    /**
     * Lists the slots of the program in evaluation order.
     *
     * @return the slots
     */
    public List<SlotItem> iterateSlots2() {
        List<SlotItem> slots = new ArrayList<>();
        iterateSlots2(slots);
        return slots;
    }

    @Override
    public Program clone() {
        List<ClassDef> classesCopy = new ArrayList<>(classes.size());
        for (ClassDef classDef : classes) {
            classesCopy.add(classDef.clone());
        }
        List<Declaration> declarationsCopy = new ArrayList<>(declarations.size());
        for (Declaration declaration : declarations) {
            declarationsCopy.add(declaration.clone());
        }
        List<Statement> statementsCopy = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            statementsCopy.add(statement.clone());
        }
        return new Program(location, classesCopy, declarationsCopy, statementsCopy,
            principal == null ? null : principal.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitProgram(this)) {
            for (ClassDef classDef : classes) {
                classDef.visit(visitor);
            }
            for (Declaration declaration : declarations) {
                declaration.visit(visitor);
            }
            for (Statement statement : statements) {
                statement.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        List<String> lines = new ArrayList<>();
        if (principal != null) {
            lines.add("executor = " + principal.toSource() + " :");
        }
        for (ClassDef classDef : classes) {
            lines.add(classDef.toSource());
        }
        for (Declaration declaration : declarations) {
            lines.add(declaration.toSource());
        }
        for (Statement statement : statements) {
            lines.add(statement.toSource());
        }
        return String.join("\n", lines);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Program)) return false;
        Program that = (Program) obj;
        return classes.equals(that.classes)
            && declarations.equals(that.declarations)
            && statements.equals(that.statements)
            && Objects.equals(principal, that.principal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classes, declarations, statements, principal);
    }

    @Override
    public String toString() {
        return "Program(" + classes + ", " + declarations + ", " + statements + ", " + principal + ")";
    }
}
