package com.thingtalk.validation;

import com.thingtalk.ast.InputParam;
import com.thingtalk.ast.Invocation;
import com.thingtalk.ast.Node;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.PermissionRule;
import com.thingtalk.ast.Program;
import com.thingtalk.ast.SpecifiedPermissionFunction;
import com.thingtalk.exception.TypeCheckException;
import com.thingtalk.expression.BooleanExpression;
import com.thingtalk.expression.ExternalBooleanExpression;
import com.thingtalk.expression.TrueBooleanExpression;
import com.thingtalk.logical.EdgeFilterStream;
import com.thingtalk.logical.FilteredStream;
import com.thingtalk.logical.FilteredTable;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.schema.FunctionDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks a type-checked program against the signatures of the functions it
 * invokes.
 *
 * <p>Validation runs after the external type-checker has attached a schema
 * to every invocation. A program that passes may be compiled; one that
 * fails must not be executed.
 *
 * <p>Checks performed:
 * <ul>
 *   <li>every invocation, external predicate and permission function has a schema</li>
 *   <li>every input parameter names an input argument of that schema</li>
 *   <li>every required input argument is bound</li>
 *   <li>queries annotated {@code require_filter} are invoked under a filter</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 *   SchemaValidator.validate(program);  // throws TypeCheckException
 * </pre>
 */
public final class SchemaValidator {

    private static final Logger logger = LoggerFactory.getLogger(SchemaValidator.class);

    private SchemaValidator() {} // Utility class

    /**
     * Validates a program.
     *
     * @param program the program
     * @throws TypeCheckException on the first violation found
     */
    public static void validate(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        program.visit(new ValidatingVisitor());
        logger.debug("Program validated: {}", program.toSource());
    }

    /**
     * Validates a permission rule.
     *
     * @param rule the rule
     * @throws TypeCheckException on the first violation found
     */
    public static void validate(PermissionRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        rule.visit(new ValidatingVisitor());
        logger.debug("Permission rule validated: {}", rule.toSource());
    }

    // ==================== Checks ====================

    private static void checkInputParams(FunctionDef schema, List<InputParam> inParams, String context) {
        Set<String> bound = new HashSet<>();
        for (InputParam param : inParams) {
            String name = param.name();
            if (!schema.hasArgument(name)) {
                throw new TypeCheckException(
                    "Unknown argument " + name + " of " + schema.qualifiedName(),
                    "input parameter validation", context,
                    "Use one of the arguments declared by " + schema.qualifiedName());
            }
            if (!Boolean.TRUE.equals(schema.isArgInput(name))) {
                throw new TypeCheckException(
                    "Output argument " + name + " of " + schema.qualifiedName() + " cannot be passed as input",
                    "input parameter validation", context,
                    "Filter on " + name + " instead of passing it");
            }
            if (!bound.add(name)) {
                throw new TypeCheckException(
                    "Duplicate input parameter " + name,
                    "input parameter validation", context, null);
            }
        }

        for (ArgumentDef arg : schema.iterateArguments()) {
            // compound fields are bound through their parent argument
            if (arg.name().indexOf('.') >= 0 || !arg.isInput() || !arg.isRequired()) {
                continue;
            }
            if (!bound.contains(arg.name())) {
                throw new TypeCheckException(
                    "Missing required argument " + arg.name() + " of " + schema.qualifiedName(),
                    "input parameter validation", context,
                    "Pass " + arg.name() + " or use $? to ask the user for it");
            }
        }
    }

    private static FunctionDef requireSchema(FunctionDef schema, String function, String context) {
        if (schema == null) {
            throw new TypeCheckException(
                "Missing schema for " + function,
                "schema resolution", context,
                "Type-check the program before validating it");
        }
        return schema;
    }

    private static boolean hasFilter(BooleanExpression filter) {
        return !(filter instanceof TrueBooleanExpression);
    }

    // ==================== Visitor ====================

    private static final class ValidatingVisitor extends NodeVisitor {

        private int filterDepth = 0;

        private static boolean isFilterNode(Node node) {
            if (node instanceof FilteredTable) {
                return hasFilter(((FilteredTable) node).filter());
            }
            if (node instanceof FilteredStream) {
                return hasFilter(((FilteredStream) node).filter());
            }
            if (node instanceof EdgeFilterStream) {
                return hasFilter(((EdgeFilterStream) node).filter());
            }
            return false;
        }

        @Override
        public void enter(Node node) {
            if (isFilterNode(node)) {
                filterDepth++;
            }
        }

        @Override
        public void exit(Node node) {
            if (isFilterNode(node)) {
                filterDepth--;
            }
        }

        @Override
        public boolean visitInvocation(Invocation node) {
            String context = node.toSource();
            FunctionDef schema = requireSchema(node.schema(), node.selectorKind() + "." + node.channel(), context);
            checkInputParams(schema, node.inParams(), context);
            if (schema.requireFilter() && filterDepth == 0) {
                throw new TypeCheckException(
                    "Query " + schema.qualifiedName() + " requires a filter",
                    "filter validation", context,
                    "Add a filter on one of the output arguments");
            }
            return true;
        }

        @Override
        public boolean visitExternalBooleanExpression(ExternalBooleanExpression node) {
            String context = node.toSource();
            FunctionDef schema = requireSchema(node.schema(), node.selectorKind() + "." + node.channel(), context);
            checkInputParams(schema, node.inParams(), context);
            if (schema.requireFilter() && !hasFilter(node.filter())) {
                throw new TypeCheckException(
                    "Query " + schema.qualifiedName() + " requires a filter",
                    "filter validation", context,
                    "Add a filter on one of the output arguments");
            }
            return true;
        }

        @Override
        public boolean visitSpecifiedPermissionFunction(SpecifiedPermissionFunction node) {
            requireSchema(node.schema(), node.kind() + "." + node.channel(), node.toSource());
            return true;
        }
    }
}
