package com.thingtalk.slots;

import com.thingtalk.ast.InputParam;
import com.thingtalk.schema.ExpressionSignature;

import java.util.Collections;
import java.util.List;

/**
 * A node that calls a function or refers to a named procedure: the owner
 * of input parameters and the source of the output scope seen by the nodes
 * evaluated after it.
 */
public interface InvocationLike {

    /**
     * Returns the signature of the called function.
     *
     * @return the schema, or null before type checking
     */
    ExpressionSignature schema();

    /**
     * Returns the bound input parameters.
     *
     * @return the live parameter list
     */
    default List<InputParam> inParams() {
        return Collections.emptyList();
    }

    /**
     * Returns the kind of the device the call targets.
     *
     * @return the device kind, or null if the call has no device
     */
    default String selectorKind() {
        return null;
    }
}
