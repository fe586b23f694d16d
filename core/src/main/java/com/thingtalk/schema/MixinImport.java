package com.thingtalk.schema;

import com.thingtalk.ast.InputParam;
import com.thingtalk.ast.Node;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Import of a mixin module into a class, e.g.
 * {@code import loader from @org.thingpedia.v2();} or
 * {@code import config from @org.thingpedia.config.oauth2(client_id="...");}.
 *
 * <p>The facets name the role the mixin plays for the class.
 */
public final class MixinImport extends Node {

    private final List<String> facets;
    private final String module;
    private final List<InputParam> inParams;

    public MixinImport(SourceRange location, List<String> facets, String module, List<InputParam> inParams) {
        super(location);
        Objects.requireNonNull(facets, "facets must not be null");
        this.module = Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(inParams, "inParams must not be null");
        if (facets.isEmpty()) {
            throw new IllegalArgumentException("Mixin import of " + module + " must have at least one facet");
        }
        this.facets = new ArrayList<>(facets);
        this.inParams = new ArrayList<>(inParams);
    }

    public MixinImport(List<String> facets, String module, List<InputParam> inParams) {
        this(null, facets, module, inParams);
    }

    public List<String> facets() {
        return Collections.unmodifiableList(facets);
    }

    public String module() {
        return module;
    }

    /**
     * Returns the live parameter list.
     *
     * @return the parameters
     */
    public List<InputParam> inParams() {
        return inParams;
    }

    public boolean hasFacet(String facet) {
        return facets.contains(facet);
    }

    @Override
    public MixinImport clone() {
        List<InputParam> params = new ArrayList<>(inParams.size());
        for (InputParam param : inParams) {
            params.add(param.clone());
        }
        return new MixinImport(location, facets, module, params);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitMixinImport(this)) {
            for (InputParam param : inParams) {
                param.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "import " + String.join(", ", facets) + " from @" + module
            + "(" + SourceFormat.join(inParams, InputParam::toSource, ", ") + ");";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MixinImport)) return false;
        MixinImport that = (MixinImport) obj;
        return facets.equals(that.facets) && module.equals(that.module) && inParams.equals(that.inParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(facets, module, inParams);
    }

    @Override
    public String toString() {
        return "MixinImport(" + facets + ", " + module + ", " + inParams + ")";
    }
}
