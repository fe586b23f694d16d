package com.thingtalk.test;

import org.junit.jupiter.api.Tag;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tag annotations used to select groups of tests.
 *
 * <p>Run a single group with {@code mvn test -Dgroups=tier1}.
 */
public final class TestCategories {

    private TestCategories() {} // Utility class

    // ==================== Tiers ====================

    /** Fast tests run on every build. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier1")
    public @interface Tier1 {}

    /** Slower scenario tests. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier2")
    public @interface Tier2 {}

    // ==================== Kinds ====================

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("unit")
    public @interface Unit {}

    /** Tests of tree rewriting: optimizer and clone semantics. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("rewrite")
    public @interface Rewrite {}

    /** Tests of interchange formats: surface syntax and manifests. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("interchange")
    public @interface Interchange {}
}
