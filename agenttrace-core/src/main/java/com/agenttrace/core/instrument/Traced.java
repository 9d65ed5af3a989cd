package com.agenttrace.core.instrument;

import com.agenttrace.core.model.NodeType;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an interface method whose calls should be recorded as child spans when invoked through a
 * {@link TracedProxy}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Traced {

    /** Node name; the method name when empty. */
    String name() default "";

    String nodeType() default NodeType.CUSTOM;

    boolean captureArgs() default true;

    boolean captureReturn() default true;
}
