package com.github.salilvnair.chatflow.engine.pipeline.annotation;

import java.lang.annotation.*;

/**
 * Marks the step that always runs last and always produces the result.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TerminalStep {
}
