package com.example.laborhours.export.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a public bean method whose wall-clock duration should be logged.
 * Only calls that go through the Spring proxy are timed.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogExecutionTime {
    /**
     * Human readable label for the timed stage
     */
    String value() default "";
}
