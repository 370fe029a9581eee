package io.deephaven.pivot.annotations;

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The style for specification objects that are assembled through a builder, with defaults for most attributes.
 */
@Target({ElementType.TYPE, ElementType.PACKAGE})
@Retention(RetentionPolicy.CLASS)
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE,
        defaults = @Value.Immutable(copy = false), strictBuilder = false, weakInterning = true,
        jdkOnly = true)
public @interface BuildableStyle {
    // Note: this produces ImmutableX.builder()s for the implementation classes
}
