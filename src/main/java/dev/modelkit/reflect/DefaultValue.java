package dev.modelkit.reflect;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the value a parameter takes when a call supplies it neither positionally nor by
 * keyword.
 *
 * <p>The literal is JSON and is read into the parameter's declared type, e.g. {@code "false"},
 * {@code "0.1"}, {@code "[1, 2]"}. {@code String} parameters take the literal verbatim and
 * {@code "null"} always means null.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface DefaultValue {
    String value();
}
