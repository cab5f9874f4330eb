package org.netpreserve.consolescan.cdp.protocol;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a domain method whose result object has a single interesting field. The method then returns that
 * field's value instead of the enclosing object.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Unwrap {
    /**
     * Result field to return. Defaults to the return type's simple name with a lowercase first letter.
     */
    String value() default "";
}
