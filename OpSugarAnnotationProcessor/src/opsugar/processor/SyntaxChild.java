package opsugar.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

// A List accessor is a sequence slot and must return the mutable backing list. Any other
// accessor is a single slot and needs a setName setter.
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface SyntaxChild {}
