package opsugar.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

// The class must implement the generated interface, e.g. Ast_BinaryExpr_SyntaxNode for
// Ast.BinaryExpr.
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface SyntaxNode {}
