package opsugar;

import java.util.Optional;

public final class BasicTypeResolver implements TypeResolver {

  @Override
  public Resolution resolve(Ast.File file) {
    return TypeChecker.check(file);
  }

  @Override
  public Optional<Method> lookupMethod(Type type, String name) {
    return Types.lookupMethod(type, name, false);
  }
}
