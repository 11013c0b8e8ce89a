package opsugar;

import java.util.Optional;

public interface TypeResolver {
  // Must not modify the tree. An unchanged tree always gets the same verdict.
  Resolution resolve(Ast.File file);

  // Fields of the same name do not count.
  Optional<Method> lookupMethod(Type type, String name);
}
