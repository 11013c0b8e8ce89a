package opsugar;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class Resolution {
  public abstract ImmutableList<CompilerException> errors();

  public abstract TypeBinding binding();

  public final boolean succeeded() {
    return errors().isEmpty();
  }

  public static Resolution create(List<CompilerException> errors, TypeBinding binding) {
    return new AutoValue_Resolution(ImmutableList.copyOf(errors), binding);
  }

  public void printErrors() {
    errors().forEach(CompilerException::print);
  }
}
