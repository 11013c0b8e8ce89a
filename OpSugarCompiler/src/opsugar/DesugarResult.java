package opsugar;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class DesugarResult {
  // The rewritten file; the same instance that was passed in.
  public abstract Ast.File file();

  public abstract Resolution resolution();

  public abstract int operatorSites();

  public abstract ImmutableList<Integer> rewritesPerSweep();

  public static DesugarResult create(
      Ast.File file, Resolution resolution, int operatorSites, List<Integer> rewritesPerSweep) {
    return new AutoValue_DesugarResult(
        file, resolution, operatorSites, ImmutableList.copyOf(rewritesPerSweep));
  }

  public final boolean succeeded() {
    return resolution().succeeded();
  }

  public final int sweeps() {
    return rewritesPerSweep().size();
  }

  @Memoized
  public int totalRewrites() {
    return rewritesPerSweep().stream().mapToInt(Integer::intValue).sum();
  }
}
