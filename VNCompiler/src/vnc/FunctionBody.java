package vnc;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A function as written: a flat statement sequence. */
@AutoValue
public abstract class FunctionBody {
  public abstract String name();

  public abstract Document.Pos pos();

  public abstract ImmutableList<Statement> statements();

  public static FunctionBody create(String name, Document.Pos pos, Iterable<Statement> statements) {
    return new AutoValue_FunctionBody(name, pos, ImmutableList.copyOf(statements));
  }
}
