package vnc;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** The IR of one document: declarations and function bodies in document order. */
public final class Program {
  private final String title;
  private final Declarations declarations;
  private final ImmutableList<FunctionBody> functions;

  Program(String title, Declarations declarations, ImmutableList<FunctionBody> functions) {
    this.title = title;
    this.declarations = declarations;
    this.functions = functions;
  }

  public String title() {
    return title;
  }

  public Declarations declarations() {
    return declarations;
  }

  public ImmutableList<FunctionBody> functions() {
    return functions;
  }

  public Optional<FunctionBody> function(String name) {
    return functions.stream().filter(f -> f.name().equals(name)).findFirst();
  }
}
