package vnc;

import java.io.PrintStream;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Everything one compilation produced. Always complete, whatever was reported. */
@AutoValue
public abstract class CompilationResult {
  public abstract Program program();

  public abstract ImmutableList<Function> functions();

  /** The Ren'Py script. */
  public abstract String script();

  public abstract PlainDump dump();

  /** In the order the stages reported them. */
  public abstract ImmutableList<Diagnostic> diagnostics();

  public ImmutableList<Diagnostic> diagnostics(Diagnostic.Code code) {
    return diagnostics()
        .stream()
        .filter(d -> d.code() == code)
        .collect(ImmutableList.toImmutableList());
  }

  public boolean hasErrors() {
    return diagnostics().stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
  }

  public void printDiagnostics(PrintStream out) {
    diagnostics().forEach(d -> out.println(d.format()));
  }

  static CompilationResult create(
      Program program,
      ImmutableList<Function> functions,
      String script,
      PlainDump dump,
      ImmutableList<Diagnostic> diagnostics) {
    return new AutoValue_CompilationResult(program, functions, script, dump, diagnostics);
  }
}
