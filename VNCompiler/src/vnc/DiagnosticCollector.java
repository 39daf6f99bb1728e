package vnc;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** Base for every stage that reports problems instead of failing. */
abstract class DiagnosticCollector {
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  protected ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  protected void report(Diagnostic.Code code, Document.Pos pos, String msg) {
    report(Diagnostic.create(code, pos, msg));
  }

  protected void report(Diagnostic.Code code, Document.Pos pos, String format, Object... args) {
    report(Diagnostic.create(code, pos, String.format(format, args)));
  }

  protected void report(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  protected void report(Diagnostic.Code code, CompilerException ex) {
    report(ex.toDiagnostic(code));
  }

  protected void takeDiagnostics(DiagnosticCollector other) {
    diagnostics.addAll(other.diagnostics);
    other.diagnostics.clear();
  }
}
