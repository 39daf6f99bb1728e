package vnc;

/**
 * A recoverable syntax problem inside a stage. Stages catch it at their boundary and turn it into a
 * {@link Diagnostic}.
 */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Document.Pos pos;
  private final String errorMsg;

  public CompilerException(Document.Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Document.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public Diagnostic toDiagnostic(Diagnostic.Code code) {
    return Diagnostic.create(code, pos, errorMsg);
  }
}
