package vnc;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** One reported problem. Diagnostics never abort compilation. */
@AutoValue
public abstract class Diagnostic {

  public enum Severity {
    INFO,
    WARNING,
    ERROR;
  }

  /** Stable diagnostic codes, each in the namespace of the stage that reports it. */
  public enum Code {
    UNRECOGNIZED_COMMAND(Stage.PARSER, "unrecognized-command", Severity.ERROR),
    COMMAND_INVALID_ARGUMENT(Stage.PARSER, "command-invalid-argument", Severity.ERROR),
    SAYER_IMPLICIT_DECL(Stage.PARSER, "sayer-implicit-decl", Severity.WARNING),
    CHARACTER_NAMERESOLUTION_FAILED(
        Stage.PARSER, "character-nameresolution-failed", Severity.WARNING),
    SAYMODE_INSUFFICIENT_SAYER(Stage.PARSER, "saymode-insufficient-sayer", Severity.ERROR),
    FUNCTION_DUPLICATE(Stage.PARSER, "function-duplicate", Severity.ERROR),
    UNHANDLED_NODE_IN_TERMINATED_BLOCK(
        Stage.CFG, "unhandled-node-in-terminated-block", Severity.WARNING),
    LABEL_CROSS_FUNCTION(Stage.CFG, "label-cross-function", Severity.ERROR),
    LABEL_NOTFOUND(Stage.CFG, "label-notfound", Severity.ERROR),
    LABEL_DUPLICATE(Stage.CFG, "label-duplicate", Severity.ERROR),
    FUNCTION_NOTFOUND(Stage.CFG, "function-notfound", Severity.ERROR),
    BLOCK_UNREACHABLE(Stage.CFG, "block-unreachable", Severity.INFO),
    CFG_INVARIANT(Stage.CFG, "cfg-invariant", Severity.ERROR),
    CHARACTER_STATE_EMPTY(Stage.CODEGEN, "character-state-empty", Severity.WARNING),
    CHARACTER_STATEERROR(Stage.CODEGEN, "character-stateerror", Severity.WARNING),
    CHARACTER_NOT_ONSTAGE(Stage.CODEGEN, "character-not-onstage", Severity.WARNING),
    SCENE_NOTFOUND(Stage.CODEGEN, "scene-notfound", Severity.WARNING),
    JOINPATH_COMPENSATED(Stage.CODEGEN, "joinpath-compensated", Severity.INFO);

    private final Stage stage;
    private final String suffix;
    private final Severity defaultSeverity;

    private Code(Stage stage, String suffix, Severity defaultSeverity) {
      this.stage = stage;
      this.suffix = suffix;
      this.defaultSeverity = defaultSeverity;
    }

    public Severity defaultSeverity() {
      return defaultSeverity;
    }

    /** The stable string form, e.g. {@code vncodegen-character-state-empty}. */
    public String id() {
      return stage.prefix + suffix;
    }

    @Override
    public String toString() {
      return id();
    }
  }

  private enum Stage {
    PARSER("vnparser-"),
    CFG("vncfg-"),
    CODEGEN("vncodegen-");

    private final String prefix;

    private Stage(String prefix) {
      this.prefix = prefix;
    }
  }

  public abstract Code code();

  public abstract Severity severity();

  public abstract String message();

  public abstract Optional<Document.Pos> location();

  public String format() {
    if (location().isPresent()) {
      return String.format("%s: %s [%s] %s", severity(), location().get(), code(), message());
    } else {
      return String.format("%s: [%s] %s", severity(), code(), message());
    }
  }

  public static Diagnostic create(Code code, Document.Pos location, String message) {
    return new AutoValue_Diagnostic(
        code,
        code.defaultSeverity(),
        message,
        location.equals(Document.Pos.internal()) ? Optional.empty() : Optional.of(location));
  }

  public static Diagnostic create(Code code, String message) {
    return new AutoValue_Diagnostic(code, code.defaultSeverity(), message, Optional.empty());
  }
}
