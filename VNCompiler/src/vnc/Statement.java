package vnc;

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;

/** One entry of a function body before it is cut into basic blocks. */
@AutoOneOf(Statement.Kind.class)
public abstract class Statement {

  public enum Kind {
    INSTRUCTION,
    TERMINATOR,
    LABEL;
  }

  @AutoValue
  public abstract static class Label {
    public abstract String name();

    public abstract Document.Pos pos();

    public static Label create(String name, Document.Pos pos) {
      return new AutoValue_Statement_Label(name, pos);
    }
  }

  public abstract Kind kind();

  public abstract Instruction instruction();

  public abstract Terminator terminator();

  public abstract Label label();

  public Document.Pos pos() {
    switch (kind()) {
      case INSTRUCTION:
        return instruction().pos();
      case TERMINATOR:
        return terminator().pos();
      case LABEL:
        return label().pos();
    }
    throw new AssertionError(kind());
  }

  public static Statement instruction(Instruction instruction) {
    return AutoOneOf_Statement.instruction(instruction);
  }

  public static Statement terminator(Terminator terminator) {
    return AutoOneOf_Statement.terminator(terminator);
  }

  public static Statement label(String name, Document.Pos pos) {
    return AutoOneOf_Statement.label(Label.create(name, pos));
  }
}
