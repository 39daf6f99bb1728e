package vnc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The single control-flow statement ending a basic block. */
public abstract class Terminator {

  public enum Type {
    JUMP_TO_FUNCTION,
    CALL_FUNCTION,
    JUMP_TO_LABEL,
    BRANCH,
    RETURN;
  }

  Terminator() {}

  public abstract Type type();

  public abstract Document.Pos pos();

  /** Labels of this function that control may reach next. */
  public abstract ImmutableList<String> successors();

  @SuppressWarnings("unchecked")
  public <T extends Terminator> T cast() {
    return (T) this;
  }

  public <T extends Terminator> T cast(Class<T> clazz) {
    return clazz.cast(this);
  }

  @AutoValue
  public abstract static class JumpToFunction extends Terminator {
    public abstract String function();

    @Override
    public final Type type() {
      return Type.JUMP_TO_FUNCTION;
    }

    @Override
    public ImmutableList<String> successors() {
      return ImmutableList.of();
    }

    public static JumpToFunction create(String function, Document.Pos pos) {
      return new AutoValue_Terminator_JumpToFunction(pos, function);
    }
  }

  /** Calls a function and continues with the block labelled {@link #continuation()}. */
  @AutoValue
  public abstract static class CallFunction extends Terminator {
    public abstract String function();

    /** Unset until the CFG is built. */
    public abstract Optional<String> continuation();

    @Override
    public final Type type() {
      return Type.CALL_FUNCTION;
    }

    @Override
    public ImmutableList<String> successors() {
      return continuation().map(ImmutableList::of).orElse(ImmutableList.of());
    }

    public CallFunction withContinuation(String label) {
      return new AutoValue_Terminator_CallFunction(pos(), function(), Optional.of(label));
    }

    public static CallFunction create(String function, Document.Pos pos) {
      return new AutoValue_Terminator_CallFunction(pos, function, Optional.empty());
    }
  }

  @AutoValue
  public abstract static class JumpToLabel extends Terminator {
    public abstract String label();

    /** Inserted where a block falls into a label. */
    public abstract boolean implicit();

    @Override
    public final Type type() {
      return Type.JUMP_TO_LABEL;
    }

    @Override
    public ImmutableList<String> successors() {
      return ImmutableList.of(label());
    }

    public static JumpToLabel create(String label, Document.Pos pos) {
      return new AutoValue_Terminator_JumpToLabel(pos, label, false);
    }

    public static JumpToLabel implicit(String label, Document.Pos pos) {
      return new AutoValue_Terminator_JumpToLabel(pos, label, true);
    }
  }

  @AutoValue
  public abstract static class Branch extends Terminator {
    @AutoValue
    public abstract static class Choice {
      public abstract StyledText text();

      public abstract String label();

      public static Choice create(StyledText text, String label) {
        return new AutoValue_Terminator_Branch_Choice(text, label);
      }
    }

    public abstract ImmutableList<Choice> choices();

    @Override
    public final Type type() {
      return Type.BRANCH;
    }

    @Override
    public ImmutableList<String> successors() {
      return choices()
          .stream()
          .map(Choice::label)
          .distinct()
          .collect(ImmutableList.toImmutableList());
    }

    public static Branch create(Iterable<Choice> choices, Document.Pos pos) {
      return new AutoValue_Terminator_Branch(pos, ImmutableList.copyOf(choices));
    }
  }

  @AutoValue
  public abstract static class Return extends Terminator {
    /** Generated rather than written, e.g. at the end of a function. */
    public abstract boolean implicit();

    @Override
    public final Type type() {
      return Type.RETURN;
    }

    @Override
    public ImmutableList<String> successors() {
      return ImmutableList.of();
    }

    public static Return create(Document.Pos pos) {
      return new AutoValue_Terminator_Return(pos, false);
    }

    public static Return implicit(Document.Pos pos) {
      return new AutoValue_Terminator_Return(pos, true);
    }
  }
}
