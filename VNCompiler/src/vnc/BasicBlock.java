package vnc;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Straight-line instructions ending in exactly one terminator. */
@AutoValue
public abstract class BasicBlock {
  /** Unique within the owning function. */
  public abstract String label();

  /** False for generated labels of anonymous or renamed blocks. */
  public abstract boolean declared();

  public abstract Document.Pos pos();

  public abstract ImmutableList<Instruction> instructions();

  public abstract Terminator terminator();

  public ImmutableList<String> successors() {
    return terminator().successors();
  }

  public static BasicBlock create(
      String label,
      boolean declared,
      Document.Pos pos,
      Iterable<? extends Instruction> instructions,
      Terminator terminator) {
    return new AutoValue_BasicBlock(
        label, declared, pos, ImmutableList.copyOf(instructions), terminator);
  }
}
