package vnc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A say line or narration, before speaker resolution. */
@AutoValue
public abstract class SayNode {

  public enum Kind {
    /** An explicit speaker. */
    FULL,
    /** Quoted or separated content without a speaker. */
    QUOTED,
    NARRATE;
  }

  public abstract Optional<String> speaker();

  public abstract ImmutableList<String> status();

  public abstract StyledText content();

  public abstract boolean quoted();

  public abstract boolean hasSeparator();

  public abstract Document.Pos pos();

  public Kind kind() {
    if (speaker().isPresent()) return Kind.FULL;
    if (quoted() || hasSeparator()) return Kind.QUOTED;
    return Kind.NARRATE;
  }

  public static SayNode narration(StyledText content, Document.Pos pos) {
    return builder().setContent(content).setPos(pos).build();
  }

  public static Builder builder() {
    return new AutoValue_SayNode.Builder()
        .setStatus(ImmutableList.of())
        .setQuoted(false)
        .setHasSeparator(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSpeaker(String speaker);

    public abstract Builder setSpeaker(Optional<String> speaker);

    public abstract Builder setStatus(ImmutableList<String> status);

    public abstract Builder setContent(StyledText content);

    public abstract Builder setQuoted(boolean quoted);

    public abstract Builder setHasSeparator(boolean hasSeparator);

    public abstract Builder setPos(Document.Pos pos);

    public abstract SayNode build();
  }
}
