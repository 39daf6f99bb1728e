package vnc;

import java.util.Optional;

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The scanner's verdict for one paragraph. */
@AutoOneOf(ScannedLine.Kind.class)
public abstract class ScannedLine {

  public enum Kind {
    COMMANDS,
    SAY;
  }

  // [body] [body] # comment
  @AutoValue
  public abstract static class Segment {
    /** Bracket interior without the brackets and without a disabling '#'. */
    public abstract String body();

    public abstract Document.Pos pos();

    public abstract boolean disabled();

    /** Number of element markers in the paragraph before this segment. */
    public abstract int elementOffset();

    public static Segment create(
        String body, Document.Pos pos, boolean disabled, int elementOffset) {
      return new AutoValue_ScannedLine_Segment(body, pos, disabled, elementOffset);
    }
  }

  @AutoValue
  public abstract static class Commands {
    public abstract ImmutableList<Segment> segments();

    public abstract Optional<String> comment();

    public static Commands create(Iterable<Segment> segments, Optional<String> comment) {
      return new AutoValue_ScannedLine_Commands(ImmutableList.copyOf(segments), comment);
    }
  }

  public abstract Kind kind();

  public abstract Commands commands();

  public abstract SayNode say();

  public static ScannedLine commands(Commands commands) {
    return AutoOneOf_ScannedLine.commands(commands);
  }

  public static ScannedLine say(SayNode say) {
    return AutoOneOf_ScannedLine.say(say);
  }
}
