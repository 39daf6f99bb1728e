package vnc;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Decides who says a line that names no speaker. Speakers are canonical character names; an empty
 * result means the narrator.
 */
final class SayModeState {

  enum Mode {
    DEFAULT(0),
    /** One speaker says everything that names no one else. */
    SINGLE(1),
    /** Unnamed quoted lines cycle through the speakers. */
    ROTATION(1);

    private final int minSpeakers;

    private Mode(int minSpeakers) {
      this.minSpeakers = minSpeakers;
    }

    int minSpeakers() {
      return minSpeakers;
    }

    private static final ImmutableMap<String, Mode> BY_NAME =
        ImmutableMap.<String, Mode>builder()
            .put("default", DEFAULT)
            .put("默认", DEFAULT)
            .put("single", SINGLE)
            .put("long_speech", SINGLE)
            .put("长发言", SINGLE)
            .put("rotation", ROTATION)
            .put("interleave", ROTATION)
            .put("interleaved", ROTATION)
            .put("交替", ROTATION)
            .build();

    static Optional<Mode> parse(String name) {
      return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase()));
    }
  }

  private Mode mode = Mode.DEFAULT;
  private ImmutableList<String> speakers = ImmutableList.of();
  private Optional<String> lastSpeaker = Optional.empty();
  private int next = 0;

  Mode mode() {
    return mode;
  }

  ImmutableList<String> speakers() {
    return speakers;
  }

  /**
   * Returns false, leaving the state untouched, when there are too few speakers. Single-speaker
   * mode without a speaker takes the last one who spoke.
   */
  boolean setMode(Mode mode, List<String> speakers) {
    if (mode == Mode.SINGLE && speakers.isEmpty() && lastSpeaker.isPresent()) {
      speakers = ImmutableList.of(lastSpeaker.get());
    }
    if (speakers.size() < mode.minSpeakers()) return false;

    this.mode = mode;
    this.speakers = ImmutableList.copyOf(speakers);
    this.next = 0;
    if (!speakers.isEmpty()) lastSpeaker = Optional.of(speakers.get(0));
    return true;
  }

  void reset() {
    mode = Mode.DEFAULT;
    speakers = ImmutableList.of();
    lastSpeaker = Optional.empty();
    next = 0;
  }

  /** The speaker of one line. Every attributed line becomes the last speaker. */
  Optional<String> resolve(SayNode.Kind kind, Optional<String> named) {
    if (mode == Mode.DEFAULT && kind == SayNode.Kind.FULL) {
      lastSpeaker = named;
      return named;
    }

    Optional<String> speaker = attribute(kind, named);
    if (speaker.isPresent()) lastSpeaker = speaker;
    return speaker;
  }

  private Optional<String> attribute(SayNode.Kind kind, Optional<String> named) {
    switch (mode) {
      case DEFAULT:
        switch (kind) {
          case NARRATE:
            return Optional.empty();
          case QUOTED:
            return lastSpeaker;
          case FULL:
            return named;
        }
        break;
      case SINGLE:
        return kind == SayNode.Kind.FULL ? named : Optional.of(speakers.get(0));
      case ROTATION:
        switch (kind) {
          case NARRATE:
            return Optional.empty();
          case QUOTED:
            String speaker = speakers.get(next);
            next = (next + 1) % speakers.size();
            return Optional.of(speaker);
          case FULL:
            int index = named.map(speakers::indexOf).orElse(-1);
            if (index >= 0) next = (index + 1) % speakers.size();
            return named;
        }
        break;
    }
    throw new AssertionError(mode + " " + kind);
  }
}
