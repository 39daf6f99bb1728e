package vnc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A non-terminating statement of a basic block. */
public abstract class Instruction {

  public enum Type {
    SAY,
    SHOW_SPRITE,
    HIDE_SPRITE,
    CHANGE_SPRITE_STATE,
    SET_SCENE,
    PLAY_AUDIO,
    SHOW_IMAGE,
    HIDE_IMAGE,
    PASSTHROUGH_RAW,
    COMMENT;
  }

  Instruction() {}

  public abstract Type type();

  public abstract Document.Pos pos();

  @SuppressWarnings("unchecked")
  public <T extends Instruction> T cast() {
    return (T) this;
  }

  public <T extends Instruction> T cast(Class<T> clazz) {
    return clazz.cast(this);
  }

  /** A line of dialogue; no character means the narrator. */
  @AutoValue
  public abstract static class Say extends Instruction {
    public abstract Optional<String> character();

    /** Sprite state tags the speaker switches to while saying this line. */
    public abstract ImmutableList<String> status();

    public abstract StyledText content();

    @Override
    public final Type type() {
      return Type.SAY;
    }

    public static Say create(
        Optional<String> character,
        ImmutableList<String> status,
        StyledText content,
        Document.Pos pos) {
      return new AutoValue_Instruction_Say(pos, character, status, content);
    }
  }

  /** Shows a character; an empty state means the current or default one. */
  @AutoValue
  public abstract static class ShowSprite extends Instruction {
    public abstract String character();

    public abstract ImmutableList<String> state();

    @Override
    public final Type type() {
      return Type.SHOW_SPRITE;
    }

    public static ShowSprite create(
        String character, ImmutableList<String> state, Document.Pos pos) {
      return new AutoValue_Instruction_ShowSprite(pos, character, state);
    }
  }

  @AutoValue
  public abstract static class HideSprite extends Instruction {
    public abstract String character();

    @Override
    public final Type type() {
      return Type.HIDE_SPRITE;
    }

    public static HideSprite create(String character, Document.Pos pos) {
      return new AutoValue_Instruction_HideSprite(pos, character);
    }
  }

  @AutoValue
  public abstract static class ChangeSpriteState extends Instruction {
    public abstract String character();

    public abstract ImmutableList<String> state();

    @Override
    public final Type type() {
      return Type.CHANGE_SPRITE_STATE;
    }

    public static ChangeSpriteState create(
        String character, ImmutableList<String> state, Document.Pos pos) {
      return new AutoValue_Instruction_ChangeSpriteState(pos, character, state);
    }
  }

  /** Switches the scene; without a name only the stage is cleared. */
  @AutoValue
  public abstract static class SetScene extends Instruction {
    public abstract Optional<String> scene();

    @Override
    public final Type type() {
      return Type.SET_SCENE;
    }

    public static SetScene create(Optional<String> scene, Document.Pos pos) {
      return new AutoValue_Instruction_SetScene(pos, scene);
    }
  }

  @AutoValue
  public abstract static class PlayAudio extends Instruction {
    public abstract String audio();

    public abstract String channel();

    @Override
    public final Type type() {
      return Type.PLAY_AUDIO;
    }

    public static PlayAudio create(String audio, String channel, Document.Pos pos) {
      return new AutoValue_Instruction_PlayAudio(pos, audio, channel);
    }
  }

  /** Displays a standalone image, e.g. a centred illustration. */
  @AutoValue
  public abstract static class ShowImage extends Instruction {
    public abstract String image();

    public abstract AssetRef asset();

    @Override
    public final Type type() {
      return Type.SHOW_IMAGE;
    }

    public static ShowImage create(String image, AssetRef asset, Document.Pos pos) {
      return new AutoValue_Instruction_ShowImage(pos, image, asset);
    }
  }

  @AutoValue
  public abstract static class HideImage extends Instruction {
    public abstract String image();

    @Override
    public final Type type() {
      return Type.HIDE_IMAGE;
    }

    public static HideImage create(String image, Document.Pos pos) {
      return new AutoValue_Instruction_HideImage(pos, image);
    }
  }

  /** Engine script copied verbatim. */
  @AutoValue
  public abstract static class PassthroughRaw extends Instruction {
    public abstract ImmutableList<String> lines();

    @Override
    public final Type type() {
      return Type.PASSTHROUGH_RAW;
    }

    public static PassthroughRaw create(ImmutableList<String> lines, Document.Pos pos) {
      return new AutoValue_Instruction_PassthroughRaw(pos, lines);
    }
  }

  @AutoValue
  public abstract static class Comment extends Instruction {
    public abstract String text();

    @Override
    public final Type type() {
      return Type.COMMENT;
    }

    public static Comment create(String text, Document.Pos pos) {
      return new AutoValue_Instruction_Comment(pos, text);
    }
  }
}
