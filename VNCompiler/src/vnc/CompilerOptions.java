package vnc;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

/** Immutable settings of a compilation; one instance may be shared across documents. */
@AutoValue
public abstract class CompilerOptions {

  /** What to do with a Show of a character that is already on stage. */
  public enum ReentrantShowPolicy {
    /** Report {@code character-stateerror} and skip the Show. */
    REPORT_AND_SKIP,
    /** Treat a Show with a different state as a state change. */
    UPDATE_STATE;
  }

  public abstract ReentrantShowPolicy reentrantShowPolicy();

  /** Longer text is never taken for a speaker name. */
  public abstract int maxSpeakerNameLength();

  /** Spaces per indentation level of the generated script. */
  public abstract int indent();

  public abstract String defaultAudioChannel();

  /** Speaker column of narration in the plain dump. */
  public abstract String narratorLabel();

  public abstract Builder toBuilder();

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setReentrantShowPolicy(ReentrantShowPolicy.REPORT_AND_SKIP)
        .setMaxSpeakerNameLength(10)
        .setIndent(4)
        .setDefaultAudioChannel("music")
        .setNarratorLabel("");
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setReentrantShowPolicy(ReentrantShowPolicy policy);

    public abstract Builder setMaxSpeakerNameLength(int length);

    public abstract Builder setIndent(int indent);

    public abstract Builder setDefaultAudioChannel(String channel);

    public abstract Builder setNarratorLabel(String label);

    @ForOverride
    abstract CompilerOptions autoBuild();

    public CompilerOptions build() {
      CompilerOptions options = autoBuild();
      Preconditions.checkState(
          options.maxSpeakerNameLength() > 0, "maxSpeakerNameLength must be positive");
      Preconditions.checkState(options.indent() > 0, "indent must be positive");
      return options;
    }
  }
}
