package vnc;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The normalized block stream handed over by a document-ingestion collaborator. Nothing in here
 * knows about container formats; the builder only assembles already-extracted paragraphs.
 */
@AutoValue
public abstract class Document {

  /** Stands in for an embedded media reference inside paragraph text. */
  public static final char ELEMENT_MARKER = '\uFFFC';

  @AutoValue
  public abstract static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = create("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    public abstract String document();

    public abstract int blockIndex();

    public abstract int column();

    public Pos addColumns(int columns) {
      return create(document(), blockIndex(), column() + columns);
    }

    public static Pos create(String document, int blockIndex, int column) {
      return new AutoValue_Document_Pos(document, blockIndex, column);
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(Pos::document)
          .thenComparing(Pos::blockIndex)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public final String toString() {
      return String.format("%s@%d:%d", document(), blockIndex() + 1, column() + 1);
    }
  }

  public enum Alignment {
    DEFAULT,
    LEFT,
    CENTER,
    RIGHT;
  }

  @AutoValue
  public abstract static class TextRun {
    public abstract String text();

    public abstract boolean bold();

    public abstract boolean italic();

    public abstract Optional<String> color();

    public boolean isPlain() {
      return !bold() && !italic() && !color().isPresent();
    }

    /** Same styling, different text. */
    public TextRun withText(String text) {
      return new AutoValue_Document_TextRun(text, bold(), italic(), color());
    }

    public static TextRun plain(String text) {
      return new AutoValue_Document_TextRun(text, false, false, Optional.empty());
    }

    public static TextRun styled(
        String text, boolean bold, boolean italic, Optional<String> color) {
      return new AutoValue_Document_TextRun(text, bold, italic, color);
    }
  }

  @AutoValue
  public abstract static class MediaRef {
    public enum Kind {
      IMAGE,
      AUDIO;
    }

    public abstract Kind kind();

    /** Caller-supplied asset reference, usually a path relative to the game directory. */
    public abstract String reference();

    public static MediaRef image(String reference) {
      return new AutoValue_Document_MediaRef(Kind.IMAGE, reference);
    }

    public static MediaRef audio(String reference) {
      return new AutoValue_Document_MediaRef(Kind.AUDIO, reference);
    }
  }

  @AutoValue
  public abstract static class Block {
    private static final ImmutableSet<String> DEFAULT_BACKGROUNDS =
        ImmutableSet.of("", "auto", "transparent", "none", "#ffffff", "#fff", "white");

    public abstract ImmutableList<TextRun> runs();

    public abstract Alignment alignment();

    public abstract Optional<String> backgroundColor();

    public abstract Optional<ImmutableList<ImmutableList<String>>> table();

    public abstract Optional<ImmutableList<String>> list();

    public abstract ImmutableList<MediaRef> media();

    @Memoized
    public String text() {
      return runs().stream().map(TextRun::text).collect(Collectors.joining());
    }

    public StyledText styledText() {
      return StyledText.of(runs());
    }

    public boolean hasSpecialBackground() {
      return backgroundColor().isPresent()
          && !DEFAULT_BACKGROUNDS.contains(backgroundColor().get().trim().toLowerCase());
    }

    public boolean hasImages() {
      return media().stream().anyMatch(m -> m.kind() == MediaRef.Kind.IMAGE);
    }

    /** A table or list with no paragraph text around it. */
    public boolean isStructured() {
      return (table().isPresent() || list().isPresent()) && text().trim().isEmpty();
    }

    public static Block paragraph(String text) {
      return builder().addRun(TextRun.plain(text)).build();
    }

    public static Builder builder() {
      return new AutoValue_Document_Block.Builder().setAlignment(Alignment.DEFAULT);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      abstract ImmutableList.Builder<TextRun> runsBuilder();

      abstract ImmutableList.Builder<MediaRef> mediaBuilder();

      @CanIgnoreReturnValue
      public Builder addRun(TextRun run) {
        runsBuilder().add(run);
        return this;
      }

      @CanIgnoreReturnValue
      public Builder addMedia(MediaRef media) {
        mediaBuilder().add(media);
        return this;
      }

      public abstract Builder setAlignment(Alignment alignment);

      public abstract Builder setBackgroundColor(String color);

      public abstract Builder setTable(ImmutableList<ImmutableList<String>> table);

      public abstract Builder setList(ImmutableList<String> list);

      public abstract Block build();
    }
  }

  public abstract String title();

  public abstract ImmutableList<Block> blocks();

  public Pos pos(int blockIndex, int column) {
    return Pos.create(title(), blockIndex, column);
  }

  public static Builder builder(String title) {
    return new AutoValue_Document.Builder().setTitle(title);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setTitle(String title);

    abstract ImmutableList.Builder<Block> blocksBuilder();

    @CanIgnoreReturnValue
    public Builder addBlock(Block block) {
      blocksBuilder().add(block);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addParagraph(String text) {
      return addBlock(Block.paragraph(text));
    }

    @CanIgnoreReturnValue
    public Builder addParagraphs(String... lines) {
      Arrays.stream(lines).forEach(this::addParagraph);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addTable(List<? extends List<String>> rows) {
      return addBlock(
          Block.builder()
              .setTable(
                  rows.stream()
                      .map(row -> ImmutableList.<String>copyOf(row))
                      .collect(ImmutableList.toImmutableList()))
              .build());
    }

    @CanIgnoreReturnValue
    public Builder addList(String... items) {
      return addBlock(Block.builder().setList(ImmutableList.copyOf(items)).build());
    }

    public abstract Document build();
  }
}
