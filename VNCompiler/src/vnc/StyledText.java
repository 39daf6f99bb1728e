package vnc;

import java.util.List;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Paragraph text that keeps its inline run styling through slicing. */
@AutoValue
public abstract class StyledText {
  private static final StyledText EMPTY = of(ImmutableList.of());

  public abstract ImmutableList<Document.TextRun> runs();

  @Memoized
  public String plain() {
    return runs().stream().map(Document.TextRun::text).collect(Collectors.joining());
  }

  public int length() {
    return plain().length();
  }

  public boolean isEmpty() {
    return plain().isEmpty();
  }

  public boolean isBlank() {
    return plain().trim().isEmpty();
  }

  /** Slices by character offsets into {@link #plain()}. */
  public StyledText substring(int start, int end) {
    Preconditions.checkArgument(
        0 <= start && start <= end && end <= length(), "bad range %s..%s", start, end);

    ImmutableList.Builder<Document.TextRun> builder = ImmutableList.builder();
    int offset = 0;
    for (Document.TextRun run : runs()) {
      int runStart = offset;
      int runEnd = offset + run.text().length();
      offset = runEnd;

      int from = Math.max(start, runStart);
      int to = Math.min(end, runEnd);
      if (from < to) {
        builder.add(run.withText(run.text().substring(from - runStart, to - runStart)));
      }
    }
    return of(builder.build());
  }

  public StyledText trim() {
    String text = plain();
    int start = 0;
    int end = text.length();
    while (start < end && isSpace(text.charAt(start))) start++;
    while (end > start && isSpace(text.charAt(end - 1))) end--;
    return substring(start, end);
  }

  public boolean hasStyling() {
    return runs().stream().anyMatch(r -> !r.isPlain());
  }

  static boolean isSpace(char ch) {
    return java.lang.Character.isWhitespace(ch) || ch == '　' || ch == ' ';
  }

  public static StyledText empty() {
    return EMPTY;
  }

  public static StyledText of(String text) {
    return of(ImmutableList.of(Document.TextRun.plain(text)));
  }

  public static StyledText of(List<Document.TextRun> runs) {
    return new AutoValue_StyledText(
        runs.stream().filter(r -> !r.text().isEmpty()).collect(ImmutableList.toImmutableList()));
  }

  public static StyledText concat(List<StyledText> parts) {
    return of(parts.stream().flatMap(p -> p.runs().stream()).collect(Collectors.toList()));
  }

  @Override
  public final String toString() {
    return plain();
  }
}
