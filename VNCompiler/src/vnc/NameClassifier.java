package vnc;

import java.util.function.Predicate;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/** Decides whether a piece of say-line text can be a speaker name. */
public final class NameClassifier {

  public enum Result {
    DEFINITE_NAME,
    DEFINITE_NON_NAME,
    AMBIGUOUS_TREAT_AS_NAME;

    public boolean isName() {
      return this != DEFINITE_NON_NAME;
    }
  }

  // Sentence punctuation and quote characters never appear in a speaker name.
  private static final CharMatcher RESERVED =
      CharMatcher.anyOf("，。！？；：…,.!?;:\"“”‘’「」『』《》()（）[]【】［］#＃\n\t");

  private final Predicate<String> declaredNames;
  private final int maxNameLength;

  public NameClassifier(Predicate<String> declaredNames, int maxNameLength) {
    Preconditions.checkArgument(maxNameLength > 0, "maxNameLength: %s", maxNameLength);
    this.declaredNames = declaredNames;
    this.maxNameLength = maxNameLength;
  }

  public Result classify(String text) {
    String name = text.trim();
    if (name.isEmpty()) return Result.DEFINITE_NON_NAME;
    if (declaredNames.test(name)) return Result.DEFINITE_NAME;
    if (RESERVED.matchesAnyOf(name)) return Result.DEFINITE_NON_NAME;
    if (CharMatcher.inRange('0', '9').matchesAllOf(name)) return Result.DEFINITE_NON_NAME;
    if (name.codePointCount(0, name.length()) > maxNameLength) return Result.DEFINITE_NON_NAME;
    return Result.AMBIGUOUS_TREAT_AS_NAME;
  }
}
