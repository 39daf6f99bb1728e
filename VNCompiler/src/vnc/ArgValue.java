package vnc;

import com.google.auto.value.AutoOneOf;

/** A command argument value. */
@AutoOneOf(ArgValue.Kind.class)
public abstract class ArgValue {

  public enum Kind {
    TEXT,
    QUOTED,
    /** Index of an embedded media reference of the paragraph. */
    ELEMENT,
    CALL;
  }

  public abstract Kind kind();

  public abstract String text();

  public abstract String quoted();

  public abstract int element();

  public abstract CommandNode call();

  /** The value as written, for arguments that only need a string. */
  public String asText() {
    switch (kind()) {
      case TEXT:
        return text();
      case QUOTED:
        return quoted();
      case ELEMENT:
        return String.valueOf(Document.ELEMENT_MARKER);
      case CALL:
        return call().toString();
    }
    throw new AssertionError(kind());
  }

  public static ArgValue text(String text) {
    return AutoOneOf_ArgValue.text(text);
  }

  public static ArgValue quoted(String quoted) {
    return AutoOneOf_ArgValue.quoted(quoted);
  }

  public static ArgValue element(int element) {
    return AutoOneOf_ArgValue.element(element);
  }

  public static ArgValue call(CommandNode call) {
    return AutoOneOf_ArgValue.call(call);
  }
}
