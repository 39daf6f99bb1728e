package vnc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;

/**
 * Parses the interior of a command bracket.
 *
 * <pre>
 *   command := name (':' | ws) args?
 *   args    := arg (',' arg)*
 *   arg     := key '=' value | value
 *   value   := text | "quoted" | element | name '(' args? ')'
 * </pre>
 *
 * Full-width punctuation is accepted everywhere. A malformed interior still yields a node carrying
 * the command name and every argument parsed before the error.
 */
public class CommandParser extends DiagnosticCollector {
  private static final CharMatcher NAME_END =
      CharMatcher.anyOf(":：,，").or(CharMatcher.whitespace());
  private static final CharMatcher NAME_SEPARATOR = CharMatcher.anyOf(":：");
  private static final CharMatcher COMMA = CharMatcher.anyOf(",，");
  private static final CharMatcher EQUALS = CharMatcher.anyOf("=＝");
  private static final CharMatcher CALL_OPEN = CharMatcher.anyOf("(（");
  private static final CharMatcher CALL_CLOSE = CharMatcher.anyOf(")）");
  private static final CharMatcher BARE_END =
      COMMA.or(EQUALS).or(CALL_OPEN).or(CALL_CLOSE).or(CharMatcher.is(Document.ELEMENT_MARKER));

  // Arguments collected so far, kept for partial results.
  private static final class Args {
    private Optional<ArgValue> positional = Optional.empty();
    private final Map<String, ArgValue> keywords = new LinkedHashMap<>();

    private void apply(CommandNode.Builder builder) {
      positional.ifPresent(builder::setPositional);
      builder.setKeywords(ImmutableMap.copyOf(keywords));
    }
  }

  private String body;
  private Document.Pos pos;
  private int elementOffset;
  private int index;

  public CommandNode parse(ScannedLine.Segment segment) {
    this.body = segment.body();
    this.pos = segment.pos();
    this.elementOffset = segment.elementOffset();
    this.index = 0;

    skipSpace();
    int nameStart = index;
    while (index < body.length() && !NAME_END.matches(body.charAt(index))) index++;
    String name = body.substring(nameStart, index);
    CommandNode.Builder builder =
        CommandNode.builder(name, pos.addColumns(nameStart)).setDisabled(segment.disabled());

    Args args = new Args();
    try {
      if (name.isEmpty()) throw error("missing command name");
      skipSpace();
      if (index < body.length() && NAME_SEPARATOR.matches(body.charAt(index))) index++;
      parseArgs(args, false);
    } catch (CompilerException ex) {
      report(Diagnostic.Code.UNRECOGNIZED_COMMAND, ex.pos(), "%s: %s", name, ex.errorMsg());
    }

    args.apply(builder);
    return builder.build();
  }

  private CompilerException error(String msg) {
    return new CompilerException(pos.addColumns(index), msg);
  }

  private void skipSpace() {
    while (index < body.length() && StyledText.isSpace(body.charAt(index))) index++;
  }

  private boolean atEnd(boolean nested) {
    if (index >= body.length()) return true;
    return nested && CALL_CLOSE.matches(body.charAt(index));
  }

  private void parseArgs(Args args, boolean nested) throws CompilerException {
    skipSpace();
    if (atEnd(nested)) return;

    while (true) {
      parseArg(args);
      skipSpace();
      if (atEnd(nested)) return;

      if (!COMMA.matches(body.charAt(index))) throw error("expected ','");
      index++;
      skipSpace();
      if (atEnd(nested)) throw error("expected an argument after ','");
    }
  }

  private void parseArg(Args args) throws CompilerException {
    int start = index;
    ArgValue value = parseValue();
    skipSpace();

    if (index < body.length() && EQUALS.matches(body.charAt(index))) {
      if (value.kind() != ArgValue.Kind.TEXT) throw error("keyword must be plain text");
      String key = value.text();
      index++;
      ArgValue keywordValue = parseValue();
      if (args.keywords.containsKey(key)) {
        throw new CompilerException(
            pos.addColumns(start), String.format("duplicate keyword argument '%s'", key));
      }
      args.keywords.put(key, keywordValue);
      return;
    }

    if (!args.keywords.isEmpty()) {
      throw new CompilerException(
          pos.addColumns(start), "positional argument after keyword argument");
    }
    if (args.positional.isPresent()) {
      throw new CompilerException(pos.addColumns(start), "more than one positional argument");
    }
    args.positional = Optional.of(value);
  }

  private ArgValue parseValue() throws CompilerException {
    skipSpace();
    if (index >= body.length()) throw error("expected a value");

    char ch = body.charAt(index);
    if (ch == Document.ELEMENT_MARKER) {
      int element = elementOffset + countMarkers(index);
      index++;
      return ArgValue.element(element);
    }

    String closers = quoteClosers(ch);
    if (closers != null) {
      int close = -1;
      for (int i = index + 1; i < body.length(); i++) {
        if (closers.indexOf(body.charAt(i)) >= 0) {
          close = i;
          break;
        }
      }
      if (close < 0) throw error("unterminated string");
      String quoted = body.substring(index + 1, close);
      index = close + 1;
      return ArgValue.quoted(quoted);
    }

    int start = index;
    while (index < body.length() && !BARE_END.matches(body.charAt(index))) index++;
    String text = body.substring(start, index).trim();
    if (text.isEmpty()) throw error("expected a value");

    if (index < body.length() && CALL_OPEN.matches(body.charAt(index))) {
      Document.Pos callPos = pos.addColumns(start);
      index++;
      Args callArgs = new Args();
      parseArgs(callArgs, true);
      if (index >= body.length()) throw error("unterminated call, expected ')'");
      index++;

      CommandNode.Builder call = CommandNode.builder(text, callPos);
      callArgs.apply(call);
      return ArgValue.call(call.build());
    }

    return ArgValue.text(text);
  }

  private int countMarkers(int end) {
    int count = 0;
    for (int i = 0; i < end; i++) {
      if (body.charAt(i) == Document.ELEMENT_MARKER) count++;
    }
    return count;
  }

  private static String quoteClosers(char open) {
    switch (open) {
      case '"':
        return "\"";
      case '“':
      case '”':
        return "“”";
      case '「':
        return "」";
      case '『':
        return "』";
      default:
        return null;
    }
  }
}
