package vnc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Classifies paragraph text as a command line, a say line or narration. Scanning never fails: text
 * that is not a well-formed command line is re-read as a say line, and text that matches no say
 * pattern is narration.
 */
public class LineScanner {
  private static final CharMatcher OPEN_BRACKET = CharMatcher.anyOf("[［【");
  private static final CharMatcher CLOSE_BRACKET = CharMatcher.anyOf("]］】");
  private static final CharMatcher COMMENT = CharMatcher.anyOf("#＃");
  private static final CharMatcher SEPARATOR = CharMatcher.anyOf(":：");
  private static final CharMatcher STATUS_OPEN = CharMatcher.anyOf("(（");
  private static final String STATUS_CLOSE = ")）";

  static final Splitter STATUS_SPLITTER =
      Splitter.on(CharMatcher.anyOf(",，、")).trimResults().omitEmptyStrings();

  private enum TokenType {
    TEXT,
    QUOTED,
    STATUS,
    SEP;
  }

  private static final class Token {
    private final TokenType type;
    private final int start;
    private final int end;
    private final int innerStart;
    private final int innerEnd;
    private final char open;

    private Token(TokenType type, int start, int end, int innerStart, int innerEnd, char open) {
      this.type = type;
      this.start = start;
      this.end = end;
      this.innerStart = innerStart;
      this.innerEnd = innerEnd;
      this.open = open;
    }

    String inner(String line) {
      return line.substring(innerStart, innerEnd);
    }

    boolean isBracketQuote() {
      return type == TokenType.QUOTED && (open == '[' || open == '【');
    }

    @Override
    public String toString() {
      return type + "@" + start + ".." + end;
    }
  }

  private final NameClassifier classifier;

  public LineScanner(NameClassifier classifier) {
    this.classifier = classifier;
  }

  public ScannedLine scan(Document.Pos pos, StyledText text) {
    try {
      return ScannedLine.commands(scanCommands(pos, text.plain()));
    } catch (CompilerException ex) {
      return ScannedLine.say(scanSay(pos, text));
    }
  }

  // Say-line quote pairs. Curly quotes close with either direction.
  private static String sayQuoteClosers(char open) {
    switch (open) {
      case '"':
        return "\"";
      case '\'':
        return "'";
      case '“':
      case '”':
        return "“”";
      case '‘':
      case '’':
        return "‘’";
      case '[':
        return "]";
      case '【':
        return "】";
      case '「':
        return "」";
      case '『':
        return "』";
      default:
        return null;
    }
  }

  // Quotes that may hide bracket characters inside a command.
  private static String commandQuoteClosers(char open) {
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

  private static int indexOfAny(String line, String chars, int from) {
    for (int i = from; i < line.length(); i++) {
      if (chars.indexOf(line.charAt(i)) >= 0) return i;
    }
    return -1;
  }

  private static int skipSpace(String line, int from) {
    int i = from;
    while (i < line.length() && StyledText.isSpace(line.charAt(i))) i++;
    return i;
  }

  private static int countMarkers(String line, int end) {
    int count = 0;
    for (int i = 0; i < end; i++) {
      if (line.charAt(i) == Document.ELEMENT_MARKER) count++;
    }
    return count;
  }

  ScannedLine.Commands scanCommands(Document.Pos pos, String line) throws CompilerException {
    List<ScannedLine.Segment> segments = new ArrayList<>();
    Optional<String> comment = Optional.empty();

    int i = skipSpace(line, 0);
    while (i < line.length()) {
      char ch = line.charAt(i);
      if (COMMENT.matches(ch) && !segments.isEmpty()) {
        comment = Optional.of(line.substring(i + 1).trim());
        break;
      }
      if (!OPEN_BRACKET.matches(ch)) {
        throw new CompilerException(pos.addColumns(i), "expected '[' to start a command");
      }

      int close = findClose(pos, line, i + 1);
      int bodyStart = skipSpace(line, i + 1);
      boolean disabled = false;
      if (bodyStart < close && COMMENT.matches(line.charAt(bodyStart))) {
        disabled = true;
        bodyStart++;
      }
      String body = line.substring(bodyStart, close);
      if (body.trim().isEmpty()) {
        throw new CompilerException(pos.addColumns(i), "empty command");
      }

      segments.add(
          ScannedLine.Segment.create(
              body, pos.addColumns(bodyStart), disabled, countMarkers(line, bodyStart)));
      i = skipSpace(line, close + 1);
    }

    if (segments.isEmpty()) throw new CompilerException(pos, "not a command line");
    return ScannedLine.Commands.create(segments, comment);
  }

  private static int findClose(Document.Pos pos, String line, int from) throws CompilerException {
    int depth = 1;
    int i = from;
    while (i < line.length()) {
      char ch = line.charAt(i);
      String closers = commandQuoteClosers(ch);
      if (closers != null) {
        int quoteEnd = indexOfAny(line, closers, i + 1);
        if (quoteEnd >= 0) {
          i = quoteEnd + 1;
          continue;
        }
      }

      if (OPEN_BRACKET.matches(ch)) {
        depth++;
      } else if (CLOSE_BRACKET.matches(ch) && --depth == 0) {
        return i;
      }
      i++;
    }
    throw new CompilerException(pos.addColumns(from - 1), "unterminated command bracket");
  }

  private static ImmutableList<Token> tokenize(String line) {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int textStart = -1;
    int i = 0;
    while (i < line.length()) {
      char ch = line.charAt(i);

      int close = -1;
      TokenType type = null;
      String closers = sayQuoteClosers(ch);
      if (closers != null) {
        close = indexOfAny(line, closers, i + 1);
        type = TokenType.QUOTED;
      } else if (STATUS_OPEN.matches(ch)) {
        close = indexOfAny(line, STATUS_CLOSE, i + 1);
        type = TokenType.STATUS;
      } else if (SEPARATOR.matches(ch)) {
        close = i;
        type = TokenType.SEP;
      }

      // An unmatched opener is ordinary text.
      if (close < 0) {
        if (textStart < 0) textStart = i;
        i++;
        continue;
      }

      if (textStart >= 0) {
        addText(tokens, line, textStart, i);
        textStart = -1;
      }
      if (type == TokenType.SEP) {
        tokens.add(new Token(type, i, i + 1, i, i + 1, ch));
      } else {
        tokens.add(new Token(type, i, close + 1, i + 1, close, ch));
      }
      i = close + 1;
    }
    if (textStart >= 0) addText(tokens, line, textStart, line.length());

    return tokens.build();
  }

  private static void addText(
      ImmutableList.Builder<Token> tokens, String line, int start, int end) {
    if (!line.substring(start, end).trim().isEmpty()) {
      tokens.add(new Token(TokenType.TEXT, start, end, start, end, ' '));
    }
  }

  private static boolean at(List<Token> tokens, int index, TokenType type) {
    return index < tokens.size() && tokens.get(index).type == type;
  }

  private static boolean atName(List<Token> tokens, int index) {
    return at(tokens, index, TokenType.TEXT) || at(tokens, index, TokenType.QUOTED);
  }

  // Any text the classifier does not reject.
  private Optional<String> looseName(Token token, String line) {
    String name = token.inner(line).trim();
    return classifier.classify(name).isName() ? Optional.of(name) : Optional.empty();
  }

  // Quoted names must be declared, or bracket-quoted and plausible.
  private Optional<String> strongName(Token token, String line) {
    String name = token.inner(line).trim();
    NameClassifier.Result result = classifier.classify(name);
    if (result == NameClassifier.Result.DEFINITE_NAME
        || (token.isBracketQuote() && result.isName())) {
      return Optional.of(name);
    }
    return Optional.empty();
  }

  SayNode scanSay(Document.Pos pos, StyledText text) {
    String line = text.plain();
    ImmutableList<Token> tokens = tokenize(line);

    Optional<SayNode> node = sepThenStatus(pos, text, tokens);
    if (!node.isPresent()) node = statusThenSep(pos, text, tokens);
    if (!node.isPresent()) node = nameThenQuote(pos, text, tokens);
    if (!node.isPresent()) node = strongNameThenContent(pos, text, tokens);
    if (node.isPresent()) return node.get();

    return build(pos, text, tokens, Optional.empty(), ImmutableList.of(), 0, false);
  }

  // name? SEP status? content
  private Optional<SayNode> sepThenStatus(
      Document.Pos pos, StyledText text, ImmutableList<Token> tokens) {
    String line = text.plain();
    Optional<String> name = Optional.empty();
    int idx;
    if (atName(tokens, 0) && at(tokens, 1, TokenType.SEP)) {
      name = looseName(tokens.get(0), line);
      if (!name.isPresent()) return Optional.empty();
      idx = 2;
    } else if (at(tokens, 0, TokenType.SEP)) {
      idx = 1;
    } else {
      return Optional.empty();
    }

    ImmutableList<String> status = ImmutableList.of();
    if (at(tokens, idx, TokenType.STATUS)) {
      status = parseStatus(tokens.get(idx++), line);
    }
    return Optional.of(build(pos, text, tokens, name, status, idx, true));
  }

  // name? status? SEP content
  private Optional<SayNode> statusThenSep(
      Document.Pos pos, StyledText text, ImmutableList<Token> tokens) {
    String line = text.plain();
    Optional<String> name = Optional.empty();
    int idx = 0;
    if (atName(tokens, 0)
        && (at(tokens, 1, TokenType.STATUS) || at(tokens, 1, TokenType.SEP))) {
      name = looseName(tokens.get(0), line);
      if (!name.isPresent()) return Optional.empty();
      idx = 1;
    }

    ImmutableList<String> status = ImmutableList.of();
    if (at(tokens, idx, TokenType.STATUS)) {
      status = parseStatus(tokens.get(idx++), line);
    }
    if (!at(tokens, idx, TokenType.SEP)) return Optional.empty();
    return Optional.of(build(pos, text, tokens, name, status, idx + 1, true));
  }

  // name status? "content"
  private Optional<SayNode> nameThenQuote(
      Document.Pos pos, StyledText text, ImmutableList<Token> tokens) {
    String line = text.plain();
    if (!atName(tokens, 0)) return Optional.empty();

    Token first = tokens.get(0);
    Optional<String> name =
        first.type == TokenType.TEXT ? looseName(first, line) : strongName(first, line);
    if (!name.isPresent()) return Optional.empty();

    int idx = 1;
    ImmutableList<String> status = ImmutableList.of();
    if (at(tokens, idx, TokenType.STATUS)) {
      status = parseStatus(tokens.get(idx++), line);
    }
    if (!at(tokens, idx, TokenType.QUOTED)) return Optional.empty();
    return Optional.of(build(pos, text, tokens, name, status, idx, false));
  }

  // name_strong status? content
  private Optional<SayNode> strongNameThenContent(
      Document.Pos pos, StyledText text, ImmutableList<Token> tokens) {
    String line = text.plain();
    Optional<String> name = Optional.empty();
    if (at(tokens, 0, TokenType.QUOTED)) {
      name = strongName(tokens.get(0), line);
    } else if (at(tokens, 0, TokenType.TEXT) && at(tokens, 1, TokenType.STATUS)) {
      String candidate = tokens.get(0).inner(line).trim();
      if (classifier.classify(candidate) == NameClassifier.Result.DEFINITE_NAME) {
        name = Optional.of(candidate);
      }
    }
    if (!name.isPresent()) return Optional.empty();

    int idx = 1;
    ImmutableList<String> status = ImmutableList.of();
    if (at(tokens, idx, TokenType.STATUS)) {
      status = parseStatus(tokens.get(idx++), line);
    }
    if (idx >= tokens.size()) return Optional.empty();
    return Optional.of(build(pos, text, tokens, name, status, idx, false));
  }

  private static ImmutableList<String> parseStatus(Token token, String line) {
    return ImmutableList.copyOf(STATUS_SPLITTER.split(token.inner(line)));
  }

  private static SayNode build(
      Document.Pos pos,
      StyledText text,
      ImmutableList<Token> tokens,
      Optional<String> name,
      ImmutableList<String> status,
      int contentIndex,
      boolean separator) {
    SayNode.Builder builder =
        SayNode.builder()
            .setPos(pos)
            .setSpeaker(name)
            .setStatus(status)
            .setHasSeparator(separator);

    if (contentIndex >= tokens.size()) {
      return builder.setContent(StyledText.empty()).build();
    }

    Token first = tokens.get(contentIndex);
    if (first.type == TokenType.QUOTED) {
      List<StyledText> parts = new ArrayList<>();
      for (Token token : tokens.subList(contentIndex, tokens.size())) {
        if (token.type == TokenType.QUOTED) {
          parts.add(text.substring(token.innerStart, token.innerEnd));
        }
      }
      return builder.setQuoted(true).setContent(StyledText.concat(parts)).build();
    }

    return builder.setContent(text.substring(first.start, text.length()).trim()).build();
  }
}
