package vnc;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Turns a document into declarations and function bodies. Every problem is reported and recovered
 * from locally; building never fails.
 */
public class IRBuilder extends DiagnosticCollector {
  private static final ImmutableSet<String> NARRATOR_NAMES =
      ImmutableSet.of("narrator", "旁白", "叙述");

  private final CompilerOptions options;
  private final Declarations declarations = new Declarations();
  private final LineScanner scanner;
  private final CommandParser parser = new CommandParser();
  private final SayModeState sayMode = new SayModeState();
  private final List<FunctionBody> functions = new ArrayList<>();
  private final Set<String> imageIds = new HashSet<>();

  private Document.Block block;

  // The open function; null before the first one.
  private String functionName = null;
  private Document.Pos functionPos = null;
  private List<Statement> statements = null;

  public IRBuilder(CompilerOptions options) {
    this.options = options;
    this.scanner =
        new LineScanner(
            new NameClassifier(
                name -> declarations.isCharacterName(name) || NARRATOR_NAMES.contains(name),
                options.maxSpeakerNameLength()));
  }

  public Program build(Document document) {
    ensureFunction(document);

    ImmutableList<Document.Block> blocks = document.blocks();
    for (int i = 0; i < blocks.size(); i++) {
      block = blocks.get(i);
      Document.Pos pos = document.pos(i, 0);

      // Structured blocks only count right after a command line.
      if (block.isStructured()) continue;

      if (block.hasSpecialBackground()) {
        emit(
            Instruction.PassthroughRaw.create(
                ImmutableList.copyOf(Splitter.on('\n').split(block.text())), pos));
        continue;
      }

      if (block.alignment() == Document.Alignment.CENTER && block.hasImages()) {
        showImages(pos);
        continue;
      }

      StyledText text = block.styledText();
      if (text.isBlank()) continue;

      ScannedLine line = scanner.scan(pos, text);
      switch (line.kind()) {
        case COMMANDS:
          Optional<Document.Block> trailing = Optional.empty();
          int next = trailingBlock(blocks, i);
          if (next >= 0) {
            trailing = Optional.of(blocks.get(next));
            i = next;
          }
          handleCommands(line.commands(), trailing);
          break;
        case SAY:
          handleSay(line.say());
          break;
      }
    }

    closeFunction();
    return new Program(document.title(), declarations, ImmutableList.copyOf(functions));
  }

  // Index of the table or list attached to the command line at i, or -1. Blank paragraphs between
  // the two are skipped.
  private static int trailingBlock(ImmutableList<Document.Block> blocks, int i) {
    int j = i + 1;
    while (j < blocks.size() && isBlankParagraph(blocks.get(j))) j++;
    return j < blocks.size() && blocks.get(j).isStructured() ? j : -1;
  }

  private static boolean isBlankParagraph(Document.Block block) {
    return !block.isStructured()
        && !block.hasSpecialBackground()
        && block.media().isEmpty()
        && block.text().trim().isEmpty();
  }

  /**
   * Opens a function named after the document when the document declares none, so that all of its
   * content has an owner.
   */
  void ensureFunction(Document document) {
    for (int i = 0; i < document.blocks().size(); i++) {
      Document.Block candidate = document.blocks().get(i);
      if (candidate.isStructured() || candidate.hasSpecialBackground()) continue;
      try {
        ScannedLine.Commands commands =
            scanner.scanCommands(document.pos(i, 0), candidate.text());
        for (ScannedLine.Segment segment : commands.segments()) {
          if (!segment.disabled() && isFunctionCommand(segment.body())) return;
        }
      } catch (CompilerException ex) {
        // Not a command line.
        continue;
      }
    }

    String title = document.title().trim();
    openFunction(title.isEmpty() ? "main" : title, document.pos(0, 0));
  }

  private static boolean isFunctionCommand(String body) {
    String name = body.trim();
    int end = CharMatcher.anyOf(":：,，").or(CharMatcher.whitespace()).indexIn(name);
    if (end >= 0) name = name.substring(0, end);
    return CommandHandlers.Command.lookup(name).equals(
        Optional.of(CommandHandlers.Command.FUNCTION));
  }

  private void handleCommands(ScannedLine.Commands commands, Optional<Document.Block> trailing) {
    ImmutableList<ScannedLine.Segment> segments = commands.segments();
    for (int i = 0; i < segments.size(); i++) {
      CommandNode command = parser.parse(segments.get(i));
      takeDiagnostics(parser);

      // A trailing table or list belongs to the last command of the line.
      if (i == segments.size() - 1 && trailing.isPresent()) {
        Document.Block structured = trailing.get();
        if (structured.table().isPresent()) command = command.withTable(structured.table().get());
        if (structured.list().isPresent()) command = command.withList(structured.list().get());
      }
      if (command.disabled() || command.name().isEmpty()) continue;

      Optional<CommandHandlers.Command> type = CommandHandlers.Command.lookup(command.name());
      if (!type.isPresent()) {
        report(
            Diagnostic.Code.UNRECOGNIZED_COMMAND,
            command.pos(),
            "unknown command '%s'",
            command.name());
        continue;
      }

      try {
        type.get().handle(this, command);
      } catch (CompilerException ex) {
        report(Diagnostic.Code.COMMAND_INVALID_ARGUMENT, ex);
      }
    }

    if (commands.comment().isPresent()) {
      emit(Instruction.Comment.create(commands.comment().get(), segments.get(0).pos()));
    }
  }

  private void handleSay(SayNode say) {
    if (statements == null) return;

    // An explicit narrator name bypasses the say mode.
    if (say.speaker().isPresent() && NARRATOR_NAMES.contains(say.speaker().get())) {
      emit(
          Instruction.Say.create(Optional.empty(), ImmutableList.of(), say.content(), say.pos()));
      return;
    }

    Optional<String> named =
        say.speaker().map(name -> resolveSayer(name, say.pos()).name());
    Optional<String> speaker = sayMode.resolve(say.kind(), named);
    emit(
        Instruction.Say.create(
            speaker,
            speaker.isPresent() ? say.status() : ImmutableList.of(),
            say.content(),
            say.pos()));
  }

  private Character resolveSayer(String name, Document.Pos pos) {
    Optional<Character> character = declarations.character(name);
    if (character.isPresent()) return character.get();

    report(
        Diagnostic.Code.SAYER_IMPLICIT_DECL,
        pos,
        "speaker '%s' is not declared, declaring it implicitly",
        name);
    return declarations.declareCharacter(name, pos, true);
  }

  private void showImages(Document.Pos pos) {
    String caption = CharMatcher.is(Document.ELEMENT_MARKER).removeFrom(block.text()).trim();
    int index = 0;
    for (Document.MediaRef media : block.media()) {
      if (media.kind() != Document.MediaRef.Kind.IMAGE) continue;

      String id;
      if (caption.isEmpty()) {
        id = String.format("image%d", imageIds.size() + 1);
      } else {
        id = index == 0 ? caption : String.format("%s_%d", caption, index + 1);
      }
      index++;

      imageIds.add(id);
      emit(Instruction.ShowImage.create(id, AssetRef.asset(media.reference()), pos));
    }
  }

  // Used by CommandHandlers.

  CompilerOptions options() {
    return options;
  }

  Declarations declarations() {
    return declarations;
  }

  boolean isImageId(String id) {
    return imageIds.contains(id);
  }

  /** The k-th embedded media reference of the current paragraph. */
  Optional<Document.MediaRef> media(int element) {
    if (element < 0 || element >= block.media().size()) return Optional.empty();
    return Optional.of(block.media().get(element));
  }

  /** Resolves a character named by a command, declaring it when unknown. */
  Character resolveCharacter(String name, Document.Pos pos) {
    Optional<Character> character = declarations.character(name);
    if (character.isPresent()) return character.get();

    report(
        Diagnostic.Code.CHARACTER_NAMERESOLUTION_FAILED,
        pos,
        "character '%s' is not declared, declaring it implicitly",
        name);
    return declarations.declareCharacter(name, pos, true);
  }

  void setSayMode(SayModeState.Mode mode, List<String> names, Document.Pos pos) {
    List<String> speakers = new ArrayList<>();
    for (String name : names) {
      speakers.add(resolveCharacter(name, pos).name());
    }

    if (!sayMode.setMode(mode, speakers)) {
      report(
          Diagnostic.Code.SAYMODE_INSUFFICIENT_SAYER,
          pos,
          "say mode %s needs at least %d speaker(s), got %d",
          mode.name().toLowerCase(),
          mode.minSpeakers(),
          speakers.size());
    }
  }

  void openFunction(String name, Document.Pos pos) {
    closeFunction();

    String unique = name;
    if (isFunctionName(name)) {
      int suffix = 2;
      while (isFunctionName(name + "_" + suffix)) suffix++;
      unique = name + "_" + suffix;
      report(
          Diagnostic.Code.FUNCTION_DUPLICATE,
          pos,
          "function '%s' is already declared, renamed to '%s'",
          name,
          unique);
    }

    functionName = unique;
    functionPos = pos;
    statements = new ArrayList<>();
    sayMode.reset();
  }

  private boolean isFunctionName(String name) {
    return name.equals(functionName) || functions.stream().anyMatch(f -> f.name().equals(name));
  }

  private void closeFunction() {
    if (statements == null) return;
    functions.add(FunctionBody.create(functionName, functionPos, statements));
    statements = null;
  }

  // Content outside any function is dropped.

  void emit(Instruction instruction) {
    if (statements != null) statements.add(Statement.instruction(instruction));
  }

  void emit(Terminator terminator) {
    if (statements != null) statements.add(Statement.terminator(terminator));
  }

  void emitLabel(String name, Document.Pos pos) {
    if (statements != null) statements.add(Statement.label(name, pos));
  }
}
