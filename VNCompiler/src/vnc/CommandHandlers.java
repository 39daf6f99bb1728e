package vnc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** The command vocabulary of the IR builder. */
final class CommandHandlers {
  private CommandHandlers() {}

  @FunctionalInterface
  private interface Handler {
    void handle(IRBuilder builder, CommandNode command) throws CompilerException;
  }

  // State tags and name lists: "a/b", "a, b".
  static final Splitter LIST_SPLITTER =
      Splitter.on(CharMatcher.anyOf("/,，、")).trimResults().omitEmptyStrings();

  private static final ImmutableSet<String> SPRITE_TABLE_HEADERS =
      ImmutableSet.of("state", "状态", "立绘", "sprite");

  enum Command {
    FUNCTION(CommandHandlers::function, "Function", "Section", "函数", "章节"),
    DECL_CHARACTER(CommandHandlers::declCharacter, "DeclCharacter", "声明角色"),
    DECL_CHARACTER_SPRITE(
        CommandHandlers::declCharacterSprite, "DeclCharacterSprite", "声明角色立绘"),
    DECL_SCENE(CommandHandlers::declScene, "DeclScene", "声明场景"),
    DECL_ALIAS(CommandHandlers::declAlias, "DeclAlias", "声明别名"),
    LABEL(CommandHandlers::label, "Label", "标签"),
    JUMP_LABEL(CommandHandlers::jumpLabel, "JumpLabel", "跳转标签"),
    JUMP_FUNCTION(CommandHandlers::jumpFunction, "JumpFunction", "跳转章节"),
    CALL(CommandHandlers::call, "Call", "调用"),
    RETURN(CommandHandlers::returnCommand, "Return", "返回"),
    MENU(CommandHandlers::menu, "Menu", "选项"),
    SHOW(CommandHandlers::show, "Show", "角色入场"),
    HIDE(CommandHandlers::hide, "Hide", "角色退场"),
    STATE(CommandHandlers::state, "State", "角色状态"),
    SCENE(CommandHandlers::scene, "Scene", "切换场景"),
    PLAY(CommandHandlers::play, "Play", "BGM", "播放", "背景音乐"),
    SAY_MODE(CommandHandlers::sayMode, "SayMode", "发言模式"),
    DEFAULT_SAYER(CommandHandlers::defaultSayer, "DefaultSayer", "默认发言者"),
    ASM(CommandHandlers::asm, "ASM", "代码"),
    COMMENT(CommandHandlers::comment, "Comment", "注释");

    private final Handler handler;
    private final ImmutableList<String> names;

    private Command(Handler handler, String... names) {
      this.handler = handler;
      this.names = ImmutableList.copyOf(names);
    }

    ImmutableList<String> names() {
      return names;
    }

    void handle(IRBuilder builder, CommandNode command) throws CompilerException {
      handler.handle(builder, command);
    }

    private static final ImmutableMap<String, Command> BY_NAME;

    static {
      ImmutableMap.Builder<String, Command> builder = ImmutableMap.builder();
      for (Command command : values()) {
        for (String name : command.names) {
          builder.put(name.toLowerCase(), command);
        }
      }
      BY_NAME = builder.build();
    }

    static Optional<Command> lookup(String name) {
      return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase()));
    }
  }

  // Keyword spellings.
  private static final String[] ALIAS = {"alias", "别名"};
  private static final String[] NAME_COLOR = {"name_color", "名字颜色"};
  private static final String[] CONTENT_COLOR = {"content_color", "内容颜色"};
  private static final String[] STATE_KEY = {"state", "状态"};
  private static final String[] IMAGE = {"image", "图片"};
  private static final String[] BACKGROUND = {"background", "背景"};
  private static final String[] TARGET = {"target", "目标"};
  private static final String[] CHANNEL = {"channel", "通道"};
  private static final String[] SAYERS = {"sayers", "sayer", "发言者"};

  private static void checkKeywords(CommandNode command, String[]... allowed)
      throws CompilerException {
    Set<String> names =
        Arrays.stream(allowed)
            .flatMap(a -> Arrays.stream(a))
            .collect(ImmutableSet.toImmutableSet());
    for (String key : command.keywords().keySet()) {
      if (!names.contains(key)) {
        throw new CompilerException(
            command.pos(),
            String.format("%s: unexpected keyword argument '%s'", command.name(), key));
      }
    }
  }

  private static String requirePositional(CommandNode command, String what)
      throws CompilerException {
    Optional<String> value = command.positionalText().map(String::trim);
    if (!value.isPresent() || value.get().isEmpty()) {
      throw new CompilerException(
          command.pos(), String.format("%s: missing %s", command.name(), what));
    }
    return value.get();
  }

  private static void checkNoPositional(CommandNode command) throws CompilerException {
    if (command.positional().isPresent()) {
      throw new CompilerException(
          command.pos(), String.format("%s: unexpected argument", command.name()));
    }
  }

  private static String requireKeyword(CommandNode command, String[] names)
      throws CompilerException {
    Optional<String> value = command.keywordText(names).map(String::trim);
    if (!value.isPresent() || value.get().isEmpty()) {
      throw new CompilerException(
          command.pos(), String.format("%s: missing '%s'", command.name(), names[0]));
    }
    return value.get();
  }

  private static ImmutableList<String> states(Optional<String> text) {
    return text.map(t -> ImmutableList.copyOf(LIST_SPLITTER.split(t))).orElse(ImmutableList.of());
  }

  /** An element argument names a media reference of the paragraph; text is an asset path. */
  private static Optional<AssetRef> asset(IRBuilder builder, CommandNode command, ArgValue value)
      throws CompilerException {
    if (value.kind() == ArgValue.Kind.ELEMENT) {
      Optional<Document.MediaRef> media = builder.media(value.element());
      if (!media.isPresent()) {
        throw new CompilerException(
            command.pos(), String.format("%s: embedded media not found", command.name()));
      }
      return Optional.of(AssetRef.asset(media.get().reference()));
    }

    String path = value.asText().trim();
    return path.isEmpty() ? Optional.empty() : Optional.of(AssetRef.asset(path));
  }

  private static void function(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command);
    builder.openFunction(requirePositional(command, "function name"), command.pos());
  }

  private static void declCharacter(IRBuilder builder, CommandNode command)
      throws CompilerException {
    checkKeywords(command, ALIAS, NAME_COLOR, CONTENT_COLOR);
    String name = requirePositional(command, "character name");

    Optional<Character> existing = builder.declarations().character(name);
    Character character;
    if (existing.isPresent()) {
      if (!existing.get().implicit() || !existing.get().name().equals(name)) {
        throw new CompilerException(
            command.pos(), String.format("character '%s' is already declared", name));
      }
      character = existing.get();
    } else {
      character = builder.declarations().declareCharacter(name, command.pos(), false);
    }
    character.setColors(command.keywordText(NAME_COLOR), command.keywordText(CONTENT_COLOR));

    for (String alias : LIST_SPLITTER.split(command.keywordText(ALIAS).orElse(""))) {
      if (!builder.declarations().addAlias(character, alias)) {
        builder.report(
            Diagnostic.Code.COMMAND_INVALID_ARGUMENT,
            command.pos(),
            "alias '%s' is already in use",
            alias);
      }
    }

    if (command.table().isPresent()) {
      for (ImmutableList<String> row : command.table().get()) {
        if (row.isEmpty() || SPRITE_TABLE_HEADERS.contains(row.get(0).trim().toLowerCase())) {
          continue;
        }
        ImmutableList<String> state = states(Optional.of(row.get(0)));
        if (state.isEmpty()) continue;

        String image = row.size() > 1 ? row.get(1).trim() : "";
        Optional<AssetRef> asset =
            image.isEmpty() ? Optional.empty() : Optional.of(AssetRef.asset(image));
        addSprite(character, state, asset);
      }
    }
  }

  private static void addSprite(
      Character character, ImmutableList<String> state, Optional<AssetRef> asset) {
    character
        .sprites()
        .add(
            state,
            asset.orElseGet(
                () ->
                    AssetRef.placeholder(
                        character.name() + " " + String.join("/", state),
                        AssetRef.Shape.CHARACTER)));
  }

  private static void declCharacterSprite(IRBuilder builder, CommandNode command)
      throws CompilerException {
    checkKeywords(command, STATE_KEY, IMAGE);
    String name = requirePositional(command, "character name");
    ImmutableList<String> state = states(Optional.of(requireKeyword(command, STATE_KEY)));

    Optional<AssetRef> asset = Optional.empty();
    Optional<ArgValue> image = command.keyword(IMAGE);
    if (image.isPresent()) asset = asset(builder, command, image.get());

    Character character = builder.resolveCharacter(name, command.pos());
    addSprite(character, state, asset);
  }

  private static void declScene(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command, BACKGROUND);
    String name = requirePositional(command, "scene name");

    Optional<AssetRef> background = Optional.empty();
    Optional<ArgValue> value = command.keyword(BACKGROUND);
    if (value.isPresent()) background = asset(builder, command, value.get());
    if (!background.isPresent()) {
      background = Optional.of(AssetRef.placeholder(name, AssetRef.Shape.BACKGROUND));
    }

    builder.declarations().declareScene(Scene.create(name, background, command.pos()));
  }

  private static void declAlias(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command, TARGET);
    String alias = requirePositional(command, "alias");
    String target = requireKeyword(command, TARGET);

    Character character = builder.resolveCharacter(target, command.pos());
    if (!builder.declarations().addAlias(character, alias)) {
      throw new CompilerException(
          command.pos(), String.format("alias '%s' is already in use", alias));
    }
  }

  private static void label(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command);
    builder.emitLabel(requirePositional(command, "label name"), command.pos());
  }

  private static void jumpLabel(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command);
    String label = requirePositional(command, "label name");
    builder.emit(Terminator.JumpToLabel.create(label, command.pos()));
  }

  private static void jumpFunction(IRBuilder builder, CommandNode command)
      throws CompilerException {
    checkKeywords(command);
    String function = requirePositional(command, "function name");
    builder.emit(Terminator.JumpToFunction.create(function, command.pos()));
  }

  private static void call(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command);
    String function = requirePositional(command, "function name");
    builder.emit(Terminator.CallFunction.create(function, command.pos()));
  }

  private static void returnCommand(IRBuilder builder, CommandNode command)
      throws CompilerException {
    checkKeywords(command);
    checkNoPositional(command);
    builder.emit(Terminator.Return.create(command.pos()));
  }

  private static void menu(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command);
    checkNoPositional(command);

    List<Terminator.Branch.Choice> choices = new ArrayList<>();
    if (command.table().isPresent()) {
      for (ImmutableList<String> row : command.table().get()) {
        if (row.isEmpty() || row.get(0).trim().isEmpty()) continue;
        String text = row.get(0).trim();
        String label = row.size() > 1 && !row.get(1).trim().isEmpty() ? row.get(1).trim() : text;
        choices.add(Terminator.Branch.Choice.create(StyledText.of(text), label));
      }
    } else if (command.list().isPresent()) {
      for (String item : command.list().get()) {
        if (item.trim().isEmpty()) continue;
        choices.add(Terminator.Branch.Choice.create(StyledText.of(item.trim()), item.trim()));
      }
    }

    if (choices.isEmpty()) {
      throw new CompilerException(
          command.pos(), String.format("%s: expected a table or list of options", command.name()));
    }
    builder.emit(Terminator.Branch.create(choices, command.pos()));
  }

  private static void show(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command, STATE_KEY);
    String name = requirePositional(command, "character name");
    ImmutableList<String> state = states(command.keywordText(STATE_KEY));

    Character character = builder.resolveCharacter(name, command.pos());
    builder.emit(Instruction.ShowSprite.create(character.name(), state, command.pos()));
  }

  private static void hide(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command);
    String name = requirePositional(command, "character or image name");

    if (!builder.declarations().isCharacterName(name) && builder.isImageId(name)) {
      builder.emit(Instruction.HideImage.create(name, command.pos()));
      return;
    }

    Character character = builder.resolveCharacter(name, command.pos());
    builder.emit(Instruction.HideSprite.create(character.name(), command.pos()));
  }

  private static void state(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command, STATE_KEY);
    String name = requirePositional(command, "character name");
    ImmutableList<String> state = states(Optional.of(requireKeyword(command, STATE_KEY)));

    Character character = builder.resolveCharacter(name, command.pos());
    builder.emit(Instruction.ChangeSpriteState.create(character.name(), state, command.pos()));
  }

  private static void scene(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command);
    Optional<String> scene = command.positionalText().map(String::trim).filter(s -> !s.isEmpty());
    builder.emit(Instruction.SetScene.create(scene, command.pos()));
  }

  private static void play(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command, CHANNEL);
    if (!command.positional().isPresent()) {
      throw new CompilerException(
          command.pos(), String.format("%s: missing audio", command.name()));
    }
    Optional<AssetRef> audio = asset(builder, command, command.positional().get());
    if (!audio.isPresent()) {
      throw new CompilerException(
          command.pos(), String.format("%s: missing audio", command.name()));
    }

    String channel = command.keywordText(CHANNEL).orElse(builder.options().defaultAudioChannel());
    builder.emit(Instruction.PlayAudio.create(audio.get().asset(), channel, command.pos()));
  }

  private static void sayMode(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command, SAYERS);
    String modeName = requirePositional(command, "say mode");
    Optional<SayModeState.Mode> mode = SayModeState.Mode.parse(modeName);
    if (!mode.isPresent()) {
      throw new CompilerException(
          command.pos(), String.format("%s: unknown say mode '%s'", command.name(), modeName));
    }

    List<String> names = new ArrayList<>();
    Optional<String> sayers = command.keywordText(SAYERS);
    if (sayers.isPresent()) {
      LIST_SPLITTER.split(sayers.get()).forEach(names::add);
    } else if (command.list().isPresent()) {
      command.list().get().stream().map(String::trim).filter(s -> !s.isEmpty()).forEach(names::add);
    }

    builder.setSayMode(mode.get(), names, command.pos());
  }

  private static void defaultSayer(IRBuilder builder, CommandNode command)
      throws CompilerException {
    checkKeywords(command);
    String name = requirePositional(command, "character name");
    builder.setSayMode(SayModeState.Mode.SINGLE, ImmutableList.of(name), command.pos());
  }

  private static void asm(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command);
    ImmutableList<String> lines;
    if (command.positional().isPresent()) {
      lines = ImmutableList.copyOf(Splitter.on('\n').split(command.positional().get().asText()));
    } else if (command.list().isPresent()) {
      lines = command.list().get();
    } else {
      throw new CompilerException(command.pos(), String.format("%s: missing code", command.name()));
    }
    builder.emit(Instruction.PassthroughRaw.create(lines, command.pos()));
  }

  private static void comment(IRBuilder builder, CommandNode command) throws CompilerException {
    checkKeywords(command);
    builder.emit(
        Instruction.Comment.create(command.positionalText().orElse("").trim(), command.pos()));
  }
}
