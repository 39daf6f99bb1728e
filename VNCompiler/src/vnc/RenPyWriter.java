package vnc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/** Renders generated functions as a Ren'Py script. */
public final class RenPyWriter {
  private static final Joiner SPACE = Joiner.on(' ');

  // Inside a quoted Ren'Py string.
  private static final Escaper STRING_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('"', "\\\"")
          .addEscape('\n', "\\n")
          .build();

  // Displayed text also has interpolation and text tags.
  private static final Escaper TEXT_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('"', "\\\"")
          .addEscape('\n', "\\n")
          .addEscape('[', "[[")
          .addEscape('{', "{{")
          .build();

  private final String indentUnit;

  private Program program;
  private CodeGenerator.Result generated;
  private StringBuilder out;

  private IdentifierAllocator variables;
  private IdentifierAllocator imageTags;
  private IdentifierAllocator scenes;
  private IdentifierAllocator labels;
  private Map<Character, IdentifierAllocator> spriteTags;

  private Map<String, String> entryLabels;

  // Display image id -> distinct assets, in order of first use.
  private Map<String, List<AssetRef>> displayImages;

  public RenPyWriter(CompilerOptions options) {
    this.indentUnit = Strings.repeat(" ", options.indent());
  }

  public String write(Program program, CodeGenerator.Result generated) {
    this.program = program;
    this.generated = generated;
    this.out = new StringBuilder();
    allocateIdentifiers();

    line(0, "# Generated from \"%s\". Edits are lost on recompilation.", program.title());
    writeCharacters();
    writeImages();
    writeEntry();
    for (CodeGenerator.ScheduledFunction function : generated.functions()) {
      writeFunction(function);
    }
    return out.toString();
  }

  private static String blockKey(String function, String label) {
    return function + "\0" + label;
  }

  private static String functionKey(String function) {
    return "function\0" + function;
  }

  private void allocateIdentifiers() {
    variables = new IdentifierAllocator(IdentifierAllocator.RESERVED_NAMES, "c");
    imageTags =
        new IdentifierAllocator(
            ImmutableSet.<String>builder()
                .addAll(IdentifierAllocator.RESERVED_NAMES)
                .addAll(IdentifierAllocator.RESERVED_TAGS)
                .build(),
            "img");
    scenes = new IdentifierAllocator(ImmutableSet.of(), "scene");
    labels = new IdentifierAllocator(IdentifierAllocator.RESERVED_NAMES, "l");
    spriteTags = new HashMap<>();
    displayImages = new LinkedHashMap<>();
    entryLabels = new HashMap<>();

    for (Character character : program.declarations().characters()) {
      variables.allocate(character, character.name());
      imageTags.allocate(character, character.name());
      IdentifierAllocator tags = new IdentifierAllocator(ImmutableSet.of(), "s");
      spriteTags.put(character, tags);
      for (ImmutableList<String> path : character.sprites().leaves().keySet()) {
        path.forEach(tag -> tags.allocate(tag, tag));
      }
    }

    for (Scene scene : allScenes()) {
      scenes.allocate(scene.name(), scene.name());
    }

    for (CodeGenerator.ScheduledFunction function : generated.functions()) {
      labels.allocate(functionKey(function.name()), function.name());
      entryLabels.put(function.name(), function.blocks().get(0).label());
    }
    for (CodeGenerator.ScheduledFunction function : generated.functions()) {
      for (CodeGenerator.ScheduledBlock block : function.blocks()) {
        if (!isEntry(function.name(), block.label())) {
          labels.allocate(blockKey(function.name(), block.label()), block.label());
        }

        for (Instruction instruction : instructions(block)) {
          if (instruction.type() != Instruction.Type.SHOW_IMAGE) continue;
          Instruction.ShowImage show = instruction.cast(Instruction.ShowImage.class);
          imageTags.allocate("image\0" + show.image(), show.image());
          List<AssetRef> assets =
              displayImages.computeIfAbsent(show.image(), k -> new ArrayList<>());
          if (!assets.contains(show.asset())) assets.add(show.asset());
        }
      }
    }
  }

  private boolean isEntry(String function, String label) {
    return entryLabels.get(function).equals(label);
  }

  // The entry block is labelled with the function's own identifier.
  private String label(String function, String label) {
    if (isEntry(function, label)) return labels.get(functionKey(function));
    return labels.get(blockKey(function, label));
  }

  private List<Scene> allScenes() {
    List<Scene> all = new ArrayList<>(program.declarations().scenes());
    all.addAll(generated.implicitScenes());
    return all;
  }

  private static Iterable<Instruction> instructions(CodeGenerator.ScheduledBlock block) {
    return ImmutableList.<Instruction>builder()
        .addAll(block.instructions())
        .addAll(block.compensation())
        .build();
  }

  private void line(int depth, String format, Object... args) {
    out.append(Strings.repeat(indentUnit, depth));
    out.append(String.format(format, args)).append('\n');
  }

  private void blankLine() {
    out.append('\n');
  }

  private static String quote(String s) {
    return "\"" + STRING_ESCAPER.escape(s) + "\"";
  }

  private static String quoteText(String s) {
    return "\"" + TEXT_ESCAPER.escape(s) + "\"";
  }

  /** Quoted display text with the runs' styling as Ren'Py text tags. */
  static String markup(StyledText text) {
    StringBuilder sb = new StringBuilder("\"");
    for (Document.TextRun run : text.runs()) {
      String escaped = TEXT_ESCAPER.escape(run.text());
      if (run.italic()) escaped = "{i}" + escaped + "{/i}";
      if (run.bold()) escaped = "{b}" + escaped + "{/b}";
      if (run.color().isPresent()) {
        escaped = "{color=" + run.color().get() + "}" + escaped + "{/color}";
      }
      sb.append(escaped);
    }
    return sb.append('"').toString();
  }

  private static String asset(AssetRef asset) {
    switch (asset.kind()) {
      case ASSET:
        return quote(asset.asset());
      case PLACEHOLDER:
        AssetRef.Placeholder placeholder = asset.placeholder();
        String base = placeholder.shape().renpyBase();
        if (base == null) return String.format("Placeholder(text=%s)", quote(placeholder.label()));
        return String.format(
            "Placeholder(base=%s, text=%s)", quote(base), quote(placeholder.label()));
    }
    throw new AssertionError(asset.kind());
  }

  private void writeCharacters() {
    if (program.declarations().characters().isEmpty()) return;

    blankLine();
    for (Character character : program.declarations().characters()) {
      StringBuilder args = new StringBuilder(quoteText(character.name()));
      character.nameColor().ifPresent(c -> args.append(", who_color=").append(quote(c)));
      character.contentColor().ifPresent(c -> args.append(", what_color=").append(quote(c)));
      line(0, "define %s = Character(%s)", variables.get(character), args);
    }
  }

  private void writeImages() {
    List<String> images = new ArrayList<>();
    for (Character character : program.declarations().characters()) {
      String tag = imageTags.get(character);
      if (character.sprites().isEmpty()) {
        images.add(
            String.format(
                "image %s = %s",
                tag,
                asset(AssetRef.placeholder(character.name(), AssetRef.Shape.CHARACTER))));
        continue;
      }
      IdentifierAllocator tags = spriteTags.get(character);
      character
          .sprites()
          .leaves()
          .forEach(
              (path, asset) ->
                  images.add(
                      String.format(
                          "image %s %s = %s", tag, attributes(tags, path), asset(asset))));
    }

    for (Scene scene : allScenes()) {
      AssetRef background =
          scene.background().orElse(AssetRef.placeholder(scene.name(), AssetRef.Shape.BACKGROUND));
      images.add(String.format("image bg %s = %s", scenes.get(scene.name()), asset(background)));
    }

    displayImages.forEach(
        (id, assets) -> {
          String tag = imageTags.get("image\0" + id);
          if (assets.size() == 1) {
            images.add(String.format("image %s = %s", tag, asset(assets.get(0))));
            return;
          }
          for (int i = 0; i < assets.size(); i++) {
            images.add(String.format("image %s v%d = %s", tag, i + 1, asset(assets.get(i))));
          }
        });

    if (images.isEmpty()) return;
    blankLine();
    images.forEach(image -> line(0, "%s", image));
  }

  private static String attributes(IdentifierAllocator tags, List<String> path) {
    List<String> names = new ArrayList<>();
    path.forEach(tag -> names.add(tags.get(tag)));
    return SPACE.join(names);
  }

  // Ren'Py starts at 'start'; it is reserved, so no function label can take it.
  private void writeEntry() {
    blankLine();
    line(0, "label start:");
    if (generated.functions().isEmpty()) {
      line(1, "return");
    } else {
      line(1, "jump %s", labels.get(functionKey(generated.functions().get(0).name())));
    }
  }

  private void writeFunction(CodeGenerator.ScheduledFunction function) {
    for (CodeGenerator.ScheduledBlock block : function.blocks()) {
      blankLine();
      line(0, "label %s:", label(function.name(), block.label()));
      for (Instruction instruction : block.instructions()) {
        writeInstruction(instruction);
      }
      for (Instruction instruction : block.compensation()) {
        writeInstruction(instruction);
      }
      writeTerminator(function.name(), block.terminator());
    }
  }

  private String sprite(String characterName, List<String> path) {
    Character character = program.declarations().character(characterName).get();
    String tag = imageTags.get(character);
    if (path.isEmpty()) return tag;
    return tag + " " + attributes(spriteTags.get(character), path);
  }

  private String displayImage(String id, AssetRef asset) {
    String tag = imageTags.get("image\0" + id);
    List<AssetRef> assets = displayImages.get(id);
    if (assets.size() == 1) return tag;
    return String.format("%s v%d", tag, assets.indexOf(asset) + 1);
  }

  private void writeInstruction(Instruction instruction) {
    switch (instruction.type()) {
      case SAY:
        Instruction.Say say = instruction.cast(Instruction.Say.class);
        if (say.character().isPresent()) {
          Character character = program.declarations().character(say.character().get()).get();
          line(1, "%s %s", variables.get(character), markup(say.content()));
        } else {
          line(1, "%s", markup(say.content()));
        }
        break;
      case SHOW_SPRITE:
        Instruction.ShowSprite show = instruction.cast(Instruction.ShowSprite.class);
        line(1, "show %s", sprite(show.character(), show.state()));
        break;
      case CHANGE_SPRITE_STATE:
        Instruction.ChangeSpriteState change =
            instruction.cast(Instruction.ChangeSpriteState.class);
        line(1, "show %s", sprite(change.character(), change.state()));
        break;
      case HIDE_SPRITE:
        Instruction.HideSprite hide = instruction.cast(Instruction.HideSprite.class);
        line(1, "hide %s", sprite(hide.character(), ImmutableList.of()));
        break;
      case SET_SCENE:
        Instruction.SetScene scene = instruction.cast(Instruction.SetScene.class);
        if (scene.scene().isPresent()) {
          line(1, "scene bg %s", scenes.get(scene.scene().get()));
        } else {
          line(1, "scene");
        }
        break;
      case PLAY_AUDIO:
        Instruction.PlayAudio play = instruction.cast(Instruction.PlayAudio.class);
        line(1, "play %s %s", play.channel(), quote(play.audio()));
        break;
      case SHOW_IMAGE:
        Instruction.ShowImage image = instruction.cast(Instruction.ShowImage.class);
        line(1, "show %s", displayImage(image.image(), image.asset()));
        break;
      case HIDE_IMAGE:
        Instruction.HideImage hideImage = instruction.cast(Instruction.HideImage.class);
        line(1, "hide %s", imageTags.get("image\0" + hideImage.image()));
        break;
      case PASSTHROUGH_RAW:
        for (String raw : instruction.cast(Instruction.PassthroughRaw.class).lines()) {
          line(1, "%s", raw);
        }
        break;
      case COMMENT:
        String comment = instruction.cast(Instruction.Comment.class).text();
        line(1, "# %s", comment.replace('\n', ' '));
        break;
    }
  }

  private void writeTerminator(String function, Terminator terminator) {
    switch (terminator.type()) {
      case JUMP_TO_FUNCTION:
        String callee = terminator.cast(Terminator.JumpToFunction.class).function();
        line(1, "jump %s", labels.get(functionKey(callee)));
        break;
      case CALL_FUNCTION:
        Terminator.CallFunction call = terminator.cast(Terminator.CallFunction.class);
        line(1, "call %s", labels.get(functionKey(call.function())));
        line(1, "jump %s", label(function, call.continuation().get()));
        break;
      case JUMP_TO_LABEL:
        String target = terminator.cast(Terminator.JumpToLabel.class).label();
        line(1, "jump %s", label(function, target));
        break;
      case BRANCH:
        line(1, "menu:");
        for (Terminator.Branch.Choice choice :
            terminator.cast(Terminator.Branch.class).choices()) {
          line(2, "%s:", markup(choice.text()));
          line(3, "jump %s", label(function, choice.label()));
        }
        break;
      case RETURN:
        line(1, "return");
        break;
    }
  }
}
