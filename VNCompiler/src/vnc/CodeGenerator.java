package vnc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.auto.value.AutoValue;
import com.google.common.base.Verify;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

/**
 * Walks each function's CFG in document order while simulating what the engine shows, and
 * schedules the instructions to emit.
 *
 * <p>A block's entry state is the exit state of its lowest-ordered predecessor that was simulated
 * before it. Once every block has been simulated, each other predecessor whose exit state
 * disagrees gets the compensating instructions from {@link StateDiff}, either at its end or, when
 * it has several successors, in a trampoline block on that edge.
 *
 * <p>Functions and declarations are never modified, so generating twice gives the same result.
 */
public class CodeGenerator extends DiagnosticCollector {

  @AutoValue
  public abstract static class ScheduledBlock {
    public abstract String label();

    public abstract ImmutableList<Instruction> instructions();

    /** Runs after {@link #instructions()}, bringing the state in line with the successor. */
    public abstract ImmutableList<Instruction> compensation();

    public abstract Terminator terminator();

    public abstract boolean trampoline();

    static ScheduledBlock create(
        String label,
        Iterable<Instruction> instructions,
        Iterable<Instruction> compensation,
        Terminator terminator,
        boolean trampoline) {
      return new AutoValue_CodeGenerator_ScheduledBlock(
          label,
          ImmutableList.copyOf(instructions),
          ImmutableList.copyOf(compensation),
          terminator,
          trampoline);
    }
  }

  @AutoValue
  public abstract static class ScheduledFunction {
    public abstract String name();

    /** Entry block first. */
    public abstract ImmutableList<ScheduledBlock> blocks();

    static ScheduledFunction create(String name, Iterable<ScheduledBlock> blocks) {
      return new AutoValue_CodeGenerator_ScheduledFunction(name, ImmutableList.copyOf(blocks));
    }
  }

  @AutoValue
  public abstract static class Result {
    public abstract ImmutableList<ScheduledFunction> functions();

    /** Scenes used without being declared, in order of first use. */
    public abstract ImmutableList<Scene> implicitScenes();

    static Result create(Iterable<ScheduledFunction> functions, Iterable<Scene> implicitScenes) {
      return new AutoValue_CodeGenerator_Result(
          ImmutableList.copyOf(functions), ImmutableList.copyOf(implicitScenes));
    }
  }

  private final CompilerOptions options;

  private Declarations declarations;
  private ImmutableList<String> characterOrder;
  private Map<String, Scene> implicitScenes;

  // Characters whose sprite state can no longer be tracked in the current function.
  private Set<String> unknownState;

  public CodeGenerator(CompilerOptions options) {
    this.options = options;
  }

  public Result generate(Program program, List<Function> functions) {
    declarations = program.declarations();
    characterOrder =
        declarations
            .characters()
            .stream()
            .map(Character::name)
            .collect(ImmutableList.toImmutableList());
    implicitScenes = new LinkedHashMap<>();

    ImmutableList.Builder<ScheduledFunction> scheduled = ImmutableList.builder();
    for (Function function : functions) {
      scheduled.add(generate(function));
    }
    return Result.create(scheduled.build(), implicitScenes.values());
  }

  private ScheduledFunction generate(Function function) {
    unknownState = new HashSet<>();
    ImmutableList<BasicBlock> blocks = function.blocks();
    int size = blocks.size();

    Map<String, Integer> indices = new HashMap<>();
    for (int i = 0; i < size; i++) {
      indices.put(blocks.get(i).label(), i);
    }

    // Predecessor lists come out in ascending document order.
    ListMultimap<Integer, Integer> predecessors = ArrayListMultimap.create();
    for (int i = 0; i < size; i++) {
      for (String successor : blocks.get(i).successors()) {
        Integer target = indices.get(successor);
        Verify.verifyNotNull(target, "unresolved successor %s", successor);
        predecessors.put(target, i);
      }
    }

    RuntimeState[] entry = new RuntimeState[size];
    RuntimeState[] exit = new RuntimeState[size];
    int[] authoritative = new int[size];
    List<List<Instruction>> emitted = new ArrayList<>();
    for (int i = 0; i < size; i++) emitted.add(null);

    // Simulate every block whose entry state is known, in document order, until none is left.
    boolean progress = true;
    while (progress) {
      progress = false;
      for (int i = 0; i < size; i++) {
        if (exit[i] != null) continue;

        int from = i == 0 ? -1 : firstSimulated(predecessors.get(i), exit);
        if (i != 0 && from < 0) continue;

        simulate(blocks.get(i), i, from, entry, exit, authoritative, emitted);
        progress = true;
      }
    }

    // Unreachable blocks still get code.
    for (int i = 0; i < size; i++) {
      if (exit[i] == null) {
        simulate(
            blocks.get(i),
            i,
            firstSimulated(predecessors.get(i), exit),
            entry,
            exit,
            authoritative,
            emitted);
      }
    }

    // Reconcile the remaining predecessors of every join point.
    List<List<Instruction>> compensation = new ArrayList<>();
    List<Map<String, String>> redirects = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      compensation.add(new ArrayList<>());
      redirects.add(new HashMap<>());
    }
    Set<String> labels = new HashSet<>(indices.keySet());
    List<ScheduledBlock> trampolines = new ArrayList<>();

    for (int target = 0; target < size; target++) {
      BasicBlock join = blocks.get(target);
      for (int pred : predecessors.get(target)) {
        if (pred == authoritative[target]) continue;

        BasicBlock predecessor = blocks.get(pred);
        ImmutableList<Instruction> diff =
            StateDiff.diff(
                exit[pred], entry[target], characterOrder, predecessor.terminator().pos());
        if (diff.isEmpty()) continue;

        report(
            Diagnostic.Code.JOINPATH_COMPENSATED,
            join.pos(),
            "state on the edge from '%s' differs at '%s'; %d compensating instruction(s) added",
            predecessor.label(),
            join.label(),
            diff.size());

        if (predecessor.successors().size() == 1) {
          compensation.get(pred).addAll(diff);
        } else {
          String trampoline = fresh(labels, predecessor.label() + "_to_" + join.label());
          redirects.get(pred).put(join.label(), trampoline);
          trampolines.add(
              ScheduledBlock.create(
                  trampoline,
                  diff,
                  ImmutableList.of(),
                  Terminator.JumpToLabel.implicit(join.label(), predecessor.terminator().pos()),
                  true));
        }
      }
    }

    List<ScheduledBlock> result = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      BasicBlock block = blocks.get(i);
      result.add(
          ScheduledBlock.create(
              block.label(),
              emitted.get(i),
              compensation.get(i),
              redirect(block.terminator(), redirects.get(i)),
              false));
    }
    result.addAll(trampolines);
    return ScheduledFunction.create(function.name(), result);
  }

  private static int firstSimulated(List<Integer> predecessors, RuntimeState[] exit) {
    for (int pred : predecessors) {
      if (exit[pred] != null) return pred;
    }
    return -1;
  }

  private static String fresh(Set<String> taken, String base) {
    String label = base;
    for (int i = 2; taken.contains(label); i++) {
      label = base + "_" + i;
    }
    taken.add(label);
    return label;
  }

  private static Terminator redirect(Terminator terminator, Map<String, String> redirects) {
    if (redirects.isEmpty()) return terminator;

    switch (terminator.type()) {
      case JUMP_TO_LABEL:
        Terminator.JumpToLabel jump = terminator.cast(Terminator.JumpToLabel.class);
        String label = redirects.getOrDefault(jump.label(), jump.label());
        return jump.implicit()
            ? Terminator.JumpToLabel.implicit(label, jump.pos())
            : Terminator.JumpToLabel.create(label, jump.pos());
      case BRANCH:
        Terminator.Branch branch = terminator.cast(Terminator.Branch.class);
        ImmutableList.Builder<Terminator.Branch.Choice> choices = ImmutableList.builder();
        for (Terminator.Branch.Choice choice : branch.choices()) {
          choices.add(
              Terminator.Branch.Choice.create(
                  choice.text(), redirects.getOrDefault(choice.label(), choice.label())));
        }
        return Terminator.Branch.create(choices.build(), branch.pos());
      case CALL_FUNCTION:
        Terminator.CallFunction call = terminator.cast(Terminator.CallFunction.class);
        String continuation = call.continuation().get();
        return call.withContinuation(redirects.getOrDefault(continuation, continuation));
      default:
        return terminator;
    }
  }

  private void simulate(
      BasicBlock block,
      int index,
      int from,
      RuntimeState[] entry,
      RuntimeState[] exit,
      int[] authoritative,
      List<List<Instruction>> emitted) {
    RuntimeState state = from < 0 ? new RuntimeState() : exit[from].copy();
    entry[index] = state.copy();
    authoritative[index] = from;

    List<Instruction> out = new ArrayList<>();
    for (Instruction instruction : block.instructions()) {
      execute(instruction, state, out);
    }

    exit[index] = state;
    emitted.set(index, out);
  }

  private Character character(String name) {
    Optional<Character> character = declarations.character(name);
    Verify.verify(character.isPresent(), "undeclared character %s", name);
    return character.get();
  }

  private void reportState(Diagnostic.Code code, String character, Document.Pos pos, String msg) {
    if (unknownState.contains(character)) return;
    report(code, pos, msg);
  }

  /**
   * Resolves requested tags against the character's sprites. On failure the character's state
   * becomes unknown and the best known path is returned instead.
   */
  private ImmutableList<String> resolveState(
      Character character, List<String> tags, RuntimeState state, Document.Pos pos) {
    RuntimeState.CharacterState current = state.character(character.name());
    SpriteStateTree sprites = character.sprites();

    Optional<ImmutableList<String>> resolved;
    if (sprites.isEmpty()) {
      resolved = tags.isEmpty() ? Optional.of(ImmutableList.of()) : Optional.empty();
    } else {
      resolved = sprites.resolve(tags, current.path());
    }
    if (resolved.isPresent()) return resolved.get();

    reportState(
        Diagnostic.Code.CHARACTER_STATE_EMPTY,
        character.name(),
        pos,
        String.format(
            "character '%s' has no sprite state matching '%s'",
            character.name(),
            String.join("/", tags)));
    unknownState.add(character.name());

    if (sprites.isEmpty()) return ImmutableList.of();
    return sprites.resolve(ImmutableList.of(), current.path()).orElse(ImmutableList.of());
  }

  private void execute(Instruction instruction, RuntimeState state, List<Instruction> out) {
    switch (instruction.type()) {
      case SAY:
        executeSay(instruction.cast(Instruction.Say.class), state, out);
        break;
      case SHOW_SPRITE:
        executeShow(instruction.cast(Instruction.ShowSprite.class), state, out);
        break;
      case HIDE_SPRITE:
        Instruction.HideSprite hide = instruction.cast(Instruction.HideSprite.class);
        if (!state.isPresent(hide.character())) {
          report(
              Diagnostic.Code.CHARACTER_NOT_ONSTAGE,
              hide.pos(),
              "character '%s' is not on stage, hide skipped",
              hide.character());
          break;
        }
        state.setCharacter(hide.character(), state.character(hide.character()).withPresent(false));
        out.add(hide);
        break;
      case CHANGE_SPRITE_STATE:
        Instruction.ChangeSpriteState change =
            instruction.cast(Instruction.ChangeSpriteState.class);
        changeState(character(change.character()), change.state(), change.pos(), state, out);
        break;
      case SET_SCENE:
        Instruction.SetScene scene = instruction.cast(Instruction.SetScene.class);
        scene.scene().ifPresent(name -> checkScene(name, scene.pos()));
        state.setScene(scene.scene());
        out.add(scene);
        break;
      case SHOW_IMAGE:
        Instruction.ShowImage image = instruction.cast(Instruction.ShowImage.class);
        state.showImage(image.image(), image.asset());
        out.add(image);
        break;
      case HIDE_IMAGE:
        Instruction.HideImage hideImage = instruction.cast(Instruction.HideImage.class);
        if (state.hideImage(hideImage.image())) out.add(hideImage);
        break;
      case PLAY_AUDIO:
      case PASSTHROUGH_RAW:
      case COMMENT:
        out.add(instruction);
        break;
    }
  }

  private void executeSay(Instruction.Say say, RuntimeState state, List<Instruction> out) {
    if (say.character().isPresent() && !say.status().isEmpty()) {
      changeState(character(say.character().get()), say.status(), say.pos(), state, out);
    }
    out.add(say);
  }

  // Updates the tracked path; only a character on stage is redrawn.
  private void changeState(
      Character character,
      List<String> tags,
      Document.Pos pos,
      RuntimeState state,
      List<Instruction> out) {
    RuntimeState.CharacterState current = state.character(character.name());
    ImmutableList<String> path = resolveState(character, tags, state, pos);
    if (current.path().equals(Optional.of(path))) return;

    state.setCharacter(character.name(), current.withPath(path));
    if (current.present()) {
      out.add(Instruction.ChangeSpriteState.create(character.name(), path, pos));
    }
  }

  private void executeShow(Instruction.ShowSprite show, RuntimeState state, List<Instruction> out) {
    Character character = character(show.character());
    RuntimeState.CharacterState current = state.character(character.name());

    if (current.present()) {
      if (options.reentrantShowPolicy() == CompilerOptions.ReentrantShowPolicy.UPDATE_STATE) {
        ImmutableList<String> path = resolveState(character, show.state(), state, show.pos());
        if (!current.path().equals(Optional.of(path))) {
          state.setCharacter(character.name(), current.withPath(path));
          out.add(Instruction.ChangeSpriteState.create(character.name(), path, show.pos()));
          return;
        }
      }
      reportState(
          Diagnostic.Code.CHARACTER_STATEERROR,
          character.name(),
          show.pos(),
          String.format("character '%s' is already on stage, show skipped", character.name()));
      return;
    }

    ImmutableList<String> path = resolveState(character, show.state(), state, show.pos());
    state.setCharacter(
        character.name(), RuntimeState.CharacterState.create(Optional.of(path), true));
    out.add(Instruction.ShowSprite.create(character.name(), path, show.pos()));
  }

  private void checkScene(String name, Document.Pos pos) {
    if (declarations.scene(name).isPresent() || implicitScenes.containsKey(name)) return;

    report(
        Diagnostic.Code.SCENE_NOTFOUND,
        pos,
        "scene '%s' is not declared, creating it without a background",
        name);
    implicitScenes.put(name, Scene.create(name, Optional.empty(), pos));
  }
}
