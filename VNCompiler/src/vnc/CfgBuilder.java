package vnc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

/**
 * Cuts function bodies into basic blocks and resolves control-flow targets. Anything that cannot
 * be resolved is reported and the offending edge is dropped, so every block of the result has
 * exactly one terminator whose targets are labels of the same function.
 */
public class CfgBuilder extends DiagnosticCollector {

  // A block under construction.
  private static final class RawBlock {
    private final Optional<String> declaredLabel;
    private final Document.Pos pos;
    private final List<Instruction> instructions = new ArrayList<>();
    private String label;
    private Terminator terminator = null;
    // Next block in document order, for fallthrough and call continuations.
    private RawBlock next = null;

    private RawBlock(Optional<String> declaredLabel, Document.Pos pos) {
      this.declaredLabel = declaredLabel;
      this.pos = pos;
    }

    private boolean isEmpty() {
      return !declaredLabel.isPresent() && instructions.isEmpty() && terminator == null;
    }
  }

  private Set<String> functionNames;
  private Map<String, String> labelOwners;

  public ImmutableList<Function> build(Program program) {
    functionNames = new HashSet<>();
    labelOwners = new HashMap<>();
    for (FunctionBody body : program.functions()) {
      functionNames.add(body.name());
      for (Statement statement : body.statements()) {
        if (statement.kind() == Statement.Kind.LABEL) {
          labelOwners.putIfAbsent(statement.label().name(), body.name());
        }
      }
    }

    return program.functions().stream().map(this::build).collect(ImmutableList.toImmutableList());
  }

  Function build(FunctionBody body) {
    List<RawBlock> blocks = split(body);
    assignLabels(body, blocks);

    Set<String> localLabels = new HashSet<>();
    blocks.forEach(b -> localLabels.add(b.label));

    ImmutableList.Builder<BasicBlock> result = ImmutableList.builder();
    for (RawBlock block : blocks) {
      result.add(
          BasicBlock.create(
              block.label,
              block.declaredLabel.map(block.label::equals).orElse(false),
              block.pos,
              block.instructions,
              resolve(body, block, localLabels)));
    }
    return Function.create(body.name(), body.pos(), result.build());
  }

  private static String describe(Statement statement) {
    switch (statement.kind()) {
      case INSTRUCTION:
        return statement.instruction().type().name().toLowerCase();
      case TERMINATOR:
        return statement.terminator().type().name().toLowerCase();
      case LABEL:
        return "label " + statement.label().name();
    }
    throw new AssertionError(statement.kind());
  }

  private List<RawBlock> split(FunctionBody body) {
    List<RawBlock> blocks = new ArrayList<>();
    RawBlock current = new RawBlock(Optional.empty(), body.pos());
    blocks.add(current);
    // The terminator that made the rest of the current region unreachable.
    Terminator terminatedBy = null;

    for (Statement statement : body.statements()) {
      switch (statement.kind()) {
        case LABEL:
          Statement.Label label = statement.label();
          if (current != null && current.isEmpty()) {
            // Reuse the empty block opened after a call or at the function entry.
            RawBlock labelled = new RawBlock(Optional.of(label.name()), label.pos());
            blocks.set(blocks.size() - 1, labelled);
            relink(blocks, current, labelled);
            current = labelled;
            continue;
          }

          RawBlock next = new RawBlock(Optional.of(label.name()), label.pos());
          if (current != null) current.next = next;
          blocks.add(next);
          current = next;
          terminatedBy = null;
          break;

        case INSTRUCTION:
          if (current == null) {
            reportDropped(statement, terminatedBy);
            continue;
          }
          current.instructions.add(statement.instruction());
          break;

        case TERMINATOR:
          if (current == null) {
            reportDropped(statement, terminatedBy);
            continue;
          }
          Terminator terminator = statement.terminator();
          current.terminator = terminator;
          if (terminator.type() == Terminator.Type.CALL_FUNCTION) {
            RawBlock continuation = new RawBlock(Optional.empty(), terminator.pos());
            current.next = continuation;
            blocks.add(continuation);
            current = continuation;
          } else {
            current = null;
            terminatedBy = terminator;
          }
          break;
      }
    }

    if (current != null && current.terminator == null) {
      Document.Pos end =
          body.statements().isEmpty()
              ? body.pos()
              : body.statements().get(body.statements().size() - 1).pos();
      current.terminator = Terminator.Return.implicit(end);
    }
    return blocks;
  }

  // Points the predecessor of 'from' at 'to'.
  private static void relink(List<RawBlock> blocks, RawBlock from, RawBlock to) {
    for (RawBlock block : blocks) {
      if (block.next == from) block.next = to;
    }
  }

  private void reportDropped(Statement statement, Terminator terminatedBy) {
    report(
        Diagnostic.Code.UNHANDLED_NODE_IN_TERMINATED_BLOCK,
        statement.pos(),
        "%s after %s is unreachable and was dropped",
        describe(statement),
        terminatedBy.type().name().toLowerCase());
  }

  /**
   * Gives every block a unique label. Anonymous blocks get generated ones; of several blocks
   * declaring the same label the last keeps it and the earlier ones are renamed.
   */
  private void assignLabels(FunctionBody body, List<RawBlock> blocks) {
    Map<String, RawBlock> lastDeclaration = new HashMap<>();
    for (RawBlock block : blocks) {
      block.declaredLabel.ifPresent(l -> lastDeclaration.put(l, block));
    }

    Set<String> taken = new HashSet<>(lastDeclaration.keySet());
    int anonymous = 0;
    for (RawBlock block : blocks) {
      if (!block.declaredLabel.isPresent()) {
        block.label = fresh(taken, anonymous == 0 ? body.name() : body.name() + "_" + anonymous);
        anonymous++;
        continue;
      }

      String label = block.declaredLabel.get();
      if (lastDeclaration.get(label) == block) {
        block.label = label;
        continue;
      }

      block.label = fresh(taken, label + "_dup");
      RawBlock winner = lastDeclaration.get(label);
      report(
          Diagnostic.Code.LABEL_DUPLICATE,
          block.pos,
          "label '%s' is declared again at %s; this block is renamed to '%s'",
          label,
          winner.pos,
          block.label);
    }
  }

  private static String fresh(Set<String> taken, String base) {
    String label = base;
    for (int i = 2; taken.contains(label); i++) {
      label = base + "_" + i;
    }
    taken.add(label);
    return label;
  }

  private Terminator resolve(FunctionBody body, RawBlock block, Set<String> localLabels) {
    Terminator terminator = block.terminator;
    if (terminator == null) {
      // Falls into the next block.
      Verify.verifyNotNull(block.next, "block %s has no terminator and no successor", block.label);
      return Terminator.JumpToLabel.implicit(block.next.label, block.next.pos);
    }

    switch (terminator.type()) {
      case JUMP_TO_FUNCTION:
        String target = terminator.cast(Terminator.JumpToFunction.class).function();
        if (functionNames.contains(target)) return terminator;
        report(
            Diagnostic.Code.FUNCTION_NOTFOUND,
            terminator.pos(),
            "function '%s' not found, returning instead",
            target);
        return Terminator.Return.implicit(terminator.pos());

      case CALL_FUNCTION:
        Terminator.CallFunction call = terminator.cast(Terminator.CallFunction.class);
        if (functionNames.contains(call.function())) {
          return call.withContinuation(block.next.label);
        }
        report(
            Diagnostic.Code.FUNCTION_NOTFOUND,
            terminator.pos(),
            "function '%s' not found, call removed",
            call.function());
        return Terminator.JumpToLabel.implicit(block.next.label, terminator.pos());

      case JUMP_TO_LABEL:
        String label = terminator.cast(Terminator.JumpToLabel.class).label();
        if (checkLocalLabel(body, label, terminator.pos(), localLabels)) return terminator;
        return Terminator.Return.implicit(terminator.pos());

      case BRANCH:
        Terminator.Branch branch = terminator.cast(Terminator.Branch.class);
        List<Terminator.Branch.Choice> choices = new ArrayList<>();
        for (Terminator.Branch.Choice choice : branch.choices()) {
          if (checkLocalLabel(body, choice.label(), terminator.pos(), localLabels)) {
            choices.add(choice);
          }
        }
        if (choices.isEmpty()) return Terminator.Return.implicit(terminator.pos());
        if (choices.size() == branch.choices().size()) return terminator;
        return Terminator.Branch.create(choices, terminator.pos());

      case RETURN:
        return terminator;
    }
    throw new AssertionError(terminator.type());
  }

  private boolean checkLocalLabel(
      FunctionBody body, String label, Document.Pos pos, Set<String> localLabels) {
    if (localLabels.contains(label)) return true;

    String owner = labelOwners.get(label);
    if (owner != null && !owner.equals(body.name())) {
      report(
          Diagnostic.Code.LABEL_CROSS_FUNCTION,
          pos,
          "label '%s' belongs to function '%s', not '%s'; edge dropped",
          label,
          owner,
          body.name());
    } else {
      report(
          Diagnostic.Code.LABEL_NOTFOUND,
          pos,
          "label '%s' not found in function '%s'; edge dropped",
          label,
          body.name());
    }
    return false;
  }
}
