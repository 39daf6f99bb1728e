package vnc;

import java.util.HashSet;
import java.util.Set;

import com.google.common.graph.Graphs;

/**
 * Checks the structural guarantees of built functions and reports unreachable blocks. A violated
 * guarantee is a compiler bug; it is reported as {@code cfg-invariant} rather than thrown.
 */
public class CfgValidator extends DiagnosticCollector {

  public void validate(Function function) {
    Set<String> labels = new HashSet<>();
    for (BasicBlock block : function.blocks()) {
      if (!labels.add(block.label())) {
        report(
            Diagnostic.Code.CFG_INVARIANT,
            block.pos(),
            "function '%s' has more than one block labelled '%s'",
            function.name(),
            block.label());
      }
    }

    for (BasicBlock block : function.blocks()) {
      for (String successor : block.successors()) {
        if (!labels.contains(successor)) {
          report(
              Diagnostic.Code.CFG_INVARIANT,
              block.terminator().pos(),
              "block '%s' jumps to '%s', which is not a label of function '%s'",
              block.label(),
              successor,
              function.name());
        }
      }
    }

    // The label graph needs unique labels.
    if (labels.size() != function.blocks().size()) return;

    Set<String> reachable = Graphs.reachableNodes(function.graph(), function.entry().label());
    for (BasicBlock block : function.blocks()) {
      if (!reachable.contains(block.label())) {
        report(
            Diagnostic.Code.BLOCK_UNREACHABLE,
            block.pos(),
            "block '%s' of function '%s' is never reached",
            block.label(),
            function.name());
      }
    }
  }
}
