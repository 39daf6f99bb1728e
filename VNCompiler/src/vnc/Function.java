package vnc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.ImmutableGraph;

/** A function's control-flow graph; blocks are in document order and the first is the entry. */
@AutoValue
public abstract class Function {
  public abstract String name();

  public abstract Document.Pos pos();

  public abstract ImmutableList<BasicBlock> blocks();

  public BasicBlock entry() {
    return blocks().get(0);
  }

  @Memoized
  ImmutableMap<String, BasicBlock> blocksByLabel() {
    return blocks().stream().collect(ImmutableMap.toImmutableMap(BasicBlock::label, b -> b));
  }

  public Optional<BasicBlock> block(String label) {
    return Optional.ofNullable(blocksByLabel().get(label));
  }

  /** Edges between block labels; targets that do not resolve locally are left out. */
  @Memoized
  public ImmutableGraph<String> graph() {
    ImmutableGraph.Builder<String> builder =
        GraphBuilder.directed().allowsSelfLoops(true).<String>immutable();
    for (BasicBlock block : blocks()) {
      builder.addNode(block.label());
    }
    for (BasicBlock block : blocks()) {
      for (String successor : block.successors()) {
        if (blocksByLabel().containsKey(successor)) builder.putEdge(block.label(), successor);
      }
    }
    return builder.build();
  }

  public static Function create(String name, Document.Pos pos, Iterable<BasicBlock> blocks) {
    ImmutableList<BasicBlock> list = ImmutableList.copyOf(blocks);
    Preconditions.checkArgument(!list.isEmpty(), "function %s has no blocks", name);
    return new AutoValue_Function(name, pos, list);
  }
}
