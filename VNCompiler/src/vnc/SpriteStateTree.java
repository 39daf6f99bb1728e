package vnc;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;

/**
 * A character's sprite states. Each level of the tree is a mutually exclusive choice of tag; a
 * root-to-node path that carries an asset is a complete state. The first complete path added
 * becomes the default.
 */
public final class SpriteStateTree {
  private static final Comparator<Iterable<String>> PATH_ORDER =
      Ordering.<String>natural().lexicographical();

  private static final class Node {
    private final Map<String, Node> children = new LinkedHashMap<>();
    private AssetRef asset = null;
  }

  private final Node root = new Node();
  private final Map<ImmutableList<String>, AssetRef> leaves = new LinkedHashMap<>();
  private ImmutableList<String> defaultPath = null;

  /** Binds {@code path} to {@code asset}. Returns false if the path was already bound. */
  public boolean add(List<String> path, AssetRef asset) {
    Preconditions.checkArgument(!path.isEmpty(), "empty sprite path");

    Node node = root;
    for (String tag : path) {
      node = node.children.computeIfAbsent(tag, t -> new Node());
    }

    boolean added = node.asset == null;
    node.asset = asset;
    ImmutableList<String> key = ImmutableList.copyOf(path);
    leaves.put(key, asset);
    if (defaultPath == null) defaultPath = key;
    return added;
  }

  public boolean isEmpty() {
    return leaves.isEmpty();
  }

  public Optional<ImmutableList<String>> defaultPath() {
    return Optional.ofNullable(defaultPath);
  }

  public Optional<AssetRef> lookup(List<String> path) {
    Node node = root;
    for (String tag : path) {
      node = node.children.get(tag);
      if (node == null) return Optional.empty();
    }
    return Optional.ofNullable(node.asset);
  }

  /** Complete paths in the order they were first added. */
  public ImmutableMap<ImmutableList<String>, AssetRef> leaves() {
    return ImmutableMap.copyOf(leaves);
  }

  /**
   * Resolves a possibly partial list of tags to a complete path.
   *
   * <p>No tags keeps the current path, or falls back to the default. A complete path is taken as
   * is. Otherwise the candidates are the complete paths containing every requested tag; the one
   * sharing the most tags with the current path wins, then the lexicographically smallest.
   */
  public Optional<ImmutableList<String>> resolve(
      List<String> tags, Optional<ImmutableList<String>> current) {
    if (tags.isEmpty()) {
      if (current.isPresent() && lookup(current.get()).isPresent()) return current;
      return defaultPath();
    }
    if (lookup(tags).isPresent()) return Optional.of(ImmutableList.copyOf(tags));

    Set<String> currentTags = new HashSet<>(current.orElse(ImmutableList.of()));
    ImmutableList<String> best = null;
    int bestScore = -1;
    for (ImmutableList<String> leaf : leaves.keySet()) {
      if (!leaf.containsAll(tags)) continue;

      int score = (int) leaf.stream().filter(currentTags::contains).count();
      if (score > bestScore || (score == bestScore && PATH_ORDER.compare(leaf, best) < 0)) {
        best = leaf;
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }
}
