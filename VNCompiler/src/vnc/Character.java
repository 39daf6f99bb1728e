package vnc;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/** A declared speaker. Only the sprite tree grows after declaration. */
public final class Character {
  private final String name;
  private final Document.Pos pos;
  private final boolean implicit;
  private final Set<String> aliases = new LinkedHashSet<>();
  private final SpriteStateTree sprites = new SpriteStateTree();
  private Optional<String> nameColor = Optional.empty();
  private Optional<String> contentColor = Optional.empty();

  Character(String name, Document.Pos pos, boolean implicit) {
    this.name = name;
    this.pos = pos;
    this.implicit = implicit;
  }

  public String name() {
    return name;
  }

  public Document.Pos pos() {
    return pos;
  }

  /** True when created on first use rather than by a declaration. */
  public boolean implicit() {
    return implicit;
  }

  public ImmutableSet<String> aliases() {
    return ImmutableSet.copyOf(aliases);
  }

  void addAlias(String alias) {
    aliases.add(alias);
  }

  public SpriteStateTree sprites() {
    return sprites;
  }

  public Optional<String> nameColor() {
    return nameColor;
  }

  public Optional<String> contentColor() {
    return contentColor;
  }

  void setColors(Optional<String> nameColor, Optional<String> contentColor) {
    this.nameColor = nameColor;
    this.contentColor = contentColor;
  }

  @Override
  public String toString() {
    return name;
  }
}
