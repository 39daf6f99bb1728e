package vnc;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;

/** Characters, aliases and scenes of one compilation unit, in declaration order. */
public final class Declarations {
  private final Map<String, Character> charactersByName = new LinkedHashMap<>();
  private final Map<String, Character> charactersByAlias = new HashMap<>();
  private final Map<String, Scene> scenesByName = new LinkedHashMap<>();

  public Character declareCharacter(String name, Document.Pos pos, boolean implicit) {
    Preconditions.checkState(
        !isCharacterName(name), "character '%s' is already declared", name);
    Character character = new Character(name, pos, implicit);
    charactersByName.put(name, character);
    return character;
  }

  /** Resolves a name or alias. */
  public Optional<Character> character(String nameOrAlias) {
    Character character = charactersByName.get(nameOrAlias);
    if (character == null) character = charactersByAlias.get(nameOrAlias);
    return Optional.ofNullable(character);
  }

  public boolean isCharacterName(String nameOrAlias) {
    return character(nameOrAlias).isPresent();
  }

  /** Returns false if the alias is already taken by another name or alias. */
  public boolean addAlias(Character character, String alias) {
    Optional<Character> existing = character(alias);
    if (existing.isPresent()) return existing.get() == character;

    charactersByAlias.put(alias, character);
    character.addAlias(alias);
    return true;
  }

  public Collection<Character> characters() {
    return Collections.unmodifiableCollection(charactersByName.values());
  }

  /** Returns the previous declaration if there was one; the new declaration replaces it. */
  public Optional<Scene> declareScene(Scene scene) {
    return Optional.ofNullable(scenesByName.put(scene.name(), scene));
  }

  public Optional<Scene> scene(String name) {
    return Optional.ofNullable(scenesByName.get(name));
  }

  public Collection<Scene> scenes() {
    return Collections.unmodifiableCollection(scenesByName.values());
  }
}
