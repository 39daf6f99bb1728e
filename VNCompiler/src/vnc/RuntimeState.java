package vnc;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/** What the engine is showing at some point of a function, as far as the generator can tell. */
public final class RuntimeState {

  @AutoValue
  public abstract static class CharacterState {
    private static final CharacterState ABSENT = create(Optional.empty(), false);

    /** Last known sprite path; kept while the character is off stage. */
    public abstract Optional<ImmutableList<String>> path();

    public abstract boolean present();

    public CharacterState withPath(ImmutableList<String> path) {
      return create(Optional.of(path), present());
    }

    public CharacterState withPresent(boolean present) {
      return create(path(), present);
    }

    public static CharacterState absent() {
      return ABSENT;
    }

    public static CharacterState create(Optional<ImmutableList<String>> path, boolean present) {
      return new AutoValue_RuntimeState_CharacterState(path, present);
    }
  }

  private final Map<String, CharacterState> characters;
  private final Map<String, AssetRef> images;
  private Optional<String> scene;

  public RuntimeState() {
    this(new HashMap<>(), new TreeMap<>(), Optional.empty());
  }

  private RuntimeState(
      Map<String, CharacterState> characters,
      Map<String, AssetRef> images,
      Optional<String> scene) {
    this.characters = characters;
    this.images = images;
    this.scene = scene;
  }

  public RuntimeState copy() {
    return new RuntimeState(new HashMap<>(characters), new TreeMap<>(images), scene);
  }

  public CharacterState character(String name) {
    return characters.getOrDefault(name, CharacterState.absent());
  }

  public void setCharacter(String name, CharacterState state) {
    if (state.equals(CharacterState.absent())) {
      characters.remove(name);
    } else {
      characters.put(name, state);
    }
  }

  public boolean isPresent(String name) {
    return character(name).present();
  }

  /** Displayed standalone images by id, sorted. */
  public ImmutableSortedMap<String, AssetRef> images() {
    return ImmutableSortedMap.copyOf(images);
  }

  public void showImage(String id, AssetRef asset) {
    images.put(id, asset);
  }

  public boolean hideImage(String id) {
    return images.remove(id) != null;
  }

  public Optional<String> scene() {
    return scene;
  }

  /** A scene change empties the stage; off-stage sprite paths are remembered. */
  public void setScene(Optional<String> scene) {
    this.scene = scene;
    images.clear();
    for (String name : ImmutableList.copyOf(characters.keySet())) {
      setCharacter(name, character(name).withPresent(false));
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RuntimeState)) return false;
    RuntimeState that = (RuntimeState) obj;
    return characters.equals(that.characters)
        && images.equals(that.images)
        && scene.equals(that.scene);
  }

  @Override
  public int hashCode() {
    return Objects.hash(characters, images, scene);
  }

  @Override
  public String toString() {
    return String.format("scene=%s characters=%s images=%s", scene, characters, images.keySet());
  }
}
