package vnc;

import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/** Computes the instructions that turn one runtime state into another. */
public final class StateDiff {
  private StateDiff() {}

  /**
   * Instructions that bring the engine from {@code from} to {@code to}: the scene first, then
   * characters in {@code characterOrder}, then standalone images by id. Sprite paths of off-stage
   * characters are not compensated; every emitted Show names its full path.
   */
  public static ImmutableList<Instruction> diff(
      RuntimeState from, RuntimeState to, Iterable<String> characterOrder, Document.Pos pos) {
    ImmutableList.Builder<Instruction> out = ImmutableList.builder();

    RuntimeState current = from;
    if (!from.scene().equals(to.scene())) {
      out.add(Instruction.SetScene.create(to.scene(), pos));
      current = from.copy();
      current.setScene(to.scene());
    }

    for (String name : characterOrder) {
      RuntimeState.CharacterState before = current.character(name);
      RuntimeState.CharacterState after = to.character(name);
      ImmutableList<String> path = after.path().orElse(ImmutableList.of());

      if (after.present() && !before.present()) {
        out.add(Instruction.ShowSprite.create(name, path, pos));
      } else if (!after.present() && before.present()) {
        out.add(Instruction.HideSprite.create(name, pos));
      } else if (after.present() && !before.path().equals(after.path())) {
        out.add(Instruction.ChangeSpriteState.create(name, path, pos));
      }
    }

    ImmutableSortedMap<String, AssetRef> beforeImages = current.images();
    ImmutableSortedMap<String, AssetRef> afterImages = to.images();
    for (Map.Entry<String, AssetRef> image : afterImages.entrySet()) {
      if (!image.getValue().equals(beforeImages.get(image.getKey()))) {
        out.add(Instruction.ShowImage.create(image.getKey(), image.getValue(), pos));
      }
    }
    for (String id : beforeImages.keySet()) {
      if (!afterImages.containsKey(id)) out.add(Instruction.HideImage.create(id, pos));
    }

    return out.build();
  }
}
