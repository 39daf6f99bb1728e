package vnc;

import java.util.Optional;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Scene {
  public abstract String name();

  public abstract Optional<AssetRef> background();

  public abstract Document.Pos pos();

  public static Scene create(String name, Optional<AssetRef> background, Document.Pos pos) {
    return new AutoValue_Scene(name, background, pos);
  }
}
