package vnc;

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;

/** Either a caller-supplied asset path or a placeholder for the engine to draw. */
@AutoOneOf(AssetRef.Kind.class)
public abstract class AssetRef {

  public enum Kind {
    ASSET,
    PLACEHOLDER;
  }

  public enum Shape {
    BACKGROUND("bg"),
    CHARACTER("girl"),
    NONE(null);

    private final String renpyBase;

    private Shape(String renpyBase) {
      this.renpyBase = renpyBase;
    }

    /** The {@code base=} argument of a Ren'Py Placeholder, or null for a plain one. */
    public String renpyBase() {
      return renpyBase;
    }
  }

  @AutoValue
  public abstract static class Placeholder {
    public abstract String label();

    public abstract Shape shape();

    public static Placeholder create(String label, Shape shape) {
      return new AutoValue_AssetRef_Placeholder(label, shape);
    }
  }

  public abstract Kind kind();

  public abstract String asset();

  public abstract Placeholder placeholder();

  public static AssetRef asset(String path) {
    return AutoOneOf_AssetRef.asset(path);
  }

  public static AssetRef placeholder(String label, Shape shape) {
    return AutoOneOf_AssetRef.placeholder(Placeholder.create(label, shape));
  }
}
