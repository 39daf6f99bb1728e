package vnc;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// [name: positional, key=value, key=call(args)]
@AutoValue
public abstract class CommandNode {
  public abstract String name();

  public abstract Optional<ArgValue> positional();

  /** Keyword arguments in source order. */
  public abstract ImmutableMap<String, ArgValue> keywords();

  public abstract Optional<ImmutableList<ImmutableList<String>>> table();

  public abstract Optional<ImmutableList<String>> list();

  public abstract boolean disabled();

  public abstract Document.Pos pos();

  public Optional<String> positionalText() {
    return positional().map(ArgValue::asText);
  }

  /** The first keyword argument present under any of the given spellings. */
  public Optional<ArgValue> keyword(String... names) {
    return Arrays.stream(names)
        .filter(keywords()::containsKey)
        .findFirst()
        .map(keywords()::get);
  }

  public Optional<String> keywordText(String... names) {
    return keyword(names).map(ArgValue::asText);
  }

  public CommandNode withTable(ImmutableList<ImmutableList<String>> table) {
    return toBuilder().setTable(table).build();
  }

  public CommandNode withList(ImmutableList<String> list) {
    return toBuilder().setList(list).build();
  }

  public abstract Builder toBuilder();

  public static Builder builder(String name, Document.Pos pos) {
    return new AutoValue_CommandNode.Builder()
        .setName(name)
        .setPos(pos)
        .setKeywords(ImmutableMap.of())
        .setDisabled(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setName(String name);

    public abstract Builder setPositional(ArgValue positional);

    public abstract Builder setKeywords(ImmutableMap<String, ArgValue> keywords);

    public abstract Builder setTable(ImmutableList<ImmutableList<String>> table);

    public abstract Builder setList(ImmutableList<String> list);

    public abstract Builder setDisabled(boolean disabled);

    abstract Builder setPos(Document.Pos pos);

    public abstract CommandNode build();
  }

  @Override
  public final String toString() {
    Stream<String> args =
        Stream.concat(
            positional().map(ArgValue::asText).map(Stream::of).orElse(Stream.empty()),
            keywords().entrySet().stream().map(e -> e.getKey() + "=" + e.getValue().asText()));
    String joined = args.collect(Collectors.joining(", "));
    return joined.isEmpty() ? name() : name() + "(" + joined + ")";
  }
}
