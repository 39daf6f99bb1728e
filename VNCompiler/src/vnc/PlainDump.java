package vnc;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** Every spoken line in control-flow order, without any staging. */
@AutoValue
public abstract class PlainDump {
  private static final Joiner TAB = Joiner.on('\t');

  @AutoValue
  public abstract static class Record {
    public abstract String function();

    /** The speaking character, or the narrator label for narration. */
    public abstract String speaker();

    public abstract String content();

    public abstract ImmutableList<String> status();

    public abstract Document.Pos location();

    public static Record create(
        String function,
        String speaker,
        String content,
        ImmutableList<String> status,
        Document.Pos location) {
      return new AutoValue_PlainDump_Record(function, speaker, content, status, location);
    }
  }

  public abstract ImmutableList<Record> records();

  /** One tab-separated line per record: function, speaker, content, status, location. */
  public String render() {
    StringBuilder sb = new StringBuilder();
    for (Record record : records()) {
      TAB.appendTo(
          sb,
          record.function(),
          record.speaker(),
          record.content().replace('\n', ' ').replace('\t', ' '),
          String.join("/", record.status()),
          record.location());
      sb.append('\n');
    }
    return sb.toString();
  }

  public static PlainDump of(List<Function> functions, CompilerOptions options) {
    ImmutableList.Builder<Record> records = ImmutableList.builder();
    for (Function function : functions) {
      for (BasicBlock block : function.blocks()) {
        for (Instruction instruction : block.instructions()) {
          if (instruction.type() != Instruction.Type.SAY) continue;

          Instruction.Say say = instruction.cast(Instruction.Say.class);
          records.add(
              Record.create(
                  function.name(),
                  say.character().orElse(options.narratorLabel()),
                  say.content().plain(),
                  say.status(),
                  say.pos()));
        }
      }
    }
    return new AutoValue_PlainDump(records.build());
  }
}
