package vnc;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class PlainDumpTest {

  private static PlainDump dump(String... paragraphs) {
    CompilerOptions options = CompilerOptions.builder().setNarratorLabel("旁白").build();
    Program program =
        new IRBuilder(options).build(Document.builder("对白").addParagraphs(paragraphs).build());
    return PlainDump.of(new CfgBuilder().build(program), options);
  }

  @Test
  public void recordsFollowBlockOrder() {
    PlainDump dump =
        dump(
            "[Function 甲]",
            "小明（开心）：早上好",
            "[Call 乙]",
            "天亮了。",
            "[Function 乙]",
            "小红：你好");

    ImmutableList<PlainDump.Record> records = dump.records();
    assertThat(records).hasSize(3);
    assertThat(records.get(0).function()).isEqualTo("甲");
    assertThat(records.get(0).status()).containsExactly("开心");
    assertThat(records.get(1).function()).isEqualTo("甲");
    assertThat(records.get(1).speaker()).isEqualTo("旁白");
    assertThat(records.get(2).function()).isEqualTo("乙");
    assertThat(records.get(2).speaker()).isEqualTo("小红");
  }

  @Test
  public void renderIsTabSeparated() {
    PlainDump dump = dump("小明（开心）：早上好");
    PlainDump.Record record = dump.records().get(0);

    assertThat(dump.render())
        .isEqualTo("对白\t小明\t早上好\t开心\t" + record.location() + "\n");
  }
}
