package vnc;

import static com.google.common.truth.Truth.assertThat;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class LineScannerTest {
  private static final Document.Pos POS = Document.Pos.create("test", 0, 0);

  private final Set<String> declared = new HashSet<>();
  private final LineScanner scanner = new LineScanner(new NameClassifier(declared::contains, 10));

  private ScannedLine scan(StyledText text) {
    return scanner.scan(POS, text);
  }

  private SayNode say(String text) {
    ScannedLine line = scan(StyledText.of(text));
    assertThat(line.kind()).isEqualTo(ScannedLine.Kind.SAY);
    return line.say();
  }

  private ScannedLine.Commands commands(String text) {
    ScannedLine line = scan(StyledText.of(text));
    assertThat(line.kind()).isEqualTo(ScannedLine.Kind.COMMANDS);
    return line.commands();
  }

  @Test
  public void nameSeparatorContent() {
    SayNode say = say("名字: 你好");

    assertThat(say.speaker()).hasValue("名字");
    assertThat(say.content().plain()).isEqualTo("你好");
    assertThat(say.hasSeparator()).isTrue();
    assertThat(say.quoted()).isFalse();
    assertThat(say.kind()).isEqualTo(SayNode.Kind.FULL);
  }

  @Test
  public void quotedWithoutName() {
    SayNode say = say("\"你好\"");

    assertThat(say.speaker()).isEmpty();
    assertThat(say.content().plain()).isEqualTo("你好");
    assertThat(say.quoted()).isTrue();
    assertThat(say.kind()).isEqualTo(SayNode.Kind.QUOTED);
  }

  @Test
  public void bracketedName() {
    SayNode say = say("【小明】你好");

    assertThat(say.speaker()).hasValue("小明");
    assertThat(say.content().plain()).isEqualTo("你好");
  }

  @Test
  public void squareBracketNameFollowedByText() {
    SayNode say = say("[小明] 你好");

    assertThat(say.speaker()).hasValue("小明");
    assertThat(say.content().plain()).isEqualTo("你好");
  }

  @Test
  public void statusBeforeSeparator() {
    SayNode say = say("小红（开心，害羞）：真好");

    assertThat(say.speaker()).hasValue("小红");
    assertThat(say.status()).containsExactly("开心", "害羞").inOrder();
    assertThat(say.content().plain()).isEqualTo("真好");
  }

  @Test
  public void nameThenQuote() {
    SayNode say = say("小明“早上好”");

    assertThat(say.speaker()).hasValue("小明");
    assertThat(say.content().plain()).isEqualTo("早上好");
    assertThat(say.quoted()).isTrue();
  }

  @Test
  public void quotedPartsAreJoined() {
    SayNode say = say("小明：“你好。”他笑了笑，“再见。”");

    assertThat(say.speaker()).hasValue("小明");
    assertThat(say.content().plain()).isEqualTo("你好。再见。");
  }

  @Test
  public void narration() {
    SayNode say = say("天色渐渐暗了下来。");

    assertThat(say.speaker()).isEmpty();
    assertThat(say.kind()).isEqualTo(SayNode.Kind.NARRATE);
    assertThat(say.content().plain()).isEqualTo("天色渐渐暗了下来。");
  }

  @Test
  public void sentenceBeforeColonIsNotAName() {
    SayNode say = say("他说道，今天的天气真不错：晴朗");

    assertThat(say.speaker()).isEmpty();
    assertThat(say.content().plain()).isEqualTo("他说道，今天的天气真不错：晴朗");
  }

  @Test
  public void statusWithoutSeparatorNeedsDeclaredName() {
    SayNode undeclared = say("小明（生气）你怎么来了");
    assertThat(undeclared.speaker()).isEmpty();

    declared.add("小明");
    SayNode say = say("小明（生气）你怎么来了");
    assertThat(say.speaker()).hasValue("小明");
    assertThat(say.status()).containsExactly("生气");
    assertThat(say.content().plain()).isEqualTo("你怎么来了");
  }

  @Test
  public void contentKeepsStyling() {
    StyledText text =
        StyledText.of(
            ImmutableList.of(
                Document.TextRun.plain("小明："),
                Document.TextRun.styled("你好", true, false, Optional.empty())));

    SayNode say = scan(text).say();

    assertThat(say.content().plain()).isEqualTo("你好");
    assertThat(say.content().hasStyling()).isTrue();
  }

  @Test
  public void commandLineWithComment() {
    ScannedLine.Commands commands = commands("[Show 小明, state=开心] [Hide 小红] # 注释");

    assertThat(commands.segments()).hasSize(2);
    assertThat(commands.segments().get(0).body()).isEqualTo("Show 小明, state=开心");
    assertThat(commands.segments().get(1).body()).isEqualTo("Hide 小红");
    assertThat(commands.comment()).hasValue("注释");
  }

  @Test
  public void disabledCommand() {
    ScannedLine.Commands commands = commands("【#Show 小明】");

    assertThat(commands.segments()).hasSize(1);
    assertThat(commands.segments().get(0).disabled()).isTrue();
    assertThat(commands.segments().get(0).body()).isEqualTo("Show 小明");
  }

  @Test
  public void bracketInsideQuotedArgument() {
    ScannedLine.Commands commands = commands("[Comment \"a]b\"]");

    assertThat(commands.segments()).hasSize(1);
    assertThat(commands.segments().get(0).body()).isEqualTo("Comment \"a]b\"");
  }

  @Test
  public void elementOffsetCountsEarlierMarkers() {
    ScannedLine.Commands commands =
        commands("[Play \uFFFC] [DeclScene 公园, background=\uFFFC]");

    assertThat(commands.segments().get(0).elementOffset()).isEqualTo(0);
    assertThat(commands.segments().get(1).elementOffset()).isEqualTo(1);
  }
}
