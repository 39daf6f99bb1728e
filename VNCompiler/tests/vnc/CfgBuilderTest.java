package vnc;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class CfgBuilderTest {
  private static final Document.Pos POS = Document.Pos.create("cfg", 0, 0);

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private ImmutableList<Function> build(Document.Builder document) {
    IRBuilder irBuilder = new IRBuilder(CompilerOptions.defaults());
    Program program = irBuilder.build(document.build());
    diagnostics.addAll(irBuilder.diagnostics());

    CfgBuilder cfgBuilder = new CfgBuilder();
    ImmutableList<Function> functions = cfgBuilder.build(program);
    diagnostics.addAll(cfgBuilder.diagnostics());

    CfgValidator validator = new CfgValidator();
    functions.forEach(validator::validate);
    diagnostics.addAll(validator.diagnostics());

    assertWellFormed(functions);
    return functions;
  }

  private ImmutableList<Function> build(String... paragraphs) {
    return build(Document.builder("cfg").addParagraphs(paragraphs));
  }

  private ImmutableList<Diagnostic.Code> codes() {
    return diagnostics.stream().map(Diagnostic::code).collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<String> labels(Function function) {
    return function
        .blocks()
        .stream()
        .map(BasicBlock::label)
        .collect(ImmutableList.toImmutableList());
  }

  // Unique labels, one terminator per block, every target local.
  private static void assertWellFormed(List<Function> functions) {
    for (Function function : functions) {
      Set<String> labels = new HashSet<>(labels(function));
      assertThat(labels).hasSize(function.blocks().size());
      for (BasicBlock block : function.blocks()) {
        assertThat(block.terminator()).isNotNull();
        assertThat(labels).containsAtLeastElementsIn(block.successors());
      }
    }
  }

  @Test
  public void straightLineFunction() {
    ImmutableList<Function> functions = build("[Function main]", "你好");

    Function main = functions.get(0);
    assertThat(labels(main)).containsExactly("main");
    assertThat(main.entry().instructions()).hasSize(1);
    Terminator.Return ret = main.entry().terminator().cast(Terminator.Return.class);
    assertThat(ret.implicit()).isTrue();
    assertThat(codes()).isEmpty();
  }

  @Test
  public void labelStartsBlockWithFallthrough() {
    ImmutableList<Function> functions =
        build("[Function main]", "一", "[Label L1]", "二", "[JumpLabel L1]");

    Function main = functions.get(0);
    assertThat(labels(main)).containsExactly("main", "L1").inOrder();
    Terminator.JumpToLabel fallthrough =
        main.entry().terminator().cast(Terminator.JumpToLabel.class);
    assertThat(fallthrough.label()).isEqualTo("L1");
    assertThat(fallthrough.implicit()).isTrue();
    assertThat(main.block("L1").get().successors()).containsExactly("L1");
    assertThat(main.block("L1").get().declared()).isTrue();
  }

  @Test
  public void contentAfterJumpIsDropped() {
    ImmutableList<Function> functions =
        build(
            "[Function main]",
            "[JumpFunction other]",
            "死代码",
            "[Label L]",
            "活代码",
            "[Function other]",
            "其他");

    Function main = functions.get(0);
    assertThat(labels(main)).containsExactly("main", "L").inOrder();
    assertThat(main.entry().instructions()).isEmpty();
    assertThat(main.entry().terminator().type()).isEqualTo(Terminator.Type.JUMP_TO_FUNCTION);
    assertThat(codes())
        .containsExactly(
            Diagnostic.Code.UNHANDLED_NODE_IN_TERMINATED_BLOCK, Diagnostic.Code.BLOCK_UNREACHABLE)
        .inOrder();
  }

  @Test
  public void callContinuesInNextBlock() {
    ImmutableList<Function> functions =
        build("[Function main]", "[Call sub]", "回来了", "[Function sub]", "子程序");

    Function main = functions.get(0);
    assertThat(labels(main)).containsExactly("main", "main_1").inOrder();
    Terminator.CallFunction call = main.entry().terminator().cast(Terminator.CallFunction.class);
    assertThat(call.function()).isEqualTo("sub");
    assertThat(call.continuation()).hasValue("main_1");
    assertThat(main.block("main_1").get().instructions()).hasSize(1);
    assertThat(codes()).isEmpty();
  }

  @Test
  public void labelOfAnotherFunction() {
    ImmutableList<Function> functions =
        build("[Function a]", "[JumpLabel L]", "[Function b]", "[Label L]", "x");

    assertThat(functions.get(0).entry().terminator().type()).isEqualTo(Terminator.Type.RETURN);
    assertThat(codes()).containsExactly(Diagnostic.Code.LABEL_CROSS_FUNCTION);
  }

  @Test
  public void unknownLabel() {
    ImmutableList<Function> functions = build("[Function a]", "[JumpLabel nowhere]");

    assertThat(functions.get(0).entry().terminator().type()).isEqualTo(Terminator.Type.RETURN);
    assertThat(codes()).containsExactly(Diagnostic.Code.LABEL_NOTFOUND);
  }

  @Test
  public void unknownFunctionCallFallsThrough() {
    ImmutableList<Function> functions = build("[Function a]", "[Call ghost]", "x");

    Function a = functions.get(0);
    Terminator.JumpToLabel jump = a.entry().terminator().cast(Terminator.JumpToLabel.class);
    assertThat(jump.label()).isEqualTo("a_1");
    assertThat(codes()).containsExactly(Diagnostic.Code.FUNCTION_NOTFOUND);
  }

  @Test
  public void unknownFunctionJumpReturns() {
    ImmutableList<Function> functions = build("[Function a]", "[JumpFunction ghost]");

    assertThat(functions.get(0).entry().terminator().type()).isEqualTo(Terminator.Type.RETURN);
    assertThat(codes()).containsExactly(Diagnostic.Code.FUNCTION_NOTFOUND);
  }

  @Test
  public void duplicateLabelLastWins() {
    ImmutableList<Function> functions =
        build("[Function main]", "[Label L]", "一", "[JumpLabel L]", "[Label L]", "二");

    Function main = functions.get(0);
    assertThat(labels(main)).containsExactly("L_dup", "L").inOrder();
    assertThat(main.entry().successors()).containsExactly("L");
    assertThat(codes()).containsExactly(Diagnostic.Code.LABEL_DUPLICATE);
  }

  @Test
  public void branchLosesUnknownOption() {
    ImmutableList<Function> functions =
        build(
            Document.builder("cfg")
                .addParagraph("[Function main]")
                .addParagraph("[Menu]")
                .addList("A", "nowhere")
                .addParagraph("[Label A]")
                .addParagraph("选了A"));

    Function main = functions.get(0);
    Terminator.Branch branch = main.entry().terminator().cast(Terminator.Branch.class);
    assertThat(branch.choices()).hasSize(1);
    assertThat(branch.successors()).containsExactly("A");
    assertThat(codes()).containsExactly(Diagnostic.Code.LABEL_NOTFOUND);
  }

  @Test
  public void validatorReportsBrokenFunction() {
    Function broken =
        Function.create(
            "f",
            POS,
            ImmutableList.of(
                BasicBlock.create(
                    "f", false, POS, ImmutableList.of(), Terminator.JumpToLabel.create("x", POS)),
                BasicBlock.create(
                    "g", false, POS, ImmutableList.of(), Terminator.Return.create(POS))));

    CfgValidator validator = new CfgValidator();
    validator.validate(broken);

    assertThat(
            validator
                .diagnostics()
                .stream()
                .map(Diagnostic::code)
                .collect(ImmutableList.toImmutableList()))
        .containsExactly(Diagnostic.Code.CFG_INVARIANT, Diagnostic.Code.BLOCK_UNREACHABLE)
        .inOrder();
  }
}
