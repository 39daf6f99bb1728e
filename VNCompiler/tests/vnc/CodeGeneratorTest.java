package vnc;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class CodeGeneratorTest {
  private static final ImmutableList<String> HAPPY = ImmutableList.of("开心");
  private static final ImmutableList<String> ANGRY = ImmutableList.of("生气");

  private Program program;
  private ImmutableList<Function> functions;
  private CodeGenerator generator;

  // A character with two sprite states and one declared scene, then an open function.
  private static Document.Builder document() {
    return Document.builder("codegen")
        .addParagraph("[DeclCharacter 小明]")
        .addTable(
            ImmutableList.of(
                ImmutableList.of("开心", "xm/happy.png"), ImmutableList.of("生气", "xm/angry.png")))
        .addParagraph("[DeclScene 公园, background=bg/park.png]")
        .addParagraph("[Function main]");
  }

  private CodeGenerator.ScheduledFunction generate(
      CompilerOptions options, Document.Builder document) {
    program = new IRBuilder(options).build(document.build());
    functions = new CfgBuilder().build(program);
    generator = new CodeGenerator(options);
    return generator.generate(program, functions).functions().get(0);
  }

  private CodeGenerator.ScheduledFunction generate(Document.Builder document) {
    return generate(CompilerOptions.defaults(), document);
  }

  private CodeGenerator.ScheduledFunction generate(String... paragraphs) {
    return generate(document().addParagraphs(paragraphs));
  }

  private ImmutableList<Diagnostic.Code> codes() {
    return generator
        .diagnostics()
        .stream()
        .map(Diagnostic::code)
        .collect(ImmutableList.toImmutableList());
  }

  private static CodeGenerator.ScheduledBlock block(
      CodeGenerator.ScheduledFunction function, String label) {
    return function.blocks().stream().filter(b -> b.label().equals(label)).findFirst().get();
  }

  private static ImmutableList<Instruction.Type> types(ImmutableList<Instruction> instructions) {
    return instructions.stream().map(Instruction::type).collect(ImmutableList.toImmutableList());
  }

  private static int compensationCount(CodeGenerator.ScheduledFunction function) {
    int count = 0;
    for (CodeGenerator.ScheduledBlock block : function.blocks()) {
      count += block.compensation().size();
      if (block.trampoline()) count += block.instructions().size();
    }
    return count;
  }

  @Test
  public void twoWayMergeNeedsOneCompensation() {
    CodeGenerator.ScheduledFunction main =
        generate(
            document()
                .addParagraph("[Show 小明, state=开心]")
                .addParagraph("[Menu]")
                .addList("左", "右")
                .addParagraphs(
                    "[Label 左]",
                    "[State 小明, state=生气]",
                    "[JumpLabel 汇合]",
                    "[Label 右]",
                    "[JumpLabel 汇合]",
                    "[Label 汇合]",
                    "小明：结束"));

    assertThat(compensationCount(main)).isEqualTo(1);
    Instruction compensation = block(main, "右").compensation().get(0);
    assertThat(compensation.cast(Instruction.ChangeSpriteState.class).state()).isEqualTo(ANGRY);
    assertThat(codes()).containsExactly(Diagnostic.Code.JOINPATH_COMPENSATED);
  }

  @Test
  public void agreeingPredecessorsNeedNothing() {
    CodeGenerator.ScheduledFunction main =
        generate(
            document()
                .addParagraph("[Show 小明, state=开心]")
                .addParagraph("[Menu]")
                .addList("左", "右")
                .addParagraphs(
                    "[Label 左]", "[JumpLabel 汇合]", "[Label 右]", "[Label 汇合]", "结束"));

    assertThat(compensationCount(main)).isEqualTo(0);
    assertThat(codes()).isEmpty();
  }

  @Test
  public void threePredecessorsPatchedAgainstTheFirst() {
    CodeGenerator.ScheduledFunction main =
        generate(
            document()
                .addParagraph("[Show 小明, state=开心]")
                .addParagraph("[Menu]")
                .addList("甲路", "乙路", "汇合")
                .addParagraphs(
                    "[Label 甲路]",
                    "[State 小明, state=生气]",
                    "[JumpLabel 汇合]",
                    "[Label 乙路]",
                    "[Hide 小明]",
                    "[JumpLabel 汇合]",
                    "[Label 汇合]",
                    "结束"));

    Document.Pos pos = block(main, "甲路").terminator().pos();
    assertThat(block(main, "甲路").compensation())
        .containsExactly(Instruction.ChangeSpriteState.create("小明", HAPPY, pos));
    Document.Pos pos2 = block(main, "乙路").terminator().pos();
    assertThat(block(main, "乙路").compensation())
        .containsExactly(Instruction.ShowSprite.create("小明", HAPPY, pos2));
    assertThat(block(main, "main").compensation()).isEmpty();
    assertThat(codes())
        .containsExactly(
            Diagnostic.Code.JOINPATH_COMPENSATED, Diagnostic.Code.JOINPATH_COMPENSATED);
  }

  @Test
  public void branchingPredecessorGetsTrampoline() {
    CodeGenerator.ScheduledFunction main =
        generate(
            document()
                .addParagraph("[Show 小明, state=开心]")
                .addParagraph("[Menu]")
                .addList("汇合", "改变")
                .addParagraphs(
                    "[Label 汇合]", "结束", "[Return]", "[Label 改变]", "[State 小明, state=生气]")
                .addParagraph("[Menu]")
                .addList("汇合", "别处")
                .addParagraphs("[Label 别处]", "别处"));

    assertThat(
            main.blocks()
                .stream()
                .map(CodeGenerator.ScheduledBlock::label)
                .collect(ImmutableList.toImmutableList()))
        .containsExactly("main", "汇合", "改变", "别处", "改变_to_汇合")
        .inOrder();

    CodeGenerator.ScheduledBlock trampoline = block(main, "改变_to_汇合");
    assertThat(trampoline.trampoline()).isTrue();
    assertThat(types(trampoline.instructions()))
        .containsExactly(Instruction.Type.CHANGE_SPRITE_STATE);
    assertThat(trampoline.terminator().successors()).containsExactly("汇合");

    CodeGenerator.ScheduledBlock branching = block(main, "改变");
    assertThat(branching.compensation()).isEmpty();
    assertThat(branching.terminator().successors())
        .containsExactly("改变_to_汇合", "别处")
        .inOrder();
  }

  @Test
  public void reentrantShowIsReportedAndSkipped() {
    CodeGenerator.ScheduledFunction main = generate("[Show 小明]", "[Show 小明]");

    assertThat(types(main.blocks().get(0).instructions()))
        .containsExactly(Instruction.Type.SHOW_SPRITE);
    assertThat(codes()).containsExactly(Diagnostic.Code.CHARACTER_STATEERROR);
  }

  @Test
  public void reentrantShowUpdatesStateWhenConfigured() {
    CompilerOptions options =
        CompilerOptions.defaults()
            .toBuilder()
            .setReentrantShowPolicy(CompilerOptions.ReentrantShowPolicy.UPDATE_STATE)
            .build();
    CodeGenerator.ScheduledFunction main =
        generate(
            options,
            document()
                .addParagraphs(
                    "[Show 小明, state=开心]", "[Show 小明, state=生气]", "[Show 小明, state=生气]"));

    ImmutableList<Instruction> instructions = main.blocks().get(0).instructions();
    assertThat(types(instructions))
        .containsExactly(Instruction.Type.SHOW_SPRITE, Instruction.Type.CHANGE_SPRITE_STATE)
        .inOrder();
    assertThat(instructions.get(1).cast(Instruction.ChangeSpriteState.class).state())
        .isEqualTo(ANGRY);
    assertThat(codes()).containsExactly(Diagnostic.Code.CHARACTER_STATEERROR);
  }

  @Test
  public void undeclaredSceneIsCreated() {
    program =
        new IRBuilder(CompilerOptions.defaults())
            .build(document().addParagraphs("[Scene 森林]", "[Scene 森林]").build());
    functions = new CfgBuilder().build(program);
    generator = new CodeGenerator(CompilerOptions.defaults());
    CodeGenerator.Result result = generator.generate(program, functions);

    assertThat(result.implicitScenes()).hasSize(1);
    assertThat(result.implicitScenes().get(0).name()).isEqualTo("森林");
    assertThat(result.implicitScenes().get(0).background()).isEmpty();
    assertThat(types(result.functions().get(0).blocks().get(0).instructions()))
        .containsExactly(Instruction.Type.SET_SCENE, Instruction.Type.SET_SCENE);
    assertThat(codes()).containsExactly(Diagnostic.Code.SCENE_NOTFOUND);
  }

  @Test
  public void undeclaredStateFallsBackAndIsReportedOnce() {
    CodeGenerator.ScheduledFunction main =
        generate("[Show 小明, state=泳装]", "[State 小明, state=游泳]");

    ImmutableList<Instruction> instructions = main.blocks().get(0).instructions();
    assertThat(instructions).hasSize(1);
    assertThat(instructions.get(0).cast(Instruction.ShowSprite.class).state()).isEqualTo(HAPPY);
    assertThat(codes()).containsExactly(Diagnostic.Code.CHARACTER_STATE_EMPTY);
  }

  @Test
  public void hideOfAbsentCharacter() {
    CodeGenerator.ScheduledFunction main = generate("[Show 小明]", "[Scene 公园]", "[Hide 小明]");

    assertThat(types(main.blocks().get(0).instructions()))
        .containsExactly(Instruction.Type.SHOW_SPRITE, Instruction.Type.SET_SCENE)
        .inOrder();
    assertThat(codes()).containsExactly(Diagnostic.Code.CHARACTER_NOT_ONSTAGE);
  }

  @Test
  public void sayStatusUpdatesOffStagePath() {
    CodeGenerator.ScheduledFunction main = generate("小明（生气）：哼", "[Show 小明]");

    ImmutableList<Instruction> instructions = main.blocks().get(0).instructions();
    assertThat(types(instructions))
        .containsExactly(Instruction.Type.SAY, Instruction.Type.SHOW_SPRITE)
        .inOrder();
    assertThat(instructions.get(1).cast(Instruction.ShowSprite.class).state()).isEqualTo(ANGRY);
  }

  @Test
  public void sayStatusRedrawsCharacterOnStage() {
    CodeGenerator.ScheduledFunction main = generate("[Show 小明]", "小明（生气）：哼");

    ImmutableList<Instruction> instructions = main.blocks().get(0).instructions();
    assertThat(types(instructions))
        .containsExactly(
            Instruction.Type.SHOW_SPRITE,
            Instruction.Type.CHANGE_SPRITE_STATE,
            Instruction.Type.SAY)
        .inOrder();
  }

  @Test
  public void generationIsIdempotent() {
    generate(
        document()
            .addParagraph("[Show 小明, state=开心]")
            .addParagraph("[Menu]")
            .addList("左", "右")
            .addParagraphs(
                "[Label 左]",
                "[State 小明, state=生气]",
                "[JumpLabel 汇合]",
                "[Label 右]",
                "[Label 汇合]",
                "[Scene 森林]"));

    CodeGenerator first = new CodeGenerator(CompilerOptions.defaults());
    CodeGenerator second = new CodeGenerator(CompilerOptions.defaults());
    CodeGenerator.Result a = first.generate(program, functions);
    CodeGenerator.Result b = second.generate(program, functions);

    assertThat(b).isEqualTo(a);
    assertThat(second.diagnostics()).isEqualTo(first.diagnostics());
    assertThat(first.generate(program, functions).functions()).isEqualTo(a.functions());
  }

  @Test
  public void unreachableBlockStillGenerated() {
    CodeGenerator.ScheduledFunction main =
        generate("[Return]", "[Label 孤立]", "[Show 小明]");

    assertThat(types(block(main, "孤立").instructions()))
        .containsExactly(Instruction.Type.SHOW_SPRITE);
    assertThat(block(main, "孤立").terminator().type()).isEqualTo(Terminator.Type.RETURN);
  }
}
