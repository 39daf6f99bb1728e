package vnc;

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class StateDiffTest {
  private static final Document.Pos POS = Document.Pos.create("test", 3, 0);
  private static final ImmutableList<String> ORDER = ImmutableList.of("alice", "bob", "carol");

  private static RuntimeState.CharacterState onStage(String... path) {
    return RuntimeState.CharacterState.create(Optional.of(ImmutableList.copyOf(path)), true);
  }

  @Test
  public void identicalStates() {
    RuntimeState state = new RuntimeState();
    state.setScene(Optional.of("park"));
    state.setCharacter("alice", onStage("happy"));

    assertThat(StateDiff.diff(state, state.copy(), ORDER, POS)).isEmpty();
  }

  @Test
  public void charactersInDeclarationOrder() {
    RuntimeState from = new RuntimeState();
    from.setCharacter("alice", onStage("happy"));
    from.setCharacter("bob", onStage());

    RuntimeState to = new RuntimeState();
    to.setCharacter("carol", onStage("x"));
    to.setCharacter("alice", onStage("sad"));

    assertThat(StateDiff.diff(from, to, ORDER, POS))
        .containsExactly(
            Instruction.ChangeSpriteState.create("alice", ImmutableList.of("sad"), POS),
            Instruction.HideSprite.create("bob", POS),
            Instruction.ShowSprite.create("carol", ImmutableList.of("x"), POS))
        .inOrder();
  }

  @Test
  public void sceneChangeComesFirstAndClearsTheStage() {
    RuntimeState from = new RuntimeState();
    from.setScene(Optional.of("park"));
    from.setCharacter("alice", onStage("happy"));

    RuntimeState to = new RuntimeState();
    to.setScene(Optional.of("school"));
    to.setCharacter("alice", onStage("happy"));

    assertThat(StateDiff.diff(from, to, ORDER, POS))
        .containsExactly(
            Instruction.SetScene.create(Optional.of("school"), POS),
            Instruction.ShowSprite.create("alice", ImmutableList.of("happy"), POS))
        .inOrder();
  }

  @Test
  public void offStagePathIsNotCompensated() {
    RuntimeState from = new RuntimeState();
    from.setCharacter(
        "alice", RuntimeState.CharacterState.create(Optional.of(ImmutableList.of("a")), false));
    RuntimeState to = new RuntimeState();
    to.setCharacter(
        "alice", RuntimeState.CharacterState.create(Optional.of(ImmutableList.of("b")), false));

    assertThat(StateDiff.diff(from, to, ORDER, POS)).isEmpty();
  }

  @Test
  public void images() {
    RuntimeState from = new RuntimeState();
    from.showImage("photo", AssetRef.asset("a.png"));
    from.showImage("letter", AssetRef.asset("letter.png"));

    RuntimeState to = new RuntimeState();
    to.showImage("photo", AssetRef.asset("b.png"));

    assertThat(StateDiff.diff(from, to, ORDER, POS))
        .containsExactly(
            Instruction.ShowImage.create("photo", AssetRef.asset("b.png"), POS),
            Instruction.HideImage.create("letter", POS))
        .inOrder();
  }
}
