package vnc;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

public class NameClassifierTest {
  private final NameClassifier classifier =
      new NameClassifier(ImmutableSet.of("小明", "Alice")::contains, 10);

  @Test
  public void declaredNames() {
    assertThat(classifier.classify("小明")).isEqualTo(NameClassifier.Result.DEFINITE_NAME);
    assertThat(classifier.classify(" Alice ")).isEqualTo(NameClassifier.Result.DEFINITE_NAME);
  }

  @Test
  public void nonNames() {
    assertThat(classifier.classify("")).isEqualTo(NameClassifier.Result.DEFINITE_NON_NAME);
    assertThat(classifier.classify("你好，世界")).isEqualTo(NameClassifier.Result.DEFINITE_NON_NAME);
    assertThat(classifier.classify("12345")).isEqualTo(NameClassifier.Result.DEFINITE_NON_NAME);
    assertThat(classifier.classify("一个非常非常长的名字超过十个字"))
        .isEqualTo(NameClassifier.Result.DEFINITE_NON_NAME);
  }

  @Test
  public void plausibleNames() {
    NameClassifier.Result result = classifier.classify("小红");

    assertThat(result).isEqualTo(NameClassifier.Result.AMBIGUOUS_TREAT_AS_NAME);
    assertThat(result.isName()).isTrue();
    assertThat(NameClassifier.Result.DEFINITE_NON_NAME.isName()).isFalse();
  }
}
