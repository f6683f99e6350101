package ladder;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

public class RungTokenizerTest {

  private static final Correspondence<RungToken, String> HAS_TEXT =
      Correspondence.transforming(RungToken::text, "has text");

  @Test
  public void emptyText() {
    assertThat(RungTokenizer.tokenize("")).isEmpty();
    assertThat(RungTokenizer.tokenize(null)).isEmpty();
  }

  @Test
  public void noInstructions() {
    assertThat(RungTokenizer.tokenize("garbage text")).isEmpty();
    assertThat(RungTokenizer.tokenize("[,]")).isEmpty();
  }

  @Test
  public void plainSequence() {
    ImmutableList<RungToken> tokens = RungTokenizer.tokenize("XIC(Tag1)XIO(Tag2)OTE(Tag3)");

    assertThat(tokens)
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("XIC(Tag1)", "XIO(Tag2)", "OTE(Tag3)")
        .inOrder();
    assertThat(tokens.get(0).offset()).isEqualTo(0);
    assertThat(tokens.get(1).offset()).isEqualTo(9);
    assertThat(tokens.get(2).offset()).isEqualTo(18);
    assertThat(tokens.stream().allMatch(RungToken::isInstruction)).isTrue();
  }

  @Test
  public void branchDelimiters() {
    ImmutableList<RungToken> tokens = RungTokenizer.tokenize("XIC(Tag1)[XIO(Tag2),]OTE(Tag3)");

    assertThat(tokens)
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("XIC(Tag1)", "[", "XIO(Tag2)", ",", "]", "OTE(Tag3)")
        .inOrder();
    assertThat(tokens.get(1).type()).isEqualTo(RungToken.Type.BRANCH_START);
    assertThat(tokens.get(3).type()).isEqualTo(RungToken.Type.BRANCH_NEXT);
    assertThat(tokens.get(4).type()).isEqualTo(RungToken.Type.BRANCH_END);
  }

  @Test
  public void arrayIndicesStayInsideInstructions() {
    ImmutableList<RungToken> tokens =
        RungTokenizer.tokenize("XIC(Array[2].Member)COP(Src[0],Dest[1,2],5)");

    assertThat(tokens)
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("XIC(Array[2].Member)", "COP(Src[0],Dest[1,2],5)")
        .inOrder();
  }

  @Test
  public void nestedParentheses() {
    assertThat(RungTokenizer.tokenize("CPT(Dest,(A+B)*(C-D))OTE(X)"))
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("CPT(Dest,(A+B)*(C-D))", "OTE(X)")
        .inOrder();
  }

  @Test
  public void whitespaceAndSemicolonSkipped() {
    assertThat(RungTokenizer.tokenize(" XIC(A) [ XIO(B) , ] OTE(C);"))
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("XIC(A)", "[", "XIO(B)", ",", "]", "OTE(C)")
        .inOrder();
  }

  @Test
  public void unterminatedCallDropped() {
    assertThat(RungTokenizer.tokenize("XIC(A)OTE(B"))
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("XIC(A)");
  }

  @Test
  public void strayNameIgnored() {
    assertThat(RungTokenizer.tokenize("abc XIC(A)"))
        .comparingElementsUsing(HAS_TEXT)
        .containsExactly("XIC(A)");
  }

  @Test
  public void canonicalTextRoundTrips() {
    String text = "XIC(A)[XIO(B)[XIC(C),XIC(D)],XIC(E[1])]OTE(F.G)";

    assertThat(RungToken.join(RungToken.texts(RungTokenizer.tokenize(text)))).isEqualTo(text);
  }
}
