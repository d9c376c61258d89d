package com.scholary.syncmap.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TreeTest {

  @Test
  void newRoot_shouldBeEmptyWithHeightOne() {
    Tree<String> root = new Tree<>();

    assertThat(root.isEmpty()).isTrue();
    assertThat(root.isRoot()).isTrue();
    assertThat(root.isLeaf()).isTrue();
    assertThat(root.height()).isEqualTo(1);
    assertThat(root.childrenNotEmpty()).isEmpty();
  }

  @Test
  void addChild_shouldAppendOrPrepend() {
    Tree<String> root = new Tree<>();
    root.addChild(new Tree<>("b"));
    root.addChild(new Tree<>("c"), true);
    root.addChild(new Tree<>("a"), false);

    assertThat(root.children()).extracting(Tree::value).containsExactly("a", "b", "c");
    assertThat(root.children().get(0).parent()).isSameAs(root);
  }

  @Test
  void addChild_shouldRejectNullAndAttachedNodes() {
    Tree<String> root = new Tree<>();
    Tree<String> child = root.addChild(new Tree<>("a"));

    assertThatThrownBy(() -> root.addChild(null, true))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Tree<String>().addChild(child))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("already attached");
  }

  @Test
  void isEmpty_shouldLookAtTheWholeSubtree() {
    Tree<String> root = new Tree<>();
    Tree<String> structural = root.addChild(new Tree<>());
    Tree<String> emptyStructural = root.addChild(new Tree<>());
    structural.addChild(new Tree<>()).addChild(new Tree<>("deep"));

    assertThat(structural.isEmpty()).isFalse();
    assertThat(emptyStructural.isEmpty()).isTrue();
    assertThat(root.childrenNotEmpty()).containsExactly(structural);
  }

  @Test
  void height_shouldCountLevels() {
    Tree<String> root = new Tree<>();
    Tree<String> paragraph = root.addChild(new Tree<>("p1"));
    root.addChild(new Tree<>("p2"));
    assertThat(root.height()).isEqualTo(2);

    paragraph.addChild(new Tree<>("s1")).addChild(new Tree<>("w1"));
    assertThat(root.height()).isEqualTo(4);
  }

  @Test
  void preOrderValues_shouldFollowDocumentOrder() {
    Tree<String> root = new Tree<>();
    Tree<String> p1 = root.addChild(new Tree<>("p1"));
    p1.addChild(new Tree<>("s1"));
    p1.addChild(new Tree<>("s2"));
    Tree<String> structural = root.addChild(new Tree<>());
    structural.addChild(new Tree<>("s3"));

    assertThat(root.preOrderValues()).containsExactly("p1", "s1", "s2", "s3");
  }
}
