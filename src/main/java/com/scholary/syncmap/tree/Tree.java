package com.scholary.syncmap.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generic ordered multi-way tree.
 *
 * <p>Each node optionally carries a value and owns an ordered list of children. A node is
 * "empty" when neither it nor any of its descendants carries a value; purely structural nodes
 * can therefore be non-empty if something below them holds a value.
 *
 * @param <T> the value type
 */
public class Tree<T> {

  private final T value;
  private final List<Tree<T>> children = new ArrayList<>();
  private Tree<T> parent;

  /** Create a node without a value (a root or a structural node). */
  public Tree() {
    this(null);
  }

  public Tree(T value) {
    this.value = value;
  }

  public T value() {
    return value;
  }

  public boolean hasValue() {
    return value != null;
  }

  public Tree<T> parent() {
    return parent;
  }

  public boolean isRoot() {
    return parent == null;
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  /** Read-only view of the direct children, in order. */
  public List<Tree<T>> children() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Attach a child node.
   *
   * @param child the node to attach; it must not already belong to another tree
   * @param asLast if true append the child, otherwise prepend it
   * @return the attached child
   */
  public Tree<T> addChild(Tree<T> child, boolean asLast) {
    if (child == null) {
      throw new IllegalArgumentException("Child node cannot be null");
    }
    if (child.parent != null) {
      throw new IllegalArgumentException("Child node is already attached to a tree");
    }
    child.parent = this;
    if (asLast) {
      children.add(child);
    } else {
      children.add(0, child);
    }
    return child;
  }

  public Tree<T> addChild(Tree<T> child) {
    return addChild(child, true);
  }

  /** True if no node in this subtree carries a value. */
  public boolean isEmpty() {
    if (value != null) {
      return false;
    }
    for (Tree<T> child : children) {
      if (!child.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /** Direct children whose subtree holds at least one value, in order. */
  public List<Tree<T>> childrenNotEmpty() {
    List<Tree<T>> result = new ArrayList<>();
    for (Tree<T> child : children) {
      if (!child.isEmpty()) {
        result.add(child);
      }
    }
    return result;
  }

  /**
   * Number of levels in this subtree.
   *
   * <p>A node without children has height 1.
   */
  public int height() {
    int maxChildHeight = 0;
    for (Tree<T> child : children) {
      maxChildHeight = Math.max(maxChildHeight, child.height());
    }
    return maxChildHeight + 1;
  }

  /** Values of this subtree in pre-order (document order), skipping nodes without a value. */
  public List<T> preOrderValues() {
    List<T> result = new ArrayList<>();
    collectValues(this, result);
    return result;
  }

  private static <T> void collectValues(Tree<T> node, List<T> result) {
    if (node.value != null) {
      result.add(node.value);
    }
    for (Tree<T> child : node.children) {
      collectValues(child, result);
    }
  }
}
