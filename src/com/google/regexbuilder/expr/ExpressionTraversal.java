/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.regexbuilder.expr;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Depth-first, pre-order traversal of expression trees.
 *
 * <p>Every expression is visited before its children, siblings from left to
 * right. A traversal never modifies the tree and may be repeated any number
 * of times.
 */
public final class ExpressionTraversal {

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits one item of the tree.
     *
     * @param item An {@link Expression} or a scalar child of an expression.
     * @param level The depth of the item. Roots have level 0.
     * @param hasChildren True for expressions, false for scalars.
     */
    void visit(Object item, int level, boolean hasChildren);
  }

  private ExpressionTraversal() {}

  /** Traverses each root and all of its descendants, roots in iteration order. */
  public static void traverse(Iterable<? extends Expression> roots, Callback callback) {
    checkNotNull(callback);
    for (Expression root : roots) {
      traverse(root, 0, callback);
    }
  }

  /** Counts the leaves, the scalars, of all given trees. */
  public static int countLeaves(Iterable<? extends Expression> roots) {
    LeafCounter counter = new LeafCounter();
    traverse(roots, counter);
    return counter.count;
  }

  private static void traverse(Expression n, int level, Callback callback) {
    callback.visit(n, level, true);
    for (Object child : n.getChildren()) {
      if (child instanceof Expression) {
        traverse((Expression) child, level + 1, callback);
      } else {
        callback.visit(child, level + 1, false);
      }
    }
  }

  private static final class LeafCounter implements Callback {
    int count = 0;

    @Override
    public void visit(Object item, int level, boolean hasChildren) {
      if (!hasChildren) {
        count++;
      }
    }
  }
}
