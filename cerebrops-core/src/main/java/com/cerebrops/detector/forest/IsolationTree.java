/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector.forest;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;


/**
 * A single isolation tree. Internal nodes split on a randomly chosen feature at a random value between the
 * feature's minimum and maximum in the node; leaves remember how many training rows reached them.
 */
public final class IsolationTree {
  static final double EULER_MASCHERONI = 0.5772156649015329;
  private final Node _root;
  private final int _height;

  private IsolationTree(Node root, int height) {
    _root = root;
    _height = height;
  }

  /**
   * Grow a tree on the given subsample.
   *
   * @param rows Subsample of training rows.
   * @param maxDepth Depth at which growth stops.
   * @param random Source of randomness.
   * @return A new isolation tree.
   */
  static IsolationTree grow(double[][] rows, int maxDepth, Random random) {
    Node root = grow(rows, 0, maxDepth, random);
    return new IsolationTree(root, root.height());
  }

  private static Node grow(double[][] rows, int depth, int maxDepth, Random random) {
    if (depth >= maxDepth || rows.length <= 1) {
      return Node.leaf(rows.length);
    }
    int numFeatures = rows[0].length;
    double[] min = new double[numFeatures];
    double[] max = new double[numFeatures];
    for (int f = 0; f < numFeatures; f++) {
      min[f] = Double.POSITIVE_INFINITY;
      max[f] = Double.NEGATIVE_INFINITY;
    }
    for (double[] row : rows) {
      for (int f = 0; f < numFeatures; f++) {
        min[f] = Math.min(min[f], row[f]);
        max[f] = Math.max(max[f], row[f]);
      }
    }
    List<Integer> candidates = new ArrayList<>(numFeatures);
    for (int f = 0; f < numFeatures; f++) {
      if (max[f] > min[f]) {
        candidates.add(f);
      }
    }
    // All remaining rows are identical.
    if (candidates.isEmpty()) {
      return Node.leaf(rows.length);
    }
    int feature = candidates.get(random.nextInt(candidates.size()));
    double split = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

    int numLeft = 0;
    for (double[] row : rows) {
      if (row[feature] < split) {
        numLeft++;
      }
    }
    if (numLeft == 0 || numLeft == rows.length) {
      return Node.leaf(rows.length);
    }
    double[][] left = new double[numLeft][];
    double[][] right = new double[rows.length - numLeft][];
    int l = 0;
    int r = 0;
    for (double[] row : rows) {
      if (row[feature] < split) {
        left[l++] = row;
      } else {
        right[r++] = row;
      }
    }
    return Node.internal(feature, split, grow(left, depth + 1, maxDepth, random), grow(right, depth + 1, maxDepth, random));
  }

  /**
   * @param x Feature vector.
   * @return The number of edges from the root to the leaf reached by x, plus the expected path length of an
   * unbuilt subtree holding the leaf's training rows.
   */
  public double pathLength(double[] x) {
    Node node = _root;
    int depth = 0;
    while (!node.isLeaf()) {
      node = x[node._feature] < node._split ? node._left : node._right;
      depth++;
    }
    return depth + averagePathLength(node._size);
  }

  public int height() {
    return _height;
  }

  /**
   * The average path length of an unsuccessful search in a binary search tree of n nodes, used to normalize path
   * lengths: {@code c(n) = 2 * (ln(n - 1) + gamma) - 2 * (n - 1) / n}, with {@code c(1) = 0} and {@code c(2) = 1}.
   *
   * @param n Number of rows.
   * @return c(n).
   */
  public static double averagePathLength(int n) {
    if (n <= 1) {
      return 0.0;
    }
    if (n == 2) {
      return 1.0;
    }
    return 2.0 * (Math.log(n - 1.0) + EULER_MASCHERONI) - 2.0 * (n - 1.0) / n;
  }

  private static final class Node {
    private final int _feature;
    private final double _split;
    private final Node _left;
    private final Node _right;
    private final int _size;

    private Node(int feature, double split, Node left, Node right, int size) {
      _feature = feature;
      _split = split;
      _left = left;
      _right = right;
      _size = size;
    }

    static Node leaf(int size) {
      return new Node(-1, Double.NaN, null, null, size);
    }

    static Node internal(int feature, double split, Node left, Node right) {
      return new Node(feature, split, left, right, left._size + right._size);
    }

    boolean isLeaf() {
      return _left == null;
    }

    int height() {
      return isLeaf() ? 0 : 1 + Math.max(_left.height(), _right.height());
    }
  }
}
