// file: core/src/main/java/io/courselite/core/AvlTree.java
package io.courselite.core;

import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Height-balanced binary search tree (AVL) keyed by string.
 * <p>
 * Responsibilities:
 *  - insert(): add or overwrite a key, rebalancing with rotations on the way back up.
 *  - find():   exact-key lookup, read-only.
 *  - inOrder(): lazy ascending enumeration of values.
 *  - teardown(): release every node, children before parent.
 * <p>
 * Invariants after every insert:
 *  - BST order: left keys < node key < right keys (String natural order).
 *  - height == 1 + max(height(left), height(right)); an absent child has height 0.
 *  - |height(left) - height(right)| <= 1 at every node.
 *  - one node per distinct key; re-inserting a key overwrites the value in place.
 * <p>
 * Each node is referenced by exactly one parent (or by {@code root}); there are no
 * parent pointers. Not thread-safe: wrap externally if shared between threads.
 *
 * @param <V> value type stored under each key
 */
public final class AvlTree<V> {

    static final class Node<V> {
        final String key;
        V value;
        int height = 1;
        Node<V> left;
        Node<V> right;

        Node(String key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    private Node<V> root;
    private int size;
    private long rotations;

    // Bumped on every structural change; iterators capture it to fail fast.
    private int modCount;

    /**
     * Insert or overwrite the value for a key.
     *
     * @return true if a new node was created, false if an existing key was overwritten
     */
    public boolean insert(String key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        int before = size;
        root = insert(root, key, value);
        return size > before;
    }

    /** Exact-key lookup. */
    public Optional<V> find(String key) {
        Objects.requireNonNull(key, "key");
        Node<V> n = root;
        while (n != null) {
            int cmp = key.compareTo(n.key);
            if (cmp < 0) {
                n = n.left;
            } else if (cmp > 0) {
                n = n.right;
            } else {
                return Optional.of(n.value);
            }
        }
        return Optional.empty();
    }

    /**
     * Values in ascending key order.
     * <p>
     * The returned iterable is lazy and restartable: every call to
     * {@code iterator()} starts a fresh traversal from the current root.
     */
    public Iterable<V> inOrder() {
        return InOrderIterator::new;
    }

    /** Recursive in-order visit of (key, value) pairs. */
    public void forEachInOrder(BiConsumer<String, ? super V> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        visit(root, visitor);
    }

    /**
     * Release every node in post-order (children before parent, root last).
     * Safe on an empty tree and safe to call more than once; the tree can be
     * reused afterwards.
     */
    public void teardown() {
        release(root);
        root = null;
        size = 0;
        modCount++;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Height of the whole tree; 0 when empty. */
    public int height() {
        return height(root);
    }

    public Optional<String> rootKey() {
        return root == null ? Optional.empty() : Optional.of(root.key);
    }

    /** Number of single rotations performed so far. A double rotation counts as two. */
    public long rotationCount() {
        return rotations;
    }

    Node<V> root() {
        return root;
    }

    // ---------- insertion ----------

    private Node<V> insert(Node<V> node, String key, V value) {
        if (node == null) {
            size++;
            modCount++;
            return new Node<>(key, value);
        }

        int cmp = key.compareTo(node.key);
        if (cmp < 0) {
            node.left = insert(node.left, key, value);
        } else if (cmp > 0) {
            node.right = insert(node.right, key, value);
        } else {
            // Same key: latest write wins, structure untouched.
            node.value = value;
            return node;
        }

        updateHeight(node);
        int balance = balanceFactor(node);

        // Left-Left
        if (balance > 1 && key.compareTo(node.left.key) < 0) {
            return rotateRight(node);
        }
        // Right-Right
        if (balance < -1 && key.compareTo(node.right.key) > 0) {
            return rotateLeft(node);
        }
        // Left-Right
        if (balance > 1 && key.compareTo(node.left.key) > 0) {
            node.left = rotateLeft(node.left);
            return rotateRight(node);
        }
        // Right-Left
        if (balance < -1 && key.compareTo(node.right.key) < 0) {
            node.right = rotateRight(node.right);
            return rotateLeft(node);
        }
        return node;
    }

    // ---------- rotations ----------

    /**
     * Promote y.left to subtree root. x's right subtree moves to y.left.
     *
     *        y            x
     *       / \          / \
     *      x   C  ->    A   y
     *     / \              / \
     *    A   B            B   C
     */
    private Node<V> rotateRight(Node<V> y) {
        Node<V> x = y.left;
        Node<V> b = x.right;
        x.right = y;
        y.left = b;
        updateHeight(y);
        updateHeight(x);
        rotations++;
        return x;
    }

    /** Mirror of {@link #rotateRight(Node)}: promote x.right to subtree root. */
    private Node<V> rotateLeft(Node<V> x) {
        Node<V> y = x.right;
        Node<V> b = y.left;
        y.left = x;
        x.right = b;
        updateHeight(x);
        updateHeight(y);
        rotations++;
        return y;
    }

    // ---------- helpers ----------

    static int height(Node<?> n) {
        return n == null ? 0 : n.height;
    }

    static int balanceFactor(Node<?> n) {
        return n == null ? 0 : height(n.left) - height(n.right);
    }

    private static void updateHeight(Node<?> n) {
        n.height = 1 + Math.max(height(n.left), height(n.right));
    }

    private static <V> void visit(Node<V> n, BiConsumer<String, ? super V> visitor) {
        if (n == null) return;
        visit(n.left, visitor);
        visitor.accept(n.key, n.value);
        visit(n.right, visitor);
    }

    private static <V> void release(Node<V> n) {
        if (n == null) return;
        release(n.left);
        release(n.right);
        n.left = null;
        n.right = null;
        n.value = null;
    }

    /**
     * Explicit-stack in-order iterator: holds the left spine of the
     * not-yet-visited part of the tree.
     */
    private final class InOrderIterator implements Iterator<V> {
        private final Deque<Node<V>> stack = new ArrayDeque<>();
        private final int expectedModCount = modCount;

        InOrderIterator() {
            pushLeftSpine(root);
        }

        @Override
        public boolean hasNext() {
            checkForComodification();
            return !stack.isEmpty();
        }

        @Override
        public V next() {
            checkForComodification();
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            Node<V> n = stack.pop();
            pushLeftSpine(n.right);
            return n.value;
        }

        private void pushLeftSpine(Node<V> n) {
            while (n != null) {
                stack.push(n);
                n = n.left;
            }
        }

        private void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException("tree modified during traversal");
            }
        }
    }
}
