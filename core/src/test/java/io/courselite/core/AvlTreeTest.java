package io.courselite.core;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior of the AVL tree: rotation cases, overwrite policy, ordering,
 * lookup, teardown, and the invariants after arbitrary insert sequences.
 */
class AvlTreeTest {

    private static AvlTree<String> treeOf(String... keys) {
        var tree = new AvlTree<String>();
        for (String k : keys) {
            tree.insert(k, "v-" + k);
        }
        return tree;
    }

    // Pre-order "key/height" listing; captures structure and heights.
    private static String shape(AvlTree.Node<?> n) {
        if (n == null) return ".";
        return "(" + n.key + "/" + n.height + " " + shape(n.left) + " " + shape(n.right) + ")";
    }

    private static void assertBalancedThree(AvlTree<String> tree) {
        AvlTree.Node<String> root = tree.root();
        assertEquals("B", root.key);
        assertEquals("A", root.left.key);
        assertEquals("C", root.right.key);
        assertEquals(2, root.height);
        assertEquals(1, root.left.height);
        assertEquals(1, root.right.height);
        assertTrue(AvlInvariants.isValid(tree), () -> AvlInvariants.check(tree).toString());
    }

    @Test
    void left_left_case_single_right_rotation() {
        var tree = treeOf("C", "B", "A");
        assertBalancedThree(tree);
        assertEquals(1, tree.rotationCount());
    }

    @Test
    void right_right_case_single_left_rotation() {
        var tree = treeOf("A", "B", "C");
        assertBalancedThree(tree);
        assertEquals(1, tree.rotationCount());
    }

    @Test
    void left_right_case_double_rotation() {
        var tree = treeOf("C", "A", "B");
        assertBalancedThree(tree);
        assertEquals(2, tree.rotationCount());
    }

    @Test
    void right_left_case_double_rotation() {
        var tree = treeOf("A", "C", "B");
        assertBalancedThree(tree);
        assertEquals(2, tree.rotationCount());
    }

    @Test
    void empty_tree_has_height_zero_and_no_root() {
        var tree = new AvlTree<String>();
        assertTrue(tree.isEmpty());
        assertEquals(0, tree.height());
        assertTrue(tree.rootKey().isEmpty());
        assertTrue(tree.find("ANY").isEmpty());
        assertFalse(tree.inOrder().iterator().hasNext());
    }

    @Test
    void duplicate_key_overwrites_value_without_changing_shape() {
        var tree = treeOf("M", "F", "T", "B", "H", "Z");
        String before = shape(tree.root());
        long rotationsBefore = tree.rotationCount();

        boolean created = tree.insert("H", "updated");

        assertFalse(created, "overwrite must not report a new node");
        assertEquals(before, shape(tree.root()));
        assertEquals(rotationsBefore, tree.rotationCount());
        assertEquals(6, tree.size());
        assertEquals(Optional.of("updated"), tree.find("H"));
    }

    @Test
    void latest_value_wins_across_repeated_inserts() {
        var tree = new AvlTree<String>();
        assertTrue(tree.insert("CSCI100", "first"));
        assertFalse(tree.insert("CSCI100", "second"));
        assertFalse(tree.insert("CSCI100", "third"));

        assertEquals(1, tree.size());
        assertEquals(Optional.of("third"), tree.find("CSCI100"));
    }

    @Test
    void in_order_yields_strictly_ascending_keys_once_each() {
        var tree = new AvlTree<String>();
        for (String k : List.of("MATH201", "CSCI300", "CSCI100", "CSCI200", "CSCI100", "CSCI400", "CSCI350")) {
            tree.insert(k, k);
        }

        List<String> seen = new ArrayList<>();
        for (String v : tree.inOrder()) {
            seen.add(v);
        }
        assertEquals(List.of("CSCI100", "CSCI200", "CSCI300", "CSCI350", "CSCI400", "MATH201"), seen);
    }

    @Test
    void in_order_iterable_is_restartable() {
        var tree = treeOf("D", "B", "F", "A");
        Iterable<String> values = tree.inOrder();

        List<String> first = new ArrayList<>();
        values.forEach(first::add);
        List<String> second = new ArrayList<>();
        values.forEach(second::add);

        assertEquals(List.of("v-A", "v-B", "v-D", "v-F"), first);
        assertEquals(first, second);
    }

    @Test
    void for_each_in_order_visits_keys_and_values() {
        var tree = treeOf("B", "A", "C");
        List<String> pairs = new ArrayList<>();
        tree.forEachInOrder((k, v) -> pairs.add(k + "=" + v));
        assertEquals(List.of("A=v-A", "B=v-B", "C=v-C"), pairs);
    }

    @Test
    void iterator_fails_fast_after_structural_insert() {
        var tree = treeOf("B", "A", "C");
        Iterator<String> it = tree.inOrder().iterator();
        it.next();

        tree.insert("D", "v-D");

        assertThrows(ConcurrentModificationException.class, it::next);
    }

    @Test
    void iterator_tolerates_value_overwrite() {
        var tree = treeOf("B", "A", "C");
        Iterator<String> it = tree.inOrder().iterator();
        assertEquals("v-A", it.next());

        tree.insert("C", "new-C");

        assertEquals("v-B", it.next());
        assertEquals("new-C", it.next());
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void find_misses_report_empty_never_throw() {
        var tree = treeOf("X100", "X200");
        assertTrue(tree.find("X999").isEmpty());
        assertTrue(tree.find("").isEmpty());
        assertTrue(tree.find("x100").isEmpty(), "keys are compared exactly; normalization is the caller's job");
    }

    @Test
    void empty_key_is_ordered_like_any_other_string() {
        var tree = treeOf("B", "", "A", "C");
        assertEquals(Optional.of("v-"), tree.find(""));
        assertTrue(AvlInvariants.isValid(tree));
        List<String> order = new ArrayList<>();
        tree.forEachInOrder((k, v) -> order.add(k));
        assertEquals(List.of("", "A", "B", "C"), order);
    }

    @Test
    void null_key_or_value_is_rejected() {
        var tree = new AvlTree<String>();
        assertThrows(NullPointerException.class, () -> tree.insert(null, "v"));
        assertThrows(NullPointerException.class, () -> tree.insert("K", null));
        assertThrows(NullPointerException.class, () -> tree.find(null));
        assertTrue(tree.isEmpty());
    }

    @Test
    void teardown_releases_everything_and_is_idempotent() {
        var tree = treeOf("C", "A", "E", "B", "D");
        tree.teardown();

        assertTrue(tree.isEmpty());
        assertEquals(0, tree.height());
        assertTrue(tree.find("C").isEmpty());
        assertTrue(AvlInvariants.isValid(tree));

        tree.teardown();
        assertTrue(tree.isEmpty());

        // reusable after teardown
        tree.insert("Z", "v-Z");
        assertEquals(Optional.of("v-Z"), tree.find("Z"));
        assertEquals(Optional.of("Z"), tree.rootKey());
    }

    @Test
    void teardown_on_fresh_tree_is_a_no_op() {
        var tree = new AvlTree<String>();
        assertDoesNotThrow(tree::teardown);
        assertTrue(tree.isEmpty());
    }

    @Test
    void teardown_invalidates_open_iterators() {
        var tree = treeOf("A", "B", "C");
        Iterator<String> it = tree.inOrder().iterator();
        tree.teardown();
        assertThrows(ConcurrentModificationException.class, it::hasNext);
    }

    @Test
    void invariants_hold_after_every_insert_of_a_random_sequence() {
        var rnd = new Random(42L);
        var tree = new AvlTree<Integer>();
        var model = new TreeMap<String, Integer>();

        for (int i = 0; i < 2_000; i++) {
            String key = "K" + rnd.nextInt(700);
            tree.insert(key, i);
            model.put(key, i);

            List<String> violations = AvlInvariants.check(tree);
            assertTrue(violations.isEmpty(), "after insert #" + i + " of " + key + ": " + violations);
        }

        assertEquals(model.size(), tree.size());
        for (Map.Entry<String, Integer> e : model.entrySet()) {
            assertEquals(Optional.of(e.getValue()), tree.find(e.getKey()), e.getKey());
        }
        assertTrue(tree.find("K700").isEmpty());
        assertEquals(new ArrayList<>(model.values()), toList(tree.inOrder()));
    }

    @Test
    void height_stays_within_avl_bound_for_sorted_reverse_and_random_input() {
        int n = 10_000;
        List<String> keys = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            keys.add(String.format("C%06d", i));
        }

        List<List<String>> orders = new ArrayList<>();
        orders.add(new ArrayList<>(keys));
        List<String> reversed = new ArrayList<>(keys);
        Collections.reverse(reversed);
        orders.add(reversed);
        List<String> shuffled = new ArrayList<>(keys);
        Collections.shuffle(shuffled, new Random(7L));
        orders.add(shuffled);

        for (List<String> order : orders) {
            var tree = new AvlTree<String>();
            order.forEach(k -> tree.insert(k, k));

            assertEquals(n, tree.size());
            assertTrue(tree.height() <= AvlInvariants.heightBound(n),
                    "height " + tree.height() + " exceeds bound " + AvlInvariants.heightBound(n));
            assertTrue(tree.height() <= 1.44 * (Math.log(n + 2) / Math.log(2)) - 0.328);
            assertTrue(AvlInvariants.isValid(tree));
        }
    }

    @Test
    void ascending_inserts_of_seven_keys_build_a_perfect_tree() {
        var tree = treeOf("A", "B", "C", "D", "E", "F", "G");
        assertEquals(3, tree.height());
        assertEquals(Optional.of("D"), tree.rootKey());
        assertEquals("(D/3 (B/2 (A/1 . .) (C/1 . .)) (F/2 (E/1 . .) (G/1 . .)))", shape(tree.root()));
    }

    private static <T> List<T> toList(Iterable<T> it) {
        List<T> out = new ArrayList<>();
        it.forEach(out::add);
        return out;
    }
}
