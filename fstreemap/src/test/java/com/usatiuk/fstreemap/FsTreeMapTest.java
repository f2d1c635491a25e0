package com.usatiuk.fstreemap;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

public class FsTreeMapTest {
    private FsTreeMap<Long> tree;

    private static long leafCount(FsTreeMap<Long> tree) {
        return tree.valueReduce(0L, (acc, v) -> acc + 1);
    }

    @BeforeEach
    void setUp() {
        tree = new FsTreeMap<>(FsTreeMapConfig.defaults());
    }

    @Test
    void emptyTree() {
        Assertions.assertEquals(FsTreeMap.ROOT_NAME, tree.root().name());
        Assertions.assertTrue(tree.root().children().isEmpty());
        Assertions.assertEquals(0L, tree.valueSum(ValueAdder.LONG));
        Assertions.assertFalse(tree.any((name, value) -> true));
    }

    @Test
    void insertAtTopLevel() {
        tree.insert("home", 42L);
        Assertions.assertEquals(42L, tree.valueSum(ValueAdder.LONG));
        Assertions.assertEquals(42L, tree.getSize("home"));
        Assertions.assertEquals(42L, tree.root().getValue(ValueAdder.LONG));
    }

    @Test
    void userFilesScenario() {
        tree.insertWithParents("home/users/arthur/answer.txt", 42L);
        tree.insertWithParents("home/users/arthur/password.txt", 128L);

        Assertions.assertEquals(170L, tree.valueSum(ValueAdder.LONG));

        var children = tree.getChildren("home/users/arthur").orElseThrow();
        Assertions.assertEquals(List.of("answer.txt", "password.txt"), children.stream().map(Node::name).toList());
        Assertions.assertTrue(children.stream().allMatch(c -> c instanceof File<Long>));

        Assertions.assertTrue(tree.any((name, value) -> name.contains("passw")));
        Assertions.assertTrue(tree.any((name, value) -> value == 42));
        Assertions.assertFalse(tree.any((name, value) -> name.contains("Ideas")));
    }

    @Test
    void insertWithParentsRoundTrip() {
        tree.insertWithParents("a/b/c/file", 7L);
        var node = tree.getNode("a/b/c/file").orElseThrow();
        Assertions.assertEquals(new File<>("file", 7L), node);
        for (var dir : List.of("a", "a/b", "a/b/c"))
            Assertions.assertTrue(tree.getNode(dir).orElseThrow().isDirectory(), dir);
    }

    @Test
    void insertWithParentsReusesDirectories() {
        tree.insertWithParents("a/b/x", 1L);
        tree.insertWithParents("a/b/y", 2L);
        tree.insertWithParents("a/z", 3L);
        Assertions.assertEquals(1, tree.root().children().size());
        Assertions.assertEquals(List.of("b", "z"), tree.getChildren("a").orElseThrow().stream().map(Node::name).toList());
    }

    @Test
    void insertNeedsExistingParents() {
        var ex = Assertions.assertThrows(PathNotFoundException.class, () -> tree.insert("a/b/file", 1L));
        Assertions.assertEquals("a", ex.getPath());

        tree.makeDirectory("a");
        ex = Assertions.assertThrows(PathNotFoundException.class, () -> tree.insert("a/b/file", 1L));
        Assertions.assertEquals("a/b", ex.getPath());

        tree.makeDirectory("a/b");
        tree.insert("a/b/file", 1L);
        Assertions.assertEquals(1L, tree.getSize("a/b/file"));
    }

    @Test
    void insertThroughFileFails() {
        tree.insert("f", 1L);
        var ex = Assertions.assertThrows(ShapeViolationException.class, () -> tree.insert("f/g", 2L));
        Assertions.assertEquals(ShapeViolationException.Kind.NOT_A_DIRECTORY, ex.getKind());
        Assertions.assertEquals("f", ex.getPath());
        Assertions.assertThrows(ShapeViolationException.class, () -> tree.insertWithParents("f/g/h", 2L));
        Assertions.assertEquals(1L, leafCount(tree));
    }

    @Test
    void insertDuplicateFails() {
        tree.insertWithParents("a/x", 1L);
        var ex = Assertions.assertThrows(AlreadyExistsException.class, () -> tree.insert("a/x", 2L));
        Assertions.assertEquals("a/x", ex.getPath());
        Assertions.assertEquals("Already exists: a/x", ex.getMessage());
        ex = Assertions.assertThrows(AlreadyExistsException.class, () -> tree.insertWithParents("a", 2L));
        Assertions.assertEquals("a", ex.getPath());
        Assertions.assertEquals(1L, tree.valueSum(ValueAdder.LONG));
    }

    @Test
    void insertDuplicateShadowsWhenAllowed() {
        var appending = new FsTreeMap<Long>(new FsTreeMapConfig(false, 2));
        appending.insert("x", 1L);
        appending.insert("x", 2L);

        Assertions.assertEquals(2, appending.root().children().size());
        Assertions.assertEquals(1L, appending.getSize("x"));
        Assertions.assertEquals(3L, appending.valueSum(ValueAdder.LONG));

        Assertions.assertTrue(appending.remove("x"));
        Assertions.assertTrue(appending.root().children().isEmpty());
    }

    @Test
    void getNodeAbsent() {
        tree.insertWithParents("a/b", 1L);
        Assertions.assertTrue(tree.getNode("c").isEmpty());
        Assertions.assertTrue(tree.getNode("a/c").isEmpty());
        Assertions.assertTrue(tree.getNode("c/d/e").isEmpty());
    }

    @Test
    void getNodeThroughFileFails() {
        tree.insertWithParents("a/b", 1L);
        var ex = Assertions.assertThrows(ShapeViolationException.class, () -> tree.getNode("a/b/c"));
        Assertions.assertEquals(ShapeViolationException.Kind.NOT_A_DIRECTORY, ex.getKind());
        Assertions.assertEquals("a/b", ex.getPath());
    }

    @Test
    void getSizeRequiresFile() {
        tree.insertWithParents("a/b", 1L);
        var ex = Assertions.assertThrows(ShapeViolationException.class, () -> tree.getSize("a"));
        Assertions.assertEquals(ShapeViolationException.Kind.NOT_A_FILE, ex.getKind());
        Assertions.assertThrows(PathNotFoundException.class, () -> tree.getSize("a/c"));
    }

    @Test
    void getChildrenOnlyForDirectories() {
        tree.insertWithParents("a/b", 1L);
        Assertions.assertTrue(tree.getChildren("a/b").isEmpty());
        Assertions.assertTrue(tree.getChildren("nope").isEmpty());
        Assertions.assertEquals(1, tree.getChildren("a").orElseThrow().size());
    }

    @Test
    void makeDirectoryIsIdempotent() {
        var printer = new TreePrinter(2);
        tree.makeDirectory("a/b/c");
        var once = printer.render(tree);
        tree.makeDirectory("a/b/c");
        Assertions.assertEquals(once, printer.render(tree));
        tree.makeDirectory("a/b");
        Assertions.assertEquals(once, printer.render(tree));
        Assertions.assertEquals(1, tree.getChildren("a/b").orElseThrow().size());
    }

    @Test
    void makeDirectoryOverFileFails() {
        tree.insertWithParents("a/f", 1L);
        var ex = Assertions.assertThrows(ShapeViolationException.class, () -> tree.makeDirectory("a/f"));
        Assertions.assertEquals("a/f", ex.getPath());
        Assertions.assertThrows(ShapeViolationException.class, () -> tree.makeDirectory("a/f/g"));
    }

    @Test
    void removeFile() {
        tree.insertWithParents("a/x", 1L);
        tree.insertWithParents("a/y", 2L);
        tree.insertWithParents("b/z", 3L);

        Assertions.assertTrue(tree.remove("a/x"));
        Assertions.assertTrue(tree.getNode("a/x").isEmpty());
        Assertions.assertEquals(2L, leafCount(tree));
        Assertions.assertEquals(5L, tree.valueSum(ValueAdder.LONG));
    }

    @Test
    void removeDirectoryRemovesSubtree() {
        tree.insertWithParents("a/b/x", 1L);
        tree.insertWithParents("a/b/y", 2L);
        tree.insertWithParents("c", 4L);
        Assertions.assertTrue(tree.remove("a"));
        Assertions.assertEquals(4L, tree.valueSum(ValueAdder.LONG));
        Assertions.assertTrue(tree.getNode("a/b/x").isEmpty());
    }

    @Test
    void removeMissing() {
        tree.makeDirectory("a");
        Assertions.assertFalse(tree.remove("a/x"));
        Assertions.assertThrows(PathNotFoundException.class, () -> tree.remove("b/x"));
        tree.insert("a/f", 1L);
        Assertions.assertThrows(ShapeViolationException.class, () -> tree.remove("a/f/x"));
    }

    @Test
    void emptyPathIsLiteral() {
        Assertions.assertTrue(tree.getNode("").isEmpty());
        tree.insert("", 5L);
        Assertions.assertEquals(5L, tree.getSize(""));
        Assertions.assertEquals("", tree.root().children().get(0).name());
    }

    @Test
    void doubledSeparatorIsEmptySegment() {
        tree.insertWithParents("a//b", 1L);
        Assertions.assertTrue(tree.getNode("a/b").isEmpty());
        Assertions.assertEquals(1L, tree.getSize("a//b"));
        Assertions.assertTrue(tree.getNode("a/").orElseThrow().isDirectory());
    }

    @Test
    void leadingAndTrailingSeparators() {
        tree.insertWithParents("/x", 1L);
        Assertions.assertTrue(tree.getNode("x").isEmpty());
        Assertions.assertEquals(1L, tree.getSize("/x"));

        tree.makeDirectory("d");
        tree.insert("d/", 2L);
        Assertions.assertEquals(List.of(""), tree.getChildren("d").orElseThrow().stream().map(Node::name).toList());
        Assertions.assertEquals(2L, tree.getSize("d/"));
    }

    @Test
    void rootIsNotAPathComponent() {
        tree.insert("x", 1L);
        Assertions.assertTrue(tree.getNode("root/x").isEmpty());
        Assertions.assertTrue(tree.getNode("root").isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3})
    void sumIgnoresInsertionOrder(int rotation) {
        var paths = List.of("a/x", "a/b/y", "c", "d/e/f/g");
        var values = List.of(3L, 5L, 11L, 17L);
        for (int i = 0; i < paths.size(); i++) {
            int idx = (i + rotation) % paths.size();
            tree.insertWithParents(paths.get(idx), values.get(idx));
        }
        Assertions.assertEquals(36L, tree.valueSum(ValueAdder.LONG));
    }

    @Test
    void anyEvaluatesEveryFile() {
        tree.insertWithParents("a/match", 1L);
        tree.insertWithParents("a/b/other", 2L);
        tree.insertWithParents("c", 3L);
        var visited = new ArrayList<String>();
        Assertions.assertTrue(tree.any((name, value) -> {
            visited.add(name);
            return name.equals("match");
        }));
        Assertions.assertEquals(List.of("match", "other", "c"), visited);
    }

    @Test
    void walkTreeIsPreOrder() {
        tree.insertWithParents("a/b/x", 1L);
        tree.insertWithParents("a/y", 2L);
        tree.insertWithParents("z", 3L);
        var names = new ArrayList<String>();
        tree.walkTree(n -> names.add(n.name()));
        Assertions.assertEquals(List.of("root", "a", "b", "x", "y", "z"), names);
    }

    @Test
    void copyIsIndependent() {
        tree.insertWithParents("a/x", 1L);
        var copy = tree.copy();
        tree.insertWithParents("a/y", 2L);
        copy.remove("a/x");
        Assertions.assertEquals(3L, tree.valueSum(ValueAdder.LONG));
        Assertions.assertEquals(0L, copy.valueSum(ValueAdder.LONG));
        Assertions.assertTrue(copy.getNode("a").isPresent());
        Assertions.assertEquals(tree.config(), copy.config());
    }

    @Test
    void defaultConstructorUsesConfigFile() {
        var configured = new FsTreeMap<Long>();
        configured.insert("x", 1L);
        Assertions.assertThrows(AlreadyExistsException.class, () -> configured.insert("x", 1L));
    }
}
