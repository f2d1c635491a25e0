package com.usatiuk.fstreemap;

import jakarta.annotation.Nonnull;
import org.apache.commons.lang3.function.TriFunction;
import org.apache.commons.lang3.tuple.Pair;
import org.pcollections.PVector;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * A tree of directories and files addressed by {@code /}-delimited paths.
 * <p>
 * Paths are relative to the root directory, which is always named {@value #ROOT_NAME} and is never a part of the path.
 * Every segment of a path, empty ones included, is matched literally against child names.
 * <p>
 * Not thread-safe.
 *
 * @param <V> the type of the values stored in files
 */
public class FsTreeMap<V> {
    public static final String ROOT_NAME = "root";
    private static final Logger LOGGER = Logger.getLogger(FsTreeMap.class.getName());

    private final FsTreeMapConfig _config;
    private final Directory<V> _root;

    /**
     * Create an empty tree with the settings from the current config.
     */
    public FsTreeMap() {
        this(FsTreeMapConfig.load());
    }

    /**
     * Create an empty tree.
     *
     * @param config the settings of the tree
     */
    public FsTreeMap(FsTreeMapConfig config) {
        this(config, new Directory<>(ROOT_NAME));
    }

    private FsTreeMap(FsTreeMapConfig config, Directory<V> root) {
        _config = config;
        _root = root;
    }

    private static List<String> splitPath(String path) {
        return List.of(path.split("/", -1));
    }

    /**
     * Split a path into the list of its directory segments and its last segment
     */
    private static Pair<List<String>, String> splitStem(String path) {
        var parts = splitPath(path);
        return Pair.of(parts.subList(0, parts.size() - 1), parts.get(parts.size() - 1));
    }

    private static String joinPrefix(List<String> parts, int length) {
        return String.join("/", parts.subList(0, length));
    }

    private static <V> Directory<V> requireDirectory(Node<V> node, String path) {
        if (node instanceof Directory<V> dir)
            return dir;
        throw new ShapeViolationException(ShapeViolationException.Kind.NOT_A_DIRECTORY, path);
    }

    public FsTreeMapConfig config() {
        return _config;
    }

    /**
     * Get the root directory.
     *
     * @return the root directory
     */
    public Directory<V> root() {
        return _root;
    }

    /**
     * Find the node at the given path.
     *
     * @param path the path of the node
     * @return the node, or empty if some segment of the path doesn't exist
     * @throws ShapeViolationException if the path goes through a file
     */
    public Optional<Node<V>> getNode(String path) {
        var parts = splitPath(path);
        Node<V> current = _root;
        for (int i = 0; i < parts.size(); i++) {
            var dir = requireDirectory(current, joinPrefix(parts, i));
            var next = dir.getChild(parts.get(i));
            if (next.isEmpty())
                return Optional.empty();
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * Get the value of the file at the given path.
     *
     * @param path the path of the file
     * @return the value of the file
     * @throws PathNotFoundException   if the path doesn't exist
     * @throws ShapeViolationException if the path is a directory or goes through a file
     */
    public V getSize(String path) {
        var node = getNode(path).orElseThrow(() -> new PathNotFoundException(path));
        if (node instanceof File<V> file)
            return file.value();
        throw new ShapeViolationException(ShapeViolationException.Kind.NOT_A_FILE, path);
    }

    /**
     * Get the children of the directory at the given path.
     *
     * @param path the path of the directory
     * @return the children in insertion order, or empty if the path doesn't exist or is a file
     * @throws ShapeViolationException if the path goes through a file
     */
    public Optional<PVector<Node<V>>> getChildren(String path) {
        var node = getNode(path);
        if (node.isPresent() && node.get() instanceof Directory<V> dir)
            return Optional.of(dir.children());
        return Optional.empty();
    }

    /**
     * Walk the given directory segments for a modification
     *
     * @param dirpath       the segments to walk
     * @param createParents whether to create missing directories on the way
     * @return the directory at the end of the segments
     */
    @Nonnull
    private Directory<V> traverseW(List<String> dirpath, boolean createParents) {
        Directory<V> current = _root;
        for (int i = 0; i < dirpath.size(); i++) {
            var part = dirpath.get(i);
            var next = current.getChildW(part);
            if (next.isPresent()) {
                current = requireDirectory(next.get(), joinPrefix(dirpath, i + 1));
                continue;
            }
            if (!createParents)
                throw new PathNotFoundException(joinPrefix(dirpath, i + 1));
            var parent = current;
            LOGGER.finer(() -> "Creating missing directory " + part + " in " + parent);
            current = parent.makeDirectory(part);
        }
        return current;
    }

    private void insertImpl(String path, V value, boolean createParents) {
        var split = splitStem(path);
        var dir = traverseW(split.getLeft(), createParents);
        var stem = split.getRight();

        if (dir.getChildW(stem).isPresent()) {
            if (_config.failCreatingIfExists())
                throw new AlreadyExistsException(path);
            LOGGER.fine(() -> "Inserting file that will be shadowed by an existing node: " + path);
        }

        LOGGER.finer(() -> "Inserting file " + path);
        dir.addChild(new File<>(stem, value));
    }

    /**
     * Insert a new file, all directories on the path must already exist.
     *
     * @param path  the path of the new file
     * @param value the value of the new file
     * @throws PathNotFoundException   if some directory on the path doesn't exist
     * @throws ShapeViolationException if the path goes through a file
     * @throws AlreadyExistsException  if the name is taken and {@link FsTreeMapConfig#failCreatingIfExists()} is set
     */
    public void insert(String path, V value) {
        insertImpl(path, value, false);
    }

    /**
     * Insert a new file, creating the missing directories on the path.
     *
     * @param path  the path of the new file
     * @param value the value of the new file
     * @throws ShapeViolationException if the path goes through a file
     * @throws AlreadyExistsException  if the name is taken and {@link FsTreeMapConfig#failCreatingIfExists()} is set
     */
    public void insertWithParents(String path, V value) {
        insertImpl(path, value, true);
    }

    /**
     * Make sure every segment of the path exists as a directory, creating the missing ones.
     *
     * @param path the path of the directory
     * @throws ShapeViolationException if some segment of the path is a file
     */
    public void makeDirectory(String path) {
        var parts = splitPath(path);
        Directory<V> current = _root;
        for (int i = 0; i < parts.size(); i++) {
            var part = parts.get(i);
            var next = current.getChildW(part);
            if (next.isPresent()) {
                current = requireDirectory(next.get(), joinPrefix(parts, i + 1));
            } else {
                LOGGER.finer(() -> "Creating directory " + part + " in " + path);
                current = current.makeDirectory(part);
            }
        }
    }

    /**
     * Remove all nodes with the last name of the path from its parent directory.
     *
     * @param path the path of the node to remove
     * @return true if something was removed
     * @throws PathNotFoundException   if the parent directory doesn't exist
     * @throws ShapeViolationException if the path goes through a file
     */
    public boolean remove(String path) {
        var split = splitStem(path);
        var dir = traverseW(split.getLeft(), false);
        int removed = dir.removeChildren(split.getRight());
        if (removed > 1)
            LOGGER.fine(() -> "Removed " + removed + " nodes with the same name at " + path);
        else
            LOGGER.finer(() -> "Removed " + removed + " nodes at " + path);
        return removed > 0;
    }

    /**
     * Fold over the values of all files in the tree.
     *
     * @see Node#valueReduce(Object, BiFunction)
     */
    public <T> T valueReduce(T seed, BiFunction<T, ? super V, T> combine) {
        return _root.valueReduce(seed, combine);
    }

    /**
     * Fold over the names and values of all files in the tree.
     *
     * @see Node#reduce(Object, TriFunction)
     */
    public <T> T reduce(T seed, TriFunction<T, String, ? super V, T> combine) {
        return _root.reduce(seed, combine);
    }

    /**
     * Total of the values of all files in the tree.
     *
     * @param adder the addition to total the values with
     * @return the total, or the adder's zero for an empty tree
     */
    public V valueSum(ValueAdder<V> adder) {
        return valueReduce(adder.zero(), adder::add);
    }

    /**
     * Check whether any file matches the predicate.
     * The predicate is evaluated for every file, even after a match is found.
     *
     * @param predicate the predicate taking the file name and value
     * @return true if at least one file matches
     */
    public boolean any(BiPredicate<String, ? super V> predicate) {
        return reduce(Boolean.FALSE, (acc, name, value) -> predicate.test(name, value) || acc);
    }

    /**
     * Visit every node of the tree, the root included, depth-first, parents before their children.
     *
     * @param consumer the consumer to apply to each node
     */
    public void walkTree(Consumer<Node<V>> consumer) {
        ArrayDeque<Node<V>> stack = new ArrayDeque<>();
        stack.push(_root);

        while (!stack.isEmpty()) {
            var node = stack.pop();
            consumer.accept(node);
            if (node instanceof Directory<V> dir) {
                var children = dir.children();
                for (int i = children.size() - 1; i >= 0; i--)
                    stack.push(children.get(i));
            }
        }
    }

    /**
     * Print the tree using a {@link TreePrinter} with this tree's indent.
     *
     * @param out the stream to print to
     */
    public void printTree(PrintStream out) {
        new TreePrinter(_config.printIndent()).print(this, out);
    }

    /**
     * Copy the whole tree.
     *
     * @return a tree with the same settings that shares no nodes with this one
     */
    public FsTreeMap<V> copy() {
        return new FsTreeMap<>(_config, _root.deepCopy());
    }
}
