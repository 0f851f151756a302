package com.docsearch.chat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Self-adjusting binary search tree of chat sessions keyed by chat id
 * (natural {@link String} order). Every insert and successful access splays
 * the touched node to the root, so recently used chats are the cheapest to
 * reach again.
 *
 * <p>Nodes are kept in an arena and linked by index. Freed slots are reused.
 * Not thread-safe.
 */
public final class SplayTree {

    private static final Logger logger = LoggerFactory.getLogger(SplayTree.class);

    private static final int NIL = -1;

    private static final Comparator<ChatRecord> NEWEST_FIRST =
            Comparator.comparingLong(ChatRecord::timestamp).reversed();

    private final List<Node> arena = new ArrayList<>();
    private final Deque<Integer> free = new ArrayDeque<>();
    private int root = NIL;
    private int size;

    /**
     * Inserts a chat, or updates title and timestamp when the id exists.
     * Either way the chat ends up at the root.
     */
    public ChatRecord insert(String id, String title, long timestamp) {
        requireId(id);
        if (title == null) throw new IllegalArgumentException("title must not be null");

        if (root == NIL) {
            root = allocate(id, title, timestamp);
            size = 1;
            return record(root);
        }

        int current = root;
        int parent = NIL;
        int cmp = 0;
        while (current != NIL) {
            parent = current;
            Node n = arena.get(current);
            cmp = id.compareTo(n.id);
            if (cmp == 0) {
                n.title = title;
                n.timestamp = timestamp;
                splay(current);
                return record(current);
            }
            current = cmp < 0 ? n.left : n.right;
        }

        int created = allocate(id, title, timestamp);
        arena.get(created).parent = parent;
        if (cmp < 0) {
            arena.get(parent).left = created;
        } else {
            arena.get(parent).right = created;
        }
        size++;
        splay(created);
        return record(created);
    }

    /**
     * Looks a chat up and splays it to the root. A miss leaves the tree untouched.
     */
    public Optional<ChatRecord> access(String id) {
        int node = find(id);
        if (node == NIL) return Optional.empty();
        splay(node);
        return Optional.of(record(node));
    }

    /** Membership test that leaves the tree shape alone. */
    public boolean contains(String id) {
        return find(id) != NIL;
    }

    /**
     * Removes a chat. The left subtree's maximum becomes the new root when
     * both subtrees are present.
     *
     * @return false when the id is absent
     */
    public boolean delete(String id) {
        int node = find(id);
        if (node == NIL) return false;

        splay(node);
        Node n = arena.get(node);
        int left = n.left;
        int right = n.right;

        if (left == NIL) {
            root = right;
            if (right != NIL) arena.get(right).parent = NIL;
        } else if (right == NIL) {
            root = left;
            arena.get(left).parent = NIL;
        } else {
            arena.get(left).parent = NIL;
            arena.get(right).parent = NIL;

            int max = left;
            while (arena.get(max).right != NIL) {
                max = arena.get(max).right;
            }
            root = left;
            splay(max);

            arena.get(root).right = right;
            arena.get(right).parent = root;
        }

        release(node);
        size--;
        return true;
    }

    /**
     * Every chat, newest first. The tree itself is not reordered.
     */
    public List<ChatRecord> list() {
        List<ChatRecord> chats = inOrder();
        chats.sort(NEWEST_FIRST);
        return chats;
    }

    /**
     * Every chat in ascending id order.
     */
    public List<ChatRecord> inOrder() {
        List<ChatRecord> out = new ArrayList<>(size);
        Deque<Integer> stack = new ArrayDeque<>();
        int current = root;
        while (current != NIL || !stack.isEmpty()) {
            while (current != NIL) {
                stack.push(current);
                current = arena.get(current).left;
            }
            current = stack.pop();
            out.add(record(current));
            current = arena.get(current).right;
        }
        return out;
    }

    public void clear() {
        int dropped = size;
        arena.clear();
        free.clear();
        root = NIL;
        size = 0;
        logger.info("Cleared chat tree ({} chats dropped)", dropped);
    }

    public Optional<ChatRecord> root() {
        return root == NIL ? Optional.empty() : Optional.of(record(root));
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Edges on the longest root-to-leaf path; -1 for an empty tree. */
    public int height() {
        if (root == NIL) return -1;

        int height = 0;
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{root, 0});
        while (!stack.isEmpty()) {
            int[] top = stack.pop();
            Node n = arena.get(top[0]);
            height = Math.max(height, top[1]);
            if (n.left != NIL) stack.push(new int[]{n.left, top[1] + 1});
            if (n.right != NIL) stack.push(new int[]{n.right, top[1] + 1});
        }
        return height;
    }

    // ---------------------------------------------------------------
    // splaying
    // ---------------------------------------------------------------

    private void splay(int x) {
        while (arena.get(x).parent != NIL) {
            int p = arena.get(x).parent;
            int g = arena.get(p).parent;
            boolean xLeft = arena.get(p).left == x;

            if (g == NIL) {
                // zig
                if (xLeft) rotateRight(p); else rotateLeft(p);
                continue;
            }

            boolean pLeft = arena.get(g).left == p;
            if (xLeft && pLeft) {
                // zig-zig
                rotateRight(g);
                rotateRight(p);
            } else if (!xLeft && !pLeft) {
                rotateLeft(g);
                rotateLeft(p);
            } else if (!xLeft) {
                // zig-zag, p is a left child
                rotateLeft(p);
                rotateRight(g);
            } else {
                rotateRight(p);
                rotateLeft(g);
            }
        }
    }

    /** Lifts {@code x}'s left child into {@code x}'s place. */
    private void rotateRight(int x) {
        Node nx = arena.get(x);
        int y = nx.left;
        if (y == NIL) return;
        Node ny = arena.get(y);

        nx.left = ny.right;
        if (ny.right != NIL) arena.get(ny.right).parent = x;

        replaceChild(nx.parent, x, y);

        ny.right = x;
        nx.parent = y;
    }

    /** Lifts {@code x}'s right child into {@code x}'s place. */
    private void rotateLeft(int x) {
        Node nx = arena.get(x);
        int y = nx.right;
        if (y == NIL) return;
        Node ny = arena.get(y);

        nx.right = ny.left;
        if (ny.left != NIL) arena.get(ny.left).parent = x;

        replaceChild(nx.parent, x, y);

        ny.left = x;
        nx.parent = y;
    }

    private void replaceChild(int parent, int oldChild, int newChild) {
        arena.get(newChild).parent = parent;
        if (parent == NIL) {
            root = newChild;
        } else if (arena.get(parent).left == oldChild) {
            arena.get(parent).left = newChild;
        } else {
            arena.get(parent).right = newChild;
        }
    }

    // ---------------------------------------------------------------
    // arena
    // ---------------------------------------------------------------

    private int find(String id) {
        if (id == null) return NIL;

        int current = root;
        while (current != NIL) {
            Node n = arena.get(current);
            int cmp = id.compareTo(n.id);
            if (cmp == 0) return current;
            current = cmp < 0 ? n.left : n.right;
        }
        return NIL;
    }

    private int allocate(String id, String title, long timestamp) {
        Node n = new Node(id, title, timestamp);
        Integer slot = free.poll();
        if (slot != null) {
            arena.set(slot, n);
            return slot;
        }
        arena.add(n);
        return arena.size() - 1;
    }

    private void release(int slot) {
        arena.set(slot, null);
        free.push(slot);
    }

    private ChatRecord record(int node) {
        Node n = arena.get(node);
        return new ChatRecord(n.id, n.title, n.timestamp);
    }

    private static void requireId(String id) {
        if (id == null || id.isEmpty()) throw new IllegalArgumentException("chat id must not be empty");
    }

    private static final class Node {
        final String id;
        String title;
        long timestamp;
        int left = NIL;
        int right = NIL;
        int parent = NIL;

        Node(String id, String title, long timestamp) {
            this.id = id;
            this.title = title;
            this.timestamp = timestamp;
        }
    }
}
