/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.TimingUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;

/**
 * ScopeTimer objects measure the time spent in bracketed regions of code, and are arranged in a tree of
 * named timers. Each {@link #enter()} / {@link #exit()} bracket records one interval into the timer's
 * bounded interval history. ScopeTimer implements {@link AutoCloseable}, with {@link #close()} exiting the
 * bracket, so that a try-with-resources block records exactly one interval however control leaves it:
 * <pre>
 * ScopeTimer root = new ScopeTimer("root");
 * try (ScopeTimer r = root.enter()) {
 *     for (Task task : tasks) {
 *         try (ScopeTimer t = root.getOrCreateChild("task", 5).enter()) {
 *             task.run();
 *         }
 *     }
 * }
 * System.out.println(root);
 * </pre>
 * Children are created on first request and cached by name, so using the same child name in a loop
 * accumulates multiple intervals in the same child. A child's capacity defaults to the capacity of its
 * parent at the time the child is created.
 * <p>
 * The rendered form of a timer tree looks like:
 * <pre>
 * &lt;ScopeTimer name=root intervals=[0.9222] min=0.9222 mean=0.9222 max=0.9222 children=[
 *     &lt;ScopeTimer name=task1 intervals=[0.0501, 0.0601, 0.0701] min=0.0501 mean=0.0601 max=0.0701&gt;,
 *     &lt;ScopeTimer name=task2 intervals=[0.1702] min=0.1702 mean=0.1702 max=0.1702&gt;
 * ]&gt;
 * </pre>
 * <p>
 * Entering a timer that is already active simply restarts its bracket, losing the measurement of the
 * first (unclosed) bracket. Exiting a timer that is not active records nothing. Timers built with
 * {@link Builder#strict(boolean) strict} mode instead throw an {@link IllegalStateException} in both cases.
 * Strictness is inherited by children.
 * <p>
 * ScopeTimer is not thread safe. A given node must not be entered, exited or rendered from multiple
 * threads concurrently; use distinct children per thread or synchronize externally.
 */
public class ScopeTimer extends IntervalRecorder implements AutoCloseable {
    static final String INDENT = "    ";

    private final String name;
    private final ScopeTimer parent;
    private final boolean strict;
    private final Map<String, ScopeTimer> children = new LinkedHashMap<String, ScopeTimer>();
    private long activeStartTime;
    private boolean active = false;

    /**
     * Create a root ScopeTimer retaining the default number of intervals (10).
     *
     * @param name The name of the timer. Must not be empty.
     */
    public ScopeTimer(final String name) {
        this(name, DEFAULT_Capacity);
    }

    /**
     * Create a root ScopeTimer.
     *
     * @param name The name of the timer. Must not be empty.
     * @param capacity The maximum number of intervals to retain. Must be positive.
     */
    public ScopeTimer(final String name, final int capacity) {
        this(name, capacity, null, false);
    }

    private ScopeTimer(final String name, final int capacity, final ScopeTimer parent, final boolean strict) {
        super(Kind.SCOPE_TIMER, capacity);
        if ((name == null) || name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.name = name;
        this.parent = parent;
        this.strict = strict;
    }

    /**
     * Get the child timer with the given name, creating it with this timer's capacity if it does not
     * exist yet.
     *
     * @param name the name of the child
     * @return the child timer
     */
    public ScopeTimer getOrCreateChild(final String name) {
        return getOrCreateChild(name, getCapacity());
    }

    /**
     * Get the child timer with the given name, creating it with the given capacity if it does not exist
     * yet. The capacity is ignored when the child already exists.
     *
     * @param name the name of the child
     * @param capacity the maximum number of intervals retained by a newly created child
     * @return the child timer
     */
    public ScopeTimer getOrCreateChild(final String name, final int capacity) {
        ScopeTimer child = children.get(name);
        if (child == null) {
            child = new ScopeTimer(name, capacity, this, strict);
            children.put(name, child);
        }
        return child;
    }

    /**
     * Open a measurement bracket on this timer.
     *
     * @return this timer, to be closed (directly or via try-with-resources) when the bracket ends
     */
    public ScopeTimer enter() {
        if (active && strict) {
            throw new IllegalStateException("ScopeTimer " + getQualifiedName() + " entered while already active");
        }
        activeStartTime = TimeServices.nanoTime();
        active = true;
        return this;
    }

    /**
     * Close the current measurement bracket, recording the time elapsed since {@link #enter()}.
     */
    public void exit() {
        long now = TimeServices.nanoTime();
        if (!active) {
            if (strict) {
                throw new IllegalStateException("ScopeTimer " + getQualifiedName() + " exited while not active");
            }
            return;
        }
        recordInterval(TimeServices.nanosToSeconds(now - activeStartTime));
        active = false;
    }

    /**
     * Same as {@link #exit()}.
     */
    @Override
    public void close() {
        exit();
    }

    /**
     * Run a task within a measurement bracket of this timer. The interval is recorded even if the task
     * throws.
     *
     * @param task the task to run
     */
    public void time(final Runnable task) {
        enter();
        try {
            task.run();
        } finally {
            exit();
        }
    }

    /**
     * Call a task within a measurement bracket of this timer. The interval is recorded even if the task
     * throws, and any exception thrown by the task propagates unchanged.
     *
     * @param task the task to call
     * @param <T> the result type of the task
     * @return the task's result
     * @throws Exception if the task throws
     */
    public <T> T time(final Callable<T> task) throws Exception {
        enter();
        try {
            return task.call();
        } finally {
            exit();
        }
    }

    public String getName() {
        return name;
    }

    /**
     * @return the parent of this timer, or null for a root timer
     */
    public ScopeTimer getParent() {
        return parent;
    }

    /**
     * @return the root of the tree this timer belongs to
     */
    public ScopeTimer getRoot() {
        ScopeTimer root = this;
        while (root.parent != null) {
            root = root.parent;
        }
        return root;
    }

    /**
     * @return an unmodifiable, creation ordered view of the children of this timer, indexed by name
     */
    public Map<String, ScopeTimer> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public boolean isActive() {
        return active;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Get the ancestors of this timer, walking from the immediate parent up to the root. The walk is lazy:
     * each iteration step follows one parent link.
     *
     * @return the ancestors of this timer, empty for a root timer
     */
    public Iterable<ScopeTimer> getAncestors() {
        return new Iterable<ScopeTimer>() {
            @Override
            public Iterator<ScopeTimer> iterator() {
                return new AncestorIterator(parent);
            }
        };
    }

    /**
     * @return the dot separated names of all timers from the root down to this one, e.g. "root.task1.sub"
     */
    public String getQualifiedName() {
        List<String> names = new ArrayList<String>();
        names.add(name);
        for (ScopeTimer ancestor : getAncestors()) {
            names.add(ancestor.getName());
        }
        Collections.reverse(names);
        return String.join(".", names);
    }

    /**
     * @return the number of ancestors of this timer (0 for a root timer)
     */
    public int getDepth() {
        int depth = 0;
        for (ScopeTimer ancestor : getAncestors()) {
            depth++;
        }
        return depth;
    }

    /**
     * Render this timer and its subtree. Non-root timers are rendered on their own line, indented by
     * four spaces per level of depth.
     *
     * @return the textual rendering of this timer's subtree
     */
    @Override
    public String render() {
        final int depth = getDepth();
        final String indent = INDENT.repeat(depth);
        List<String> properties = renderedProperties();
        if (!children.isEmpty()) {
            List<String> renderedChildren = new ArrayList<String>();
            for (ScopeTimer child : children.values()) {
                renderedChildren.add(child.render());
            }
            properties.add("children=[" + String.join(", ", renderedChildren) + "\n" + indent + "]");
        }
        return ((depth > 0) ? "\n" : "") + indent + "<" + String.join(" ", properties) + ">";
    }

    @Override
    void addIdentityProperties(List<String> properties) {
        properties.add("name=" + name);
    }

    /**
     * A fluent API builder class for creating root ScopeTimer objects.
     * <br>Uses the following defaults:
     * <ul>
     * <li>capacity:          10 </li>
     * <li>strict:            false </li>
     * </ul>
     */
    public static class Builder {
        private String name;
        private int capacity = DEFAULT_Capacity;
        private boolean strict = false;

        public static Builder create(String name) {
            return new Builder().name(name);
        }

        public Builder() {

        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public ScopeTimer build() {
            return new ScopeTimer(name, capacity, null, strict);
        }
    }

    private static class AncestorIterator implements Iterator<ScopeTimer> {
        private ScopeTimer next;

        AncestorIterator(final ScopeTimer first) {
            this.next = first;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public ScopeTimer next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            ScopeTimer current = next;
            next = current.parent;
            return current;
        }
    }
}
