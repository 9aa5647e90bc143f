package com.formulagrid.app.services;

import com.formulagrid.app.exceptions.CellEvaluationException;
import com.formulagrid.app.exceptions.ErrorKind;
import com.formulagrid.app.models.CellKey;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * State shared by one top-level evaluation and every nested cell evaluation it triggers.
 * <p>
 * The call stack lives here rather than in the cells, and the same instance must be passed
 * down through every table the evaluation reaches; otherwise a loop running through
 * two tables would never be seen. Not thread-safe: one context, one thread.
 */
public class EvaluationContext {

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final Deque<CellKey> callStack = new ArrayDeque<>();
    private final Set<CellKey> onStack = new HashSet<>();
    private final Set<CellKey> refreshed = new HashSet<>();
    private final List<CellKey> computed = new ArrayList<>();

    private final int maxDepth;
    private final boolean strictReferences;
    private final boolean forceRecompute;

    public EvaluationContext() {
        this(DEFAULT_MAX_DEPTH, false, false);
    }

    public EvaluationContext(int maxDepth, boolean strictReferences, boolean forceRecompute) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.strictReferences = strictReferences;
        this.forceRecompute = forceRecompute;
    }

    /**
     * A lenient context that recomputes every formula cell it reaches, once.
     */
    public static EvaluationContext forcingRecompute() {
        return new EvaluationContext(DEFAULT_MAX_DEPTH, false, true);
    }

    public boolean isOnStack(CellKey key) {
        return onStack.contains(key);
    }

    /**
     * @throws CellEvaluationException (DEPTH_LIMIT_EXCEEDED) if the chain is already maxDepth cells deep
     */
    public void push(CellKey key) {
        if (callStack.size() >= maxDepth) {
            throw new CellEvaluationException(key.toString(), ErrorKind.DEPTH_LIMIT_EXCEEDED,
                    "Dependency chain deeper than " + maxDepth + " cells at " + key);
        }
        callStack.push(key);
        onStack.add(key);
    }

    public void pop(CellKey key) {
        CellKey top = callStack.peek();
        if (!key.equals(top)) {
            throw new IllegalStateException("Evaluation stack out of order: expected " + key + " but found " + top);
        }
        callStack.pop();
        onStack.remove(key);
    }

    /**
     * The keys currently being calculated, outermost first: "t1!A1 -> t2!A1".
     */
    public String describeStack() {
        List<String> path = new ArrayList<>();
        Iterator<CellKey> outermostFirst = callStack.descendingIterator();
        while (outermostFirst.hasNext()) {
            path.add(outermostFirst.next().toString());
        }
        return String.join(" -> ", path);
    }

    /**
     * True when a finished cell must still be recomputed in this pass.
     */
    public boolean isStale(CellKey key) {
        return forceRecompute && !refreshed.contains(key);
    }

    /**
     * Called by a cell when it starts an actual computation (as opposed to returning its cache).
     */
    public void recordComputed(CellKey key) {
        refreshed.add(key);
        computed.add(key);
    }

    /**
     * Cells actually computed during this pass, in the order they started.
     */
    public List<CellKey> getComputed() {
        return Collections.unmodifiableList(computed);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isStrictReferences() {
        return strictReferences;
    }

    public boolean isForceRecompute() {
        return forceRecompute;
    }
}
