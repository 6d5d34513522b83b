package net.littleredcomputer.dpll;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import gnu.trove.TCollections;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * A set of clauses together with the live state of a DPLL search over them: the current
 * assignment, which clauses are satisfied, and a trail from which each top-level assignment
 * (with all the unit propagation it caused) can be undone in one step.
 * <p>
 * Instances are built by {@link FormulaBuilder} and belong to a single solver.
 */
public class Formula {
    private final int nVariables;
    private final ImmutableList<Clause> clauses;
    // OCC[id] lists the clauses containing variable id. Each entry is 2*c + s, where c is the
    // clause index and s is 1 when the variable appears negated in that clause.
    private final TIntArrayList[] OCC;
    private final boolean[] satisfied;
    private final Assignment assignment;
    // The trail holds the codes of assigned literals in assignment order; GROUP holds the
    // trail size at the start of each top-level assignment.
    private final TIntArrayList trail = new TIntArrayList();
    private final TIntStack GROUP = new TIntArrayStack();
    // Groups below this depth were pushed by propagateUnits and are never undone.
    private int rootGroups = 0;
    private final Deque<Literal> forced = new ArrayDeque<>();
    private int remaining;
    private boolean contradiction = false;
    private int cursor = 0;
    private long nForced = 0;

    Formula(int nVariables, List<Clause> clauses) {
        this.nVariables = nVariables;
        this.clauses = ImmutableList.copyOf(clauses);
        this.assignment = new Assignment(nVariables);
        this.satisfied = new boolean[clauses.size()];
        this.remaining = clauses.size();
        OCC = new TIntArrayList[nVariables];
        for (int i = 0; i < nVariables; ++i) OCC[i] = new TIntArrayList();
        for (int c = 0; c < clauses.size(); ++c) {
            Clause clause = clauses.get(c);
            if (clause.size() == 0) contradiction = true;
            for (Literal l : clause.literals()) OCC[l.id()].add(2 * c + (l.negated() ? 1 : 0));
        }
    }

    public int nVariables() { return nVariables; }
    public int nClauses() { return clauses.size(); }
    public List<Clause> clauses() { return clauses; }
    public Assignment assignment() { return assignment; }

    /** @return the number of clauses not yet satisfied */
    public int remaining() { return remaining; }
    public boolean contradiction() { return contradiction; }
    public boolean solved() { return remaining == 0; }
    int cursor() { return cursor; }
    boolean isSatisfied(int clauseIndex) { return satisfied[clauseIndex]; }
    int undoDepth() { return GROUP.size(); }
    long nForced() { return nForced; }

    /** @return the packed (clause index, polarity) entries for variable id */
    TIntList occurrences(int id) { return TCollections.unmodifiableList(OCC[id]); }
    static int occurrenceClause(int entry) { return entry >> 1; }
    static boolean occurrenceNegated(int entry) { return (entry & 1) != 0; }

    /**
     * Make the decision literal l true and propagate the consequences. Everything assigned
     * here forms one group on the trail, to be reversed by {@link #unAssign(Literal)}.
     * The variable of l must be unassigned.
     */
    public void assign(Literal l) {
        cursor = l.id() + 1;
        propagate(l);
    }

    /**
     * Undo the most recent top-level assignment, whose decision literal was l, along with
     * everything it forced. Root-level assignments made by {@link #propagateUnits()} cannot
     * be undone.
     */
    public void unAssign(Literal l) {
        Preconditions.checkState(GROUP.size() > rootGroups, "nothing to undo");
        final int base = GROUP.peek();
        Preconditions.checkState(base < trail.size() && trail.get(base) == l.code(),
                "most recent decision was not %s", l);
        GROUP.pop();
        for (int t = trail.size() - 1; t >= base; --t) {
            Literal u = Literal.fromCode(trail.get(t));
            assignment.unassign(u);
            TIntArrayList occ = OCC[u.id()];
            for (int i = 0; i < occ.size(); ++i) {
                int e = occ.get(i);
                int c = occurrenceClause(e);
                if (occurrenceNegated(e) == u.negated() && satisfied[c] && !clauses.get(c).isSatisfiedBy(assignment)) {
                    satisfied[c] = false;
                    ++remaining;
                }
            }
        }
        trail.remove(base, trail.size() - base);
        contradiction = false;
        cursor = l.id();
    }

    /**
     * Force the literals of the clauses that are unit before any decision has been made.
     * These root-level assignments are never undone and leave the cursor alone.
     *
     * @return false if the formula was found contradictory
     */
    boolean propagateUnits() {
        for (int c = 0; c < clauses.size() && !contradiction; ++c) {
            if (satisfied[c]) continue;
            Clause clause = clauses.get(c);
            int live = clause.liveCount(assignment);
            if (live == 0) contradiction = true;
            else if (live == 1) propagate(clause.firstLive(assignment));
        }
        rootGroups = GROUP.size();
        return !contradiction;
    }

    /** @return the positive literal of the lowest-numbered unassigned variable at or above the cursor */
    Literal nextUnassigned() {
        for (int id = cursor; id < nVariables; ++id) {
            if (!assignment.isAssigned(id)) return Literal.positive(id);
        }
        throw new IllegalStateException("no unassigned variable at or above " + cursor + " in an undecided formula");
    }

    /**
     * @return true if every clause of this formula is satisfied by a
     */
    public boolean evaluate(Assignment a) {
        for (Clause c : clauses) if (!c.isSatisfiedBy(a)) return false;
        return true;
    }

    // Assign l and every literal it forces, as one group. Propagation stops at the first
    // violated clause; the caller will backtrack anyway.
    private void propagate(Literal l) {
        GROUP.push(trail.size());
        forced.clear();
        forced.add(l);
        boolean decision = true;
        WORK:
        while (!forced.isEmpty()) {
            Literal u = forced.poll();
            if (assignment.isSatisfied(u)) continue;
            if (assignment.isFalsified(u)) {
                // Two unit clauses demanded opposite values.
                contradiction = true;
                break;
            }
            assignment.assign(u);
            trail.add(u.code());
            if (!decision) ++nForced;
            decision = false;
            TIntArrayList occ = OCC[u.id()];
            for (int i = 0; i < occ.size(); ++i) {
                int e = occ.get(i);
                int c = occurrenceClause(e);
                if (satisfied[c]) continue;
                if (occurrenceNegated(e) == u.negated()) {
                    satisfied[c] = true;
                    --remaining;
                } else {
                    Clause clause = clauses.get(c);
                    int live = clause.liveCount(assignment);
                    if (live == 0) {
                        contradiction = true;
                        break WORK;
                    }
                    if (live == 1) forced.add(clause.firstLive(assignment));
                }
            }
        }
        forced.clear();
    }
}
