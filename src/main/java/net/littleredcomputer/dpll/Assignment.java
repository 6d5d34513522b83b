package net.littleredcomputer.dpll;

import com.google.common.base.Joiner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The current values of the variables of a formula. Each slot is TRUE, FALSE or UNASSIGNED.
 * The class performs no consistency checks: assigning a variable that already has a
 * value simply overwrites it.
 */
public final class Assignment {
    private static final byte UNASSIGNED = -1;
    private static final byte FALSE = 0;
    private static final byte TRUE = 1;
    private static final Joiner spaceJoiner = Joiner.on(' ');

    private final byte[] x;

    Assignment(int nVariables) {
        x = new byte[nVariables];
        Arrays.fill(x, UNASSIGNED);
    }

    private Assignment(byte[] x) {
        this.x = x;
    }

    public int nVariables() { return x.length; }

    /** Make l true. */
    void assign(Literal l) { x[l.id()] = l.negated() ? FALSE : TRUE; }

    void unassign(Literal l) { x[l.id()] = UNASSIGNED; }

    public boolean isAssigned(int id) { return x[id] != UNASSIGNED; }

    /** @return true if the variable of l has the value l asserts */
    public boolean isSatisfied(Literal l) { return x[l.id()] == (l.negated() ? FALSE : TRUE); }

    public boolean isFalsified(Literal l) { return x[l.id()] == (l.negated() ? TRUE : FALSE); }

    /**
     * @param id zero-based variable id
     * @return the value of the variable; an unassigned variable reads as true
     */
    public boolean value(int id) { return x[id] != FALSE; }

    public boolean[] toBooleans() {
        boolean[] bs = new boolean[x.length];
        for (int i = 0; i < x.length; ++i) bs[i] = value(i);
        return bs;
    }

    /** @return a copy in which every unassigned variable is set true */
    Assignment completed() {
        byte[] y = x.clone();
        for (int i = 0; i < y.length; ++i) if (y[i] == UNASSIGNED) y[i] = TRUE;
        return new Assignment(y);
    }

    /** @return the assigned variables as signed DIMACS values, terminated by 0 */
    @Override
    public String toString() {
        List<Integer> vs = new ArrayList<>(x.length + 1);
        for (int i = 0; i < x.length; ++i) {
            if (x[i] != UNASSIGNED) vs.add(x[i] == TRUE ? i + 1 : -i - 1);
        }
        vs.add(0);
        return spaceJoiner.join(vs);
    }
}
