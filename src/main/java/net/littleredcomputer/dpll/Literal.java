package net.littleredcomputer.dpll;

/**
 * A propositional variable, identified by a zero-based id, which may be negated.
 * Literals are encoded as in 7.2.2.2 (57), shifted to zero-based ids: the code of
 * x_id is 2*id and the code of ~x_id is 2*id+1, so complementary literals differ
 * only in the low bit.
 */
public final class Literal {
    private final int id;
    private final boolean negated;

    Literal(int id, boolean negated) {
        if (id < 0) throw new IllegalArgumentException("variable id must be non-negative");
        this.id = id;
        this.negated = negated;
    }

    /**
     * @param variable a nonzero DIMACS variable reference, e.g. 3 or -42
     * @return the literal with id |variable|-1, negated iff variable is negative
     */
    public static Literal fromDimacs(int variable) {
        if (variable == 0) throw new IllegalArgumentException("0 is not a variable");
        return new Literal(Math.abs(variable) - 1, variable < 0);
    }

    static Literal positive(int id) { return new Literal(id, false); }
    static Literal negative(int id) { return new Literal(id, true); }
    static Literal fromCode(int code) { return new Literal(code >> 1, (code & 1) != 0); }

    public int id() { return id; }
    public boolean negated() { return negated; }
    int code() { return 2 * id + (negated ? 1 : 0); }

    public Literal not() { return new Literal(id, !negated); }

    public boolean isComplementOf(Literal l) { return id == l.id && negated != l.negated; }

    /** @return the signed one-based form used in DIMACS files */
    public int toDimacs() { return negated ? -(id + 1) : id + 1; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal l = (Literal) o;
        return id == l.id && negated == l.negated;
    }

    @Override
    public int hashCode() { return code(); }

    @Override
    public String toString() { return (negated ? "~" : "") + (id + 1); }
}
