package com.ac.iisc.cardinal;

/**
 * One pg_hint_plan instruction. There are exactly three shapes: {@link ScanHint},
 * {@link JoinHint} and {@link IndexHint}.
 *
 * Tokens compare by their rendered text, which is also what the compiler
 * deduplicates join hints on.
 */
public abstract class HintToken {

    HintToken() {}

    /** pg_hint_plan text for this token, e.g. {@code HashJoin(a b)}. */
    public abstract String render();

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return render().equals(((HintToken) o).render());
    }

    @Override
    public final int hashCode() {
        return render().hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
