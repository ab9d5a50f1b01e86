package dumb.clarity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SolverTest extends AbstractTest {

    private static Solver.Result solve(int vars, List<int[]> clauses) {
        return new Solver(Budget.unlimited()).solve(vars, clauses);
    }

    /** {@code pigeons} pigeons in {@code holes} holes, one pigeon per hole: unsatisfiable when pigeons > holes. */
    static List<int[]> pigeonhole(int pigeons, int holes) {
        var out = new ArrayList<int[]>();
        for (var p = 0; p < pigeons; p++) {
            var c = new int[holes];
            for (var h = 0; h < holes; h++) c[h] = p * holes + h + 1;
            out.add(c);
        }
        for (var h = 0; h < holes; h++)
            for (var p = 0; p < pigeons; p++)
                for (var q = p + 1; q < pigeons; q++) out.add(new int[]{-(p * holes + h + 1), -(q * holes + h + 1)});
        return out;
    }

    @Test
    void satisfiable() {
        var clauses = List.of(new int[]{1, 2}, new int[]{-1, 3}, new int[]{-3, -2});
        var r = assertInstanceOf(Solver.Sat.class, solve(3, clauses));
        assertTrue(satisfies(r.model(), clauses));
    }

    @Test
    void unsatisfiableUnits() {
        var r = assertInstanceOf(Solver.Unsat.class, solve(1, List.of(new int[]{1}, new int[]{-1})));
        assertFalse(r.conflicts().isEmpty());
    }

    @Test
    void emptyClause() {
        assertInstanceOf(Solver.Unsat.class, solve(1, List.of(new int[]{1}, new int[0])));
    }

    @Test
    void noClauses() {
        assertInstanceOf(Solver.Sat.class, solve(0, List.of()));
    }

    @Test
    void pigeonholeIsUnsatisfiable() {
        assertInstanceOf(Solver.Unsat.class, solve(12, pigeonhole(4, 3)));
        assertInstanceOf(Solver.Sat.class, solve(9, pigeonhole(3, 3)));
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 5, 8, 13, 21, 34, 55, 89})
    void soundAgainstExhaustiveSearch(long seed) {
        var vars = 6;
        var clauses = randomClauses(seed, vars, 24);
        var r = solve(vars, clauses);
        if (r instanceof Solver.Sat s) {
            assertTrue(satisfies(s.model(), clauses), "model must satisfy every clause");
        } else {
            assertInstanceOf(Solver.Unsat.class, r);
            for (var bits = 0; bits < 1 << vars; bits++) {
                var model = new boolean[vars + 1];
                for (var v = 1; v <= vars; v++) model[v] = (bits >> (v - 1) & 1) == 1;
                assertFalse(satisfies(model, clauses), "reported unsatisfiable but a model exists");
            }
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {7, 11, 42})
    void deterministic(long seed) {
        var clauses = randomClauses(seed, 8, 30);
        var a = solve(8, clauses);
        var b = solve(8, clauses);
        assertEquals(a.getClass(), b.getClass());
        if (a instanceof Solver.Sat s) assertArrayEquals(s.model(), ((Solver.Sat) b).model());
        else assertEquals(a, b);
    }

    @Test
    void stepLimitYieldsUnknown() {
        var r = new Solver(new Budget(10, 0, new Budget.Cancellation())).solve(42, pigeonhole(7, 6));
        var u = assertInstanceOf(Solver.Unknown.class, r);
        assertFalse(u.cancelled());
    }

    @Test
    void cancellationYieldsUnknown() {
        var cancellation = new Budget.Cancellation();
        cancellation.cancel();
        var r = new Solver(new Budget(0, 0, cancellation)).solve(42, pigeonhole(7, 6));
        assertTrue(assertInstanceOf(Solver.Unknown.class, r).cancelled());
    }

    @Test
    void traceSeesTheSearch() {
        var events = new ArrayList<String>();
        var trace = new Solver.Trace() {
            @Override
            public void decide(int lit, int level) {
                events.add("decide " + lit);
            }

            @Override
            public void conflict(int clause, int level) {
                events.add("conflict " + clause);
            }
        };
        new Solver(Budget.unlimited(), false, trace).solve(2, List.of(new int[]{1, 2}, new int[]{-1, 2}, new int[]{1, -2}, new int[]{-1, -2}));
        assertEquals("decide 1", events.get(0));
        assertTrue(events.contains("decide -1"));
        assertTrue(events.stream().filter(e -> e.startsWith("conflict")).count() >= 2);
    }
}
