package dumb.clarity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MinimalCoreTest extends AbstractTest {

    private static Solver.Result solve(Cnf.Formula f, List<String> ids) {
        return new Solver(Budget.unlimited()).solve(f.vars().size(), f.lits(f.within(new HashSet<>(ids))));
    }

    private static MinimalCore.Found extract(Batch batch) {
        var f = Encoder.encode(batch, Config.DEFAULT).formula();
        var ids = batch.propositions.stream().map(Proposition::id).toList();
        var unsat = assertInstanceOf(Solver.Unsat.class, solve(f, ids));
        return assertInstanceOf(MinimalCore.Found.class, new MinimalCore(f, Budget.unlimited()).extract(ids, unsat));
    }

    private static void assertMinimal(Batch batch, List<String> core) {
        var f = Encoder.encode(batch, Config.DEFAULT).formula();
        assertInstanceOf(Solver.Unsat.class, solve(f, core), "core must be unsatisfiable");
        for (var id : core) {
            var rest = new ArrayList<>(core);
            rest.remove(id);
            assertInstanceOf(Solver.Sat.class, solve(f, rest), () -> "dropping " + id + " must restore satisfiability");
        }
    }

    @Test
    void cowMilkNeedsAllThree() {
        var core = extract(cowMilk());
        assertEquals(List.of("P1", "P2", "P3"), core.propositionIds());
        assertMinimal(cowMilk(), core.propositionIds());
    }

    @Test
    void bystandersAreDropped() {
        var b = batch(List.of(claim("A", "x"), claim("B", "y ∨ z"), claim("C", "¬x"), claim("D", "w")));
        var core = extract(b);
        assertEquals(List.of("A", "C"), core.propositionIds());
        assertMinimal(b, core.propositionIds());
    }

    @Test
    void coreClausesBelongToTheCore() {
        var b = batch(List.of(claim("A", "x"), claim("B", "q"), claim("C", "¬x")));
        var f = Encoder.encode(b, Config.DEFAULT).formula();
        var core = extract(b);
        for (var i : core.clauses())
            assertTrue(core.propositionIds().containsAll(f.clauses().get(i).propositionIds()));
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 4, 5, 6, 7, 8})
    void overlappingConflictsStillMinimal(int n) {
        // x1 ∧ (x1 → x2) ∧ ... ∧ (x{n-1} → xn) ∧ ¬xn, plus a shortcut x1 → xn and noise
        var props = new ArrayList<Proposition>();
        props.add(claim("S", "x1"));
        for (var i = 1; i < n; i++) props.add(claim("L" + i, "x" + i + " → x" + (i + 1)));
        props.add(claim("N", "noise"));
        props.add(claim("K", "x1 → x" + n));
        props.add(claim("E", "¬x" + n));
        var b = batch(props);
        var core = extract(b);
        assertMinimal(b, core.propositionIds());
        assertTrue(core.propositionIds().containsAll(List.of("S", "E")));
        assertFalse(core.propositionIds().contains("N"));
    }

    @Test
    void exhaustedBudgetIsUnknown() {
        var b = cowMilk();
        var f = Encoder.encode(b, Config.DEFAULT).formula();
        var ids = List.of("P1", "P2", "P3");
        var unsat = (Solver.Unsat) solve(f, ids);
        var cancellation = new Budget.Cancellation();
        cancellation.cancel();
        var r = new MinimalCore(f, new Budget(0, 0, cancellation)).extract(ids, unsat);
        assertTrue(assertInstanceOf(MinimalCore.Unknown.class, r).cancelled());
    }
}
