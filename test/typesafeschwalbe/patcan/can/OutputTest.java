package typesafeschwalbe.patcan.can;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import typesafeschwalbe.patcan.compiler.Symbol;

public class OutputTest {

    private static Symbol symbol(int id) {
        return new Symbol(Fixtures.HOME, id);
    }

    private static Output bound(int... ids) {
        Output output = new Output();
        for(int id: ids) {
            output.references.boundSymbols.add(OutputTest.symbol(id));
        }
        return output;
    }

    @Test
    @DisplayName("Merging outputs does not depend on the order")
    void unionIsCommutative() {
        Output a = OutputTest.bound(1, 2);
        a.references.valueLookups.add(OutputTest.symbol(7));
        Output b = OutputTest.bound(3);
        b.references.typeLookups.add(OutputTest.symbol(8));
        assertEquals(a.copy().union(b), b.copy().union(a));
    }

    @Test
    @DisplayName("Merging outputs does not depend on the grouping")
    void unionIsAssociative() {
        Output a = OutputTest.bound(1);
        Output b = OutputTest.bound(2);
        Output c = OutputTest.bound(3);
        c.references.referencedTypeDefs.add(OutputTest.symbol(9));
        assertEquals(
            a.copy().union(b).union(c),
            a.copy().union(b.copy().union(c))
        );
    }

    @Test
    @DisplayName("Merging adds into the receiver and keeps the argument")
    void unionMutatesReceiver() {
        Output a = OutputTest.bound(1);
        Output b = OutputTest.bound(2);
        assertSame(a, a.union(b));
        assertEquals(
            Set.of(OutputTest.symbol(1), OutputTest.symbol(2)),
            a.references.boundSymbols
        );
        assertEquals(Set.of(OutputTest.symbol(2)), b.references.boundSymbols);
    }

    @Test
    @DisplayName("Copies are independent of the original")
    void copyIsIndependent() {
        Output original = OutputTest.bound(1);
        Output copy = original.copy();
        assertNotSame(original, copy);
        copy.references.valueLookups.add(OutputTest.symbol(5));
        assertTrue(original.references.valueLookups.isEmpty());
    }

}
