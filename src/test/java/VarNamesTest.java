import org.junit.jupiter.api.Test;

import com.numeval.expr.NumEval;
import com.numeval.expr.parser.BinaryOp;
import com.numeval.expr.parser.EvalException;
import com.numeval.expr.parser.EvalNamespace;
import com.numeval.expr.parser.Evaler;
import com.numeval.expr.parser.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class VarNamesTest {

    @Test
    void constantsOnly_haveNoNames() {
        NumEval ne = new NumEval();
        assertEquals(Set.of(), ne.parse("12.34 + 43.21 + 11.11").varNames());
        assertEquals(66.66, ne.eval("12.34 + 43.21 + 11.11"), 1e-9);
    }

    @Test
    void names_inFirstReferenceOrder() {
        NumEval ne = new NumEval();
        Set<String> names = ne.varNames("x + y * x - z");
        assertEquals(List.of("x", "y", "z"), new ArrayList<>(names));
    }

    @Test
    void everyOperand_isVisited_evenThoughNoValueIsSupplied() {
        NumEval ne = new NumEval();
        // x resolves to a placeholder; y, z and w must still be asked for
        Set<String> names = ne.varNames("x || y && (z ^ w)");
        assertEquals(Set.of("x", "y", "z", "w"), names);
    }

    @Test
    void nestedAndCallArguments_areCollected_unknownFunctionsToo() {
        NumEval ne = new NumEval();
        Expression expr = ne.parse("a + (b * f(c, 2))");

        assertEquals(List.of("a", "b", "c", "f"), new ArrayList<>(expr.varNames()));
    }

    @Test
    void builtins_areNotCollected_whenGiven() {
        NumEval ne = new NumEval();
        assertEquals(List.of("x", "y"), new ArrayList<>(ne.varNames("sqrt(x) + max(y, 2)")));

        // without the builtin table every call name is reported
        assertEquals(Set.of("sqrt", "max", "x", "y"), ne.parse("sqrt(x) + max(y, 2)").varNames());
    }

    @Test
    void structuralErrors_stillPropagate() {
        Expression bad = new Expression(List.of(Expression.constant(1), Expression.op(BinaryOp.PLUS)));

        EvalException e = assertThrows(EvalException.class, bad::varNames);
        assertEquals(EvalException.Kind.STRUCTURAL, e.kind());
    }

    @Test
    void customEvaler_getsDerivedCollector() {
        Evaler withDefault = ns -> {
            Double v = ns.get("x");
            return (v != null) ? v : 1.23;
        };

        assertEquals(Set.of("x"), withDefault.varNames());
        assertEquals(1.23, withDefault.eval(new EvalNamespace((n, args) -> null)));
        assertEquals(5.0, withDefault.eval(new EvalNamespace((n, args) -> "x".equals(n) ? 5.0 : null)));
    }

    @Test
    void collectingNamespace_answersNaN() {
        List<String> asked = new ArrayList<>();
        EvalNamespace ns = EvalNamespace.collecting((name, args) -> {
            asked.add(name);
            return null;
        }, null);

        assertTrue(ns.isCollecting());
        assertTrue(Double.isNaN(ns.variable("q")));
        assertTrue(Double.isNaN(ns.call("g", List.of(1.0))));
        assertEquals(List.of("q", "g"), asked);
    }

    @Test
    void builtinArityErrors_doNotStopCollection() {
        NumEval ne = new NumEval();
        assertEquals(List.of("x"), new ArrayList<>(ne.varNames("max() + x")));
        assertEquals(List.of("a", "y"), new ArrayList<>(ne.varNames("sqrt(a, 2) * y")));

        // evaluation still reports the arity error
        assertThrows(EvalException.class, () -> ne.eval("max() + 1"));
    }
}
