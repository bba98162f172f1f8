package org.hybridnet.model.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.hybridnet.model.ModelConfigurationException;
import org.hybridnet.model.RateContext;
import org.junit.jupiter.api.Test;

public class RateExpressionTest {

    private static RateContext context(double time, Map<String, Double> marking) {
        return new RateContext() {
            @Override
            public double getMarking(String placeId) {
                return marking.get(placeId);
            }

            @Override
            public boolean hasPlace(String placeId) {
                return marking.containsKey(placeId);
            }

            @Override
            public double getTime() {
                return time;
            }
        };
    }

    private static double eval(String text, Map<String, Double> marking) {
        return RateExpression.parse(text).evaluate(context(0, marking));
    }

    @Test
    public void testArithmetic() {
        Map<String, Double> none = new HashMap<>();

        assertEquals(7.0, eval("1 + 2 * 3", none), 1e-12, "Multiplication binds tighter than addition");
        assertEquals(9.0, eval("(1 + 2) * 3", none), 1e-12);
        assertEquals(-4.0, eval("-2^2", none), 1e-12, "Unary minus applies after the power");
        assertEquals(512.0, eval("2 ** 3 ** 2", none), 1e-12, "Power is right associative");
        assertEquals(1.0, eval("7 % 3", none), 1e-12);
        assertEquals(2500.0, eval("2.5e3", none), 1e-12);
        assertEquals(Math.PI, eval("pi", none), 1e-12);
    }

    @Test
    public void testPlacesAndTime() {
        Map<String, Double> marking = new HashMap<>();
        marking.put("P1", 4.0);
        marking.put("P2", 0.5);
        RateExpression expression = RateExpression.parse("0.1 * P1 * P2 + t");

        assertEquals(1.2, expression.evaluate(context(1.0, marking)), 1e-12);
        assertTrue(expression.getReferencedNames().contains("P1"));
        assertTrue(expression.getReferencedNames().contains("t"));
    }

    @Test
    public void testParameters() {
        Map<String, Double> marking = new HashMap<>();
        marking.put("S", 3.0);
        RateExpression expression = RateExpression.parse("michaelis_menten(S, vmax, km)", Map.of("vmax", 10.0, "km", 2.0));

        assertEquals(6.0, expression.evaluate(context(0, marking)), 1e-12);
    }

    @Test
    public void testLogic() {
        Map<String, Double> marking = new HashMap<>();
        marking.put("P1", 3.0);

        assertEquals(1.0, eval("P1 >= 3 && P1 < 4", marking), 0.0);
        assertEquals(0.0, eval("P1 > 3 or P1 == 0", marking), 0.0);
        assertEquals(1.0, eval("!(P1 != 3)", marking), 0.0);
    }

    @Test
    public void testParseErrors() {
        assertThrows(ModelConfigurationException.class, () -> RateExpression.parse(""));
        assertThrows(ModelConfigurationException.class, () -> RateExpression.parse("1 +"));
        assertThrows(ModelConfigurationException.class, () -> RateExpression.parse("(P1 * 2"));
        assertThrows(ModelConfigurationException.class, () -> RateExpression.parse("foo(1)"), "Unknown function");
        assertThrows(ModelConfigurationException.class, () -> RateExpression.parse("2 $ 3"));
    }

    @Test
    public void testEvaluationErrors() {
        Map<String, Double> marking = new HashMap<>();
        marking.put("P1", 0.0);

        assertThrows(ExpressionException.class, () -> eval("missing * 2", marking), "Unknown name");
        assertThrows(ExpressionException.class, () -> eval("1 / P1", marking), "Division by zero");
        assertThrows(ExpressionException.class, () -> eval("log(P1)", marking), "Non finite result");
        assertThrows(ExpressionException.class, () -> eval("michaelis_menten(P1, 1)", marking), "Wrong arity");
    }
}
