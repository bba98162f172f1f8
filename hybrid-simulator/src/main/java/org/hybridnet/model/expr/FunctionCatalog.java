package org.hybridnet.model.expr;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Functions callable from rate expressions. Arguments are positional;
 * trailing optional arguments take the listed defaults.
 */
public final class FunctionCatalog {

    @FunctionalInterface
    interface Body {
        double apply(double[] a);
    }

    static final class Function {

        private final String name;
        private final int required;
        private final double[] defaults;
        private final boolean variadic;
        private final Body body;

        Function(String name, int required, double[] defaults, boolean variadic, Body body) {
            this.name = name;
            this.required = required;
            this.defaults = defaults;
            this.variadic = variadic;
            this.body = body;
        }

        double call(double[] args) {
            int max = required + defaults.length;
            if (args.length < required || (!variadic && args.length > max)) {
                throw new ExpressionException("Function " + name + " expects "
                        + (variadic ? "at least " + required : required == max ? required : required + ".." + max)
                        + " arguments, got " + args.length);
            }
            if (variadic || args.length == max) {
                return body.apply(args);
            }
            double[] full = new double[max];
            System.arraycopy(args, 0, full, 0, args.length);
            for (int i = args.length; i < max; i++) {
                full[i] = defaults[i - required];
            }
            return body.apply(full);
        }
    }

    private static final Map<String, Function> FUNCTIONS = new TreeMap<>();

    static {
        // math
        variadic("min", a -> {
            double m = a[0];
            for (double v : a) {
                m = Math.min(m, v);
            }
            return m;
        });
        variadic("max", a -> {
            double m = a[0];
            for (double v : a) {
                m = Math.max(m, v);
            }
            return m;
        });
        register("abs", 1, a -> Math.abs(a[0]));
        register("sqrt", 1, a -> Math.sqrt(a[0]));
        register("exp", 1, a -> Math.exp(a[0]));
        register("log", 1, a -> Math.log(a[0]));
        register("log10", 1, a -> Math.log10(a[0]));
        register("pow", 2, a -> Math.pow(a[0], a[1]));
        register("floor", 1, a -> Math.floor(a[0]));
        register("ceil", 1, a -> Math.ceil(a[0]));
        register("sin", 1, a -> Math.sin(a[0]));
        register("cos", 1, a -> Math.cos(a[0]));

        // activation
        register("sigmoid", 1, new double[] {0.0, 1.0, 1.0}, a -> sigmoid(a[0], a[1], a[2], a[3]));
        register("tanh", 1, new double[] {0.0, 1.0, 1.0}, a -> a[3] * Math.tanh(a[2] * (a[0] - a[1])));
        register("relu", 1, new double[] {0.0}, a -> Math.max(0.0, a[0] - a[1]));
        register("softplus", 1, new double[] {1.0}, a -> Math.log(1.0 + Math.exp(a[1] * a[0])) / a[1]);

        // growth
        register("exponential_growth", 2, a -> a[0] * Math.exp(a[1]));
        register("exponential_decay", 2, a -> a[0] * Math.exp(-Math.log(2) / a[1]));
        register("logistic_growth", 3, a -> a[2] * a[0] * (1.0 - a[0] / a[1]));
        register("gompertz_growth", 3, a -> a[0] <= 0 || a[0] >= a[1] ? 0.0 : a[2] * a[0] * Math.log(a[1] / a[0]));

        // kinetics
        register("michaelis_menten", 3, a -> a[1] * a[0] / (a[2] + a[0]));
        register("hill_equation", 3, new double[] {1.0}, a -> {
            double sn = Math.pow(a[0], a[3]);
            return a[1] * sn / (Math.pow(a[2], a[3]) + sn);
        });
        register("competitive_inhibition", 5, a -> a[2] * a[0] / (a[3] * (1.0 + a[1] / a[4]) + a[0]));
        register("mass_action", 1, new double[] {1.0, 1.0}, a -> a[2] * a[0] * a[1]);

        // shaping
        register("step", 2, new double[] {0.0, 1.0}, a -> a[0] >= a[1] ? a[3] : a[2]);
        register("ramp", 3, new double[] {0.0, 1.0}, a -> {
            if (a[0] < a[1]) {
                return a[3];
            }
            if (a[0] > a[2]) {
                return a[4];
            }
            return a[3] + (a[0] - a[1]) / (a[2] - a[1]) * (a[4] - a[3]);
        });
        register("pulse", 3, new double[] {1.0}, a -> a[1] <= a[0] && a[0] <= a[2] ? a[3] : 0.0);
        register("smooth_threshold", 2, new double[] {1.0}, a -> sigmoid(a[0], a[1], 5.0 / a[2], 1.0));
        register("bell_curve", 3, new double[] {1.0}, a -> a[3] * Math.exp(-Math.pow(a[0] - a[1], 2) / (2 * a[2] * a[2])));
    }

    private FunctionCatalog() {
    }

    private static void register(String name, int required, Body body) {
        register(name, required, new double[0], body);
    }

    private static void register(String name, int required, double[] defaults, Body body) {
        FUNCTIONS.put(name, new Function(name, required, defaults, false, body));
    }

    private static void variadic(String name, Body body) {
        FUNCTIONS.put(name, new Function(name, 1, new double[0], true, body));
    }

    static double sigmoid(double x, double center, double steepness, double amplitude) {
        return amplitude / (1.0 + Math.exp(-steepness * (x - center)));
    }

    public static boolean contains(String name) {
        return FUNCTIONS.containsKey(name);
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(FUNCTIONS.keySet());
    }

    public static double call(String name, double... args) {
        Function function = FUNCTIONS.get(name);
        if (function == null) {
            throw new ExpressionException("Unknown function " + name);
        }
        return function.call(args);
    }
}
