package com.patchir.registry;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Locale;

/**
 * Recomputes inlet or outlet count from the argument list for a variable-arity type.
 * Serialized as {@code {"match": {"key": "route"}, "rule": "outlets = 1 + argc"}}.
 */
public class OverrideRule {

    /** The closed set of supported rule formulas. */
    public enum Formula {
        OUTLETS_ONE_PLUS_ARGC("outlets = 1 + argc"),
        OUTLETS_ARGC("outlets = argc"),
        OUTLETS_ARG0_PLUS_ONE("outlets = arg0 + 1"),
        INLETS_ARGC("inlets = argc"),
        INLETS_ARG0("inlets = arg0"),
        OUTLETS_MAX_ARGC_TWO("outlets = max(argc, 2)"),
        INLETS_MAX_ARGC_TWO("inlets = max(argc, 2)");

        private final String text;
        Formula(String text) { this.text = text; }
        public String text() { return text; }

        /** Parses a rule string, ignoring whitespace differences. Returns null if unsupported. */
        public static Formula parse(String rule) {
            if (rule == null) return null;
            String normalized = rule.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
            for (Formula f : values()) {
                if (f.text.replaceAll("\\s+", "").equals(normalized)) return f;
            }
            return null;
        }
    }

    public static class Match {
        @SerializedName("key") public String key;
    }

    @SerializedName("match") public Match match;
    @SerializedName("rule")  public String rule;

    public static OverrideRule of(String key, Formula formula) {
        OverrideRule r = new OverrideRule();
        r.match = new Match();
        r.match.key = key;
        r.rule = formula.text();
        return r;
    }

    public String matchKey() {
        return match != null ? match.key : null;
    }

    public Formula formula() {
        return Formula.parse(rule);
    }

    /**
     * Applies the rule on top of the default arity.
     *
     * @param defaults arity from the static spec (or (1, 1) for an unknown type)
     * @param args     normalized argument list
     */
    public IoCount apply(IoCount defaults, List<String> args) {
        Formula formula = formula();
        if (formula == null) return defaults;

        int argc = args.size();
        int arg0 = firstArgAsCount(args);
        int inlets = defaults.inlets();
        int outlets = defaults.outlets();

        switch (formula) {
            case OUTLETS_ONE_PLUS_ARGC -> outlets = 1 + argc;
            case OUTLETS_ARGC          -> outlets = Math.max(argc, 1);
            case OUTLETS_ARG0_PLUS_ONE -> outlets = arg0 + 1;
            case INLETS_ARGC           -> inlets = Math.max(argc, 1);
            case INLETS_ARG0           -> inlets = Math.max(arg0, 1);
            case OUTLETS_MAX_ARGC_TWO  -> outlets = Math.max(argc, 2);
            case INLETS_MAX_ARGC_TWO   -> inlets = Math.max(argc, 2);
        }
        return new IoCount(inlets, outlets);
    }

    /** First argument as a non-negative integer; 1 when absent or not all digits. */
    static int firstArgAsCount(List<String> args) {
        if (args.isEmpty()) return 1;
        String first = args.get(0);
        if (first.isEmpty() || !first.chars().allMatch(Character::isDigit)) return 1;
        try {
            return Integer.parseInt(first);
        } catch (NumberFormatException e) {
            // digits only, so this is an overflow
            return 1;
        }
    }
}
