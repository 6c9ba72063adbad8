package WFST;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import it.unimi.dsi.fastutil.objects.Object2ObjectArrayMap;

/**
 * Flag diacritics: symbols of the form {@code @OP.FEATURE@} or {@code @OP.FEATURE.VALUE@} that read no input
 * and instead test or update a feature register carried along each path.
 * <ul>
 *     <li>P sets FEATURE to VALUE, N sets it to anything but VALUE, C clears it.</li>
 *     <li>R requires FEATURE to be set (to a value compatible with VALUE, if given).</li>
 *     <li>D fails where R would succeed.</li>
 *     <li>U sets FEATURE to VALUE if it is unset or compatible, and fails otherwise.</li>
 * </ul>
 */
public final class FlagDiacritics {
    private static final Pattern FLAG = Pattern.compile("@([PNRDCU])\\.([^.@]+)(?:\\.([^@]+))?@");

    private FlagDiacritics() {}

    public enum Op { P, N, R, D, C, U }

    /**
     * @return the flag spelled by symbol, or null if symbol is an ordinary symbol
     */
    public static Flag parse(String symbol) {
        if (symbol == null) {
            return null;
        }
        Matcher m = FLAG.matcher(symbol);
        if (!m.matches()) {
            return null;
        }
        Op op = Op.valueOf(m.group(1));
        String value = m.group(3);
        boolean needsValue = op == Op.P || op == Op.N || op == Op.U;
        if ((needsValue && value == null) || (op == Op.C && value != null)) {
            return null;
        }
        return new Flag(op, m.group(2), value);
    }

    public static boolean isFlag(String symbol) {
        return parse(symbol) != null;
    }

    /**
     * Value of one feature; a negated setting stands for every value but this one.
     */
    record Setting(String value, boolean negated) {
        boolean allows(String v) {
            return negated != value.equals(v);
        }
    }

    public record Flag(Op op, String feature, String value) {

        /**
         * @return the register after this flag, or null if the flag blocks the path
         */
        public Settings apply(Settings settings) {
            final Setting current = settings.get(feature);
            return switch (op) {
                case P -> settings.with(feature, new Setting(value, false));
                case N -> settings.with(feature, new Setting(value, true));
                case C -> settings.without(feature);
                case R -> holds(current) ? settings : null;
                case D -> holds(current) ? null : settings;
                case U -> current == null || current.allows(value)
                    ? settings.with(feature, new Setting(value, false)) : null;
            };
        }

        private boolean holds(Setting current) {
            return current != null && (value == null || current.allows(value));
        }

        @Override
        public String toString() {
            return "@" + op + "." + feature + (value == null ? "" : "." + value) + "@";
        }
    }

    /**
     * Immutable feature register. Paths rarely carry more than a few features, so updates copy.
     */
    public static final class Settings {
        public static final Settings EMPTY = new Settings(new Object2ObjectArrayMap<>());

        private final Object2ObjectArrayMap<String, Setting> features;

        private Settings(Object2ObjectArrayMap<String, Setting> features) {
            this.features = features;
        }

        Setting get(String feature) {
            return features.get(feature);
        }

        Settings with(String feature, Setting setting) {
            if (setting.equals(features.get(feature))) {
                return this;
            }
            Object2ObjectArrayMap<String, Setting> copy = new Object2ObjectArrayMap<>(features);
            copy.put(feature, setting);
            return new Settings(copy);
        }

        Settings without(String feature) {
            if (!features.containsKey(feature)) {
                return this;
            }
            Object2ObjectArrayMap<String, Setting> copy = new Object2ObjectArrayMap<>(features);
            copy.remove(feature);
            return new Settings(copy);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Settings && features.equals(((Settings) o).features);
        }

        @Override
        public int hashCode() {
            return features.hashCode();
        }

        @Override
        public String toString() {
            return features.toString();
        }
    }
}
