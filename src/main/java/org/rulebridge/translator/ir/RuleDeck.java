package org.rulebridge.translator.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the intermediate representation: the declared layers and the rule nodes
 * of one deck. Instances are immutable; they are assembled once through a {@link Builder}.
 * <p>
 * The order of {@link #rules()} is the source encounter order and must be preserved
 * by every consumer. Layers carry no order of their own.
 */
public final class RuleDeck {

    private final String sourceName;
    private final Map<String, LayerDef> layers;
    private final List<CheckNode> rules;

    private RuleDeck(String sourceName, Map<String, LayerDef> layers, List<CheckNode> rules) {
        this.sourceName = sourceName;
        this.layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
        this.rules = List.copyOf(rules);
    }

    /**
     * @param sourceName The name of the deck being parsed.
     * @return A new, empty builder.
     */
    public static Builder builder(String sourceName) {
        return new Builder(sourceName);
    }

    public String sourceName() {
        return sourceName;
    }

    /**
     * @return The layers keyed by name.
     */
    public Map<String, LayerDef> layers() {
        return layers;
    }

    /**
     * @return The rule nodes in source order.
     */
    public List<CheckNode> rules() {
        return rules;
    }

    public boolean isEmpty() {
        return layers.isEmpty() && rules.isEmpty();
    }

    @Override
    public String toString() {
        return "RuleDeck{" +
                "sourceName='" + sourceName + '\'' +
                ", layers=" + layers.size() +
                ", rules=" + rules.size() +
                '}';
    }

    /**
     * Single-writer builder used by the parser. Rules may only be appended.
     */
    public static final class Builder {
        private final String sourceName;
        private final Map<String, LayerDef> layers = new LinkedHashMap<>();
        private final List<CheckNode> rules = new ArrayList<>();

        private Builder(String sourceName) {
            this.sourceName = sourceName;
        }

        /**
         * Adds a layer. A layer with the same name declared earlier is replaced.
         * @param layer The layer to add.
         * @return The replaced layer, or {@code null} if the name was new.
         */
        public LayerDef defineLayer(LayerDef layer) {
            return layers.put(layer.name(), layer);
        }

        /**
         * Appends a rule node.
         * @param rule The node to append.
         * @return This builder.
         */
        public Builder addRule(CheckNode rule) {
            rules.add(rule);
            return this;
        }

        /**
         * @return An immutable snapshot of everything added so far.
         */
        public RuleDeck build() {
            return new RuleDeck(sourceName, layers, rules);
        }
    }
}
