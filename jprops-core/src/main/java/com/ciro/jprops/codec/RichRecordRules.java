package com.ciro.jprops.codec;

import com.ciro.jprops.spi.AssetLoader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catálogo de reglas por tipo exacto. Inmutable; se pasa al motor al construirlo.
 */
public final class RichRecordRules {

    private final Map<Class<?>, RichRecordRule> rules;

    private RichRecordRules(Map<Class<?>, RichRecordRule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static RichRecordRules empty() {
        return new RichRecordRules(new LinkedHashMap<>());
    }

    public static RichRecordRules defaults(AssetLoader assets) {
        ColorRule colors = new ColorRule();
        BrushRule brushes = new BrushRule(assets, colors);
        return empty()
                .with(colors)
                .with(new Vector2Rule())
                .with(new MarginRule())
                .with(brushes)
                .with(new ButtonStyleRule(brushes));
    }

    public RichRecordRules with(RichRecordRule rule) {
        Map<Class<?>, RichRecordRule> copy = new LinkedHashMap<>(rules);
        copy.put(rule.type(), rule);
        return new RichRecordRules(copy);
    }

    /** null si el tipo no tiene regla */
    public RichRecordRule find(Class<?> type) {
        return rules.get(type);
    }
}
