package com.ciro.jprops.codec;

import com.ciro.jprops.PropertyException;
import com.ciro.jprops.reflect.EnumNames;
import com.ciro.jprops.spi.AssetLoader;
import com.ciro.jprops.types.BrushDrawType;
import com.ciro.jprops.types.BrushTiling;
import com.ciro.jprops.types.LinearColor;
import com.ciro.jprops.types.SlateBrush;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static com.ciro.jprops.PropertyException.typeMismatch;

/**
 * SlateBrush desde {@code {ResourceObject, DrawAs, Tiling, TintColor}}, siempre en ese orden.
 * Un sub-campo que falla se registra y se salta; basta con que uno se aplique.
 */
public class BrushRule implements RichRecordRule {

    private static final Logger log = LoggerFactory.getLogger(BrushRule.class);

    private final AssetLoader assets;
    private final ColorRule colors;

    public BrushRule(AssetLoader assets, ColorRule colors) {
        this.assets = assets;
        this.colors = colors;
    }

    @Override
    public Class<?> type() {
        return SlateBrush.class;
    }

    @Override
    public Object fromNode(JsonNode node, Object current) {
        if (!node.isObject()) {
            throw typeMismatch("SlateBrush requires an object with ResourceObject, DrawAs, Tiling or TintColor, got %s",
                    node.getNodeType());
        }
        SlateBrush brush = current instanceof SlateBrush b ? b.copy() : new SlateBrush();
        int applied = 0;

        // 1. ResourceObject
        JsonNode res = JsonFields.get(node, "ResourceObject");
        if (res != null && applyResource(brush, res)) applied++;

        // 2. DrawAs
        JsonNode drawAs = JsonFields.get(node, "DrawAs");
        if (drawAs != null) {
            Optional<Enum<?>> v = EnumNames.lenient(BrushDrawType.class, drawAs.asText());
            if (v.isPresent()) {
                brush.setDrawAs((BrushDrawType) v.get());
                applied++;
            } else {
                log.warn("Skipping brush DrawAs '{}': expected one of {}", drawAs.asText(),
                        EnumNames.names(BrushDrawType.class));
            }
        }

        // 3. Tiling
        JsonNode tiling = JsonFields.get(node, "Tiling");
        if (tiling != null) {
            Optional<Enum<?>> v = EnumNames.lenient(BrushTiling.class, tiling.asText());
            if (v.isPresent()) {
                brush.setTiling((BrushTiling) v.get());
                applied++;
            } else {
                log.warn("Skipping brush Tiling '{}': expected one of {}", tiling.asText(),
                        EnumNames.names(BrushTiling.class));
            }
        }

        // 4. TintColor
        JsonNode tint = JsonFields.get(node, "TintColor");
        if (tint != null) {
            try {
                brush.setTintColor((LinearColor) colors.fromNode(tint, brush.getTintColor()));
                applied++;
            } catch (PropertyException e) {
                log.warn("Skipping brush TintColor: {}", e.getMessage());
            }
        }

        if (applied == 0) {
            throw typeMismatch("No SlateBrush sub-field could be applied from %s; "
                    + "expected ResourceObject (asset path), DrawAs, Tiling or TintColor", node);
        }
        return brush;
    }

    private boolean applyResource(SlateBrush brush, JsonNode res) {
        String path = res.isTextual() ? res.asText()
                : res.isObject() && res.hasNonNull("path") ? res.get("path").asText()
                : null;
        if (path == null || path.isBlank()) {
            log.warn("Skipping brush ResourceObject {}: expected an asset path", res);
            return false;
        }
        try {
            Optional<Object> asset = assets.load(path);
            if (asset.isEmpty()) {
                log.warn("Skipping brush ResourceObject: asset '{}' not found", path);
                return false;
            }
            brush.setResourceObject(asset.get());
            return true;
        } catch (RuntimeException e) {
            log.warn("Skipping brush ResourceObject: failed to load '{}'", path, e);
            return false;
        }
    }
}
