package com.ciro.jprops.resolve;

import com.ciro.jprops.PropertyException;
import com.ciro.jprops.path.IndexKind;
import com.ciro.jprops.path.PropertyPath;
import com.ciro.jprops.path.Segment;
import com.ciro.jprops.reflect.FieldCategory;
import com.ciro.jprops.reflect.FieldDescriptor;
import com.ciro.jprops.reflect.MapKeys;
import com.ciro.jprops.spi.AttachmentFamilyProvider;
import com.ciro.jprops.spi.EntityModel;
import com.ciro.jprops.spi.TypeReflection;
import com.ciro.jprops.spi.VirtualProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.ciro.jprops.PropertyException.invalidPath;
import static com.ciro.jprops.PropertyException.notFound;
import static com.ciro.jprops.PropertyException.outOfRange;
import static com.ciro.jprops.PropertyException.unsupported;

/**
 * Recorre los segmentos de una ruta desde la entidad (o su slot) hasta un
 * {@link ResolvedTarget}. No modifica nada: resolver dos veces la misma ruta sobre el
 * mismo estado da destinos equivalentes.
 */
public class FieldResolver {

    private static final Logger log = LoggerFactory.getLogger(FieldResolver.class);

    private final TypeReflection types;
    private final EntityModel entities;
    private final AttachmentFamilyProvider families;
    private final List<ResolutionStrategy> strategies;
    private final List<LookupFallback> fallbacks;
    private final boolean ignoreCase;

    public FieldResolver(TypeReflection types,
                         EntityModel entities,
                         AttachmentFamilyProvider families,
                         List<ResolutionStrategy> strategies,
                         List<LookupFallback> fallbacks,
                         boolean ignoreCase) {
        this.types = types;
        this.entities = entities;
        this.families = families;
        this.strategies = List.copyOf(strategies);
        this.fallbacks = List.copyOf(fallbacks);
        this.ignoreCase = ignoreCase;
    }

    /** Estrategias por defecto: ChildOrder y propiedades virtuales del slot, en ese orden */
    public static List<ResolutionStrategy> defaultStrategies(AttachmentFamilyProvider families) {
        return List.of(new SiblingOrderStrategy(), new VirtualPropertyStrategy(families));
    }

    private record Step(FieldDescriptor descriptor, Location location) {}

    public ResolvedTarget resolve(Object entity, PropertyPath path) {
        Objects.requireNonNull(entity, "entity");

        Object root = entity;
        if (path.attachmentRoot()) {
            root = entities.attachmentOf(entity);
            if (root == null) {
                throw notFound("'%s' has no slot: it is not inside a panel", entity);
            }
        }

        Object scope = root;
        Class<?> scopeType = root.getClass();

        for (int i = 0; i < path.size(); i++) {
            Segment seg = path.segment(i);
            ResolutionContext ctx = new ResolutionContext(entity, root, path, i);

            for (ResolutionStrategy s : strategies) {
                Optional<ResolvedTarget> hit = s.tryResolve(ctx, seg);
                if (hit.isPresent()) {
                    log.debug("'{}' resolved by {}", path, s.getClass().getSimpleName());
                    return hit.get();
                }
            }

            final Class<?> lookupType = scopeType;
            FieldDescriptor fd = lookup(lookupType, seg.name())
                    .orElseThrow(() -> missing(ctx, seg, lookupType));
            Step step = new Step(fd, new FieldLocation(scope, fd.field()));

            if (seg.hasIndex()) {
                step = index(step, seg);
            } else if (!ctx.isLast() && fd.category().isCollection()) {
                if (fd.category() == FieldCategory.SET) {
                    throw unsupported("Set '%s' cannot be traversed; use a collection operation on it", seg.name());
                }
                throw invalidPath("'%s' is a collection: the path must specify an index to go deeper (e.g. %s[0])",
                        seg.name(), seg.name());
            }

            if (ctx.isLast()) {
                return ResolvedTarget.field(entity, root, step.location(), step.descriptor(), path.text());
            }

            // siguiente ámbito
            Object value = step.location().get();
            FieldCategory cat = step.descriptor().category();
            switch (cat) {
                case RECORD -> {
                    if (value == null) throw notFound("Struct '%s' is null in '%s'", seg, path);
                    scope = value;
                    scopeType = step.descriptor().rawType();
                }
                case OBJECT -> {
                    if (value == null) {
                        throw notFound("'%s' is a null reference; cannot resolve '%s'", seg, path.segment(i + 1));
                    }
                    scope = value;
                    scopeType = value.getClass();
                }
                case SET -> throw unsupported("Set elements of '%s' cannot be traversed", seg);
                default -> throw invalidPath("Cannot traverse into non-composite field '%s' (%s)",
                        seg, step.descriptor().genericType().getTypeName());
            }
        }
        throw new IllegalStateException("Path without segments: " + path);
    }

    private Optional<FieldDescriptor> lookup(Class<?> type, String name) {
        Optional<FieldDescriptor> found = types.findField(type, name, ignoreCase);
        if (found.isPresent()) return found;

        for (LookupFallback f : fallbacks) {
            Optional<String> alt = f.alternateName(name);
            if (alt.isPresent()) {
                found = types.findField(type, alt.get(), ignoreCase);
                if (found.isPresent()) {
                    log.debug("'{}' found as '{}' on {}", name, alt.get(), type.getSimpleName());
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    private Step index(Step step, Segment seg) {
        FieldDescriptor fd = step.descriptor();
        Object value = step.location().get();

        switch (fd.category()) {
            case LIST -> {
                if (seg.indexKind() != IndexKind.NUMERIC) {
                    throw invalidPath("List '%s' requires a numeric index, got '%s'", seg.name(), seg.key());
                }
                List<Object> list = (List<Object>) value;
                int len = list == null ? 0 : list.size();
                if (seg.index() >= len) {
                    throw outOfRange("Array index out of bounds: %d (length %d) in '%s'", seg.index(), len, seg);
                }
                return new Step(fd.elementType(), new ListElementLocation(list, seg.index()));
            }
            case MAP -> {
                Map<Object, Object> map = (Map<Object, Object>) value;
                Object key = MapKeys.fromText(fd.keyType(), seg.indexText());
                if (map != null) {
                    for (Object k : map.keySet()) {
                        if (Objects.equals(k, key)) {
                            return new Step(fd.valueType(), new MapValueLocation(map, k));
                        }
                    }
                }
                throw outOfRange("Map key '%s' not found in '%s'", seg.indexText(), seg.name());
            }
            case SET -> throw unsupported("Set '%s' has no positions or keys and cannot be indexed", seg.name());
            default -> throw invalidPath("'%s' is not a container and cannot be indexed", seg.name());
        }
    }

    private PropertyException missing(ResolutionContext ctx, Segment seg, Class<?> scopeType) {
        String fieldNames = types.fields(scopeType).stream()
                .map(FieldDescriptor::name)
                .collect(Collectors.joining(", "));

        if (ctx.attachmentRoot() && ctx.isFirst()) {
            String virtuals = families.virtualProperties(ctx.root()).stream()
                    .map(VirtualProperty::name)
                    .collect(Collectors.joining(", "));
            return notFound("Property '%s' not found on slot family '%s'. Virtual properties: [%s]; fields: [%s]",
                    seg.name(), families.familyName(ctx.root()), virtuals, fieldNames);
        }
        return notFound("Property '%s' not found on %s. Available: [%s]",
                seg.name(), scopeType.getSimpleName(), fieldNames);
    }
}
