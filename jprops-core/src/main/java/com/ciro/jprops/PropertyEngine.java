package com.ciro.jprops;

import com.ciro.jprops.codec.ExternalValue;
import com.ciro.jprops.codec.RichRecordRules;
import com.ciro.jprops.codec.ValueCodec;
import com.ciro.jprops.codec.ValueConverter;
import com.ciro.jprops.edit.CollectionEditor;
import com.ciro.jprops.edit.CollectionOperation;
import com.ciro.jprops.notify.MutationNotifier;
import com.ciro.jprops.path.PathParser;
import com.ciro.jprops.reflect.FieldDescriptor;
import com.ciro.jprops.reflect.ReflectionTypeProvider;
import com.ciro.jprops.resolve.AliasStrategy;
import com.ciro.jprops.resolve.FieldResolver;
import com.ciro.jprops.resolve.PropertyAliases;
import com.ciro.jprops.resolve.ResolutionStrategy;
import com.ciro.jprops.resolve.ResolvedTarget;
import com.ciro.jprops.resolve.SiblingOrderStrategy;
import com.ciro.jprops.schema.SchemaReport;
import com.ciro.jprops.schema.SchemaReporter;
import com.ciro.jprops.schema.TypeLabels;
import com.ciro.jprops.spi.AssetLoader;
import com.ciro.jprops.spi.AttachmentFamilyProvider;
import com.ciro.jprops.spi.ChangeSink;
import com.ciro.jprops.spi.EntityModel;
import com.ciro.jprops.spi.TypeReflection;
import com.ciro.jprops.spi.VirtualProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Fachada del motor: parse → resolve → codec/editor → notify.
 * Ninguna excepción del motor sale de aquí; todo vuelve como {@link PropertyResult}.
 * <p>
 * Pensado para un único hilo (el del editor). No guarda destinos entre llamadas.
 */
public class PropertyEngine {

    private static final Logger log = LoggerFactory.getLogger(PropertyEngine.class);

    private static final String SLOT = PathParser.ATTACHMENT_PREFIX + ".";
    private static final String SLOT_CATEGORY = "Slot";

    private final TypeReflection types;
    private final EntityModel entities;
    private final AttachmentFamilyProvider families;
    private final FieldResolver resolver;
    private final ValueCodec codec;
    private final CollectionEditor editor;
    private final SchemaReporter schema;
    private final MutationNotifier notifier;

    private PropertyEngine(Builder b) {
        this.types = b.types;
        this.entities = b.entities;
        this.families = b.families;

        List<ResolutionStrategy> strategies = new ArrayList<>(FieldResolver.defaultStrategies(b.families));
        strategies.addAll(b.extraStrategies);
        this.resolver = new FieldResolver(types, entities, families, strategies,
                List.of(new AliasStrategy(b.aliases)), b.config.isCaseInsensitiveLookup());

        RichRecordRules rules = b.rules != null ? b.rules : RichRecordRules.defaults(b.assets);
        ValueConverter converter = new ValueConverter(types, rules, b.assets, b.config.isStrictRecordKeys());
        this.codec = new ValueCodec(converter, types, entities, families);
        this.editor = new CollectionEditor(converter);
        this.schema = new SchemaReporter(types, entities, families);
        this.notifier = new MutationNotifier(entities, b.sink);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ====================================================================
    // Operaciones
    // ====================================================================

    public PropertyResult<PropertyValue> get(Object entity, String path) {
        return guard("get", path, () -> {
            ResolvedTarget t = resolve(entity, path);
            JsonNode value = codec.read(t).node();
            SchemaReport r = schema.describe(t);
            return new PropertyValue(r.type(), r.editable(), value, r.constraints(), r.nestedHint());
        });
    }

    public PropertyResult<Void> set(Object entity, String path, ExternalValue value) {
        return guard("set", path, () -> {
            ResolvedTarget t = resolve(entity, path);
            codec.write(t, value);
            notifier.notify(entity, t, notifier.isStructural(t));
            log.debug("set '{}' = {}", path, value);
            return null;
        });
    }

    public PropertyResult<Void> apply(Object entity, String path, CollectionOperation op) {
        return guard("apply", path, () -> {
            ResolvedTarget t = resolve(entity, path);
            editor.apply(t, op);
            notifier.notify(entity, t, notifier.isStructural(t));
            return null;
        });
    }

    public PropertyResult<SchemaReport> describe(Object entity, String path) {
        return guard("describe", path, () -> schema.describe(resolve(entity, path)));
    }

    /** Como {@link #set} pero sin asignar ni notificar */
    public PropertyResult<Void> validate(Object entity, String path, ExternalValue value) {
        return guard("validate", path, () -> {
            codec.validate(resolve(entity, path), value);
            return null;
        });
    }

    /**
     * Aplica cada actualización por separado; una que falla no detiene a las demás.
     * Devuelve los mensajes de error ("ruta: motivo"), vacío si todo fue bien.
     */
    public PropertyResult<List<String>> setBatch(Object entity, List<PropertyUpdate> updates) {
        List<String> errors = new ArrayList<>();
        for (PropertyUpdate u : updates) {
            PropertyResult<Void> r = set(entity, u.path(), u.value());
            if (!r.isSuccess()) {
                errors.add(u.path() + ": " + r.error().message());
            }
        }
        return PropertyResult.success(errors);
    }

    public PropertyResult<List<PropertyInfo>> listProperties(Object entity, boolean includeAttachment) {
        return guard("list", entity == null ? "" : entity.getClass().getSimpleName(), () -> {
            List<PropertyInfo> out = new ArrayList<>();
            for (FieldDescriptor d : types.fields(entity.getClass())) {
                if (d.visible()) out.add(new PropertyInfo(d.name(), TypeLabels.of(d), d.categoryLabel(), d.editable()));
            }

            Object slot = includeAttachment ? entities.attachmentOf(entity) : null;
            if (slot != null) {
                for (FieldDescriptor d : types.fields(slot.getClass())) {
                    if (d.visible()) {
                        out.add(new PropertyInfo(SLOT + d.name(), TypeLabels.of(d), SLOT_CATEGORY, d.editable()));
                    }
                }
                for (VirtualProperty vp : families.virtualProperties(slot)) {
                    String type = TypeLabels.of(types.describe(vp.name(), vp.valueType()));
                    out.add(new PropertyInfo(SLOT + vp.name(), type, SLOT_CATEGORY, true));
                }
                out.add(new PropertyInfo(SLOT + SiblingOrderStrategy.NAME, "int", SLOT_CATEGORY, true));
            }
            return out;
        });
    }

    // ====================================================================

    private ResolvedTarget resolve(Object entity, String path) {
        if (entity == null) {
            throw PropertyException.notFound("No entity given for '%s'", path);
        }
        return resolver.resolve(entity, PathParser.parse(path));
    }

    private <T> PropertyResult<T> guard(String op, String path, Supplier<T> body) {
        try {
            return PropertyResult.success(body.get());
        } catch (PropertyException e) {
            log.debug("{} '{}' failed: {} {}", op, path, e.kind(), e.getMessage());
            return PropertyResult.failure(e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {} '{}'", op, path, e);
            return PropertyResult.failure(ErrorKind.UNSUPPORTED,
                    "Internal error on '" + path + "': " + e.getMessage());
        }
    }

    // ====================================================================
    // Builder
    // ====================================================================

    public static final class Builder {
        private JpropsConfig config = new JpropsConfig();
        private TypeReflection types = new ReflectionTypeProvider();
        private EntityModel entities;
        private AttachmentFamilyProvider families = AttachmentFamilyProvider.NONE;
        private AssetLoader assets = AssetLoader.NONE;
        private ChangeSink sink = ChangeSink.NOOP;
        private PropertyAliases aliases = PropertyAliases.defaults();
        private RichRecordRules rules;
        private final List<ResolutionStrategy> extraStrategies = new ArrayList<>();

        private Builder() {}

        public Builder config(JpropsConfig config) { this.config = Objects.requireNonNull(config); return this; }
        public Builder typeReflection(TypeReflection types) { this.types = Objects.requireNonNull(types); return this; }
        public Builder entityModel(EntityModel entities) { this.entities = Objects.requireNonNull(entities); return this; }
        public Builder families(AttachmentFamilyProvider families) { this.families = Objects.requireNonNull(families); return this; }
        public Builder assetLoader(AssetLoader assets) { this.assets = Objects.requireNonNull(assets); return this; }
        public Builder changeSink(ChangeSink sink) { this.sink = Objects.requireNonNull(sink); return this; }
        public Builder aliases(PropertyAliases aliases) { this.aliases = Objects.requireNonNull(aliases); return this; }

        /** Sustituye el catálogo por defecto (que depende del AssetLoader) */
        public Builder richRules(RichRecordRules rules) { this.rules = rules; return this; }

        /** Se prueba después de ChildOrder y de las propiedades virtuales */
        public Builder strategy(ResolutionStrategy strategy) {
            extraStrategies.add(Objects.requireNonNull(strategy));
            return this;
        }

        public PropertyEngine build() {
            if (entities == null) {
                throw new IllegalStateException("An EntityModel is required");
            }
            return new PropertyEngine(this);
        }
    }
}
