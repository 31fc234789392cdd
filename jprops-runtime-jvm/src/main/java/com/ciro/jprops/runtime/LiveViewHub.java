package com.ciro.jprops.runtime;

import com.ciro.jprops.JsonMappers;
import com.ciro.jprops.spi.ChangeSink;
import com.ciro.jprops.spi.ViewSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * {@link ChangeSink} que reenvía cada aviso del motor a las vistas abiertas del documento:
 * <pre>
 * {"type":"modified","document":"MainMenu","seq":12}
 * </pre>
 * Las sesiones cerradas o que fallan al enviar se quitan del hub.
 */
public class LiveViewHub implements ChangeSink {

    private static final Logger log = LoggerFactory.getLogger(LiveViewHub.class);

    record Frame(String type, String document, long seq) {}

    private final Function<Object, String> documentIds;
    private final ObjectMapper mapper;
    private final Map<String, Set<ViewSession>> sessions = new ConcurrentHashMap<>();
    private final AtomicLong seq = new AtomicLong(0);

    public LiveViewHub(Function<Object, String> documentIds) {
        this(documentIds, JsonMappers.create());
    }

    public LiveViewHub(Function<Object, String> documentIds, ObjectMapper mapper) {
        this.documentIds = documentIds;
        this.mapper = mapper;
    }

    public void register(String documentId, ViewSession session) {
        sessions.computeIfAbsent(documentId, k -> ConcurrentHashMap.newKeySet()).add(session);
        log.debug("Session {} watching '{}'", session.getId(), documentId);
    }

    public void unregister(String documentId, ViewSession session) {
        Set<ViewSession> set = sessions.get(documentId);
        if (set != null && set.remove(session)) {
            log.debug("Session {} left '{}'", session.getId(), documentId);
        }
    }

    public int sessionCount(String documentId) {
        Set<ViewSession> set = sessions.get(documentId);
        return set == null ? 0 : set.size();
    }

    @Override
    public void regenerate(Object document) {
        publish("regenerate", document);
    }

    @Override
    public void markModified(Object document) {
        publish("modified", document);
    }

    @Override
    public void refreshViews(Object document) {
        publish("refresh", document);
    }

    /** Cierra y olvida todas las sesiones */
    public void close() {
        sessions.forEach((doc, set) -> set.forEach(s -> closeQuietly(s, doc)));
        sessions.clear();
    }

    private void publish(String type, Object document) {
        String id = documentIds.apply(document);
        Set<ViewSession> targets = sessions.get(id);
        if (targets == null || targets.isEmpty()) return;

        String json;
        try {
            json = mapper.writeValueAsString(new Frame(type, id, seq.incrementAndGet()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + type + " frame for '" + id + "'", e);
        }

        for (ViewSession s : targets) {
            if (!s.isOpen()) {
                log.warn("Dropping closed session {} of '{}'", s.getId(), id);
                targets.remove(s);
                continue;
            }
            try {
                s.sendText(json);
            } catch (RuntimeException e) {
                log.warn("Dropping session {} of '{}': send failed", s.getId(), id, e);
                targets.remove(s);
                closeQuietly(s, id);
            }
        }
    }

    private static void closeQuietly(ViewSession s, String documentId) {
        try {
            s.close();
        } catch (RuntimeException e) {
            log.debug("Closing session {} of '{}' failed: {}", s.getId(), documentId, e.getMessage());
        }
    }
}
