package com.ciro.jprops.runtime;

import com.ciro.jprops.JpropsConfig;
import com.ciro.jprops.JsonMappers;
import com.ciro.jprops.PropertyEngine;
import com.ciro.jprops.codec.ExternalValue;
import com.ciro.jprops.model.AssetLibrary;
import com.ciro.jprops.model.CanvasPanel;
import com.ciro.jprops.model.DefaultEntityModel;
import com.ciro.jprops.model.DocumentChangeSink;
import com.ciro.jprops.model.SlotFamilies;
import com.ciro.jprops.model.TextBlock;
import com.ciro.jprops.model.WidgetDocument;
import com.ciro.jprops.spi.ChangeSink;
import com.ciro.jprops.spi.ViewSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiveViewHubTest {

    static class FakeSession implements ViewSession {
        final String id;
        final List<String> sent = new ArrayList<>();
        boolean open = true;
        boolean failOnSend;
        boolean closed;

        FakeSession(String id) {
            this.id = id;
        }

        @Override public String getId() { return id; }
        @Override public boolean isOpen() { return open; }

        @Override
        public void sendText(String json) {
            if (failOnSend) throw new IllegalStateException("socket reset");
            sent.add(json);
        }

        @Override
        public void close() {
            closed = true;
            open = false;
        }
    }

    private final ObjectMapper mapper = JsonMappers.create();

    private CanvasPanel root;
    private TextBlock title;
    private WidgetDocument document;
    private LiveViewHub hub;

    @BeforeEach
    void setUp() {
        root = new CanvasPanel("Root");
        title = new TextBlock("Title");
        root.addChild(title);
        document = new WidgetDocument("MainMenu", root);
        hub = new LiveViewHub(doc -> ((WidgetDocument) doc).getName());
    }

    private JsonNode frame(FakeSession s, int i) throws Exception {
        return mapper.readTree(s.sent.get(i));
    }

    @Test
    void framesCarryTypeAndDocument() throws Exception {
        FakeSession s = new FakeSession("s1");
        hub.register("MainMenu", s);

        hub.markModified(document);
        hub.refreshViews(document);

        assertEquals(2, s.sent.size());
        assertEquals("modified", frame(s, 0).get("type").asText());
        assertEquals("MainMenu", frame(s, 0).get("document").asText());
        assertEquals("refresh", frame(s, 1).get("type").asText());
        assertTrue(frame(s, 1).get("seq").asLong() > frame(s, 0).get("seq").asLong());
    }

    @Test
    void otherDocumentsAreNotNotified() {
        FakeSession other = new FakeSession("s2");
        hub.register("Settings", other);

        hub.regenerate(document);

        assertTrue(other.sent.isEmpty());
    }

    @Test
    void closedSessionsAreDropped() {
        FakeSession gone = new FakeSession("gone");
        FakeSession alive = new FakeSession("alive");
        gone.open = false;
        hub.register("MainMenu", gone);
        hub.register("MainMenu", alive);

        hub.refreshViews(document);

        assertEquals(1, hub.sessionCount("MainMenu"));
        assertEquals(1, alive.sent.size());
        assertTrue(gone.sent.isEmpty());
    }

    @Test
    void failingSessionsAreDroppedAndClosed() {
        FakeSession broken = new FakeSession("broken");
        broken.failOnSend = true;
        hub.register("MainMenu", broken);

        hub.refreshViews(document);

        assertEquals(0, hub.sessionCount("MainMenu"));
        assertTrue(broken.closed);
    }

    @Test
    void unregisterAndClose() {
        FakeSession a = new FakeSession("a");
        FakeSession b = new FakeSession("b");
        hub.register("MainMenu", a);
        hub.register("MainMenu", b);

        hub.unregister("MainMenu", a);
        assertEquals(1, hub.sessionCount("MainMenu"));

        hub.close();
        assertTrue(b.closed);
        assertEquals(0, hub.sessionCount("MainMenu"));
    }

    @Test
    void engineEditsReachOpenViews() throws Exception {
        FakeSession s = new FakeSession("editor");
        hub.register("MainMenu", s);
        PropertyEngine engine = JvmEngines.builder(new JpropsConfig(), new AssetLibrary())
                .entityModel(new DefaultEntityModel())
                .families(SlotFamilies.defaults())
                .changeSink(ChangeSink.compose(new DocumentChangeSink(), hub))
                .build();

        assertTrue(engine.set(title, "Slot.Position", ExternalValue.ofString("[10,20]")).isSuccess());
        assertTrue(engine.set(title, "IsVariable", ExternalValue.ofString("true")).isSuccess());

        assertEquals(4, s.sent.size());
        assertEquals("modified", frame(s, 0).get("type").asText());
        assertEquals("refresh", frame(s, 1).get("type").asText());
        assertEquals("regenerate", frame(s, 2).get("type").asText());
        assertEquals(List.of("Title"), document.getVariables());
    }
}
