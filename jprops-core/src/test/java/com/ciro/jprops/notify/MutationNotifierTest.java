package com.ciro.jprops.notify;

import com.ciro.jprops.PropertyEngine;
import com.ciro.jprops.codec.ExternalValue;
import com.ciro.jprops.edit.CollectionOperation;
import com.ciro.jprops.fixtures.Parts;
import com.ciro.jprops.fixtures.RecordingSink;
import com.ciro.jprops.fixtures.Scene;
import com.ciro.jprops.model.DefaultEntityModel;
import com.ciro.jprops.model.TextBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MutationNotifierTest {

    private Scene scene;
    private PropertyEngine engine;

    @BeforeEach
    void setUp() {
        scene = new Scene();
        engine = scene.engine();
    }

    @Test
    void plainEditMarksModified() {
        assertTrue(engine.set(scene.title, "RenderOpacity", ExternalValue.ofString("0.5")).isSuccess());

        assertEquals(List.of("modified:MainMenu", "refresh:MainMenu"), scene.sink.events);
        assertTrue(scene.document.isDirty());
        assertEquals(0, scene.document.getGeneration());
    }

    @Test
    void generativeFieldRegenerates() {
        assertTrue(engine.set(scene.title, "IsVariable", ExternalValue.ofString("true")).isSuccess());

        assertEquals(List.of("regenerate:MainMenu", "refresh:MainMenu"), scene.sink.events);
        assertEquals(1, scene.document.getGeneration());
        assertEquals(List.of("Title"), scene.document.getVariables());
    }

    @Test
    void childOrderRegenerates() {
        assertTrue(engine.set(scene.rows.get(3), "Slot.ChildOrder", ExternalValue.ofString("0")).isSuccess());
        assertEquals("regenerate:MainMenu", scene.sink.events.get(0));
    }

    @Test
    void collectionEditsNotifyToo() {
        assertTrue(engine.apply(scene.bag, "Items",
                CollectionOperation.removeAt(0)).isSuccess());
        assertEquals(List.of("modified:MainMenu", "refresh:MainMenu"), scene.sink.events);
    }

    @Test
    void failedEditsDoNotNotify() {
        assertFalse(engine.set(scene.title, "RenderOpacity", ExternalValue.ofString("x")).isSuccess());
        assertTrue(engine.validate(scene.title, "RenderOpacity", ExternalValue.ofString("0.1")).isSuccess());

        assertTrue(scene.sink.events.isEmpty());
        assertFalse(scene.document.isDirty());
    }

    @Test
    void entitiesOutsideADocumentAreSilent() {
        RecordingSink sink = new RecordingSink();
        MutationNotifier notifier = new MutationNotifier(new DefaultEntityModel(), sink);
        TextBlock loose = new TextBlock("Loose");
        Parts parts = new Parts(scene.assets);

        notifier.notify(loose, parts.resolve(loose, "FontSize"), false);

        assertTrue(sink.events.isEmpty());
    }

    @Test
    void structuralClassification() {
        Parts parts = new Parts(scene.assets);
        MutationNotifier notifier = new MutationNotifier(parts.entities, new RecordingSink());

        assertTrue(notifier.isStructural(parts.resolve(scene.title, "Variable")));
        assertTrue(notifier.isStructural(parts.resolve(scene.title, "Slot.ChildOrder")));
        assertFalse(notifier.isStructural(parts.resolve(scene.title, "Slot.Position")));
        assertFalse(notifier.isStructural(parts.resolve(scene.title, "FontSize")));
    }
}
