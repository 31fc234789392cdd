package com.ciro.jprops;

import com.ciro.jprops.codec.ExternalValue;
import com.ciro.jprops.edit.CollectionOperation;
import com.ciro.jprops.fixtures.Scene;
import com.ciro.jprops.model.HorizontalAlignment;
import com.ciro.jprops.model.OverlaySlot;
import com.ciro.jprops.model.VerticalBoxSlot;
import com.ciro.jprops.model.Widget;
import com.ciro.jprops.resolve.PropertyAliases;
import com.ciro.jprops.schema.SchemaReport;
import com.ciro.jprops.types.Margin;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PropertyEngineTest {

    private final ObjectMapper mapper = JsonMappers.create();

    private Scene scene;
    private PropertyEngine engine;

    @BeforeEach
    void setUp() {
        scene = new Scene();
        engine = scene.engine();
    }

    private ExternalValue json(String text) throws Exception {
        return ExternalValue.ofNode(mapper.readTree(text));
    }

    private JsonNode value(Object entity, String path) {
        PropertyResult<PropertyValue> r = engine.get(entity, path);
        assertTrue(r.isSuccess(), () -> path + ": " + r.error());
        return r.value().value();
    }

    private static float[] floats(JsonNode array) {
        float[] out = new float[array.size()];
        for (int i = 0; i < out.length; i++) out[i] = array.get(i).floatValue();
        return out;
    }

    @Test
    void colorRoundTrip() throws Exception {
        assertTrue(engine.set(scene.title, "ColorAndOpacity", json("[1,0,0,1]")).isSuccess());

        assertArrayEquals(new float[]{1f, 0f, 0f, 1f}, floats(value(scene.title, "ColorAndOpacity")));
    }

    @Test
    void canvasSlotPosition() throws Exception {
        assertTrue(engine.set(scene.title, "Slot.Position", json("[10,20]")).isSuccess());

        assertArrayEquals(new float[]{10f, 20f}, floats(value(scene.title, "Slot.Position")));
    }

    @Test
    void positionOnABoxSlotNamesTheFamily() throws Exception {
        PropertyResult<Void> set = engine.set(scene.rows.get(0), "Slot.Position", json("[10,20]"));
        PropertyResult<PropertyValue> get = engine.get(scene.rows.get(0), "Slot.Position");

        assertEquals(ErrorKind.NOT_FOUND, set.error().kind());
        assertEquals(ErrorKind.NOT_FOUND, get.error().kind());
        assertTrue(set.error().message().contains("VerticalBoxSlot"), set.error().message());
    }

    @Test
    void childOrderMovesTheWidget() {
        Widget moved = scene.rows.get(2);

        assertTrue(engine.set(moved, "Slot.ChildOrder", ExternalValue.ofString("0")).isSuccess());

        assertSame(moved, scene.list.getChildAt(0));
        assertEquals(4, scene.list.getChildrenCount());
        assertEquals(0, value(moved, "Slot.ChildOrder").intValue());
        assertEquals(List.of("Row2", "Row0", "Row1", "Row3"),
                scene.list.getChildren().stream().map(Widget::getName).collect(Collectors.toList()));
        assertEquals(1, scene.document.getGeneration());
    }

    @Test
    void childOrderClampsAndKeepsTheSlot() {
        Widget moved = scene.rows.get(0);
        VerticalBoxSlot slot = (VerticalBoxSlot) moved.getSlot();
        slot.setPadding(Margin.uniform(4f));

        assertTrue(engine.set(moved, "Slot.ChildOrder", ExternalValue.ofString("99")).isSuccess());

        assertEquals(3, value(moved, "Slot.ChildOrder").intValue());
        assertSame(slot, moved.getSlot());
        assertEquals(Margin.uniform(4f), slot.getPadding());
        assertEquals(ErrorKind.TYPE_MISMATCH,
                engine.set(moved, "Slot.ChildOrder", ExternalValue.ofString("first")).error().kind());
    }

    @Test
    void childOrderNeedsAParent() {
        assertEquals(ErrorKind.NOT_FOUND, engine.get(scene.root, "Slot.ChildOrder").error().kind());
    }

    @Test
    void insertIntoList() {
        assertTrue(engine.apply(scene.bag, "Items", CollectionOperation.insert(1, ExternalValue.ofString("X"))).isSuccess());
        assertEquals(List.of("a", "X", "b", "c"), scene.bag.items);
    }

    @Test
    void unterminatedIndexIsInvalid() {
        PropertyResult<PropertyValue> r = engine.get(scene.bag, "Items[2");

        assertFalse(r.isSuccess());
        assertEquals(ErrorKind.INVALID_PATH, r.error().kind());
        assertThrows(IllegalStateException.class, r::value);
    }

    @Test
    void variableAliasRegeneratesTheDocument() {
        assertTrue(engine.set(scene.badge, "bIsVariable", ExternalValue.ofString("1")).isSuccess());

        assertTrue(scene.badge.isVariable());
        assertEquals(List.of("Badge"), scene.document.getVariables());
        assertEquals(List.of("regenerate:MainMenu", "refresh:MainMenu"), scene.sink.events);
    }

    @Test
    void getDescribesTheValue() {
        PropertyValue v = engine.get(scene.title, "FontSize").value();

        assertEquals("int", v.type());
        assertTrue(v.editable());
        assertEquals(24, v.value().intValue());
        assertEquals(72d, v.constraints().uiMax());
    }

    @Test
    void describeMatchesGet() {
        SchemaReport r = engine.describe(scene.bag, "Items").value();

        assertEquals("Array<String>", r.type());
        assertEquals(3, r.constraints().length());
    }

    @Test
    void validateLeavesStateAlone() {
        assertTrue(engine.validate(scene.title, "FontSize", ExternalValue.ofString("30")).isSuccess());
        assertEquals(ErrorKind.TYPE_MISMATCH,
                engine.validate(scene.title, "FontSize", ExternalValue.ofString("thirty")).error().kind());

        assertEquals(24, scene.title.getFontSize());
        assertTrue(scene.sink.events.isEmpty());
    }

    @Test
    void batchReportsEachFailure() throws Exception {
        PropertyResult<List<String>> r = engine.setBatch(scene.title, List.of(
                new PropertyUpdate("FontSize", ExternalValue.ofString("30")),
                new PropertyUpdate("Bogus", ExternalValue.ofString("1")),
                new PropertyUpdate("Slot.Position", json("[5,5]"))));

        assertTrue(r.isSuccess());
        assertEquals(1, r.value().size());
        assertTrue(r.value().get(0).startsWith("Bogus: "), r.value().get(0));
        assertEquals(30, scene.title.getFontSize());
        assertArrayEquals(new float[]{5f, 5f}, floats(value(scene.title, "Slot.Position")));
    }

    @Test
    void listPropertiesWithSlot() {
        List<PropertyInfo> props = engine.listProperties(scene.title, true).value();
        List<String> paths = props.stream().map(PropertyInfo::path).collect(Collectors.toList());

        assertTrue(paths.contains("renderOpacity"));
        assertTrue(paths.contains("fontSize"));
        assertTrue(paths.contains("Slot.layoutData"));
        assertTrue(paths.contains("Slot.Position"));
        assertTrue(paths.contains("Slot.ChildOrder"));
        PropertyInfo name = props.stream().filter(p -> p.path().equals("name")).findFirst().orElseThrow();
        assertFalse(name.editable());
        assertEquals("Identity", name.category());
        props.stream().filter(p -> p.path().startsWith("Slot.")).forEach(p -> assertEquals("Slot", p.category()));
    }

    @Test
    void listPropertiesWithoutSlot() {
        List<PropertyInfo> props = engine.listProperties(scene.title, false).value();

        assertTrue(props.stream().noneMatch(p -> p.path().startsWith("Slot.")));
        assertTrue(engine.listProperties(scene.root, true).value().stream()
                .noneMatch(p -> p.path().startsWith("Slot.")));
    }

    @Test
    void overlayAndBoxSlots() throws Exception {
        assertTrue(engine.set(scene.badge, "Slot.Padding", json("[2,2,2,2]")).isSuccess());
        assertTrue(engine.set(scene.badge, "Slot.HorizontalAlignment", ExternalValue.ofString("Center")).isSuccess());
        assertTrue(engine.set(scene.rows.get(1), "Slot.VerticalAlignment", ExternalValue.ofString("bottom")).isSuccess());

        OverlaySlot slot = (OverlaySlot) scene.badge.getSlot();
        assertEquals(Margin.uniform(2f), slot.getPadding());
        assertEquals(HorizontalAlignment.CENTER, slot.getHorizontalAlignment());
        assertEquals("CENTER", value(scene.badge, "Slot.HorizontalAlignment").asText());
        assertEquals("BOTTOM", value(scene.rows.get(1), "Slot.VerticalAlignment").asText());
    }

    @Test
    void mapKeysMatchExactly() {
        assertEquals(1, value(scene.bag, "Scores[alpha]").intValue());
        assertEquals(ErrorKind.OUT_OF_RANGE, engine.get(scene.bag, "Scores[Alpha]").error().kind());
        assertEquals(ErrorKind.OUT_OF_RANGE, engine.get(scene.bag, "Scores[alph]").error().kind());
        assertEquals(ErrorKind.OUT_OF_RANGE, engine.get(scene.bag, "Scores[alphabet]").error().kind());
        assertEquals("aux", value(scene.bag, "Channels[200]").asText());
        assertEquals("aux", value(scene.bag, "Channels").get("200").asText());
    }

    @Test
    void caseSensitiveLookupWhenConfigured() {
        JpropsConfig cfg = new JpropsConfig();
        cfg.setCaseInsensitiveLookup(false);
        PropertyEngine strict = scene.engine(cfg);

        assertEquals(ErrorKind.NOT_FOUND, strict.get(scene.title, "RenderOpacity").error().kind());
        assertTrue(strict.get(scene.title, "renderOpacity").isSuccess());
    }

    @Test
    void customAliases() {
        PropertyEngine custom = scene.builder(new JpropsConfig())
                .aliases(PropertyAliases.defaults().with("Size", "fontSize"))
                .build();

        assertTrue(custom.set(scene.title, "Size", ExternalValue.ofString("12")).isSuccess());
        assertEquals(12, scene.title.getFontSize());
    }

    @Test
    void unexpectedFailuresBecomeUnsupported() {
        PropertyEngine broken = scene.builder(new JpropsConfig())
                .strategy((ctx, segment) -> {
                    throw new IllegalStateException("boom");
                })
                .build();

        PropertyResult<PropertyValue> r = broken.get(scene.title, "FontSize");

        assertEquals(ErrorKind.UNSUPPORTED, r.error().kind());
        assertTrue(r.error().message().contains("boom"), r.error().message());
    }

    @Test
    void nullEntity() {
        assertEquals(ErrorKind.NOT_FOUND, engine.get(null, "FontSize").error().kind());
    }

    @Test
    void entityModelIsRequired() {
        assertThrows(IllegalStateException.class, () -> PropertyEngine.builder().build());
    }
}
