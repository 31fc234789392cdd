package com.ciro.jprops.schema;

import com.ciro.jprops.fixtures.Parts;
import com.ciro.jprops.fixtures.Scene;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaReporterTest {

    private Scene scene;
    private Parts parts;
    private SchemaReporter reporter;

    @BeforeEach
    void setUp() {
        scene = new Scene();
        parts = new Parts(scene.assets);
        reporter = new SchemaReporter(parts.types, parts.entities, parts.families);
    }

    private SchemaReport describe(Object entity, String path) {
        return reporter.describe(parts.resolve(entity, path));
    }

    @Test
    void clampedFloat() {
        SchemaReport r = describe(scene.title, "RenderOpacity");

        assertEquals("float", r.type());
        assertTrue(r.editable());
        assertEquals(0d, r.constraints().min());
        assertEquals(1d, r.constraints().max());
        assertEquals(0d, r.constraints().uiMin());
        assertEquals(1d, r.constraints().uiMax());
        assertNull(r.nestedHint());
    }

    @Test
    void intWithSeparateUiRange() {
        Constraints c = describe(scene.title, "FontSize").constraints();

        assertEquals(1d, c.min());
        assertEquals(1000d, c.max());
        assertEquals(8d, c.uiMin());
        assertEquals(72d, c.uiMax());
    }

    @Test
    void partialBounds() {
        Constraints c = describe(scene.combo, "MaxListHeight").constraints();

        assertEquals(0d, c.min());
        assertNull(c.max());
        assertNull(c.uiMin());
        assertEquals(1000d, c.uiMax());
    }

    @Test
    void numbersWithoutBoundsHaveNoConstraints() {
        SchemaReport r = describe(scene.bag, "Big");

        assertEquals("int64", r.type());
        assertNull(r.constraints());
        assertEquals("double", describe(scene.bag, "Precise").type());
        assertEquals("byte", describe(scene.bag, "Level").type());
    }

    @Test
    void enumListsItsValues() {
        SchemaReport r = describe(scene.title, "Visibility");

        assertEquals("Enum<Visibility>", r.type());
        assertEquals(List.of("VISIBLE", "COLLAPSED", "HIDDEN", "HIT_TEST_INVISIBLE", "SELF_HIT_TEST_INVISIBLE"),
                r.constraints().enumValues());
    }

    @Test
    void sentinelEnumValuesAreHidden() {
        SchemaReport r = describe(scene.play, "ClickMethod");

        assertEquals("Enum<ClickMethod>", r.type());
        assertEquals(List.of("DOWN_AND_UP", "MOUSE_DOWN", "MOUSE_UP", "PRECISE_CLICK"), r.constraints().enumValues());
    }

    @Test
    void collectionsReportLengthAndElementType() {
        SchemaReport r = describe(scene.bag, "Items");

        assertEquals("Array<String>", r.type());
        assertEquals(3, r.constraints().length());
        assertEquals(Map.of("elementType", "String"), r.nestedHint());

        assertEquals("Array<Struct<LinearColor>>", describe(scene.bag, "Palette").type());
        assertEquals("Set<String>", describe(scene.bag, "Tags").type());
        assertEquals("Array<Object<Owner>>", describe(scene.bag, "Owners").type());
    }

    @Test
    void mapsReportKeyAndValueTypes() {
        SchemaReport r = describe(scene.bag, "Scores");

        assertEquals("Map<String,int>", r.type());
        assertEquals(1, r.constraints().length());
        assertEquals("String", r.nestedHint().get("keyType"));
        assertEquals("int", r.nestedHint().get("valueType"));
        assertEquals("Map<Enum<Visibility>,String>", describe(scene.bag, "Labels").type());
    }

    @Test
    void structsUseTheirStructName() {
        SchemaReport r = describe(scene.title, "ColorAndOpacity");

        assertEquals("Struct<LinearColor>", r.type());
        assertNull(r.constraints());
        assertEquals(Map.of("recordType", "LinearColor"), r.nestedHint());
        assertEquals("Struct<Vector2D>", describe(scene.title, "RenderTransformPivot").type());
        assertEquals("Struct<Stats>", describe(scene.bag, "Stats").type());
    }

    @Test
    void otherLeafTypes() {
        assertEquals("Object<Owner>", describe(scene.bag, "Owner").type());
        assertEquals("Text", describe(scene.title, "Text").type());
        assertEquals("bool", describe(scene.title, "Enabled").type());
        assertNull(describe(scene.title, "Enabled").constraints());
    }

    @Test
    void readOnlyIsReported() {
        assertFalse(describe(scene.title, "Name").editable());
        assertFalse(describe(scene.bag, "Revision").editable());
    }

    @Test
    void childOrderRange() {
        SchemaReport r = describe(scene.rows.get(1), "Slot.ChildOrder");

        assertEquals("int", r.type());
        assertTrue(r.editable());
        assertEquals(0d, r.constraints().min());
        assertEquals(3d, r.constraints().max());
        assertEquals(4, r.constraints().length());
    }

    @Test
    void onlyChildHasZeroRange() {
        SchemaReport r = describe(scene.badge, "Slot.ChildOrder");

        assertEquals(0d, r.constraints().max());
        assertEquals(1, r.constraints().length());
    }

    @Test
    void virtualProperties() {
        SchemaReport r = describe(scene.rows.get(0), "Slot.HorizontalAlignment");

        assertEquals("Enum<HorizontalAlignment>", r.type());
        assertTrue(r.editable());
        assertEquals(List.of("FILL", "LEFT", "CENTER", "RIGHT"), r.constraints().enumValues());
        assertEquals("Struct<Vector2D>", describe(scene.title, "Slot.Position").type());
    }
}
