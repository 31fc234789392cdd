package com.ciro.jprops.resolve;

import com.ciro.jprops.ErrorKind;
import com.ciro.jprops.PropertyException;
import com.ciro.jprops.fixtures.Parts;
import com.ciro.jprops.fixtures.Scene;
import com.ciro.jprops.model.CanvasPanelSlot;
import com.ciro.jprops.model.HorizontalAlignment;
import com.ciro.jprops.model.HorizontalBox;
import com.ciro.jprops.model.HorizontalBoxSlot;
import com.ciro.jprops.model.TextBlock;
import com.ciro.jprops.model.VerticalBoxSlot;
import com.ciro.jprops.reflect.FieldCategory;
import com.ciro.jprops.types.LinearColor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.*;

class FieldResolverTest {

    private Scene scene;
    private Parts parts;

    @BeforeEach
    void setUp() {
        scene = new Scene();
        parts = new Parts(scene.assets);
    }

    private static ErrorKind failure(Executable call) {
        return assertThrows(PropertyException.class, call).kind();
    }

    @Test
    void plainField() {
        ResolvedTarget t = parts.resolve(scene.title, "renderOpacity");

        assertTrue(t.isField());
        assertEquals("renderOpacity", t.descriptor().name());
        assertEquals(FieldCategory.FLOAT, t.descriptor().category());
        assertSame(scene.title, t.root());
        assertEquals(1f, t.location().get());
    }

    @Test
    void caseInsensitiveName() {
        assertEquals("renderOpacity", parts.resolve(scene.title, "RenderOpacity").descriptor().name());
        assertEquals("colorAndOpacity", parts.resolve(scene.title, "COLORANDOPACITY").descriptor().name());
    }

    @Test
    void exactCaseOnlyWhenConfigured() {
        Parts strict = new Parts(scene.assets, false, true);

        assertEquals(ErrorKind.NOT_FOUND, failure(() -> strict.resolve(scene.title, "RenderOpacity")));
        assertTrue(strict.resolve(scene.title, "renderOpacity").isField());
    }

    @Test
    void aliasesReachCanonicalFields() {
        assertEquals("variable", parts.resolve(scene.title, "IsVariable").descriptor().name());
        assertEquals("variable", parts.resolve(scene.title, "bIsVariable").descriptor().name());
        assertEquals("renderOpacity", parts.resolve(scene.title, "Opacity").descriptor().name());
        assertEquals("toolTipText", parts.resolve(scene.title, "ToolTip").descriptor().name());
    }

    @Test
    void noSubstringMatching() {
        PropertyException e = assertThrows(PropertyException.class, () -> parts.resolve(scene.title, "Opac"));

        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        assertTrue(e.getMessage().contains("renderOpacity"), e.getMessage());
    }

    @Test
    void descendsIntoStructByDeclaredType() {
        ResolvedTarget t = parts.resolve(scene.bag, "Stats.Tint");

        assertEquals("tint", t.descriptor().name());
        assertEquals(FieldCategory.RECORD, t.descriptor().category());
        assertEquals(LinearColor.white(), t.location().get());
        assertSame(scene.bag, t.entity());
    }

    @Test
    void transientStructFieldsAreHidden() {
        assertEquals(ErrorKind.NOT_FOUND, failure(() -> parts.resolve(scene.bag, "Stats.Cache")));
    }

    @Test
    void descendsIntoObjectByRuntimeClass() {
        ResolvedTarget t = parts.resolve(scene.bag, "Owner.DisplayName");

        assertEquals(FieldCategory.STRING, t.descriptor().category());
        assertEquals("Ada", t.location().get());
    }

    @Test
    void nullReferencesAreNotFound() {
        assertEquals(ErrorKind.NOT_FOUND, failure(() -> parts.resolve(scene.bag, "Missing.DisplayName")));
        assertEquals(ErrorKind.NOT_FOUND, failure(() -> parts.resolve(scene.bag, "Owner.Manager.DisplayName")));
    }

    @Test
    void fieldsWithoutPropertyAreHiddenOnObjects() {
        assertEquals(ErrorKind.NOT_FOUND, failure(() -> parts.resolve(scene.bag, "Owner.Hidden")));
    }

    @Test
    void listElements() {
        ResolvedTarget t = parts.resolve(scene.bag, "Items[1]");

        assertInstanceOf(ListElementLocation.class, t.location());
        assertEquals(FieldCategory.STRING, t.descriptor().category());
        assertEquals("b", t.location().get());
    }

    @Test
    void listElementStructFields() {
        ResolvedTarget t = parts.resolve(scene.bag, "Palette[0].R");

        assertEquals("r", t.descriptor().name());
        assertEquals(1f, t.location().get());
    }

    @Test
    void listIndexErrors() {
        assertEquals(ErrorKind.OUT_OF_RANGE, failure(() -> parts.resolve(scene.bag, "Items[3]")));
        assertEquals(ErrorKind.INVALID_PATH, failure(() -> parts.resolve(scene.bag, "Items[abc]")));
        assertEquals(ErrorKind.INVALID_PATH, failure(() -> parts.resolve(scene.bag, "Items.Length")));
    }

    @Test
    void mapValuesByExactKey() {
        ResolvedTarget t = parts.resolve(scene.bag, "Scores[alpha]");

        assertInstanceOf(MapValueLocation.class, t.location());
        assertEquals(1, t.location().get());
        assertEquals(ErrorKind.OUT_OF_RANGE, failure(() -> parts.resolve(scene.bag, "Scores[ALPHA]")));
        assertEquals(ErrorKind.OUT_OF_RANGE, failure(() -> parts.resolve(scene.bag, "Scores[alph]")));
        assertEquals(ErrorKind.OUT_OF_RANGE, failure(() -> parts.resolve(scene.bag, "Scores[alphabet]")));
    }

    @Test
    void byteMapKeysAreUnsigned() {
        assertEquals("aux", parts.resolve(scene.bag, "Channels[200]").location().get());
        assertEquals(ErrorKind.OUT_OF_RANGE, failure(() -> parts.resolve(scene.bag, "Channels[201]")));
        assertEquals(ErrorKind.TYPE_MISMATCH, failure(() -> parts.resolve(scene.bag, "Channels[-56]")));
        assertEquals(ErrorKind.TYPE_MISMATCH, failure(() -> parts.resolve(scene.bag, "Channels[256]")));
    }

    @Test
    void mapKeysAreConvertedToTheKeyType() {
        assertEquals("two", parts.resolve(scene.bag, "Rows[2]").location().get());
        assertEquals("shown", parts.resolve(scene.bag, "Labels[VISIBLE]").location().get());
        assertEquals(ErrorKind.TYPE_MISMATCH, failure(() -> parts.resolve(scene.bag, "Rows[x]")));
        assertEquals(ErrorKind.OUT_OF_RANGE, failure(() -> parts.resolve(scene.bag, "Rows[3]")));
    }

    @Test
    void setsCannotBeIndexedOrTraversed() {
        assertTrue(parts.resolve(scene.bag, "Tags").isField());
        assertEquals(ErrorKind.UNSUPPORTED, failure(() -> parts.resolve(scene.bag, "Tags[0]")));
        assertEquals(ErrorKind.UNSUPPORTED, failure(() -> parts.resolve(scene.bag, "Tags.Size")));
    }

    @Test
    void leavesCannotBeTraversedOrIndexed() {
        PropertyException e = assertThrows(PropertyException.class,
                () -> parts.resolve(scene.title, "FontSize.Value"));

        assertEquals(ErrorKind.INVALID_PATH, e.kind());
        assertTrue(e.getMessage().contains("non-composite"), e.getMessage());
        assertEquals(ErrorKind.INVALID_PATH, failure(() -> parts.resolve(scene.title, "FontSize[0]")));
    }

    @Test
    void slotFieldsAreResolvedOnTheAttachment() {
        ResolvedTarget t = parts.resolve(scene.rows.get(0), "Slot.Padding");

        assertTrue(t.isField());
        assertInstanceOf(VerticalBoxSlot.class, t.root());
        assertSame(scene.rows.get(0), t.entity());
    }

    @Test
    void slotVirtualProperty() {
        ResolvedTarget t = parts.resolve(scene.title, "Slot.Position");

        assertTrue(t.isVirtual());
        assertEquals("Position", t.virtualProperty().name());
        assertInstanceOf(CanvasPanelSlot.class, t.root());
        assertTrue(parts.resolve(scene.title, "slot.zorder").isVirtual());
    }

    @Test
    void unknownSlotPropertyNamesTheFamily() {
        PropertyException e = assertThrows(PropertyException.class,
                () -> parts.resolve(scene.rows.get(1), "Slot.Position"));

        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        assertTrue(e.getMessage().contains("VerticalBoxSlot"), e.getMessage());
        assertTrue(e.getMessage().contains("HorizontalAlignment"), e.getMessage());
        assertTrue(e.getMessage().contains("padding"), e.getMessage());
    }

    @Test
    void horizontalBoxSlotsHaveTheirOwnFamily() {
        HorizontalBox toolbar = new HorizontalBox("Toolbar");
        TextBlock label = new TextBlock("Label");
        toolbar.addChild(label);

        ResolvedTarget t = parts.resolve(label, "Slot.HorizontalAlignment");
        assertInstanceOf(HorizontalBoxSlot.class, t.root());
        assertTrue(t.isVirtual());
        assertEquals("HorizontalAlignment", t.virtualProperty().name());
        assertEquals(HorizontalAlignment.FILL, ((HorizontalBoxSlot) t.root()).getHorizontalAlignment());

        PropertyException e = assertThrows(PropertyException.class,
                () -> parts.resolve(label, "Slot.Position"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        assertTrue(e.getMessage().contains("HorizontalBoxSlot"), e.getMessage());
    }

    @Test
    void virtualPropertiesAreLeaves() {
        assertEquals(ErrorKind.INVALID_PATH, failure(() -> parts.resolve(scene.title, "Slot.Position.X")));
        assertEquals(ErrorKind.INVALID_PATH, failure(() -> parts.resolve(scene.title, "Slot.Position[0]")));
    }

    @Test
    void childOrderIsSynthetic() {
        ResolvedTarget t = parts.resolve(scene.rows.get(2), "Slot.ChildOrder");

        assertTrue(t.isSynthetic());
        assertEquals(SyntheticKind.SIBLING_ORDER, t.synthetic());
        assertEquals(ErrorKind.INVALID_PATH, failure(() -> parts.resolve(scene.rows.get(2), "Slot.ChildOrder[0]")));
    }

    @Test
    void childOrderOutsideSlotIsAnOrdinaryName() {
        assertEquals(ErrorKind.NOT_FOUND, failure(() -> parts.resolve(scene.title, "ChildOrder")));
    }

    @Test
    void rootWithoutSlot() {
        PropertyException e = assertThrows(PropertyException.class,
                () -> parts.resolve(scene.root, "Slot.Padding"));

        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        assertTrue(e.getMessage().contains("Root"), e.getMessage());
    }

    @Test
    void resolutionIsDeterministicAndSideEffectFree() {
        ResolvedTarget first = parts.resolve(scene.bag, "Palette[0].G");
        ResolvedTarget second = parts.resolve(scene.bag, "Palette[0].G");

        assertEquals(first, second);
        assertEquals(parts.resolve(scene.title, "Slot.Position"), parts.resolve(scene.title, "Slot.Position"));
        assertEquals(3, scene.bag.items.size());
        assertFalse(scene.document.isDirty());
    }
}
