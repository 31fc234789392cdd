package com.ciro.jprops.path;

import com.ciro.jprops.ErrorKind;
import com.ciro.jprops.PropertyException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathParserTest {

    @Test
    void plainSegment() {
        PropertyPath p = PathParser.parse("ColorAndOpacity");

        assertFalse(p.attachmentRoot());
        assertEquals(1, p.size());
        assertEquals(Segment.plain("ColorAndOpacity"), p.last());
    }

    @Test
    void slotPrefixStartsAtAttachment() {
        PropertyPath p = PathParser.parse("Slot.LayoutData.Offsets");

        assertTrue(p.attachmentRoot());
        assertEquals(2, p.size());
        assertEquals("LayoutData", p.segment(0).name());
        assertEquals("Offsets", p.segment(1).name());
    }

    @Test
    void slotPrefixIgnoresCase() {
        assertTrue(PathParser.parse("slot.Padding").attachmentRoot());
        assertTrue(PathParser.parse("SLOT.Padding").attachmentRoot());
    }

    @Test
    void slotOnlyAsFirstSegment() {
        PropertyPath p = PathParser.parse("Style.Slot");

        assertFalse(p.attachmentRoot());
        assertEquals("Slot", p.last().name());
    }

    @Test
    void numericIndex() {
        Segment s = PathParser.parse("Items[2]").last();

        assertEquals(IndexKind.NUMERIC, s.indexKind());
        assertEquals(2, s.index());
        assertEquals("Items", s.name());
    }

    @Test
    void keyedIndexMayContainDots() {
        PropertyPath p = PathParser.parse("Scores[Primary.Key].Value");

        assertEquals(2, p.size());
        assertEquals(IndexKind.KEYED, p.segment(0).indexKind());
        assertEquals("Primary.Key", p.segment(0).key());
        assertEquals("Value", p.segment(1).name());
    }

    @Test
    void negativeIndexIsAKey() {
        Segment s = PathParser.parse("Items[-1]").last();

        assertEquals(IndexKind.KEYED, s.indexKind());
        assertEquals("-1", s.key());
    }

    @Test
    void textRendersCanonicalForm() {
        assertEquals("Slot.Padding", PathParser.parse("slot.Padding").text());
        assertEquals("Items[2].R", PathParser.parse("Items[2].R").text());
    }

    @Test
    void unmatchedBracketIsInvalid() {
        PropertyException e = assertThrows(PropertyException.class, () -> PathParser.parse("Items[2"));

        assertEquals(ErrorKind.INVALID_PATH, e.kind());
        assertTrue(e.getMessage().contains("Items[2"), e.getMessage());
    }

    @Test
    void bareSlotIsInvalid() {
        PropertyException e = assertThrows(PropertyException.class, () -> PathParser.parse("Slot"));
        assertEquals(ErrorKind.INVALID_PATH, e.kind());
    }

    @Test
    void malformedPathsAreInvalid() {
        String[] bad = {"", "   ", "a..b", ".a", "a.", "Items]", "Items[]", "Items[2]x",
                "[2]", "a[1][2]", "a[[1]]", "Items[99999999999]"};
        for (String text : bad) {
            PropertyException e = assertThrows(PropertyException.class, () -> PathParser.parse(text), text);
            assertEquals(ErrorKind.INVALID_PATH, e.kind(), text);
        }
    }

    @Test
    void nullIsInvalid() {
        PropertyException e = assertThrows(PropertyException.class, () -> PathParser.parse(null));
        assertEquals(ErrorKind.INVALID_PATH, e.kind());
    }
}
