package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Property;
import com.ciro.jprops.types.LinearColor;
import com.ciro.jprops.types.LocalizedText;

public class TextBlock extends Widget {

    @Property(category = "Content")
    private LocalizedText text = LocalizedText.of("");

    @Property(category = "Appearance")
    private LinearColor colorAndOpacity = LinearColor.white();

    @Property(category = "Appearance", clampMin = "1", clampMax = "1000", uiMin = "8", uiMax = "72")
    private int fontSize = 24;

    @Property(category = "Appearance")
    private TextJustify justification = TextJustify.LEFT;

    @Property(category = "Wrapping")
    private boolean autoWrapText;

    public TextBlock(String name) {
        super(name);
    }

    public LocalizedText getText() { return text; }
    public void setText(LocalizedText text) { this.text = text; }
    public LinearColor getColorAndOpacity() { return colorAndOpacity; }
    public void setColorAndOpacity(LinearColor c) { this.colorAndOpacity = c; }
    public int getFontSize() { return fontSize; }
    public void setFontSize(int fontSize) { this.fontSize = fontSize; }
    public TextJustify getJustification() { return justification; }
    public void setJustification(TextJustify justification) { this.justification = justification; }
    public boolean isAutoWrapText() { return autoWrapText; }
    public void setAutoWrapText(boolean autoWrapText) { this.autoWrapText = autoWrapText; }
}
