package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Property;

import java.util.ArrayList;
import java.util.List;

public class ComboBoxString extends Widget {

    @Property(category = "Content")
    private List<String> defaultOptions = new ArrayList<>();

    @Property(category = "Content")
    private String selectedOption = "";

    @Property(category = "Appearance", clampMin = "0", uiMax = "1000")
    private float maxListHeight = 450f;

    public ComboBoxString(String name) {
        super(name);
    }

    public List<String> getDefaultOptions() { return defaultOptions; }
    public void setDefaultOptions(List<String> options) { this.defaultOptions = options; }
    public String getSelectedOption() { return selectedOption; }
    public void setSelectedOption(String selectedOption) { this.selectedOption = selectedOption; }
    public float getMaxListHeight() { return maxListHeight; }
    public void setMaxListHeight(float maxListHeight) { this.maxListHeight = maxListHeight; }
}
