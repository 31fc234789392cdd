package com.ciro.jprops.model;

public class HorizontalBoxSlot extends BoxSlot {
}
