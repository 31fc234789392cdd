package com.ciro.jprops.model;

public class VerticalBoxSlot extends BoxSlot {
}
