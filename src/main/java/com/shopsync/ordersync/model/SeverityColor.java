package com.shopsync.ordersync.model;

/**
 * Row background colours used on the ledger. The first four are the classifier vocabulary;
 * {@link #GREY} marks cancelled rows and {@link #NONE} clears the fill.
 */
public enum SeverityColor {
    GREEN("Green", 0.7f, 0.9f, 0.7f),
    YELLOW("Yellow", 1f, 1f, 0.7f),
    ORANGE("Orange", 1f, 0.85f, 0.6f),
    RED("Red", 0.95f, 0.7f, 0.7f),
    GREY("Grey", 0.85f, 0.85f, 0.85f),
    NONE("None", 1f, 1f, 1f);

    private final String label;
    private final float red;
    private final float green;
    private final float blue;

    SeverityColor(String label, float red, float green, float blue) {
        this.label = label;
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    public String getLabel() { return label; }
    public float getRed() { return red; }
    public float getGreen() { return green; }
    public float getBlue() { return blue; }
}
