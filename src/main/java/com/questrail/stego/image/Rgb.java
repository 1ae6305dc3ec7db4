package com.questrail.stego.image;

import com.questrail.stego.config.ColorChannel;

/**
 * A 3-channel colour value, each component in 0–255.
 */
public record Rgb(int red, int green, int blue)
{
    public Rgb {
        checkComponent("red", red);
        checkComponent("green", green);
        checkComponent("blue", blue);
    }

    /**
     * Unpacks a {@code 0xRRGGBB} integer; any alpha byte is ignored.
     */
    public static Rgb fromPacked(int packed) {
        return new Rgb((packed >>> 16) & 0xFF, (packed >>> 8) & 0xFF, packed & 0xFF);
    }

    public int packed() {
        return (red << 16) | (green << 8) | blue;
    }

    public int component(ColorChannel channel) {
        return switch (channel) {
            case RED -> red;
            case GREEN -> green;
            case BLUE -> blue;
        };
    }

    @Override
    public String toString() {
        return String.format("#%02X%02X%02X", red, green, blue);
    }

    private static void checkComponent(String name, int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(name + " component must be in range 0–255 (was " + value + ")");
        }
    }
}
