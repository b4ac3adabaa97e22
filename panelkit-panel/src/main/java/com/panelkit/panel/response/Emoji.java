package com.panelkit.panel.response;

/**
 * A unicode emoji (name only) or a custom platform emoji (name + id).
 */
public record Emoji(String name, String id, boolean animated) {

    public static Emoji unicode(String character) {
        return new Emoji(character, null, false);
    }

    public static Emoji custom(String name, String id, boolean animated) {
        return new Emoji(name, id, animated);
    }
}
