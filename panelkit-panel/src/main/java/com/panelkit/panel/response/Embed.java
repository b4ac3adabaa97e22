package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

/**
 * Rich embed used by legacy layouts.
 */
@Data
@Builder(toBuilder = true)
public class Embed {

    private String title;
    private String description;
    private String url;
    private Integer color;
    private Instant timestamp;
    private Footer footer;
    private Author author;
    private String thumbnailUrl;
    private String imageUrl;
    @Singular
    private List<Field> fields;

    public record Field(String name, String value, boolean inline) {

        public static Field of(String name, String value) {
            return new Field(name, value, false);
        }
    }

    public record Footer(String text, String iconUrl) {

        public static Footer of(String text) {
            return new Footer(text, null);
        }
    }

    public record Author(String name, String url, String iconUrl) {
    }
}
