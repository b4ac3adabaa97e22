package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;

/**
 * Modal text field.
 */
@Data
@Builder(toBuilder = true)
public final class TextInput implements PanelComponent {

    public enum Style {
        SHORT(1),
        PARAGRAPH(2);

        private final int value;

        Style(int value) {
            this.value = value;
        }

        public int value() {
            return value;
        }
    }

    private String customId;
    private String label;
    @Builder.Default
    private Style style = Style.SHORT;
    private String value;
    private String placeholder;
    @Builder.Default
    private boolean required = true;
    private Integer minLength;
    private Integer maxLength;
}
