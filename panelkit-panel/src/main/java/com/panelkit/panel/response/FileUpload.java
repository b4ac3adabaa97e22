package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;

/**
 * Modal file picker, rendered natively inside a label.
 */
@Data
@Builder(toBuilder = true)
public final class FileUpload implements PanelComponent {
    private String customId;
    private String label;
    private String description;
    @Builder.Default
    private boolean required = true;
    @Builder.Default
    private int minValues = 1;
    @Builder.Default
    private int maxValues = 1;
    /** File type filter for the web client, e.g. {@code .json}. */
    @Builder.Default
    private String accept = ".json";
}
