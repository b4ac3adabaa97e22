package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public final class Button implements PanelComponent {
    private String customId;
    private String label;
    @Builder.Default
    private ButtonStyle style = ButtonStyle.SECONDARY;
    private Emoji emoji;
    /** Only for {@link ButtonStyle#LINK} buttons, which carry no custom id. */
    private String url;
    private boolean disabled;
}
