package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.ArrayList;
import java.util.List;

/**
 * Text displays with at most one accessory, a {@link Button} or a {@link Thumbnail}.
 */
@Data
@Builder(toBuilder = true)
public final class Section implements PanelComponent {

    @Singular
    private List<TextDisplay> textDisplays;
    private PanelComponent accessory;

    @Override
    public List<PanelComponent> children() {
        List<PanelComponent> children = new ArrayList<>();
        if (textDisplays != null) {
            children.addAll(textDisplays);
        }
        if (accessory != null) {
            children.add(accessory);
        }
        return children;
    }
}
