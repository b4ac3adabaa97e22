package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * What a panel renders. Either a legacy layout (content, embeds, action rows)
 * or a modern layout whose components are {@link Container}s.
 */
@Data
@Builder(toBuilder = true)
public class PanelResponse {

    private String content;
    @Singular
    private List<Embed> embeds;
    @Singular
    private List<PanelComponent> components;
    @Singular
    private List<PanelFile> files;
    private boolean ephemeral;
    /** Close the panel after delivering the notification, if any. */
    private boolean closePanel;
    private Notification notification;

    /**
     * A response is modern when its first top-level component is a container.
     */
    public boolean isModern() {
        return components != null && !components.isEmpty() && components.get(0) instanceof Container;
    }

    public static PanelResponse ofContent(String content) {
        return PanelResponse.builder().content(content).build();
    }

    public static PanelResponse notificationOnly(Notification notification) {
        return PanelResponse.builder().notification(notification).build();
    }

    public static PanelResponse close(Notification notification) {
        return PanelResponse.builder().closePanel(true).notification(notification).build();
    }
}
