package com.panelkit.panel.definition;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.platform.PanelInteraction;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Everything a panel handler knows about the current call.
 */
@Data
@Builder(toBuilder = true)
public class PanelContext {

    private String panelId;
    private String userId;
    /** Null for global/system use and for the web mirror without a guild. */
    private String guildId;
    /** Target channel, when the web mirror picked one or the interaction has one. */
    private String channelId;
    @Builder.Default
    private AccessMethod accessMethod = AccessMethod.DIRECT_COMMAND;
    @Singular("navigationEntry")
    private List<String> navigationStack;
    private String sourceCategory;
    /** State the panel stored with its navigation context on the previous render. */
    private JsonNode panelState;
    /** The live interaction. Null on the web mirror and during recovery. */
    private PanelInteraction interaction;

    public boolean isWebUi() {
        return accessMethod == AccessMethod.WEB_UI;
    }
}
