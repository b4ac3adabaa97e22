package com.panelkit.panel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Durable record of one standing panel message.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PanelInstance {

    public static final String STATE_ACTIVE = "active";

    private String messageId;
    private String channelId;
    private String userId;
    private String guildId;
    private long createdAt;
    private long lastUpdated;
    private String state;
    /** Last rendered response as a neutral document. */
    private JsonNode sessionData;
    private AccessMethod accessMethod;

    @JsonIgnore
    public RenderTarget renderTarget() {
        return new RenderTarget(channelId, messageId);
    }

    @JsonIgnore
    public AccessMethod accessMethodOrDefault() {
        return accessMethod != null ? accessMethod : AccessMethod.DIRECT_COMMAND;
    }
}
