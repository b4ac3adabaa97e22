package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class SelectOption {
    private String label;
    private String value;
    private String description;
    private Emoji emoji;
    private boolean selectedByDefault;
}
