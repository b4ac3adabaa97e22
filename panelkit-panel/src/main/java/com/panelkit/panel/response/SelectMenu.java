package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

@Data
@Builder(toBuilder = true)
public final class SelectMenu implements PanelComponent {
    private String customId;
    private String placeholder;
    @Singular
    private List<SelectOption> options;
    private Integer minValues;
    private Integer maxValues;
    private boolean disabled;
}
