package com.panelkit.panel.response;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Popup form. Rows are {@link ActionRow}s of {@link TextInput}/{@link SelectMenu}
 * or bare {@link FileUpload}s.
 */
@Data
@Builder(toBuilder = true)
public class Modal {
    private String customId;
    private String title;
    @Singular
    private List<PanelComponent> components;
}
