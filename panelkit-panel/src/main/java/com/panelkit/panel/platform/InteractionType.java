package com.panelkit.panel.platform;

public enum InteractionType {
    BUTTON,
    SELECT_MENU,
    MODAL_SUBMIT
}
