package com.panelkit.panel.definition;

import com.panelkit.panel.response.Modal;
import com.panelkit.panel.response.PanelResponse;

import java.util.Objects;

/**
 * What a panel handler produced.
 */
public sealed interface PanelResult
        permits PanelResult.Render, PanelResult.ShowModal, PanelResult.HandledDirectly, PanelResult.Failed {

    record Render(PanelResponse response) implements PanelResult {
        public Render {
            Objects.requireNonNull(response, "response");
        }
    }

    /** Only honoured as a modal while the interaction has not been deferred yet. */
    record ShowModal(Modal modal) implements PanelResult {
        public ShowModal {
            Objects.requireNonNull(modal, "modal");
        }
    }

    /** The handler already acknowledged the interaction itself, e.g. by sending a file. */
    record HandledDirectly() implements PanelResult {
    }

    record Failed(Throwable error) implements PanelResult {
    }

    static PanelResult render(PanelResponse response) {
        return new Render(response);
    }

    static PanelResult modal(Modal modal) {
        return new ShowModal(modal);
    }

    static PanelResult handledDirectly() {
        return new HandledDirectly();
    }

    static PanelResult failed(Throwable error) {
        return new Failed(error);
    }
}
