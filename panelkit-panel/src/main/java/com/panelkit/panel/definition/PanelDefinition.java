package com.panelkit.panel.definition;

import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.model.RenderTarget;
import com.panelkit.panel.render.PanelResponses;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * A panel: identity, capability flags and handlers.
 *
 * <p>Only {@link #id()} and {@link #onRender} are required. Handlers for
 * interaction kinds a panel does not support answer with an error response.
 * A {@link #unique()} panel must also be {@link #persistent()}.
 */
public interface PanelDefinition {

    String id();

    CompletableFuture<PanelResult> onRender(PanelContext context);

    default String name() {
        return id();
    }

    default String description() {
        return "";
    }

    /** Listing category; null means the configured default category. */
    default String category() {
        return null;
    }

    default PanelScope scope() {
        return PanelScope.GUILD;
    }

    default boolean persistent() {
        return false;
    }

    default boolean unique() {
        return false;
    }

    default int maxActiveInstances() {
        return 1;
    }

    default boolean showInAdminPanel() {
        return true;
    }

    default int adminPanelOrder() {
        return 999;
    }

    default String icon() {
        return "📋";
    }

    default boolean devOnly() {
        return false;
    }

    default Set<String> allowedUsers() {
        return Set.of();
    }

    default boolean mainGuildOnly() {
        return false;
    }

    /** Custom text for the confirmation shown before posting a persistent panel. */
    default String persistentWarningMessage() {
        return null;
    }

    /** Called once on registration. */
    default void initialize() {
    }

    default CompletableFuture<PanelResult> onButton(PanelContext context, String buttonId) {
        return CompletableFuture.completedFuture(PanelResult.render(PanelResponses.error(
                "Button Not Supported", "This panel does not support button interactions.")));
    }

    default CompletableFuture<PanelResult> onDropdown(PanelContext context, List<String> values, String dropdownId) {
        return CompletableFuture.completedFuture(PanelResult.render(PanelResponses.error(
                "Dropdown Not Supported", "This panel does not support dropdown interactions.")));
    }

    default CompletableFuture<PanelResult> onModal(PanelContext context, String modalId, Map<String, String> fields) {
        return CompletableFuture.completedFuture(PanelResult.render(PanelResponses.error(
                "Modal Not Supported", "This panel does not support modal interactions.")));
    }

    /**
     * Refresh hook run in the background after a persistent instance survives a restart.
     * An empty result leaves the message untouched.
     */
    default CompletableFuture<Optional<PanelRefresh>> onRecovered(PanelContext context) {
        return CompletableFuture.completedFuture(Optional.empty());
    }

    /** Called after a persistent panel's standing message has been posted. */
    default void onPersistentCreated(PanelContext context, RenderTarget target) {
    }
}
