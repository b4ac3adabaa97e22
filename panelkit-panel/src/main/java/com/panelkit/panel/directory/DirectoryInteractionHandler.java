package com.panelkit.panel.directory;

import com.panelkit.common.logging.SubsystemLogger;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelResult;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.navigation.NavigationContext;
import com.panelkit.panel.navigation.NavigationContextStore;
import com.panelkit.panel.platform.PanelInteraction;
import com.panelkit.panel.platform.PlatformMessage;
import com.panelkit.panel.render.NavigationControls;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.router.FollowUpResponder;
import com.panelkit.panel.router.DispatchOutcome;
import com.panelkit.panel.router.InitialResponder;
import com.panelkit.panel.router.PanelRouter;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Buttons of the panel listing: paging, categories, opening panels, back, menu and close.
 */
public class DirectoryInteractionHandler {

    private static final SubsystemLogger log = SubsystemLogger.create("panel/directory");

    private static final Pattern LIST_ID =
            Pattern.compile("^admin_panel_(system|guild)_(page|cat|open|back|menu)(?:_(.+))?$");
    private static final Pattern PAGE = Pattern.compile("^(-?\\d+)$");
    private static final Pattern CATEGORY_PAGE = Pattern.compile("^(.+)_(-?\\d+)$");

    private final PanelDirectory directory;
    private final PanelRouter router;
    private final NavigationContextStore navigation;

    public DirectoryInteractionHandler(PanelDirectory directory, PanelRouter router,
            NavigationContextStore navigation) {
        this.directory = directory;
        this.router = router;
        this.navigation = navigation;
    }

    public boolean handles(String customId) {
        return NavigationControls.CLOSE.equals(customId)
                || (customId != null && LIST_ID.matcher(customId).matches());
    }

    public CompletableFuture<DispatchOutcome> handle(PanelInteraction interaction) {
        String customId = interaction.customId();
        InitialResponder responder = new InitialResponder(interaction);
        if (NavigationControls.CLOSE.equals(customId)) {
            return responder.defer()
                    .thenCompose(FollowUpResponder::deleteReply)
                    .thenApply(ignored -> DispatchOutcome.CLOSED)
                    .exceptionally(error -> {
                        log.warn("Failed to close panel listing", Map.of(), error);
                        return DispatchOutcome.FAILED;
                    });
        }
        Matcher matcher = customId != null ? LIST_ID.matcher(customId) : null;
        if (matcher == null || !matcher.matches()) {
            return CompletableFuture.completedFuture(DispatchOutcome.DROPPED);
        }
        PanelScope scope = PanelScope.parse(matcher.group(1));
        String action = matcher.group(2);
        String rest = matcher.group(3);
        PanelContext viewer = PanelContext.builder()
                .userId(interaction.userId())
                .guildId(interaction.guildId())
                .channelId(interaction.channelId())
                .accessMethod(scope.listAccessMethod())
                .interaction(interaction)
                .build();

        switch (action) {
            case "page": {
                Matcher page = rest != null ? PAGE.matcher(rest) : null;
                if (page == null || !page.matches() || Integer.parseInt(page.group(1)) < 0) {
                    return CompletableFuture.completedFuture(DispatchOutcome.DROPPED);
                }
                return show(responder, directory.render(scope, viewer, Integer.parseInt(page.group(1)), null));
            }
            case "cat": {
                Matcher category = rest != null ? CATEGORY_PAGE.matcher(rest) : null;
                if (category == null || !category.matches() || Integer.parseInt(category.group(2)) < 0) {
                    return CompletableFuture.completedFuture(DispatchOutcome.DROPPED);
                }
                String name = PanelDirectory.decodeCategory(category.group(1));
                return show(responder, directory.render(scope, viewer, Integer.parseInt(category.group(2)), name));
            }
            case "open":
                return rest == null
                        ? CompletableFuture.completedFuture(DispatchOutcome.DROPPED)
                        : open(responder, interaction, viewer, rest);
            case "back": {
                String source = interaction.message()
                        .flatMap(message -> navigation.get(message.id()))
                        .map(NavigationContext::sourceCategory)
                        .orElse(null);
                return show(responder, directory.render(scope, viewer, 0, source));
            }
            default:
                return show(responder, directory.render(scope, viewer, 0, null));
        }
    }

    private CompletableFuture<DispatchOutcome> open(InitialResponder responder, PanelInteraction interaction,
            PanelContext viewer, String rest) {
        String panelId = rest;
        String sourceCategory = null;
        int marker = rest.indexOf(PanelDirectory.FROM_CATEGORY);
        if (marker > 0) {
            panelId = rest.substring(0, marker);
            sourceCategory = PanelDirectory.decodeCategory(rest.substring(marker + PanelDirectory.FROM_CATEGORY.length()));
        }
        PanelContext context = viewer.toBuilder()
                .panelId(panelId)
                .navigationEntry(panelId)
                .sourceCategory(sourceCategory)
                .build();
        String openedId = panelId;

        return router.openPanel(panelId, context).thenCompose(result -> {
            if (result instanceof PanelResult.ShowModal modal) {
                return responder.showModal(modal.modal()).thenApply(ignored -> DispatchOutcome.MODAL_SHOWN);
            }
            if (result instanceof PanelResult.Render render) {
                return responder.update(render.response()).thenApply(ignored -> {
                    interaction.message().map(PlatformMessage::id).ifPresent(messageId ->
                            navigation.put(messageId, context.getNavigationStack(), context.getAccessMethod(),
                                    context.getSourceCategory(), context.getPanelState()));
                    return DispatchOutcome.UPDATED;
                });
            }
            return CompletableFuture.completedFuture(DispatchOutcome.HANDLED_DIRECTLY);
        }).exceptionally(error -> {
            log.error("Failed to open panel from listing", Map.of("panelId", openedId), error);
            return DispatchOutcome.FAILED;
        });
    }

    private CompletableFuture<DispatchOutcome> show(InitialResponder responder, PanelResponse response) {
        return responder.update(response).thenApply(ignored -> DispatchOutcome.UPDATED);
    }
}
