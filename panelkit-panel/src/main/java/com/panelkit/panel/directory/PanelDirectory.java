package com.panelkit.panel.directory;

import com.panelkit.common.config.PanelKitConfig;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.definition.PermissionEvaluator;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.render.NavigationControls;
import com.panelkit.panel.response.ActionRow;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.ButtonStyle;
import com.panelkit.panel.response.Container;
import com.panelkit.panel.response.Emoji;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.response.Section;
import com.panelkit.panel.response.Separator;
import com.panelkit.panel.response.TextDisplay;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The panel listing opened by the system and guild panel commands.
 *
 * <p>The main view pages through categories; a category view pages through its
 * panels. Control ids all start with {@code admin_panel_<scope>_}.
 */
public class PanelDirectory {

    public static final int CATEGORIES_PER_PAGE = 6;
    public static final int PREVIEW_ITEMS = 3;
    public static final int MAX_ITEMS_PER_PAGE = 25;
    public static final String PAGE_INDICATOR = "admin_panel_page_indicator";
    public static final String CATEGORY_PAGE_INDICATOR = "admin_panel_cat_page_indicator";
    public static final String FROM_CATEGORY = "_fromcat_";

    static final int COLOR_PRIMARY = 0x5865F2;
    static final int COLOR_SYSTEM = 0xED4245;

    private final PanelRegistry registry;
    private final PermissionEvaluator permissions;
    private final PanelKitConfig.AdminPanelConfig config;

    public PanelDirectory(PanelRegistry registry, PermissionEvaluator permissions,
            PanelKitConfig.AdminPanelConfig config) {
        this.registry = registry;
        this.permissions = permissions;
        this.config = config;
    }

    /**
     * Panels of {@code scope} the viewer may open, ordered by listing order then name.
     */
    public List<DirectoryEntry> list(PanelScope scope, PanelContext viewer) {
        List<DirectoryEntry> entries = new ArrayList<>();
        for (PanelDefinition panel : registry.list()) {
            if (!panel.showInAdminPanel() || panel.scope() != scope) {
                continue;
            }
            PanelContext candidate = viewer.toBuilder().panelId(panel.id()).build();
            if (!permissions.isAllowed(panel, candidate)) {
                continue;
            }
            entries.add(new DirectoryEntry(
                    panel.id(),
                    panel.name(),
                    panel.description(),
                    panel.category() != null ? panel.category() : config.getDefaultCategory(),
                    panel.icon(),
                    panel.adminPanelOrder(),
                    panel.scope()));
        }
        entries.sort(Comparator.comparingInt(DirectoryEntry::order)
                .thenComparing(DirectoryEntry::name, String.CASE_INSENSITIVE_ORDER));
        return entries;
    }

    /**
     * Group entries by category, categories in order of first appearance.
     */
    public static Map<String, List<DirectoryEntry>> byCategory(List<DirectoryEntry> entries) {
        Map<String, List<DirectoryEntry>> grouped = new LinkedHashMap<>();
        for (DirectoryEntry entry : entries) {
            grouped.computeIfAbsent(entry.category(), k -> new ArrayList<>()).add(entry);
        }
        return grouped;
    }

    /**
     * Main view when {@code category} is null, otherwise that category's panels.
     */
    public PanelResponse render(PanelScope scope, PanelContext viewer, int page, String category) {
        List<DirectoryEntry> entries = list(scope, viewer);
        return category != null
                ? renderCategory(scope, entries, category, page)
                : renderMain(scope, entries, page);
    }

    private PanelResponse renderMain(PanelScope scope, List<DirectoryEntry> entries, int page) {
        Map<String, List<DirectoryEntry>> grouped = byCategory(entries);
        List<String> names = new ArrayList<>(grouped.keySet());
        int perPage = config.isEnablePagination() ? CATEGORIES_PER_PAGE : Math.max(1, names.size());
        int totalPages = totalPages(names.size(), perPage);
        int current = clampPage(page, totalPages);
        List<String> pageNames = slice(names, current, perPage);

        Container.ContainerBuilder container = Container.builder()
                .accentColor(scope == PanelScope.SYSTEM ? COLOR_SYSTEM : COLOR_PRIMARY)
                .component(new TextDisplay(scope == PanelScope.SYSTEM ? "## System Panel" : "## Guild Panel"))
                .component(Separator.small());

        for (int i = 0; i < pageNames.size(); i++) {
            String name = pageNames.get(i);
            List<DirectoryEntry> items = grouped.get(name);
            if (i > 0) {
                container.component(Separator.small());
            }
            StringBuilder preview = new StringBuilder();
            for (DirectoryEntry item : items.subList(0, Math.min(PREVIEW_ITEMS, items.size()))) {
                if (preview.length() > 0) {
                    preview.append('\n');
                }
                preview.append("↳ ").append(item.icon()).append(' ').append(item.name());
            }
            if (items.size() > PREVIEW_ITEMS) {
                preview.append("\n↳ ...");
            }
            Button accessory = items.size() == 1
                    ? Button.builder()
                            .customId(openId(scope, items.get(0).id(), null))
                            .label("Open")
                            .emoji(Emoji.unicode("🔍"))
                            .style(ButtonStyle.PRIMARY)
                            .build()
                    : Button.builder()
                            .customId(categoryId(scope, name, 0))
                            .label("Browse")
                            .emoji(Emoji.unicode("📂"))
                            .style(ButtonStyle.SECONDARY)
                            .build();
            container.component(Section.builder()
                    .textDisplay(new TextDisplay("**📁 " + name + "** (" + items.size() + ")"))
                    .textDisplay(new TextDisplay(preview.toString()))
                    .accessory(accessory)
                    .build());
        }

        container.component(Separator.small())
                .component(new TextDisplay("-# " + entries.size() + " panels in " + names.size() + " categories"))
                .component(ActionRow.of(
                        pageButton(prefix(scope) + "page_" + (current - 1), "◀️", current == 0),
                        indicator(PAGE_INDICATOR, current, totalPages),
                        pageButton(prefix(scope) + "page_" + (current + 1), "▶️", current >= totalPages - 1),
                        closeButton()));

        return PanelResponse.builder().component(container.build()).build();
    }

    private PanelResponse renderCategory(PanelScope scope, List<DirectoryEntry> entries, String category, int page) {
        List<DirectoryEntry> items = new ArrayList<>();
        for (DirectoryEntry entry : entries) {
            if (entry.category().equals(category)) {
                items.add(entry);
            }
        }
        int perPage = config.isEnablePagination()
                ? Math.max(1, Math.min(MAX_ITEMS_PER_PAGE, config.getItemsPerPage()))
                : Math.max(1, items.size());
        int totalPages = totalPages(items.size(), perPage);
        int current = clampPage(page, totalPages);

        Container.ContainerBuilder container = Container.builder()
                .accentColor(scope == PanelScope.SYSTEM ? COLOR_SYSTEM : COLOR_PRIMARY)
                .component(new TextDisplay("# " + category))
                .component(Separator.small());
        for (DirectoryEntry item : slice(items, current, perPage)) {
            container.component(Section.builder()
                    .textDisplay(new TextDisplay("**" + item.icon() + " " + item.name() + "**"))
                    .accessory(Button.builder()
                            .customId(openId(scope, item.id(), category))
                            .label("Open")
                            .style(ButtonStyle.PRIMARY)
                            .build())
                    .build());
        }
        container.component(Separator.small())
                .component(new TextDisplay("-# " + items.size() + " panels"))
                .component(ActionRow.of(
                        pageButton(categoryId(scope, category, current - 1), "◀️", current == 0),
                        indicator(CATEGORY_PAGE_INDICATOR, current, totalPages),
                        pageButton(categoryId(scope, category, current + 1), "▶️", current >= totalPages - 1),
                        Button.builder()
                                .customId(prefix(scope) + "menu")
                                .label("Back")
                                .style(ButtonStyle.SECONDARY)
                                .build(),
                        closeButton()));

        return PanelResponse.builder().component(container.build()).build();
    }

    public static String prefix(PanelScope scope) {
        return scope == PanelScope.SYSTEM ? NavigationControls.SYSTEM_PREFIX : NavigationControls.GUILD_PREFIX;
    }

    public static String openId(PanelScope scope, String panelId, String fromCategory) {
        String id = prefix(scope) + "open_" + panelId;
        return fromCategory != null ? id + FROM_CATEGORY + encodeCategory(fromCategory) : id;
    }

    public static String categoryId(PanelScope scope, String category, int page) {
        return prefix(scope) + "cat_" + encodeCategory(category) + "_" + page;
    }

    static String encodeCategory(String category) {
        return URLEncoder.encode(category, StandardCharsets.UTF_8);
    }

    static String decodeCategory(String encoded) {
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }

    private static int totalPages(int items, int perPage) {
        return Math.max(1, (items + perPage - 1) / perPage);
    }

    private static int clampPage(int page, int totalPages) {
        return Math.max(0, Math.min(page, totalPages - 1));
    }

    private static <T> List<T> slice(List<T> items, int page, int perPage) {
        int from = Math.min(items.size(), page * perPage);
        return items.subList(from, Math.min(items.size(), from + perPage));
    }

    private static Button pageButton(String customId, String label, boolean disabled) {
        return Button.builder().customId(customId).label(label).style(ButtonStyle.SECONDARY).disabled(disabled).build();
    }

    private static Button indicator(String customId, int current, int totalPages) {
        return pageButton(customId, (current + 1) + "/" + totalPages, true);
    }

    private static Button closeButton() {
        return Button.builder()
                .customId(NavigationControls.CLOSE)
                .label("Close")
                .emoji(Emoji.unicode("✖"))
                .style(ButtonStyle.DANGER)
                .build();
    }
}
