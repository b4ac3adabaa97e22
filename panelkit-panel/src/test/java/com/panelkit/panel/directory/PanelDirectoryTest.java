package com.panelkit.panel.directory;

import com.panelkit.common.config.PanelKitConfig;
import com.panelkit.panel.definition.PanelContext;
import com.panelkit.panel.model.AccessMethod;
import com.panelkit.panel.model.PanelScope;
import com.panelkit.panel.response.ActionRow;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.Container;
import com.panelkit.panel.response.PanelComponent;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.response.Section;
import com.panelkit.panel.response.TextDisplay;
import com.panelkit.panel.testing.PanelHarness;
import com.panelkit.panel.testing.TestPanel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PanelDirectoryTest {

    @TempDir
    Path tempDir;

    private PanelHarness harness;
    private PanelKitConfig.AdminPanelConfig config;
    private PanelDirectory directory;
    private final PanelContext viewer = PanelContext.builder()
            .userId("user-1").guildId("guild-1").accessMethod(AccessMethod.GUILD_PANEL).build();

    @BeforeEach
    void setUp() {
        harness = new PanelHarness(tempDir);
        config = new PanelKitConfig.AdminPanelConfig();
        directory = new PanelDirectory(harness.registry, harness.permissions, config);
    }

    private static Container container(PanelResponse response) {
        return (Container) response.getComponents().get(0);
    }

    private static List<Section> sections(PanelResponse response) {
        return container(response).getComponents().stream()
                .filter(Section.class::isInstance)
                .map(Section.class::cast)
                .toList();
    }

    private static ActionRow navRow(PanelResponse response) {
        List<PanelComponent> children = container(response).getComponents();
        return (ActionRow) children.get(children.size() - 1);
    }

    @Test
    void list_filtersByScopeVisibilityAndPermission_sortedByOrderThenName() {
        harness.register(new TestPanel("b").name("beta").order(1));
        harness.register(new TestPanel("a").name("Alpha").order(1));
        harness.register(new TestPanel("first").name("Zulu").order(0));
        harness.register(new TestPanel("hidden").hidden());
        harness.register(new TestPanel("sys").scope(PanelScope.SYSTEM));
        harness.register(new TestPanel("dev").devOnly(true));

        List<DirectoryEntry> entries = directory.list(PanelScope.GUILD, viewer);

        assertEquals(List.of("first", "a", "b"), entries.stream().map(DirectoryEntry::id).toList());
        assertEquals("General", entries.get(0).category());
    }

    @Test
    void byCategory_keepsFirstAppearanceOrder() {
        List<DirectoryEntry> entries = List.of(
                new DirectoryEntry("a", "A", "", "Tools", "📋", 0, PanelScope.GUILD),
                new DirectoryEntry("b", "B", "", "Fun", "📋", 1, PanelScope.GUILD),
                new DirectoryEntry("c", "C", "", "Tools", "📋", 2, PanelScope.GUILD));

        Map<String, List<DirectoryEntry>> grouped = PanelDirectory.byCategory(entries);

        assertEquals(List.of("Tools", "Fun"), List.copyOf(grouped.keySet()));
        assertEquals(2, grouped.get("Tools").size());
    }

    @Test
    void render_main_showsCategorySectionsWithOpenOrBrowse() {
        harness.register(new TestPanel("roles").name("Roles").category("Moderation"));
        harness.register(new TestPanel("bans").name("Bans").category("Moderation"));
        harness.register(new TestPanel("music").name("Music").category("Fun"));

        PanelResponse response = directory.render(PanelScope.GUILD, viewer, 0, null);

        assertTrue(response.isModern());
        assertEquals(new TextDisplay("## Guild Panel"), container(response).getComponents().get(0));
        List<Section> sections = sections(response);
        assertEquals(2, sections.size());
        assertEquals("**📁 Moderation** (2)", sections.get(0).getTextDisplays().get(0).content());
        Button browse = (Button) sections.get(0).getAccessory();
        assertEquals("Browse", browse.getLabel());
        assertEquals("admin_panel_guild_cat_Moderation_0", browse.getCustomId());
        Button open = (Button) sections.get(1).getAccessory();
        assertEquals("Open", open.getLabel());
        assertEquals("admin_panel_guild_open_music", open.getCustomId());
        assertTrue(container(response).getComponents().contains(new TextDisplay("-# 3 panels in 2 categories")));
    }

    @Test
    void render_main_pagesCategories() {
        for (int i = 0; i < 8; i++) {
            harness.register(new TestPanel("p" + i).category("Cat" + i).order(i));
        }

        PanelResponse first = directory.render(PanelScope.SYSTEM, viewer, 0, null);
        PanelResponse second = directory.render(PanelScope.GUILD, viewer, 1, null);
        PanelResponse clamped = directory.render(PanelScope.GUILD, viewer, 99, null);

        assertEquals(0, sections(first).size());
        assertEquals(PanelDirectory.CATEGORIES_PER_PAGE, sections(directory.render(PanelScope.GUILD, viewer, 0, null)).size());
        assertEquals(2, sections(second).size());
        List<PanelComponent> nav = navRow(second).getComponents();
        assertEquals("admin_panel_guild_page_0", ((Button) nav.get(0)).getCustomId());
        assertFalse(((Button) nav.get(0)).isDisabled());
        assertEquals("2/2", ((Button) nav.get(1)).getLabel());
        assertTrue(((Button) nav.get(2)).isDisabled());
        assertEquals("admin_panel_close", ((Button) nav.get(3)).getCustomId());
        assertEquals("2/2", ((Button) navRow(clamped).getComponents().get(1)).getLabel());
    }

    @Test
    void render_category_listsPanelsWithBackButton() {
        config.setItemsPerPage(2);
        harness.register(new TestPanel("a").name("A").category("Mod Tools").order(0));
        harness.register(new TestPanel("b").name("B").category("Mod Tools").order(1));
        harness.register(new TestPanel("c").name("C").category("Mod Tools").order(2));

        PanelResponse page0 = directory.render(PanelScope.GUILD, viewer, 0, "Mod Tools");
        PanelResponse page1 = directory.render(PanelScope.GUILD, viewer, 1, "Mod Tools");

        assertEquals(new TextDisplay("# Mod Tools"), container(page0).getComponents().get(0));
        assertEquals(2, sections(page0).size());
        assertEquals(1, sections(page1).size());
        assertEquals("admin_panel_guild_open_a_fromcat_Mod+Tools",
                ((Button) sections(page0).get(0).getAccessory()).getCustomId());
        List<PanelComponent> nav = navRow(page0).getComponents();
        assertEquals("admin_panel_guild_cat_Mod+Tools_1", ((Button) nav.get(2)).getCustomId());
        assertEquals("admin_panel_guild_menu", ((Button) nav.get(3)).getCustomId());
    }

    @Test
    void render_paginationDisabled_showsEverything() {
        config.setEnablePagination(false);
        for (int i = 0; i < 8; i++) {
            harness.register(new TestPanel("p" + i).category("Cat" + i));
        }

        assertEquals(8, sections(directory.render(PanelScope.GUILD, viewer, 0, null)).size());
    }

    @Test
    void categoryIds_roundTripThroughEncoding() {
        assertEquals("Fun & Games", PanelDirectory.decodeCategory(PanelDirectory.encodeCategory("Fun & Games")));
        assertEquals("admin_panel_system_open_x", PanelDirectory.openId(PanelScope.SYSTEM, "x", null));
    }
}
