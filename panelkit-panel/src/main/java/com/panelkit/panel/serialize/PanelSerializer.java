package com.panelkit.panel.serialize;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelkit.panel.platform.ResolvedUser;
import com.panelkit.panel.response.ActionRow;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.Container;
import com.panelkit.panel.response.Embed;
import com.panelkit.panel.response.Emoji;
import com.panelkit.panel.response.FileComponent;
import com.panelkit.panel.response.FileUpload;
import com.panelkit.panel.response.MediaGallery;
import com.panelkit.panel.response.Modal;
import com.panelkit.panel.response.Notification;
import com.panelkit.panel.response.PanelComponent;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.response.Section;
import com.panelkit.panel.response.SelectMenu;
import com.panelkit.panel.response.SelectOption;
import com.panelkit.panel.response.Separator;
import com.panelkit.panel.response.TextDisplay;
import com.panelkit.panel.response.TextInput;
import com.panelkit.panel.response.Thumbnail;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a {@link PanelResponse} into the neutral JSON document consumed by
 * the web mirror. Absent optional fields are omitted.
 *
 * <p>Legacy layouts produce {@code content}, {@code embeds} and action-row
 * {@code components}; modern layouts produce {@code isV2: true} and {@code containers}.
 */
public final class PanelSerializer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Pattern MENTION = Pattern.compile("<@!?(\\d+)>");

    private PanelSerializer() {
    }

    public static ObjectNode serialize(PanelResponse response) {
        return serialize(response, Map.of());
    }

    public static ObjectNode serialize(PanelResponse response, Map<String, ResolvedUser> resolvedUsers) {
        ObjectNode doc = NODES.objectNode();
        if (response.isModern()) {
            doc.put("isV2", true);
            ArrayNode containers = doc.putArray("containers");
            for (PanelComponent component : response.getComponents()) {
                if (component instanceof Container container) {
                    containers.add(container(container));
                }
            }
        } else {
            putIfPresent(doc, "content", response.getContent());
            if (!response.getEmbeds().isEmpty()) {
                ArrayNode embeds = doc.putArray("embeds");
                response.getEmbeds().forEach(embed -> embeds.add(embed(embed)));
            }
            if (!response.getComponents().isEmpty()) {
                ArrayNode rows = doc.putArray("components");
                for (PanelComponent component : response.getComponents()) {
                    if (component instanceof ActionRow row) {
                        rows.add(actionRow(row));
                    }
                }
            }
        }
        if (response.isEphemeral()) {
            doc.put("ephemeral", true);
        }
        if (resolvedUsers != null && !resolvedUsers.isEmpty()) {
            ObjectNode users = doc.putObject("resolvedUsers");
            resolvedUsers.forEach((id, user) -> users.set(id, user(user)));
        }
        if (response.getNotification() != null) {
            doc.set("notification", notification(response.getNotification()));
        }
        return doc;
    }

    /**
     * Neutral document for a modal request: {@code {"modal": {...}}}.
     */
    public static ObjectNode serializeModalResponse(Modal modal) {
        ObjectNode doc = NODES.objectNode();
        doc.set("modal", modal(modal));
        return doc;
    }

    public static ObjectNode modal(Modal modal) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "modal");
        node.put("customId", modal.getCustomId());
        node.put("title", modal.getTitle());
        ArrayNode rows = node.putArray("components");
        for (PanelComponent component : modal.getComponents()) {
            ObjectNode row;
            if (component instanceof ActionRow actionRow) {
                row = actionRow(actionRow);
            } else {
                row = NODES.objectNode();
                row.put("type", "action_row");
                row.putArray("components").add(component(component));
            }
            if (!row.path("components").isEmpty()) {
                rows.add(row);
            }
        }
        return node;
    }

    public static ObjectNode notification(Notification notification) {
        ObjectNode node = NODES.objectNode();
        node.put("type", notification.type().wireName());
        node.put("message", notification.message());
        putIfPresent(node, "title", notification.title());
        if (notification.silent()) {
            node.put("silent", true);
        }
        return node;
    }

    /**
     * Distinct user ids mentioned ({@code <@id>} or {@code <@!id>}) in content and embeds.
     */
    public static Set<String> extractUserIds(PanelResponse response) {
        Set<String> ids = new LinkedHashSet<>();
        collectMentions(response.getContent(), ids);
        for (Embed embed : response.getEmbeds()) {
            collectMentions(embed.getTitle(), ids);
            collectMentions(embed.getDescription(), ids);
            for (Embed.Field field : embed.getFields()) {
                collectMentions(field.name(), ids);
                collectMentions(field.value(), ids);
            }
            if (embed.getFooter() != null) {
                collectMentions(embed.getFooter().text(), ids);
            }
            if (embed.getAuthor() != null) {
                collectMentions(embed.getAuthor().name(), ids);
            }
        }
        return ids;
    }

    static void collectMentions(String text, Set<String> into) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Matcher matcher = MENTION.matcher(text);
        while (matcher.find()) {
            into.add(matcher.group(1));
        }
    }

    private static ObjectNode embed(Embed embed) {
        ObjectNode node = NODES.objectNode();
        putIfPresent(node, "title", embed.getTitle());
        putIfPresent(node, "description", embed.getDescription());
        if (embed.getColor() != null) {
            node.put("color", embed.getColor());
        }
        if (!embed.getFields().isEmpty()) {
            ArrayNode fields = node.putArray("fields");
            for (Embed.Field field : embed.getFields()) {
                ObjectNode f = fields.addObject();
                f.put("name", field.name());
                f.put("value", field.value());
                if (field.inline()) {
                    f.put("inline", true);
                }
            }
        }
        if (embed.getAuthor() != null) {
            ObjectNode author = node.putObject("author");
            putIfPresent(author, "name", embed.getAuthor().name());
            putIfPresent(author, "iconURL", embed.getAuthor().iconUrl());
            putIfPresent(author, "url", embed.getAuthor().url());
        }
        if (embed.getFooter() != null) {
            ObjectNode footer = node.putObject("footer");
            putIfPresent(footer, "text", embed.getFooter().text());
            putIfPresent(footer, "iconURL", embed.getFooter().iconUrl());
        }
        if (embed.getThumbnailUrl() != null) {
            node.putObject("thumbnail").put("url", embed.getThumbnailUrl());
        }
        if (embed.getImageUrl() != null) {
            node.putObject("image").put("url", embed.getImageUrl());
        }
        if (embed.getTimestamp() != null) {
            node.put("timestamp", embed.getTimestamp().toString());
        }
        putIfPresent(node, "url", embed.getUrl());
        return node;
    }

    private static ObjectNode actionRow(ActionRow row) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "action_row");
        ArrayNode components = node.putArray("components");
        for (PanelComponent child : row.getComponents()) {
            ObjectNode serialized = component(child);
            if (serialized != null) {
                components.add(serialized);
            }
        }
        return node;
    }

    private static ObjectNode container(Container container) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "container");
        if (container.getAccentColor() != null) {
            node.put("accentColor", container.getAccentColor());
        }
        ArrayNode components = node.putArray("components");
        for (PanelComponent child : container.getComponents()) {
            ObjectNode serialized = component(child);
            if (serialized != null) {
                components.add(serialized);
            }
        }
        return node;
    }

    private static ObjectNode component(PanelComponent component) {
        if (component instanceof ActionRow row) {
            return actionRow(row);
        } else if (component instanceof Button button) {
            return button(button);
        } else if (component instanceof SelectMenu menu) {
            return select(menu);
        } else if (component instanceof TextInput input) {
            return textInput(input);
        } else if (component instanceof FileUpload upload) {
            return fileUpload(upload);
        } else if (component instanceof Container container) {
            return container(container);
        } else if (component instanceof Section section) {
            return section(section);
        } else if (component instanceof TextDisplay text) {
            return textDisplay(text);
        } else if (component instanceof Separator separator) {
            return separator(separator);
        } else if (component instanceof Thumbnail thumbnail) {
            return thumbnail(thumbnail);
        } else if (component instanceof MediaGallery gallery) {
            return mediaGallery(gallery);
        } else if (component instanceof FileComponent file) {
            return file(file);
        }
        return null;
    }

    private static ObjectNode button(Button button) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "button");
        putIfPresent(node, "customId", button.getCustomId());
        putIfPresent(node, "label", button.getLabel());
        node.put("style", button.getStyle().value());
        if (button.getEmoji() != null) {
            node.set("emoji", emoji(button.getEmoji()));
        }
        putIfPresent(node, "url", button.getUrl());
        if (button.isDisabled()) {
            node.put("disabled", true);
        }
        return node;
    }

    private static ObjectNode select(SelectMenu menu) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "select");
        node.put("customId", menu.getCustomId());
        putIfPresent(node, "placeholder", menu.getPlaceholder());
        ArrayNode options = node.putArray("options");
        for (SelectOption option : menu.getOptions()) {
            ObjectNode o = options.addObject();
            o.put("label", option.getLabel());
            o.put("value", option.getValue());
            putIfPresent(o, "description", option.getDescription());
            if (option.getEmoji() != null) {
                o.set("emoji", emoji(option.getEmoji()));
            }
            if (option.isSelectedByDefault()) {
                o.put("default", true);
            }
        }
        if (menu.getMinValues() != null) {
            node.put("minValues", menu.getMinValues());
        }
        if (menu.getMaxValues() != null) {
            node.put("maxValues", menu.getMaxValues());
        }
        if (menu.isDisabled()) {
            node.put("disabled", true);
        }
        return node;
    }

    private static ObjectNode textInput(TextInput input) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "text_input");
        node.put("customId", input.getCustomId());
        node.put("label", input.getLabel() != null ? input.getLabel() : "");
        node.put("style", input.getStyle().value());
        putIfPresent(node, "value", input.getValue());
        putIfPresent(node, "placeholder", input.getPlaceholder());
        node.put("required", input.isRequired());
        if (input.getMinLength() != null) {
            node.put("minLength", input.getMinLength());
        }
        if (input.getMaxLength() != null) {
            node.put("maxLength", input.getMaxLength());
        }
        return node;
    }

    private static ObjectNode fileUpload(FileUpload upload) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "file_upload");
        node.put("customId", upload.getCustomId() != null ? upload.getCustomId() : "file_upload");
        node.put("label", upload.getLabel() != null ? upload.getLabel() : "File");
        putIfPresent(node, "description", upload.getDescription());
        node.put("required", upload.isRequired());
        node.put("minValues", upload.getMinValues());
        node.put("maxValues", upload.getMaxValues());
        putIfPresent(node, "accept", upload.getAccept());
        return node;
    }

    private static ObjectNode section(Section section) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "section");
        ArrayNode texts = node.putArray("textDisplays");
        section.getTextDisplays().forEach(text -> texts.add(textDisplay(text)));
        PanelComponent accessory = section.getAccessory();
        if (accessory instanceof Button button) {
            node.set("accessory", button(button));
        } else if (accessory instanceof Thumbnail thumbnail) {
            node.set("accessory", thumbnail(thumbnail));
        }
        return node;
    }

    private static ObjectNode textDisplay(TextDisplay text) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "text_display");
        node.put("content", text.content() != null ? text.content() : "");
        return node;
    }

    private static ObjectNode separator(Separator separator) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "separator");
        node.put("spacing", separator.spacing());
        node.put("divider", separator.divider());
        return node;
    }

    private static ObjectNode thumbnail(Thumbnail thumbnail) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "thumbnail");
        node.put("url", thumbnail.url() != null ? thumbnail.url() : "");
        putIfPresent(node, "description", thumbnail.description());
        return node;
    }

    private static ObjectNode mediaGallery(MediaGallery gallery) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "media_gallery");
        ArrayNode items = node.putArray("items");
        List<MediaGallery.Item> source = gallery.items() != null ? gallery.items() : List.of();
        for (MediaGallery.Item item : source) {
            ObjectNode i = items.addObject();
            i.put("url", item.url() != null ? item.url() : "");
            putIfPresent(i, "description", item.description());
        }
        return node;
    }

    private static ObjectNode file(FileComponent file) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "file");
        node.put("url", file.url() != null ? file.url() : "");
        putIfPresent(node, "filename", file.filename());
        return node;
    }

    private static ObjectNode emoji(Emoji emoji) {
        ObjectNode node = NODES.objectNode();
        putIfPresent(node, "name", emoji.name());
        putIfPresent(node, "id", emoji.id());
        if (emoji.animated()) {
            node.put("animated", true);
        }
        return node;
    }

    private static ObjectNode user(ResolvedUser user) {
        ObjectNode node = NODES.objectNode();
        node.put("id", user.id());
        node.put("username", user.username());
        putIfPresent(node, "displayName", user.displayName());
        putIfPresent(node, "avatarURL", user.avatarURL());
        return node;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
