package com.panelkit.panel.serialize;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelkit.panel.response.ActionRow;
import com.panelkit.panel.response.Button;
import com.panelkit.panel.response.Container;
import com.panelkit.panel.response.Embed;
import com.panelkit.panel.response.Emoji;
import com.panelkit.panel.response.FileComponent;
import com.panelkit.panel.response.FileUpload;
import com.panelkit.panel.response.MediaGallery;
import com.panelkit.panel.response.Modal;
import com.panelkit.panel.response.PanelComponent;
import com.panelkit.panel.response.PanelResponse;
import com.panelkit.panel.response.Section;
import com.panelkit.panel.response.SelectMenu;
import com.panelkit.panel.response.SelectOption;
import com.panelkit.panel.response.Separator;
import com.panelkit.panel.response.TextDisplay;
import com.panelkit.panel.response.TextInput;
import com.panelkit.panel.response.Thumbnail;

/**
 * Encodes a {@link PanelResponse} as the chat platform's native message payload
 * (numeric component types, snake_case keys, message flags).
 */
public final class NativePayloadEncoder {

    public static final int FLAG_EPHEMERAL = 64;
    public static final int FLAG_COMPONENTS_V2 = 32768;

    static final int TYPE_ACTION_ROW = 1;
    static final int TYPE_BUTTON = 2;
    static final int TYPE_STRING_SELECT = 3;
    static final int TYPE_TEXT_INPUT = 4;
    static final int TYPE_SECTION = 9;
    static final int TYPE_TEXT_DISPLAY = 10;
    static final int TYPE_THUMBNAIL = 11;
    static final int TYPE_MEDIA_GALLERY = 12;
    static final int TYPE_FILE = 13;
    static final int TYPE_SEPARATOR = 14;
    static final int TYPE_CONTAINER = 17;
    static final int TYPE_LABEL = 18;
    static final int TYPE_FILE_UPLOAD = 19;

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private NativePayloadEncoder() {
    }

    public static int flags(PanelResponse response) {
        int flags = 0;
        if (response.isEphemeral()) {
            flags |= FLAG_EPHEMERAL;
        }
        if (response.isModern()) {
            flags |= FLAG_COMPONENTS_V2;
        }
        return flags;
    }

    /**
     * Modern payloads carry no content or embeds; the platform rejects them alongside containers.
     */
    public static ObjectNode encode(PanelResponse response) {
        ObjectNode payload = NODES.objectNode();
        if (!response.isModern()) {
            if (response.getContent() != null) {
                payload.put("content", response.getContent());
            }
            ArrayNode embeds = payload.putArray("embeds");
            response.getEmbeds().forEach(embed -> embeds.add(embed(embed)));
        }
        ArrayNode components = payload.putArray("components");
        response.getComponents().forEach(component -> components.add(component(component)));
        int flags = flags(response);
        if (flags != 0) {
            payload.put("flags", flags);
        }
        return payload;
    }

    public static ObjectNode encodeModal(Modal modal) {
        ObjectNode payload = NODES.objectNode();
        payload.put("custom_id", modal.getCustomId());
        payload.put("title", modal.getTitle());
        ArrayNode rows = payload.putArray("components");
        for (PanelComponent component : modal.getComponents()) {
            if (component instanceof FileUpload upload) {
                ObjectNode label = rows.addObject();
                label.put("type", TYPE_LABEL);
                label.put("label", upload.getLabel() != null ? upload.getLabel() : "File");
                if (upload.getDescription() != null) {
                    label.put("description", upload.getDescription());
                }
                label.set("component", component(upload));
            } else {
                rows.add(component(component));
            }
        }
        return payload;
    }

    static ObjectNode embed(Embed embed) {
        ObjectNode node = NODES.objectNode();
        putIfPresent(node, "title", embed.getTitle());
        putIfPresent(node, "description", embed.getDescription());
        putIfPresent(node, "url", embed.getUrl());
        if (embed.getColor() != null) {
            node.put("color", embed.getColor());
        }
        if (embed.getTimestamp() != null) {
            node.put("timestamp", embed.getTimestamp().toString());
        }
        if (embed.getFooter() != null) {
            ObjectNode footer = node.putObject("footer");
            putIfPresent(footer, "text", embed.getFooter().text());
            putIfPresent(footer, "icon_url", embed.getFooter().iconUrl());
        }
        if (embed.getAuthor() != null) {
            ObjectNode author = node.putObject("author");
            putIfPresent(author, "name", embed.getAuthor().name());
            putIfPresent(author, "url", embed.getAuthor().url());
            putIfPresent(author, "icon_url", embed.getAuthor().iconUrl());
        }
        if (embed.getThumbnailUrl() != null) {
            node.putObject("thumbnail").put("url", embed.getThumbnailUrl());
        }
        if (embed.getImageUrl() != null) {
            node.putObject("image").put("url", embed.getImageUrl());
        }
        if (!embed.getFields().isEmpty()) {
            ArrayNode fields = node.putArray("fields");
            for (Embed.Field field : embed.getFields()) {
                fields.addObject()
                        .put("name", field.name())
                        .put("value", field.value())
                        .put("inline", field.inline());
            }
        }
        return node;
    }

    static ObjectNode component(PanelComponent component) {
        ObjectNode node = NODES.objectNode();
        if (component instanceof ActionRow row) {
            node.put("type", TYPE_ACTION_ROW);
            ArrayNode children = node.putArray("components");
            row.getComponents().forEach(child -> children.add(component(child)));
        } else if (component instanceof Button button) {
            node.put("type", TYPE_BUTTON);
            node.put("style", button.getStyle().value());
            putIfPresent(node, "label", button.getLabel());
            putIfPresent(node, "custom_id", button.getCustomId());
            putIfPresent(node, "url", button.getUrl());
            if (button.getEmoji() != null) {
                node.set("emoji", emoji(button.getEmoji()));
            }
            node.put("disabled", button.isDisabled());
        } else if (component instanceof SelectMenu menu) {
            node.put("type", TYPE_STRING_SELECT);
            node.put("custom_id", menu.getCustomId());
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
                o.put("default", option.isSelectedByDefault());
            }
            if (menu.getMinValues() != null) {
                node.put("min_values", menu.getMinValues());
            }
            if (menu.getMaxValues() != null) {
                node.put("max_values", menu.getMaxValues());
            }
            node.put("disabled", menu.isDisabled());
        } else if (component instanceof TextInput input) {
            node.put("type", TYPE_TEXT_INPUT);
            node.put("custom_id", input.getCustomId());
            putIfPresent(node, "label", input.getLabel());
            node.put("style", input.getStyle().value());
            putIfPresent(node, "value", input.getValue());
            putIfPresent(node, "placeholder", input.getPlaceholder());
            node.put("required", input.isRequired());
            if (input.getMinLength() != null) {
                node.put("min_length", input.getMinLength());
            }
            if (input.getMaxLength() != null) {
                node.put("max_length", input.getMaxLength());
            }
        } else if (component instanceof FileUpload upload) {
            node.put("type", TYPE_FILE_UPLOAD);
            node.put("custom_id", upload.getCustomId() != null ? upload.getCustomId() : "file_upload");
            node.put("min_values", upload.getMinValues());
            node.put("max_values", upload.getMaxValues());
            node.put("required", upload.isRequired());
        } else if (component instanceof Container container) {
            node.put("type", TYPE_CONTAINER);
            if (container.getAccentColor() != null) {
                node.put("accent_color", container.getAccentColor());
            }
            ArrayNode children = node.putArray("components");
            container.getComponents().forEach(child -> children.add(component(child)));
        } else if (component instanceof Section section) {
            node.put("type", TYPE_SECTION);
            ArrayNode children = node.putArray("components");
            section.getTextDisplays().forEach(text -> children.add(component(text)));
            if (section.getAccessory() != null) {
                node.set("accessory", component(section.getAccessory()));
            }
        } else if (component instanceof TextDisplay text) {
            node.put("type", TYPE_TEXT_DISPLAY);
            node.put("content", text.content());
        } else if (component instanceof Separator separator) {
            node.put("type", TYPE_SEPARATOR);
            node.put("spacing", separator.spacing());
            node.put("divider", separator.divider());
        } else if (component instanceof Thumbnail thumbnail) {
            node.put("type", TYPE_THUMBNAIL);
            node.putObject("media").put("url", thumbnail.url());
            putIfPresent(node, "description", thumbnail.description());
            node.put("spoiler", thumbnail.spoiler());
        } else if (component instanceof MediaGallery gallery) {
            node.put("type", TYPE_MEDIA_GALLERY);
            ArrayNode items = node.putArray("items");
            if (gallery.items() != null) {
                for (MediaGallery.Item item : gallery.items()) {
                    ObjectNode i = items.addObject();
                    i.putObject("media").put("url", item.url());
                    putIfPresent(i, "description", item.description());
                }
            }
        } else if (component instanceof FileComponent file) {
            node.put("type", TYPE_FILE);
            node.putObject("file").put("url", file.url());
        }
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

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
