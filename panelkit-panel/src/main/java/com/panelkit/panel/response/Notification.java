package com.panelkit.panel.response;

/**
 * Toast shown next to a panel. On chat it is an ephemeral follow-up unless
 * {@code silent}; the web client always shows it.
 */
public record Notification(NotificationType type, String message, String title, boolean silent) {

    public static Notification of(NotificationType type, String message) {
        return new Notification(type, message, null, false);
    }

    /**
     * Chat follow-up text: {@code {emoji} **title**\nmessage}, title line omitted when absent.
     */
    public String toChatText() {
        String heading = title != null && !title.isEmpty() ? "**" + title + "**\n" : "";
        return type.emoji() + " " + heading + message;
    }
}
