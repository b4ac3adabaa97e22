package com.panelkit.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Frames exchanged with the web client on the panel mirror socket.
 * <ul>
 * <li>Request: {type:"req", id, method, params?}</li>
 * <li>Response: {type:"res", id, ok, payload?, error?}</li>
 * <li>Event: {type:"event", event, payload?}</li>
 * </ul>
 */
public final class MirrorFrames {

    public static final String LIVE_UPDATE_EVENT = "panel:live_update";
    public static final String CONNECTED_EVENT = "connection:authenticated";

    public static final String PANEL_LIST = "panel.list";
    public static final String PANEL_OPEN = "panel.open";
    public static final String PANEL_BUTTON = "panel.button";
    public static final String PANEL_DROPDOWN = "panel.dropdown";
    public static final String PANEL_MODAL = "panel.modal";
    public static final String PANEL_SUBSCRIBE = "panel.subscribe";
    public static final String PANEL_UNSUBSCRIBE = "panel.unsubscribe";

    /** Methods that never change panel state and skip rate limiting. */
    public static final Set<String> READ_ONLY_METHODS = Set.of(PANEL_LIST, PANEL_SUBSCRIBE, PANEL_UNSUBSCRIBE);

    private MirrorFrames() {
    }

    public static final class ErrorCodes {
        public static final String INVALID_REQUEST = "INVALID_REQUEST";
        public static final String NOT_FOUND = "NOT_FOUND";
        public static final String RATE_LIMITED = "RATE_LIMITED";
        public static final String UNAVAILABLE = "UNAVAILABLE";

        private ErrorCodes() {
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorShape {
        private String code;
        private String message;

        public static ErrorShape of(String code, String message) {
            return new ErrorShape(code, message);
        }
    }

    /** Server → client response frame. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponseFrame {
        private String type = "res";
        private String id;
        private boolean ok;
        private Object payload;
        private ErrorShape error;

        public static ResponseFrame success(String id, Object payload) {
            return new ResponseFrame("res", id, true, payload, null);
        }

        public static ResponseFrame failure(String id, String code, String message) {
            return new ResponseFrame("res", id, false, null, ErrorShape.of(code, message));
        }
    }

    /** Server → client push event. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EventFrame {
        private String type = "event";
        private String event;
        private Object payload;
        private Long seq;

        public static EventFrame of(String event, Object payload) {
            return new EventFrame("event", event, payload, null);
        }
    }
}
