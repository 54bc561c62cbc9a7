package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageType {
    @JsonProperty("join") JOIN,
    @JsonProperty("leave") LEAVE,
    @JsonProperty("cursor_move") CURSOR_MOVE,
    @JsonProperty("selection") SELECTION,
    @JsonProperty("operation") OPERATION,
    @JsonProperty("presence") PRESENCE,
    @JsonProperty("sync_request") SYNC_REQUEST,
    @JsonProperty("sync_response") SYNC_RESPONSE,
    @JsonProperty("lock") LOCK,
    @JsonProperty("unlock") UNLOCK
}
