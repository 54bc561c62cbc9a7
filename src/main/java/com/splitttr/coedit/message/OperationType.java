package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OperationType {
    @JsonProperty("insert") INSERT,
    @JsonProperty("delete") DELETE,
    @JsonProperty("replace") REPLACE,
    @JsonProperty("format") FORMAT,
    @JsonProperty("move") MOVE
}
