package com.gt.curator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gt.curator.exception.ValidationException;

public enum ReviewOrder {
    Urgency("urgency"),
    Random("random"),
    Oldest("oldest"),
    Difficulty("difficulty");

    private final String id;

    ReviewOrder(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static ReviewOrder fromId(String id) {
        if (id == null) {
            return null;
        }

        for (ReviewOrder reviewOrder : values()) {
            if (reviewOrder.id.equalsIgnoreCase(id)) {
                return reviewOrder;
            }
        }

        throw new ValidationException("Unknown review order " + id);
    }
}
