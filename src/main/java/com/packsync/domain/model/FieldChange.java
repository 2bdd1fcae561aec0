package com.packsync.domain.model;

import lombok.Value;

@Value
public class FieldChange {

    Object oldValue;
    Object newValue;

    public static FieldChange of(Object oldValue, Object newValue) {
        return new FieldChange(oldValue, newValue);
    }
}
