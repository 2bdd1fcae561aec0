package com.packsync.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Outcome of an operator-initiated delist. */
@Data
@Builder
public class AdminActionResult {

    private String performanceId;
    private int packsDelisted;
    private int vendorDeletes;
    private int vendorFailures;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
