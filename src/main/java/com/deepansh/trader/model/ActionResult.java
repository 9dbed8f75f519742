package com.deepansh.trader.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Uniform envelope returned by every dispatched action.
 * Exactly one of payload or error is meaningful, selected by success.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResult {

    private boolean success;
    private Object payload;
    private String error;
    private Instant timestamp;

    public static ActionResult ok(Object payload) {
        return ActionResult.builder()
                .success(true)
                .payload(payload)
                .timestamp(Instant.now())
                .build();
    }

    public static ActionResult failure(String error) {
        return ActionResult.builder()
                .success(false)
                .error(error)
                .timestamp(Instant.now())
                .build();
    }
}
