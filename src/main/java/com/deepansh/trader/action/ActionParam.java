package com.deepansh.trader.action;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes one input field to the oracle. The text lands verbatim in the
 * generated JSON schema, so write it for the model, not for developers.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
public @interface ActionParam {

    String value();
}
