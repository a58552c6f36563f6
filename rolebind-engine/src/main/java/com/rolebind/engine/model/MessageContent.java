package com.rolebind.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Text of the embed a role message was created with; kept so the message can
 * be cloned after the original is gone.
 *
 * @param color hex colour such as "#FF0000", nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageContent(String title, String description, String color) {
}
