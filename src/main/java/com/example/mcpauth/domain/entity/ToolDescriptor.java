package com.example.mcpauth.domain.entity;

/**
 * A tool exposed to authenticated clients. Restricted tools require the caller to be on the
 * access allow-list.
 */
public record ToolDescriptor(
    String name,
    String description,
    boolean restricted
) {}
