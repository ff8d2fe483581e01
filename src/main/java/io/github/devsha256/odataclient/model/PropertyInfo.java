package io.github.devsha256.odataclient.model;

/**
 * A small record describing a property found in metadata.
 * {@code maxLength} is null when the metadata does not declare one.
 */
public record PropertyInfo(String name, String type, boolean nullable, Integer maxLength) { }
