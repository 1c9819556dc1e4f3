package com.rulesdsl.builder;

/**
 * Id and display name of a coverage or form.
 */
public record NamedRef(String id, String name) {
}
