package com.gateflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Snapshot of the target page, fetched once per run and shared by every gate that needs it.
 *
 * @param url         page that was fetched
 * @param available   false when the page could not be fetched; the other fields are then empty
 * @param title       document title
 * @param text        visible text with scripts and styles removed
 * @param inputFields form controls found on the page
 */
public record PageContent(
    String url,
    boolean available,
    String title,
    String text,
    List<InputField> inputFields
) implements Serializable {

    public PageContent {
        inputFields = inputFields != null ? List.copyOf(inputFields) : List.of();
    }

    public static PageContent unavailable(String url) {
        return new PageContent(url, false, "", "", List.of());
    }

    public int inputFieldCount() {
        return inputFields.size();
    }

    /**
     * A form control on the page.
     *
     * @param tag  element name (input, select, textarea)
     * @param type input type attribute, or the tag name for select/textarea
     * @param name name attribute, may be empty
     * @param id   id attribute, may be empty
     */
    public record InputField(String tag, String type, String name, String id) implements Serializable {}
}
