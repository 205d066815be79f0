package com.questrail.interactions.api;

/**
 * Type of a field submitted with a modal.
 */
public enum FieldType {
    TEXT_INPUT,
    STRING_SELECT
}
