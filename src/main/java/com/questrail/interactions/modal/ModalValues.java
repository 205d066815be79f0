package com.questrail.interactions.modal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Field values extracted from a modal submission, in template order.
 *
 * <p>Submitted values are strings. A defaulted field holds its declared
 * default, which may be of any type or {@code null}.</p>
 */
public final class ModalValues
{
    private final List<Object> values;

    ModalValues(List<Object> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    public <T> T get(int index, Class<T> type) {
        Object value = values.get(index);
        if (value != null && !type.isInstance(value)) {
            throw new ClassCastException("Modal value " + index + " is a "
                + value.getClass().getName() + ", not a " + type.getName());
        }
        return type.cast(value);
    }

    public String getString(int index) {
        return get(index, String.class);
    }

    public List<Object> asList() {
        return values;
    }

    @Override
    public String toString() {
        return "ModalValues" + values;
    }
}
