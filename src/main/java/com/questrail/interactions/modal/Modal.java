package com.questrail.interactions.modal;

import com.questrail.interactions.api.SubmittedField;
import com.questrail.interactions.context.ModalContext;
import com.questrail.interactions.executor.InteractionExecutor;
import com.questrail.interactions.id.CustomIds;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Modal
 * =============================================================================
 * Executor for a modal submission: a {@link ModalTemplate} and one callback.
 *
 * <h2>Field extraction</h2>
 * Before the callback runs every declared field is resolved against the
 * submission, in template order:
 * <ul>
 *   <li>submitted keys are compared by their match segment; a prefix field
 *       takes the first submitted key (in key order) starting with its id;</li>
 *   <li>a present field of another type fails with {@link FieldTypeMismatchException};</li>
 *   <li>an absent or empty field takes its default, or fails with
 *       {@link MissingFieldException} when it has none.</li>
 * </ul>
 */
public final class Modal implements InteractionExecutor<ModalContext>
{
    private final ModalTemplate template;
    private final ModalCallback callback;
    private final boolean ephemeralDefault;

    public Modal(ModalTemplate template, ModalCallback callback) {
        this(template, callback, false);
    }

    public Modal(ModalTemplate template, ModalCallback callback, boolean ephemeralDefault) {
        this.template = Objects.requireNonNull(template, "template");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.ephemeralDefault = ephemeralDefault;
    }

    public ModalTemplate template() {
        return template;
    }

    /** A modal is registered under an explicit id, so it has no keys of its own. */
    @Override
    public Set<String> customIds() {
        return Set.of();
    }

    @Override
    public void execute(ModalContext context) {
        ModalValues values = extract(context.fields());
        context.setEphemeralDefault(ephemeralDefault);
        callback.onSubmit(context, values);
    }

    public ModalValues extract(Map<String, SubmittedField> submitted) {
        Map<String, SubmittedField> byMatch = new TreeMap<>();
        submitted.forEach((key, field) -> byMatch.putIfAbsent(CustomIds.split(key).idMatch(), field));

        List<Object> values = new ArrayList<>(template.size());
        for (FieldDescriptor descriptor : template.fields()) {
            SubmittedField field = find(byMatch, descriptor);

            if (field != null && field.type() != descriptor.type()) {
                throw new FieldTypeMismatchException(descriptor.customId(), descriptor.type(), field.type());
            }
            if (field == null || field.isEmpty()) {
                if (!descriptor.hasDefault()) {
                    throw new MissingFieldException(descriptor.customId());
                }
                values.add(descriptor.defaultValue());
            } else {
                values.add(field.value());
            }
        }
        return new ModalValues(values);
    }

    private static SubmittedField find(Map<String, SubmittedField> byMatch, FieldDescriptor descriptor) {
        if (!descriptor.prefixMatch()) {
            return byMatch.get(descriptor.customId());
        }
        for (Map.Entry<String, SubmittedField> entry : byMatch.entrySet()) {
            if (entry.getKey().startsWith(descriptor.customId())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
