package com.questrail.interactions.context;

import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.SubmittedField;
import com.questrail.interactions.transport.InteractionTransport;

import java.util.Map;

/**
 * Context for a modal submission.
 */
public final class ModalContext extends InteractionContext
{
    public ModalContext(
        Interaction interaction, InteractionTransport transport, DeliveryMode delivery, ResponseTimers timers)
    {
        super(interaction, transport, delivery, timers);
    }

    /** Raw submitted fields keyed by their full custom id. */
    public Map<String, SubmittedField> fields() {
        return interaction().fields();
    }
}
