package com.questrail.interactions.context;

import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.modal.ModalTemplate;
import com.questrail.interactions.transport.InteractionTransport;

import java.util.Objects;

/**
 * Context for a button or select menu interaction.
 */
public final class ComponentContext extends InteractionContext
{
    public ComponentContext(
        Interaction interaction, InteractionTransport transport, DeliveryMode delivery, ResponseTimers timers)
    {
        super(interaction, transport, delivery, timers);
    }

    /**
     * Answer the interaction by opening a modal rendered from {@code template}.
     * This is an initial response and follows the same state rules.
     *
     * @param customId custom id the modal submission will carry; register a
     *                 modal executor under it to receive the submission
     */
    public void createModalResponse(String title, String customId, ModalTemplate template) {
        Objects.requireNonNull(template, "template");
        sendInitialResponse(template.toPrompt(title, customId));
    }
}
