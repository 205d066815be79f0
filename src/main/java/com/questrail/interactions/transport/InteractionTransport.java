package com.questrail.interactions.transport;

import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.InteractionResponse;

/**
 * InteractionTransport
 * -----------------------------------------------------------------------------
 * Outbound port for responding to interactions.
 *
 * <p>Calls are made while the interaction's response gate is held, so an
 * implementation may block on the network but must not call back into the
 * same context.</p>
 *
 * <p>Failures are reported as unchecked exceptions and propagate to the
 * callback that triggered the call.</p>
 */
public interface InteractionTransport
{
    /**
     * Send the initial response of a push-delivered interaction.
     */
    void createInitialResponse(Interaction interaction, InteractionResponse response);

    /**
     * Replace the content of the initial response.
     *
     * @return id of the edited message
     */
    String editInitialResponse(Interaction interaction, String content);

    /**
     * Send a further message after the initial response.
     *
     * @return id of the created message
     */
    String createFollowup(Interaction interaction, String content, boolean ephemeral);

    void deleteInitialResponse(Interaction interaction);

    /**
     * Replace the content of a followup message.
     *
     * @param messageId id returned by {@link #createFollowup}
     * @return id of the edited message
     */
    String editMessage(Interaction interaction, String messageId, String content);

    /**
     * @param messageId id returned by {@link #createFollowup}
     */
    void deleteMessage(Interaction interaction, String messageId);
}
