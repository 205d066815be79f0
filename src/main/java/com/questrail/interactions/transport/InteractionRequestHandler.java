package com.questrail.interactions.transport;

import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.InteractionResponse;

/**
 * Handler for pull-delivered interactions. The returned value is the body of
 * the reply to the platform's request.
 */
@FunctionalInterface
public interface InteractionRequestHandler
{
    InteractionResponse handle(Interaction interaction);
}
