package com.questrail.interactions.client;

import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.InteractionKind;
import com.questrail.interactions.config.InteractionClientConfig;
import com.questrail.interactions.context.ComponentContext;
import com.questrail.interactions.context.DeliveryMode;
import com.questrail.interactions.context.ResponseTimers;
import com.questrail.interactions.executor.InteractionExecutor;
import com.questrail.interactions.transport.InteractionTransport;

/**
 * Client for button and select menu interactions.
 *
 * <pre>{@code
 * ComponentClient client = ComponentClient.builder()
 *     .withTransport(restTransport)
 *     .withGateway(gateway)
 *     .build();
 * client.registerExecutor(new ComponentExecutor()
 *     .addCallback("vote", ctx -> ctx.respond("Thanks for voting " + ctx.idMetadata())));
 * client.open();
 * }</pre>
 *
 * <p>Unless configured otherwise, registrations expire after two idle minutes
 * and are never limited in uses.</p>
 */
public final class ComponentClient
    extends AbstractInteractionClient<ComponentContext, InteractionExecutor<ComponentContext>>
{
    public static final String TIMED_OUT_MESSAGE = "This message has timed-out.";

    private ComponentClient(Builder builder) {
        super(InteractionKind.COMPONENT, TIMED_OUT_MESSAGE, builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected ComponentContext newContext(
        Interaction interaction, InteractionTransport transport, DeliveryMode delivery, ResponseTimers timers)
    {
        return new ComponentContext(interaction, transport, delivery, timers);
    }

    public static final class Builder extends AbstractInteractionClient.Builder<ComponentClient, Builder> {
        private Builder() {
            super(InteractionClientConfig.componentDefaults());
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public ComponentClient build() {
            return new ComponentClient(this);
        }
    }
}
