package com.questrail.interactions.client;

import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.InteractionKind;
import com.questrail.interactions.config.InteractionClientConfig;
import com.questrail.interactions.context.DeliveryMode;
import com.questrail.interactions.context.ModalContext;
import com.questrail.interactions.context.ResponseTimers;
import com.questrail.interactions.executor.InteractionExecutor;
import com.questrail.interactions.transport.InteractionTransport;

/**
 * Client for modal submissions.
 *
 * <p>A modal is normally submitted once, so the default policy allows a
 * single use within two minutes.</p>
 */
public final class ModalClient
    extends AbstractInteractionClient<ModalContext, InteractionExecutor<ModalContext>>
{
    public static final String TIMED_OUT_MESSAGE = "This modal has timed-out.";

    private ModalClient(Builder builder) {
        super(InteractionKind.MODAL, TIMED_OUT_MESSAGE, builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected ModalContext newContext(
        Interaction interaction, InteractionTransport transport, DeliveryMode delivery, ResponseTimers timers)
    {
        return new ModalContext(interaction, transport, delivery, timers);
    }

    public static final class Builder extends AbstractInteractionClient.Builder<ModalClient, Builder> {
        private Builder() {
            super(InteractionClientConfig.modalDefaults());
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public ModalClient build() {
            return new ModalClient(this);
        }
    }
}
