package com.questrail.interactions.api;

import java.util.List;
import java.util.Objects;

/**
 * InteractionResponse
 * =============================================================================
 * A fully resolved initial response, ready for a transport to put on the wire.
 *
 * <p>Push ingress hands these to the outbound transport. Pull ingress returns
 * them as the body of the request.</p>
 */
public sealed interface InteractionResponse
    permits InteractionResponse.Message, InteractionResponse.Deferred, InteractionResponse.ModalPrompt
{
    /** Message-bearing response ({@code MESSAGE_CREATE} or {@code MESSAGE_UPDATE}). */
    record Message(ResponseType type, String content, boolean ephemeral) implements InteractionResponse {
        public Message {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(content, "content");
            if (type.isDeferred()) {
                throw new IllegalArgumentException("Message response cannot use deferred type " + type);
            }
        }
    }

    /** Acknowledgement that the real response will arrive later as an edit. */
    record Deferred(ResponseType type, boolean ephemeral) implements InteractionResponse {
        public Deferred {
            Objects.requireNonNull(type, "type");
            if (!type.isDeferred()) {
                throw new IllegalArgumentException("Deferred response requires a deferred type, got " + type);
            }
        }
    }

    /** Opens a modal dialog in reply to a component interaction. */
    record ModalPrompt(String title, String customId, List<PromptField> fields) implements InteractionResponse {
        public ModalPrompt {
            Objects.requireNonNull(title, "title");
            Objects.requireNonNull(customId, "customId");
            fields = List.copyOf(fields);
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("modal prompt needs at least one field");
            }
        }
    }

    /** A field rendered inside a {@link ModalPrompt}. */
    record PromptField(String customId, FieldType type, String label, boolean required) {
        public PromptField {
            Objects.requireNonNull(customId, "customId");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(label, "label");
        }
    }

    static InteractionResponse timedOut(String content) {
        return new Message(ResponseType.MESSAGE_CREATE, content, true);
    }
}
