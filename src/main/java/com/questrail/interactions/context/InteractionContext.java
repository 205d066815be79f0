package com.questrail.interactions.context;

import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.InteractionResponse;
import com.questrail.interactions.api.ResponseMessage;
import com.questrail.interactions.api.ResponseType;
import com.questrail.interactions.api.Visibility;
import com.questrail.interactions.id.CustomIds;
import com.questrail.interactions.id.SplitId;
import com.questrail.interactions.transport.InteractionTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * InteractionContext
 * =============================================================================
 * Per-interaction response correlator handed to executor callbacks.
 *
 * <h2>One initial response</h2>
 * The platform accepts exactly one initial response per interaction. This
 * class tracks {@link ResponseState} and rejects calls which would send a
 * second one, with a {@link ResponseStateException}.
 *
 * <h2>Response gate</h2>
 * Every response call holds a {@link ReentrantLock} for its whole duration,
 * transport round-trip included. Two threads calling {@link #respond} at once
 * therefore produce one initial response and one followup, never two initial
 * responses.
 *
 * <h2>Delivery</h2>
 * With {@link DeliveryMode.Push} the initial response goes through the
 * {@link InteractionTransport}. With {@link DeliveryMode.Pull} it completes the
 * future the pull ingress is waiting on. Edits, followups and deletes always
 * use the transport.
 *
 * <h2>Visibility</h2>
 * {@link Visibility#EPHEMERAL} and {@link Visibility#PUBLIC} are honoured as
 * given. {@link Visibility#DEFAULT} resolves to the ephemeral default for
 * responses that create a message, and to public otherwise.
 *
 * <h2>Delayed deletes</h2>
 * Calls taking a {@code deleteAfter} duration delete the message they
 * produced once it has passed, on the {@link ResponseTimers} scheduler. The
 * delay must end at least {@link #DELETE_AFTER_MARGIN} before
 * {@link #expiresAt()}; {@code null} means keep the message.
 */
public abstract class InteractionContext
{
    private static final Logger log = LoggerFactory.getLogger(InteractionContext.class);

    /** How long the platform accepts edits and followups for an interaction. */
    public static final Duration INTERACTION_LIFETIME = Duration.ofMinutes(15);

    /** Slack left between a delayed delete and the end of the interaction's lifetime. */
    public static final Duration DELETE_AFTER_MARGIN = Duration.ofSeconds(10);

    private final Interaction interaction;
    private final SplitId splitId;
    private final InteractionTransport transport;
    private final DeliveryMode delivery;
    private final ResponseTimers timers;

    private final ReentrantLock responseLock = new ReentrantLock();

    private volatile ResponseState state = ResponseState.FRESH;
    private volatile boolean ephemeralDefault;
    private volatile String lastResponseId;

    protected InteractionContext(
        Interaction interaction, InteractionTransport transport, DeliveryMode delivery, ResponseTimers timers)
    {
        this.interaction = Objects.requireNonNull(interaction, "interaction");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.delivery = Objects.requireNonNull(delivery, "delivery");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.splitId = CustomIds.split(interaction.customId());
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public Interaction interaction() {
        return interaction;
    }

    public String idMatch() {
        return splitId.idMatch();
    }

    public String idMetadata() {
        return splitId.idMetadata();
    }

    public String userId() {
        return interaction.userId();
    }

    public DeliveryMode delivery() {
        return delivery;
    }

    public ResponseState state() {
        return state;
    }

    public boolean hasResponded() {
        return state == ResponseState.RESPONDED;
    }

    public boolean hasBeenDeferred() {
        return state == ResponseState.DEFERRED;
    }

    /**
     * Instant after which the platform no longer accepts responses for this
     * interaction.
     */
    public Instant expiresAt() {
        return interaction.createdAt().plus(INTERACTION_LIFETIME);
    }

    public boolean isEphemeralDefault() {
        return ephemeralDefault;
    }

    public void setEphemeralDefault(boolean ephemeralDefault) {
        this.ephemeralDefault = ephemeralDefault;
    }

    /** Id of the last followup message, if any. */
    public Optional<String> lastResponseId() {
        return Optional.ofNullable(lastResponseId);
    }

    // ---------------------------------------------------------------------
    // Initial response
    // ---------------------------------------------------------------------

    public void defer() {
        defer(ResponseType.DEFERRED_MESSAGE_CREATE, Visibility.DEFAULT);
    }

    /**
     * Acknowledge the interaction now and supply the content later with
     * {@link #editInitialResponse(String)}.
     *
     * @throws ResponseStateException if the interaction was already deferred or answered
     */
    public void defer(ResponseType type, Visibility visibility)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(visibility, "visibility");
        if (!type.isDeferred()) {
            throw new IllegalArgumentException("defer requires a deferred response type, got " + type);
        }

        responseLock.lock();
        try {
            if (state != ResponseState.FRESH) {
                throw new ResponseStateException("Context has already been responded to");
            }
            deliverInitial(new InteractionResponse.Deferred(type, resolveEphemeral(type, visibility)));
            state = ResponseState.DEFERRED;
        } finally {
            responseLock.unlock();
        }
    }

    public void createInitialResponse(String content) {
        createInitialResponse(ResponseType.MESSAGE_CREATE, ResponseMessage.of(content));
    }

    public void createInitialResponse(ResponseMessage message) {
        createInitialResponse(ResponseType.MESSAGE_CREATE, message);
    }

    /**
     * @throws ResponseStateException if already answered, or if deferred (use
     *                                {@link #editInitialResponse} instead)
     */
    public void createInitialResponse(ResponseType type, ResponseMessage message) {
        createInitialResponse(type, message, null);
    }

    /**
     * @param deleteAfter delete the response once this has passed, or {@code null} to keep it
     * @throws IllegalArgumentException if the interaction expires before {@code deleteAfter}
     */
    public void createInitialResponse(ResponseType type, ResponseMessage message, Duration deleteAfter)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
        checkDeleteAfter(deleteAfter);

        responseLock.lock();
        try {
            createInitialLocked(new InteractionResponse.Message(
                type, message.content(), resolveEphemeral(type, message.visibility())));
            deleteInitialAfter(deleteAfter);
        } finally {
            responseLock.unlock();
        }
    }

    /**
     * Send a prebuilt initial response. Subclasses use this for response kinds
     * only they may produce.
     */
    protected final void sendInitialResponse(InteractionResponse response)
    {
        responseLock.lock();
        try {
            createInitialLocked(response);
        } finally {
            responseLock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // After the initial response
    // ---------------------------------------------------------------------

    public String editInitialResponse(String content) {
        return editInitialResponse(content, null);
    }

    /**
     * @param deleteAfter delete the initial response once this has passed, or {@code null}
     * @throws ResponseStateException if there is no initial response yet
     */
    public String editInitialResponse(String content, Duration deleteAfter)
    {
        Objects.requireNonNull(content, "content");
        checkDeleteAfter(deleteAfter);

        responseLock.lock();
        try {
            String id = editLocked(content);
            deleteInitialAfter(deleteAfter);
            return id;
        } finally {
            responseLock.unlock();
        }
    }

    public String editInitialResponse(ResponseMessage message) {
        return editInitialResponse(message.content());
    }

    public String createFollowup(String content) {
        return createFollowup(ResponseMessage.of(content));
    }

    /**
     * @throws ResponseStateException if no initial response exists yet
     */
    public String createFollowup(ResponseMessage message) {
        return createFollowup(message, null);
    }

    public String createFollowup(ResponseMessage message, Duration deleteAfter)
    {
        Objects.requireNonNull(message, "message");
        checkDeleteAfter(deleteAfter);

        responseLock.lock();
        try {
            String id = followupLocked(message);
            deleteMessageAfter(id, deleteAfter);
            return id;
        } finally {
            responseLock.unlock();
        }
    }

    public void deleteInitialResponse()
    {
        responseLock.lock();
        try {
            deleteInitialLocked();
        } finally {
            responseLock.unlock();
        }
    }

    public String editLastResponse(String content) {
        return editLastResponse(content, null);
    }

    /**
     * Edit the last followup, or the initial response when no followup was
     * sent.
     *
     * @throws NoSuchElementException if nothing has been sent yet
     */
    public String editLastResponse(String content, Duration deleteAfter)
    {
        Objects.requireNonNull(content, "content");
        checkDeleteAfter(deleteAfter);

        responseLock.lock();
        try {
            String last = lastResponseId;
            if (last != null) {
                String id = transport.editMessage(interaction, last, content);
                deleteMessageAfter(id, deleteAfter);
                return id;
            }
            if (state == ResponseState.FRESH) {
                throw new NoSuchElementException("Context has no last response");
            }
            String id = editLocked(content);
            deleteInitialAfter(deleteAfter);
            return id;
        } finally {
            responseLock.unlock();
        }
    }

    /**
     * Delete the last followup, or the initial response when no followup was
     * sent.
     *
     * @throws NoSuchElementException if nothing has been sent yet
     */
    public void deleteLastResponse()
    {
        responseLock.lock();
        try {
            String last = lastResponseId;
            if (last != null) {
                transport.deleteMessage(interaction, last);
            } else if (state == ResponseState.FRESH) {
                throw new NoSuchElementException("Context has no last response");
            } else {
                deleteInitialLocked();
            }
        } finally {
            responseLock.unlock();
        }
    }

    public Optional<String> respond(String content) {
        return respond(ResponseMessage.of(content));
    }

    /**
     * Send {@code message} the right way for the current state: as the initial
     * response when fresh, as an edit when deferred, and as a followup once
     * answered.
     *
     * @return id of the created or edited message when the transport reports one
     */
    public Optional<String> respond(ResponseMessage message) {
        return respond(message, null);
    }

    /**
     * As {@link #respond(ResponseMessage)}, deleting whatever was sent once
     * {@code deleteAfter} has passed.
     */
    public Optional<String> respond(ResponseMessage message, Duration deleteAfter)
    {
        Objects.requireNonNull(message, "message");
        checkDeleteAfter(deleteAfter);

        responseLock.lock();
        try {
            switch (state) {
                case FRESH -> {
                    createInitialLocked(new InteractionResponse.Message(
                        ResponseType.MESSAGE_CREATE,
                        message.content(),
                        resolveEphemeral(ResponseType.MESSAGE_CREATE, message.visibility())));
                    deleteInitialAfter(deleteAfter);
                    return Optional.empty();
                }
                case DEFERRED -> {
                    String id = editLocked(message.content());
                    deleteInitialAfter(deleteAfter);
                    return Optional.of(id);
                }
                default -> {
                    String id = followupLocked(message);
                    deleteMessageAfter(id, deleteAfter);
                    return Optional.of(id);
                }
            }
        } finally {
            responseLock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Internals; callers hold responseLock
    // ---------------------------------------------------------------------

    private void createInitialLocked(InteractionResponse response)
    {
        if (state == ResponseState.RESPONDED) {
            throw new ResponseStateException("Initial response has already been created");
        }
        if (state == ResponseState.DEFERRED) {
            throw new ResponseStateException(
                "editInitialResponse must be used to set the initial response after a context has been deferred");
        }
        deliverInitial(response);
        state = ResponseState.RESPONDED;
    }

    private String editLocked(String content)
    {
        if (state == ResponseState.FRESH) {
            throw new ResponseStateException("There is no initial response to edit");
        }
        String id = transport.editInitialResponse(interaction, content);
        state = ResponseState.RESPONDED;
        return id;
    }

    private void deleteInitialLocked()
    {
        if (state == ResponseState.FRESH) {
            throw new ResponseStateException("There is no initial response to delete");
        }
        transport.deleteInitialResponse(interaction);
        state = ResponseState.RESPONDED;
    }

    private String followupLocked(ResponseMessage message)
    {
        if (state != ResponseState.RESPONDED) {
            throw new ResponseStateException("An initial response must be created before a followup");
        }
        boolean ephemeral = resolveEphemeral(ResponseType.MESSAGE_CREATE, message.visibility());
        String id = transport.createFollowup(interaction, message.content(), ephemeral);
        lastResponseId = id;
        return id;
    }

    private void deliverInitial(InteractionResponse response)
    {
        if (delivery instanceof DeliveryMode.Pull pull) {
            if (!pull.future().complete(response)) {
                log.warn("Interaction {} request was abandoned before its initial response", interaction.id());
                throw new ResponseStateException("The interaction request is no longer waiting for a response");
            }
        } else {
            transport.createInitialResponse(interaction, response);
        }
    }

    private void checkDeleteAfter(Duration deleteAfter)
    {
        if (deleteAfter == null) {
            return;
        }
        if (deleteAfter.isNegative()) {
            throw new IllegalArgumentException("deleteAfter must be >= 0");
        }
        Duration left = Duration.between(timers.wallClock().now(), expiresAt());
        if (deleteAfter.plus(DELETE_AFTER_MARGIN).compareTo(left) > 0) {
            throw new IllegalArgumentException("This interaction will have expired before deleteAfter is reached");
        }
    }

    private void deleteInitialAfter(Duration deleteAfter)
    {
        if (deleteAfter == null) {
            return;
        }
        timers.runAfter(deleteAfter, () -> {
            try {
                deleteInitialResponse();
            } catch (RuntimeException e) {
                log.warn("Failed to delete initial response of interaction {} after {}",
                    interaction.id(), deleteAfter, e);
            }
        });
    }

    private void deleteMessageAfter(String messageId, Duration deleteAfter)
    {
        if (deleteAfter == null) {
            return;
        }
        timers.runAfter(deleteAfter, () -> {
            try {
                transport.deleteMessage(interaction, messageId);
            } catch (RuntimeException e) {
                log.warn("Failed to delete message {} of interaction {} after {}",
                    messageId, interaction.id(), deleteAfter, e);
            }
        });
    }

    private boolean resolveEphemeral(ResponseType type, Visibility visibility)
    {
        return switch (visibility) {
            case EPHEMERAL -> true;
            case PUBLIC -> false;
            case DEFAULT -> type.createsMessage() && ephemeralDefault;
        };
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[interaction=" + interaction.id()
            + ", customId=" + interaction.customId() + ", state=" + state + "]";
    }
}
