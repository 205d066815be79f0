/**
 * Interaction Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between the dispatch core and whatever talks to
 * the chat platform (a gateway connection, an HTTP endpoint, a REST client or
 * a test double).
 *
 * <h2>Ingress</h2>
 * <ul>
 *   <li>{@link com.questrail.interactions.transport.InteractionGateway}: push
 *       source. Listeners receive interactions and answer through the
 *       outbound transport.</li>
 *   <li>{@link com.questrail.interactions.transport.InteractionServer}: pull
 *       source. The handler's return value is the initial response.</li>
 * </ul>
 *
 * <h2>Egress</h2>
 * {@link com.questrail.interactions.transport.InteractionTransport} carries
 * every response that is not the return value of a pull request.
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations perform I/O and wire encoding only. They do not route by
 * custom id, track response state or evict registrations.
 */
package com.questrail.interactions.transport;
