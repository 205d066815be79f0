package com.questrail.interactions.context;

/**
 * Response lifecycle of a single interaction.
 *
 * <pre>
 *   FRESH --defer--> DEFERRED --edit/delete--> RESPONDED
 *   FRESH --create------------------------->  RESPONDED --followup/edit--> RESPONDED
 * </pre>
 */
public enum ResponseState {
    FRESH,
    DEFERRED,
    RESPONDED
}
