package com.questrail.interactions.modal;

import com.questrail.interactions.context.ModalContext;

/**
 * Callback run for a modal submission once all declared fields resolved.
 */
@FunctionalInterface
public interface ModalCallback
{
    void onSubmit(ModalContext context, ModalValues values);
}
