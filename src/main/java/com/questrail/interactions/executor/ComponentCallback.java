package com.questrail.interactions.executor;

import com.questrail.interactions.context.ComponentContext;

@FunctionalInterface
public interface ComponentCallback
{
    void handle(ComponentContext context);
}
