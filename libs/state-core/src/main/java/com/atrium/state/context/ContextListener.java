package com.atrium.state.context;

@FunctionalInterface
public interface ContextListener {

    void onContextChanged(ContextChange change);
}
