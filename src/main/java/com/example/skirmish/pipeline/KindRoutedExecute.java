package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;

import java.util.HashMap;
import java.util.Map;

/**
 * Execute stage that picks a strategy by action kind, falling back to a
 * default for kinds without a route.
 */
public class KindRoutedExecute<S> implements ExecuteStage<S> {

    private final Map<String, ExecuteStage<S>> routes = new HashMap<>();
    private final ExecuteStage<S> fallback;

    public KindRoutedExecute(ExecuteStage<S> fallback) {
        if (fallback == null) throw new IllegalArgumentException("fallback is required");
        this.fallback = fallback;
    }

    /**
     * Route one action kind to a strategy. Intended for pipeline construction;
     * do not call while the pipeline is running.
     */
    public KindRoutedExecute<S> route(String actionKind, ExecuteStage<S> stage) {
        if (actionKind != null && stage != null) {
            routes.put(actionKind, stage);
        }
        return this;
    }

    @Override
    public void execute(ActionRequest request, S state) {
        routes.getOrDefault(request.getActionKind(), fallback).execute(request, state);
    }
}
