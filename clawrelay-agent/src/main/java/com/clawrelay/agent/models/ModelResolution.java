package com.clawrelay.agent.models;

/**
 * Outcome of resolving a model reference: a selection, or user-facing error
 * text.
 */
public record ModelResolution(ModelSelection selection, String error) {

    public static ModelResolution ok(ModelSelection selection) {
        return new ModelResolution(selection, null);
    }

    public static ModelResolution failed(String error) {
        return new ModelResolution(null, error);
    }

    public boolean isOk() {
        return selection != null;
    }
}
