package com.clawrelay.agent.models;

import java.util.List;

/**
 * Source of known models.
 */
@FunctionalInterface
public interface ModelCatalog {

    List<ModelCatalogEntry> entries();
}
