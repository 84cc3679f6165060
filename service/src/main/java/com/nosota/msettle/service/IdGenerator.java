package com.nosota.msettle.service;

import java.util.UUID;

/**
 * Source of entity ids. Injected so that ids never depend on caller-visible state.
 */
public interface IdGenerator {
    UUID nextId();
}
