package com.vidnyan.storygraph.application.port.out;

import com.vidnyan.storygraph.domain.model.ScriptModel;
import com.vidnyan.storygraph.domain.model.ScriptUnit;

import java.util.List;

/**
 * Port for extracting structural facts from raw script text.
 * Implemented by adapters (e.g., the Ren'Py pattern extractor).
 */
public interface ScriptExtractor {

    /**
     * Extract labels, transfers, definitions and dialogue from all units.
     * Never fails on malformed script text.
     * @param units Units in project order
     * @return Extracted facts
     */
    ScriptModel extract(List<ScriptUnit> units);
}
