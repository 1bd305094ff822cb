package com.loh.galaxy;

import com.loh.domain.model.GalaxyTopology;

/**
 * Read access to a game's static star map. Generation of the map happens elsewhere;
 * resolution and AI code only need to read it.
 */
public interface GalaxyTopologyProvider {

    GalaxyTopology getTopology(String gameId);
}
