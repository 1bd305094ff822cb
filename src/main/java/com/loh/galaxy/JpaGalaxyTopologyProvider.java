package com.loh.galaxy;

import com.loh.domain.model.GalaxyTopology;
import com.loh.domain.model.Star;
import com.loh.domain.model.Wormhole;
import com.loh.mapper.GalaxyMapper;
import com.loh.repository.jpa.StarJpaRepository;
import com.loh.repository.jpa.WormholeJpaRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads topology from the star and wormhole tables. The map never changes once a game
 * has started, so results are cached per game id.
 */
@Service
public class JpaGalaxyTopologyProvider implements GalaxyTopologyProvider {

    private static final Logger log = LoggerFactory.getLogger(JpaGalaxyTopologyProvider.class);

    public static final String CACHE_NAME = "galaxyTopology";

    private final StarJpaRepository starJpaRepository;
    private final WormholeJpaRepository wormholeJpaRepository;
    private final GalaxyMapper galaxyMapper;

    public JpaGalaxyTopologyProvider(
            StarJpaRepository starJpaRepository,
            WormholeJpaRepository wormholeJpaRepository,
            GalaxyMapper galaxyMapper) {
        this.starJpaRepository = starJpaRepository;
        this.wormholeJpaRepository = wormholeJpaRepository;
        this.galaxyMapper = galaxyMapper;
    }

    @Override
    @Cacheable(value = CACHE_NAME, unless = "#result.stars.isEmpty()")
    @Transactional(readOnly = true)
    public GalaxyTopology getTopology(String gameId) {
        List<Star> stars = galaxyMapper.toStarList(starJpaRepository.findByGameIdOrderByStarIdAsc(gameId));
        List<Wormhole> wormholes = galaxyMapper.toWormholeList(wormholeJpaRepository.findByGameId(gameId));
        log.debug("Loaded topology for game {}: {} stars, {} wormholes", gameId, stars.size(), wormholes.size());
        return GalaxyTopology.builder().stars(stars).wormholes(wormholes).build();
    }
}
