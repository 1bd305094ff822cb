package com.loh.repository.jpa;

import com.loh.entity.StarStateEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StarStateJpaRepository extends JpaRepository<StarStateEntity, String> {

    Optional<StarStateEntity> findByGameIdAndStarId(String gameId, String starId);

    List<StarStateEntity> findByGameId(String gameId);

    List<StarStateEntity> findByGameIdAndOwnerPlayerId(String gameId, String ownerPlayerId);

    List<StarStateEntity> findByGameIdAndHasStandingOrdersTrue(String gameId);
}
