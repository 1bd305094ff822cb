package com.loh.repository.jpa;

import com.loh.domain.enums.ShipStatus;
import com.loh.entity.ShipEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ShipJpaRepository extends JpaRepository<ShipEntity, String> {

    List<ShipEntity> findByGameIdAndStatus(String gameId, ShipStatus status);

    List<ShipEntity> findByGameIdAndLocationStarIdAndOwnerPlayerIdAndStatus(
            String gameId, String locationStarId, String ownerPlayerId, ShipStatus status);
}
