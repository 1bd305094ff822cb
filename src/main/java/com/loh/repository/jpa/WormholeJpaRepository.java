package com.loh.repository.jpa;

import com.loh.entity.WormholeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WormholeJpaRepository extends JpaRepository<WormholeEntity, String> {

    List<WormholeEntity> findByGameId(String gameId);
}
