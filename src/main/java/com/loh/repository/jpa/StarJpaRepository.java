package com.loh.repository.jpa;

import com.loh.entity.StarEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StarJpaRepository extends JpaRepository<StarEntity, String> {

    List<StarEntity> findByGameIdOrderByStarIdAsc(String gameId);
}
