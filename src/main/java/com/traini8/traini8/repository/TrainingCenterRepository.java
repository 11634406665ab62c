package com.traini8.traini8.repository;

import com.traini8.traini8.entity.TrainingCenterEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

@Repository
public interface TrainingCenterRepository
    extends JpaRepository<TrainingCenterEntity, Integer>,
    JpaSpecificationExecutor<TrainingCenterEntity> {

  /** center_code 는 유니크 제약이 걸려 있어 최대 1건 */
  Optional<TrainingCenterEntity> findByCenterCode(String centerCode);
}
