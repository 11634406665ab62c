package com.traini8.traini8.service;

import com.traini8.traini8.dto.TrainingCenterDto;
import com.traini8.traini8.dto.TrainingCenterFilter;
import com.traini8.traini8.entity.TrainingCenterEntity;
import java.util.List;
import java.util.Optional;

public interface TrainingCenterService {

  // center_code 로 단건 조회 (등록 전 중복 확인용)
  Optional<TrainingCenterEntity> findByCode(String centerCode);

  // 검증 → 중복 확인 → 저장
  TrainingCenterDto create(TrainingCenterDto dto);

  // city / state / pincode 조건 조회 (AND)
  List<TrainingCenterDto> list(TrainingCenterFilter filter);
}
