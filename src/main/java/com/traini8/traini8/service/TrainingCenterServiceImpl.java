package com.traini8.traini8.service;

import com.traini8.traini8.dto.TrainingCenterDto;
import com.traini8.traini8.dto.TrainingCenterFilter;
import com.traini8.traini8.entity.TrainingCenterEntity;
import com.traini8.traini8.exception.DuplicateCenterCodeException;
import com.traini8.traini8.exception.StoreException;
import com.traini8.traini8.repository.TrainingCenterRepository;
import com.traini8.traini8.specification.TrainingCenterSpecification;
import com.traini8.traini8.validation.TrainingCenterValidator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingCenterServiceImpl implements TrainingCenterService {

  private final TrainingCenterRepository repo;
  private final TrainingCenterValidator validator;

  /**
   * center_code 로 단건 조회
   */
  @Override
  @Transactional(readOnly = true)
  public Optional<TrainingCenterEntity> findByCode(String centerCode) {
    return repo.findByCenterCode(centerCode);
  }

  /**
   * 신규 센터 등록.
   * 사전 중복 확인과 저장은 원자적이지 않다. 동시에 같은 코드가 들어오면
   * 유니크 제약 위반으로 늦게 걸리고 StoreException(500) 으로 보고된다.
   */
  @Override
  @Transactional
  public TrainingCenterDto create(TrainingCenterDto dto) {
    validator.validate(dto);

    if (findByCode(dto.getCenterCode()).isPresent()) {
      log.info("Duplicate center_code rejected: {}", dto.getCenterCode());
      throw new DuplicateCenterCodeException();
    }

    TrainingCenterEntity saved = insert(dto.toEntity());
    log.info("Training center registered: code={}, id={}", saved.getCenterCode(), saved.getId());
    return TrainingCenterDto.fromEntity(saved);
  }

  /**
   * 조건 조회. 저장소 기본 순서, 페이징 없음
   */
  @Override
  @Transactional(readOnly = true)
  public List<TrainingCenterDto> list(TrainingCenterFilter filter) {
    return repo.findAll(TrainingCenterSpecification.matching(filter)).stream()
        .map(TrainingCenterDto::fromEntity)
        .collect(Collectors.toList());
  }

  // 트랜잭션 안에서 flush 까지 해서 제약 위반을 여기서 잡는다.
  // 예외가 나가면 create 의 트랜잭션은 롤백된다.
  private TrainingCenterEntity insert(TrainingCenterEntity entity) {
    try {
      return repo.saveAndFlush(entity);
    } catch (DataAccessException ex) {
      String detail = ex.getMostSpecificCause().getMessage();
      log.error("Insert failed for center_code={}: {}", entity.getCenterCode(), detail, ex);
      throw new StoreException(detail, ex);
    }
  }
}
