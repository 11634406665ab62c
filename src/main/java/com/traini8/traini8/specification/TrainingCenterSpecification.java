package com.traini8.traini8.specification;

import com.traini8.traini8.dto.TrainingCenterFilter;
import com.traini8.traini8.entity.TrainingCenterEntity;
import org.springframework.data.jpa.domain.Specification;

public final class TrainingCenterSpecification {

  private TrainingCenterSpecification(){}

  /** city 정확히 일치 (대소문자 구분) */
  public static Specification<TrainingCenterEntity> eqCity(String city){
    return eqField("city", city);
  }

  /** state 정확히 일치 */
  public static Specification<TrainingCenterEntity> eqState(String state){
    return eqField("state", state);
  }

  /** pincode 정확히 일치 */
  public static Specification<TrainingCenterEntity> eqPincode(String pincode){
    return eqField("pincode", pincode);
  }

  /**
   * 필터의 세 조건을 AND 로 묶는다. null 인 조건은 적용하지 않는다.
   * 빈 문자열은 값으로 취급한다 (?city= 는 city = '' 조건).
   */
  public static Specification<TrainingCenterEntity> matching(TrainingCenterFilter filter){
    Specification<TrainingCenterEntity> spec = Specification.where(null);
    if (filter == null) return spec;
    return spec
        .and(eqCity(filter.getCity()))
        .and(eqState(filter.getState()))
        .and(eqPincode(filter.getPincode()));
  }

  private static Specification<TrainingCenterEntity> eqField(String field, String value){
    return (root, q, cb) -> value == null ? null : cb.equal(root.get(field), value);
  }
}
