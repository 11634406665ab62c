package com.traini8.traini8.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Entity
@Setter
@Getter
@Table(
    name = "training_center",
    uniqueConstraints = @UniqueConstraint(name = "uk_training_center_code", columnNames = "center_code")
)
public class TrainingCenterEntity {

  /** 길이 검증이 없는 문자열 컬럼. 입력 길이로 저장이 실패하지 않도록 넉넉하게 둔다 */
  public static final int FREE_TEXT_LENGTH = 4000;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id")
  private Integer id;

  // 검증은 40 code point, 컬럼은 UTF-16 기준이라 두 배로 잡는다
  @Column(name = "center_name", length = 80, nullable = false)
  private String centerName;

  @Column(name = "center_code", length = 24, nullable = false)
  private String centerCode;

  @Column(name = "detailed_address", length = FREE_TEXT_LENGTH, nullable = false)
  private String detailedAddress;

  @Column(name = "city", length = FREE_TEXT_LENGTH, nullable = false)
  private String city;

  @Column(name = "state", length = FREE_TEXT_LENGTH, nullable = false)
  private String state;

  @Column(name = "pincode", length = FREE_TEXT_LENGTH, nullable = false)
  private String pincode;

  @Column(name = "student_capacity")
  private Integer studentCapacity;

  /** 개설 과정 목록 (입력 순서 유지) */
  @ElementCollection
  @CollectionTable(name = "training_center_course", joinColumns = @JoinColumn(name = "center_id"))
  @OrderColumn(name = "position")
  @Column(name = "course_name", length = FREE_TEXT_LENGTH, nullable = false)
  private List<String> coursesOffered = new ArrayList<>();

  /** 생성 시각 (unix seconds, 저장 시 자동 채워짐) */
  @Column(name = "created_on", nullable = false, updatable = false)
  private Long createdOn;

  @Column(name = "contact_email", length = FREE_TEXT_LENGTH)
  private String contactEmail;

  @Column(name = "contact_phone", length = 15, nullable = false)
  private String contactPhone;

  @PrePersist
  protected void onCreate() {
    this.createdOn = Instant.now().getEpochSecond();
  }
}
