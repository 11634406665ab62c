package com.traini8.traini8.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.traini8.traini8.entity.TrainingCenterEntity;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonPropertyOrder({
    "center_name", "center_code", "address", "student_capacity",
    "courses_offered", "created_on", "contact_email", "contact_phone"
})
public class TrainingCenterDto {

  @JsonProperty("center_name")
  private String centerName; // 센터명 (최대 40자)

  @JsonProperty("center_code")
  private String centerCode; // 센터 코드 (12자, 중복 불가)

  private AddressDto address;

  @JsonProperty("student_capacity")
  private Integer studentCapacity;

  @JsonProperty("courses_offered")
  private List<String> coursesOffered;

  // 서버에서만 채우는 값, 요청 본문의 값은 무시
  @JsonProperty(value = "created_on", access = JsonProperty.Access.READ_ONLY)
  private Long createdOn;

  @JsonProperty("contact_email")
  private String contactEmail;

  @JsonProperty("contact_phone")
  private String contactPhone; // 숫자 10자리

  public static TrainingCenterDto fromEntity(TrainingCenterEntity e) {
    List<String> courses = e.getCoursesOffered() == null
        ? new ArrayList<>()
        : new ArrayList<>(e.getCoursesOffered());

    return TrainingCenterDto.builder()
        .centerName(e.getCenterName())
        .centerCode(e.getCenterCode())
        .address(AddressDto.builder()
            .detailedAddress(e.getDetailedAddress())
            .city(e.getCity())
            .state(e.getState())
            .pincode(e.getPincode())
            .build())
        .studentCapacity(e.getStudentCapacity())
        .coursesOffered(courses)
        .createdOn(e.getCreatedOn())
        .contactEmail(e.getContactEmail())
        .contactPhone(e.getContactPhone())
        .build();
  }

  /**
   * 저장용 엔티티로 변환한다. address 는 평탄화되고 id, createdOn 은 비워 둔다.
   * 검증을 통과한 값이라는 전제 (address 가 null 이면 안 됨).
   */
  public TrainingCenterEntity toEntity() {
    TrainingCenterEntity e = new TrainingCenterEntity();
    e.setCenterName(centerName);
    e.setCenterCode(centerCode);
    e.setDetailedAddress(address.getDetailedAddress());
    e.setCity(address.getCity());
    e.setState(address.getState());
    e.setPincode(address.getPincode());
    e.setStudentCapacity(studentCapacity);
    e.setCoursesOffered(coursesOffered == null ? new ArrayList<>() : new ArrayList<>(coursesOffered));
    e.setContactEmail(contactEmail);
    e.setContactPhone(contactPhone);
    return e;
  }
}
