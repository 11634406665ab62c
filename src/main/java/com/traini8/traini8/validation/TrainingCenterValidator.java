package com.traini8.traini8.validation;

import com.traini8.traini8.dto.AddressDto;
import com.traini8.traini8.dto.TrainingCenterDto;
import com.traini8.traini8.exception.ValidationErrorType;
import com.traini8.traini8.exception.ValidationException;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * 센터 등록 요청 검증.
 * 저장소 접근 전에 아래 순서대로 검사하고 첫 실패에서 멈춘다.
 * 1) 필수 필드 2) 센터명 길이 3) 코드 길이 4) 이메일 형식 5) 전화번호 형식 6) 주소 항목 7) 과정명
 */
@Component
public class TrainingCenterValidator {

  public static final int CENTER_NAME_MAX_LENGTH = 40;
  public static final int CENTER_CODE_LENGTH = 12;

  public static final String MSG_NAME_TOO_LONG = "CenterName should be less than 40 characters";
  public static final String MSG_CODE_LENGTH = "CenterCode should be exactly 12 characters";
  public static final String MSG_INVALID_EMAIL = "Invalid email format";
  public static final String MSG_INVALID_PHONE = "Invalid phone number format";
  public static final String MSG_INCOMPLETE_ADDRESS = "Incomplete address details";
  public static final String MSG_EMPTY_COURSE = "courses_offered must not contain empty course names";

  private static final Pattern EMAIL = Pattern.compile("[^@]+@[^@]+\\.[^@].*");
  private static final Pattern PHONE = Pattern.compile("\\d{10}");

  public void validate(TrainingCenterDto dto) {
    requirePresent("center_name", dto.getCenterName());
    requirePresent("center_code", dto.getCenterCode());
    requirePresent("address", dto.getAddress());
    requirePresent("contact_phone", dto.getContactPhone());

    if (length(dto.getCenterName()) > CENTER_NAME_MAX_LENGTH) {
      throw new ValidationException(ValidationErrorType.FIELD_TOO_LONG, "center_name", MSG_NAME_TOO_LONG);
    }
    if (length(dto.getCenterCode()) != CENTER_CODE_LENGTH) {
      throw new ValidationException(ValidationErrorType.INVALID_LENGTH, "center_code", MSG_CODE_LENGTH);
    }
    if (dto.getContactEmail() != null && !isValidEmail(dto.getContactEmail())) {
      throw new ValidationException(ValidationErrorType.INVALID_FORMAT, "contact_email", MSG_INVALID_EMAIL);
    }
    if (!isValidPhone(dto.getContactPhone())) {
      throw new ValidationException(ValidationErrorType.INVALID_FORMAT, "contact_phone", MSG_INVALID_PHONE);
    }
    if (!isCompleteAddress(dto.getAddress())) {
      throw new ValidationException(ValidationErrorType.INCOMPLETE_ADDRESS, "address", MSG_INCOMPLETE_ADDRESS);
    }
    if (!hasOnlyNamedCourses(dto.getCoursesOffered())) {
      throw new ValidationException(ValidationErrorType.INVALID_FORMAT, "courses_offered", MSG_EMPTY_COURSE);
    }
  }

  public static boolean isValidEmail(String email) {
    return EMAIL.matcher(email).matches();
  }

  public static boolean isValidPhone(String phone) {
    return PHONE.matcher(phone).matches();
  }

  static boolean isCompleteAddress(AddressDto address) {
    return address.getDetailedAddress() != null
        && address.getCity() != null
        && address.getState() != null
        && address.getPincode() != null;
  }

  // 목록 자체가 없는 건 허용, null 이나 공백 항목은 불가
  static boolean hasOnlyNamedCourses(List<String> courses) {
    return courses == null || courses.stream().allMatch(c -> c != null && !c.isBlank());
  }

  private void requirePresent(String field, Object value) {
    if (value == null) {
      throw new ValidationException(ValidationErrorType.MISSING_FIELD, field, field + " is required");
    }
  }

  // 서로게이트 쌍은 한 글자로 센다
  private static int length(String s) {
    return s.codePointCount(0, s.length());
  }
}
