package com.traini8.traini8.validation;

import com.traini8.traini8.dto.AddressDto;
import com.traini8.traini8.dto.TrainingCenterDto;
import com.traini8.traini8.exception.ValidationErrorType;
import com.traini8.traini8.exception.ValidationException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class TrainingCenterValidatorTest {

  private final TrainingCenterValidator validator = new TrainingCenterValidator();

  static TrainingCenterDto valid() {
    return TrainingCenterDto.builder()
        .centerName("Skill Hub Pune")
        .centerCode("PUNE00000001")
        .address(AddressDto.builder()
            .detailedAddress("12 FC Road")
            .city("Pune")
            .state("Maharashtra")
            .pincode("411004")
            .build())
        .studentCapacity(120)
        .coursesOffered(List.of("Java", "Spring"))
        .contactEmail("info@skillhub.in")
        .contactPhone("9876543210")
        .build();
  }

  private ValidationException fails(TrainingCenterDto dto) {
    return catchThrowableOfType(() -> validator.validate(dto), ValidationException.class);
  }

  @Test
  void acceptsValidRequest() {
    assertThatCode(() -> validator.validate(valid())).doesNotThrowAnyException();
  }

  @Test
  void acceptsMissingOptionalFields() {
    TrainingCenterDto dto = valid();
    dto.setContactEmail(null);
    dto.setStudentCapacity(null);
    dto.setCoursesOffered(null);
    assertThatCode(() -> validator.validate(dto)).doesNotThrowAnyException();
  }

  @Test
  void missingRequiredFieldIsNamed() {
    TrainingCenterDto noName = valid();
    noName.setCenterName(null);
    assertThat(fails(noName).getReason()).isEqualTo("center_name is required");

    TrainingCenterDto noCode = valid();
    noCode.setCenterCode(null);
    assertThat(fails(noCode).getReason()).isEqualTo("center_code is required");

    TrainingCenterDto noAddress = valid();
    noAddress.setAddress(null);
    ValidationException ex = fails(noAddress);
    assertThat(ex.getType()).isEqualTo(ValidationErrorType.MISSING_FIELD);
    assertThat(ex.getField()).isEqualTo("address");
    assertThat(ex.getReason()).isEqualTo("address is required");

    TrainingCenterDto noPhone = valid();
    noPhone.setContactPhone(null);
    assertThat(fails(noPhone).getReason()).isEqualTo("contact_phone is required");
  }

  @Test
  void presenceIsCheckedBeforeLength() {
    TrainingCenterDto dto = valid();
    dto.setCenterName("x".repeat(41));
    dto.setContactPhone(null);
    assertThat(fails(dto).getReason()).isEqualTo("contact_phone is required");
  }

  @Test
  void centerNameLimitIsForty() {
    TrainingCenterDto ok = valid();
    ok.setCenterName("x".repeat(40));
    assertThatCode(() -> validator.validate(ok)).doesNotThrowAnyException();

    TrainingCenterDto tooLong = valid();
    tooLong.setCenterName("x".repeat(41));
    ValidationException ex = fails(tooLong);
    assertThat(ex.getType()).isEqualTo(ValidationErrorType.FIELD_TOO_LONG);
    assertThat(ex.getReason()).isEqualTo("CenterName should be less than 40 characters");
  }

  @ParameterizedTest
  @ValueSource(strings = {"ABCDEFGHIJK", "ABCDEFGHIJKLM", ""})
  void centerCodeMustBeTwelveCharacters(String code) {
    TrainingCenterDto dto = valid();
    dto.setCenterCode(code);
    ValidationException ex = fails(dto);
    assertThat(ex.getType()).isEqualTo(ValidationErrorType.INVALID_LENGTH);
    assertThat(ex.getReason()).isEqualTo("CenterCode should be exactly 12 characters");
  }

  @ParameterizedTest
  @ValueSource(strings = {"not-an-email", "a@b", "@b.com", "a@@b.com", "a@b.@c", "a@b."})
  void rejectsMalformedEmail(String email) {
    TrainingCenterDto dto = valid();
    dto.setContactEmail(email);
    ValidationException ex = fails(dto);
    assertThat(ex.getType()).isEqualTo(ValidationErrorType.INVALID_FORMAT);
    assertThat(ex.getReason()).isEqualTo("Invalid email format");
  }

  @ParameterizedTest
  @ValueSource(strings = {"info@skillhub.in", "a.b@c.d", "a@b.c@d"})
  void acceptsWellFormedEmail(String email) {
    TrainingCenterDto dto = valid();
    dto.setContactEmail(email);
    assertThatCode(() -> validator.validate(dto)).doesNotThrowAnyException();
  }

  @ParameterizedTest
  @ValueSource(strings = {"12345", "12345678901", "98765-4321", "abcdefghij", ""})
  void rejectsMalformedPhone(String phone) {
    TrainingCenterDto dto = valid();
    dto.setContactPhone(phone);
    ValidationException ex = fails(dto);
    assertThat(ex.getField()).isEqualTo("contact_phone");
    assertThat(ex.getReason()).isEqualTo("Invalid phone number format");
  }

  @Test
  void emailIsCheckedBeforePhone() {
    TrainingCenterDto dto = valid();
    dto.setContactEmail("nope");
    dto.setContactPhone("123");
    assertThat(fails(dto).getReason()).isEqualTo("Invalid email format");
  }

  @Test
  void addressNeedsAllFourParts() {
    TrainingCenterDto dto = valid();
    dto.getAddress().setPincode(null);
    ValidationException ex = fails(dto);
    assertThat(ex.getType()).isEqualTo(ValidationErrorType.INCOMPLETE_ADDRESS);
    assertThat(ex.getReason()).isEqualTo("Incomplete address details");

    dto = valid();
    dto.setAddress(new AddressDto());
    assertThat(fails(dto).getReason()).isEqualTo("Incomplete address details");
  }

  @Test
  void courseNamesMustNotBeEmpty() {
    TrainingCenterDto withNull = valid();
    withNull.setCoursesOffered(Arrays.asList("Java", null, "SQL"));
    ValidationException ex = fails(withNull);
    assertThat(ex.getType()).isEqualTo(ValidationErrorType.INVALID_FORMAT);
    assertThat(ex.getField()).isEqualTo("courses_offered");
    assertThat(ex.getReason()).isEqualTo("courses_offered must not contain empty course names");

    TrainingCenterDto withBlank = valid();
    withBlank.setCoursesOffered(List.of("Java", "  "));
    assertThat(fails(withBlank).getField()).isEqualTo("courses_offered");

    TrainingCenterDto empty = valid();
    empty.setCoursesOffered(List.of());
    assertThatCode(() -> validator.validate(empty)).doesNotThrowAnyException();
  }

  @Test
  void addressIsCheckedBeforeCourses() {
    TrainingCenterDto dto = valid();
    dto.getAddress().setCity(null);
    dto.setCoursesOffered(Arrays.asList((String) null));
    assertThat(fails(dto).getReason()).isEqualTo("Incomplete address details");
  }
}
