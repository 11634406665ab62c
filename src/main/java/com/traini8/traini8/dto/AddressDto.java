package com.traini8.traini8.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 센터 주소 (요청/응답 모두 address 객체로 중첩된다)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonPropertyOrder({"detailed_address", "city", "state", "pincode"})
public class AddressDto {

  @JsonProperty("detailed_address")
  private String detailedAddress;

  private String city;

  private String state;

  private String pincode;
}
