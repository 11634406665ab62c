package com.traini8.traini8.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 목록 조회 조건. null 인 항목은 조건에서 빠진다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrainingCenterFilter {
  private String city;
  private String state;
  private String pincode;
}
