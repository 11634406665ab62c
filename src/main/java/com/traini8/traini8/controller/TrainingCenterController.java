package com.traini8.traini8.controller;

import com.traini8.traini8.dto.TrainingCenterDto;
import com.traini8.traini8.dto.TrainingCenterFilter;
import com.traini8.traini8.logging.LogActivity;
import com.traini8.traini8.service.TrainingCenterService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
public class TrainingCenterController {

  private final TrainingCenterService centerSvc;

  /**
   * 센터 등록
   * - 검증 실패, 코드 중복: 400
   * - 저장 실패: 500
   */
  @LogActivity(type = "center", activity = "등록", contents = "#{'center_code=' + #reqDto.centerCode}")
  @PostMapping("/training-center")
  public ResponseEntity<TrainingCenterDto> create(@RequestBody TrainingCenterDto reqDto) {
    TrainingCenterDto created = centerSvc.create(reqDto);
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  /**
   * 센터 목록 조회 (city, state, pincode 모두 선택, AND 조건)
   */
  @LogActivity(type = "center", activity = "조회", contents = "#{'city=' + #city + ', state=' + #state + ', pincode=' + #pincode + ', hits=' + #return?.body?.size()}")
  @GetMapping("/training-centers")
  public ResponseEntity<List<TrainingCenterDto>> list(
      @RequestParam(name = "city", required = false) String city,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "pincode", required = false) String pincode
  ) {
    TrainingCenterFilter filter = TrainingCenterFilter.builder()
        .city(city)
        .state(state)
        .pincode(pincode)
        .build();
    return ResponseEntity.ok(centerSvc.list(filter));
  }
}
