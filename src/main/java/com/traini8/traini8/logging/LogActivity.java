package com.traini8.traini8.logging;

import java.lang.annotation.*;

@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface LogActivity {
  String type();                 // 대분류 (center, health 등)
  String activity();             // 활동명 (등록, 조회 등)
  String contents() default "";  // 상세내용 (SpEL 템플릿 가능, #{...})
}
