package com.traini8.traini8.logging;

import jakarta.servlet.http.HttpServletRequest;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.common.TemplateParserContext;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * {@link LogActivity} 가 붙은 핸들러 호출을 한 줄씩 남긴다.
 * 형식: [type/activity] contents | ip=... | OK|FAIL | ...ms
 */
@Aspect
@Component
public class ActivityLogAspect {

  private static final Logger log = LoggerFactory.getLogger(ActivityLogAspect.class);

  private final SpelExpressionParser    parser   = new SpelExpressionParser();
  private final TemplateParserContext   template = new TemplateParserContext();
  private final ParameterNameDiscoverer pd       = new DefaultParameterNameDiscoverer();

  @Around("@annotation(logActivity)")
  public Object around(ProceedingJoinPoint jp, LogActivity logActivity) throws Throwable {
    long started = System.currentTimeMillis();
    String ip = clientIp();

    Object result;
    try {
      result = jp.proceed();
    } catch (Throwable t) {
      log.warn("[{}/{}] {} | ip={} | FAIL({}) | {}ms",
          logActivity.type(), logActivity.activity(),
          evalOrLiteral(logActivity.contents(), context(jp, null)),
          ip, t.getMessage(), System.currentTimeMillis() - started);
      throw t;
    }

    log.info("[{}/{}] {} | ip={} | OK | {}ms",
        logActivity.type(), logActivity.activity(),
        evalOrLiteral(logActivity.contents(), context(jp, result)),
        ip, System.currentTimeMillis() - started);
    return result;
  }

  // ───────────────────────────── helpers ─────────────────────────────
  private StandardEvaluationContext context(ProceedingJoinPoint jp, Object result) {
    MethodSignature sig = (MethodSignature) jp.getSignature();
    Object[] args = jp.getArgs();
    String[] names = pd.getParameterNames(sig.getMethod());

    StandardEvaluationContext ctx = new StandardEvaluationContext();
    for (int i = 0; i < args.length; i++) ctx.setVariable("p" + i, args[i]);
    if (names != null) for (int i = 0; i < names.length && i < args.length; i++) ctx.setVariable(names[i], args[i]);
    ctx.setVariable("return", result);
    return ctx;
  }

  String evalOrLiteral(String expr, StandardEvaluationContext ctx) {
    if (expr == null) return "";
    String s = expr.trim();
    if (s.isEmpty()) return "";
    try {
      if (s.contains("#{")) return parser.parseExpression(s, template).getValue(ctx, String.class);
      return s;
    } catch (Exception e) {
      log.warn("LogActivity evaluation failed, fallback to literal. expr={}", s, e);
      return s;
    }
  }

  private String clientIp() {
    ServletRequestAttributes sa = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
    if (sa == null) return "-";
    HttpServletRequest req = sa.getRequest();
    String xff = req.getHeader("X-Forwarded-For");
    if (xff != null && !xff.isBlank()) return normalizeV4(xff.split(",")[0].trim());
    return normalizeV4(req.getRemoteAddr());
  }

  private String normalizeV4(String ip) {
    if (ip == null || ip.isBlank()) return "-";
    if ("0:0:0:0:0:0:0:1".equals(ip) || "::1".equals(ip)) return "127.0.0.1";
    if (ip.startsWith("::ffff:")) return ip.substring(7);
    return ip;
  }
}
