package mergington.activities.global.filter;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import mergington.activities.infrastructure.executor.LogicExecutor;
import mergington.activities.infrastructure.executor.TaskContext;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 로그 추적용 MDC 필터
 *
 * <h4>MDC 키</h4>
 *
 * <ul>
 *   <li>{@link #REQUEST_ID_KEY}: 요청 추적용 Correlation ID (logback 패턴의 {@code %X{requestId}})
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MDCFilter implements Filter {

  /** HTTP 헤더 이름: X-Correlation-ID */
  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

  /** MDC 키: requestId */
  public static final String REQUEST_ID_KEY = "requestId";

  private final LogicExecutor executor;

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {

    HttpServletRequest httpRequest = (HttpServletRequest) request;
    HttpServletResponse httpResponse = (HttpServletResponse) response;

    String correlationId = resolveCorrelationId(httpRequest);
    setupMdcContext(correlationId, httpResponse);

    // 요청 종료 시 반드시 MDC를 비운다 (스레드 재사용 시 오염 방지)
    executor.executeWithFinally(
        () -> {
          chain.doFilter(request, response);
          return null;
        },
        MDC::clear,
        TaskContext.of("Filter", "MDC", correlationId));
  }

  /** 외부 헤더 확인 후 없으면 생성 */
  private String resolveCorrelationId(HttpServletRequest request) {
    String id = request.getHeader(CORRELATION_ID_HEADER);
    return (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
  }

  private void setupMdcContext(String correlationId, HttpServletResponse response) {
    MDC.put(REQUEST_ID_KEY, correlationId);
    response.setHeader(CORRELATION_ID_HEADER, correlationId);
  }
}
