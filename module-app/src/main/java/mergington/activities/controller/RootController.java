package mergington.activities.controller;

import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** 루트 요청을 정적 프론트엔드로 보낸다 (307, 메서드 보존) */
@RestController
public class RootController {

  static final String INDEX_PAGE = "/static/index.html";

  @GetMapping("/")
  public ResponseEntity<Void> root() {
    return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
        .location(URI.create(INDEX_PAGE))
        .build();
  }
}
