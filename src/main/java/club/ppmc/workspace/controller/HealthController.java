/**
 * HealthController.java
 *
 * 简单的存活探针，供负载均衡器或前端检查服务是否在线。
 */
package club.ppmc.workspace.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping("/api/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("healthy");
    }
}
